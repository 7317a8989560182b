package com.microservices.elasticsearch.timeseries.query.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.microservices.elasticsearch.timeseries.query.dto.TimeRange;
import com.microservices.elasticsearch.timeseries.query.model.AggregationNode;
import com.microservices.elasticsearch.timeseries.query.model.BucketAgg;
import com.microservices.elasticsearch.timeseries.query.model.MetricAgg;

class AggregationTreeBuilderTest {

    private static final TimeRange TIME_RANGE = new TimeRange(1_000L, 61_000L);
    private static final String TIME_FIELD = "@timestamp";

    private AggregationTreeBuilder builder;
    private AggregationNode root;

    @BeforeEach
    void setUp() {
        builder = new AggregationTreeBuilder(new SettingsNormalizer());
        root = AggregationNode.root();
    }

    @Test
    void testBuild_WithAutoDateHistogram_ShouldUseIntervalPlaceholderAndExtendedBounds() {
        // Given
        BucketAgg dateHistogram = bucket("2", "date_histogram", "", Map.of("interval", "auto"));

        // When
        AggregationNode innermost = builder.build(root, List.of(dateHistogram), Map.of(), TIME_RANGE, TIME_FIELD);

        // Then
        assertThat(innermost.getKey()).isEqualTo("2");
        Map<String, Object> body = innermost.getBody();
        assertThat(body).containsEntry("field", TIME_FIELD)
                .containsEntry("fixed_interval", AggregationTreeBuilder.INTERVAL_MS_PLACEHOLDER)
                .containsEntry("min_doc_count", 0)
                .containsEntry("format", "epoch_millis")
                .containsEntry("extended_bounds", Map.of("min", 1_000L, "max", 61_000L))
                .doesNotContainKey("time_zone");
    }

    @Test
    void testBuild_WithExplicitIntervalAndTimeZone_ShouldCarryThemOver() {
        // Given
        BucketAgg dateHistogram = bucket("2", "date_histogram", "created",
                Map.of("interval", "1h", "min_doc_count", "2", "timeZone", "Europe/Berlin", "offset", "30m"));

        // When
        AggregationNode innermost = builder.build(root, List.of(dateHistogram), Map.of(), TIME_RANGE, TIME_FIELD);

        // Then
        assertThat(innermost.getBody()).containsEntry("field", "created")
                .containsEntry("fixed_interval", "1h")
                .containsEntry("min_doc_count", 2)
                .containsEntry("time_zone", "Europe/Berlin")
                .containsEntry("offset", "30m");
    }

    @Test
    void testBuild_WithSeveralBucketAggs_ShouldNestInDeclarationOrder() {
        // Given
        List<BucketAgg> bucketAggs = List.of(
                bucket("3", "terms", "host", Map.of("size", "10")),
                bucket("2", "date_histogram", "", Map.of()));

        // When
        AggregationNode innermost = builder.build(root, bucketAggs, Map.of(), TIME_RANGE, TIME_FIELD);

        // Then
        assertThat(innermost.getKey()).isEqualTo("2");
        assertThat(root.getChildren()).containsOnlyKeys("3");
        assertThat(root.getChild("3").getChildren()).containsOnlyKeys("2");
        assertThat(root.getChild("3").getBody()).containsEntry("size", 10);
    }

    @Test
    void testBuild_WithUnknownBucketType_ShouldSkipLevel() {
        // Given
        List<BucketAgg> bucketAggs = List.of(
                bucket("4", "nested", "tags", Map.of()),
                bucket("2", "date_histogram", "", Map.of()));

        // When
        builder.build(root, bucketAggs, Map.of(), TIME_RANGE, TIME_FIELD);

        // Then
        assertThat(root.getChildren()).containsOnlyKeys("2");
    }

    @Test
    void testAddTerms_WithZeroSize_ShouldDefaultTo500() {
        // When
        AggregationNode terms = builder.addTerms(root, bucket("3", "terms", "host", Map.of("size", "0")), Map.of());

        // Then
        assertThat(terms.getBody()).containsEntry("size", 500).doesNotContainKey("order");
    }

    @Test
    void testAddTerms_WithoutSize_ShouldDefaultTo500() {
        // When
        AggregationNode terms = builder.addTerms(root, bucket("3", "terms", "host", Map.of()), Map.of());

        // Then
        assertThat(terms.getBody()).containsEntry("size", 500);
    }

    @Test
    void testAddTerms_WithSizeBeyondIntRange_ShouldDefaultTo500() {
        // When
        AggregationNode terms = builder.addTerms(root,
                bucket("3", "terms", "host", Map.of("size", 5_000_000_000L)), Map.of());

        // Then
        assertThat(terms.getBody()).containsEntry("size", 500);
    }

    @Test
    void testAddTerms_OrderedByCountMetric_ShouldOrderByCountKey() {
        // Given
        Map<String, MetricAgg> metrics = Map.of("1", metric("1", "count", ""));
        BucketAgg terms = bucket("3", "terms", "host", Map.of("orderBy", "1", "order", "asc"));

        // When
        AggregationNode node = builder.addTerms(root, terms, metrics);

        // Then
        assertThat(node.getBody()).containsEntry("order", Map.of("_count", "asc"));
        assertThat(node.hasChildren()).isFalse();
    }

    @Test
    void testAddTerms_OrderedByFieldMetric_ShouldAttachMetricInsideTerms() {
        // Given
        Map<String, MetricAgg> metrics = Map.of("5", metric("5", "avg", "bytes"));
        BucketAgg terms = bucket("3", "terms", "host", Map.of("orderBy", "5"));

        // When
        AggregationNode node = builder.addTerms(root, terms, metrics);

        // Then
        assertThat(node.getBody()).containsEntry("order", Map.of("5", "desc"));
        assertThat(node.getChild("5").getType()).isEqualTo("avg");
        assertThat(node.getChild("5").getBody()).isEqualTo(Map.of("field", "bytes"));
    }

    @Test
    void testAddTerms_OrderedBySubValueOfMetric_ShouldKeepFullOrderKey() {
        // Given
        Map<String, MetricAgg> metrics = Map.of("2", metric("2", "extended_stats", "latency"));
        BucketAgg terms = bucket("3", "terms", "host", Map.of("orderBy", "2[std_deviation]"));

        // When
        AggregationNode node = builder.addTerms(root, terms, metrics);

        // Then
        assertThat(node.getBody()).containsEntry("order", Map.of("2[std_deviation]", "desc"));
        assertThat(node.getChild("2")).isNotNull();
    }

    @Test
    void testAddTerms_OrderedByUnknownMetric_ShouldOmitOrder() {
        // When
        AggregationNode node = builder.addTerms(root, bucket("3", "terms", "host", Map.of("orderBy", "9")), Map.of());

        // Then
        assertThat(node.getBody()).doesNotContainKey("order");
    }

    @Test
    void testAddTerms_OrderedByTermKey_ShouldUseItVerbatim() {
        // When
        AggregationNode node = builder.addTerms(root,
                bucket("3", "terms", "host", Map.of("orderBy", "_term", "min_doc_count", "1")), Map.of());

        // Then
        assertThat(node.getBody()).containsEntry("order", Map.of("_term", "desc"))
                .containsEntry("min_doc_count", 1);
    }

    @Test
    void testAddFilters_WithoutLabel_ShouldUseQueryAsKey() {
        // Given
        BucketAgg filters = bucket("4", "filters", "", Map.of("filters", List.of(
                Map.of("label", "", "query", "status:500"),
                Map.of("label", "ok", "query", "status:200"))));

        // When
        AggregationNode node = builder.addFilters(root, filters);

        // Then
        @SuppressWarnings("unchecked")
        Map<String, Object> byLabel = (Map<String, Object>) node.getBody().get("filters");
        assertThat(byLabel).containsOnlyKeys("status:500", "ok");
        assertThat(byLabel.get("ok")).isEqualTo(AggregationTreeBuilder.queryStringFilter("status:200"));
    }

    @Test
    void testAddFilters_WithNoFilters_ShouldAddNoLevel() {
        // When
        AggregationNode node = builder.addFilters(root, bucket("4", "filters", "", Map.of()));

        // Then
        assertThat(node).isSameAs(root);
        assertThat(root.hasChildren()).isFalse();
    }

    @Test
    void testAddHistogram_WithStringSettings_ShouldCoerceIntegers() {
        // When
        AggregationNode node = builder.addHistogram(root,
                bucket("5", "histogram", "bytes", Map.of("interval", "250", "missing", "0")));

        // Then
        assertThat(node.getBody()).containsEntry("field", "bytes")
                .containsEntry("interval", 250)
                .containsEntry("min_doc_count", 0)
                .containsEntry("missing", 0);
    }

    @Test
    void testAddGeoHashGrid_WithoutPrecision_ShouldDefaultTo3() {
        // When
        AggregationNode node = builder.addGeoHashGrid(root, bucket("6", "geohash_grid", "location", Map.of()));

        // Then
        assertThat(node.getBody()).containsEntry("precision", 3).containsEntry("field", "location");
    }

    private static BucketAgg bucket(String id, String type, String field, Map<String, Object> settings) {
        return BucketAgg.builder().id(id).type(type).field(field).settings(settings).build();
    }

    private static MetricAgg metric(String id, String type, String field) {
        return MetricAgg.builder().id(id).type(type).field(field).build();
    }
}
