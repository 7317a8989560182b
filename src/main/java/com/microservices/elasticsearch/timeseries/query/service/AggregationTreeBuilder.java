package com.microservices.elasticsearch.timeseries.query.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.microservices.elasticsearch.timeseries.query.dto.TimeRange;
import com.microservices.elasticsearch.timeseries.query.model.AggregationNode;
import com.microservices.elasticsearch.timeseries.query.model.BucketAgg;
import com.microservices.elasticsearch.timeseries.query.model.BucketAggType;
import com.microservices.elasticsearch.timeseries.query.model.MetricAgg;
import com.microservices.elasticsearch.timeseries.query.model.MetricAggTypes;
import com.microservices.elasticsearch.timeseries.query.model.settings.DateHistogramSettings;
import com.microservices.elasticsearch.timeseries.query.model.settings.FiltersSettings;
import com.microservices.elasticsearch.timeseries.query.model.settings.HistogramSettings;
import com.microservices.elasticsearch.timeseries.query.model.settings.TermsSettings;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Nests one bucket aggregation per declared bucket agg, outermost first
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AggregationTreeBuilder {

    /** Expanded by the datasource client to the interval in milliseconds followed by "ms". */
    public static final String INTERVAL_MS_PLACEHOLDER = "$__interval_msms";
    public static final String EPOCH_MILLIS_FORMAT = "epoch_millis";
    public static final String COUNT_ORDER_KEY = "_count";

    // extended stats and percentiles order keys look like 2[std_deviation], everything else is the bare id
    private static final Pattern LEADING_METRIC_ID = Pattern.compile("^(\\d+)");

    private final SettingsNormalizer settingsNormalizer;

    /**
     * Build the bucket levels under {@code root} and return the innermost level, where metrics attach.
     * Unsupported bucket types and empty filter sets add no level.
     */
    public AggregationNode build(AggregationNode root,
                                 List<BucketAgg> bucketAggs,
                                 Map<String, MetricAgg> metricsById,
                                 TimeRange timeRange,
                                 String timeField) {
        AggregationNode current = root;
        for (BucketAgg bucketAgg : bucketAggs) {
            current = addBucketAggregation(current, bucketAgg, metricsById, timeRange, timeField);
        }
        log.debug("Nested {} bucket aggregation(s), innermost level: {}", bucketAggs.size(), current);
        return current;
    }

    AggregationNode addBucketAggregation(AggregationNode parent,
                                         BucketAgg bucketAgg,
                                         Map<String, MetricAgg> metricsById,
                                         TimeRange timeRange,
                                         String timeField) {
        Optional<BucketAggType> type = BucketAggType.fromValue(bucketAgg.getType());
        if (type.isEmpty()) {
            return parent;
        }
        return switch (type.get()) {
            case DATE_HISTOGRAM -> addDateHistogram(parent, bucketAgg, timeRange, timeField);
            case HISTOGRAM -> addHistogram(parent, bucketAgg);
            case FILTERS -> addFilters(parent, bucketAgg);
            case TERMS -> addTerms(parent, bucketAgg, metricsById);
            case GEOHASH_GRID -> addGeoHashGrid(parent, bucketAgg);
        };
    }

    AggregationNode addDateHistogram(AggregationNode parent, BucketAgg bucketAgg, TimeRange timeRange, String timeField) {
        DateHistogramSettings settings = settingsNormalizer.dateHistogram(bucketAgg);
        String field = isBlank(bucketAgg.getField()) ? timeField : bucketAgg.getField();

        Map<String, Object> extendedBounds = new LinkedHashMap<>();
        extendedBounds.put("min", timeRange.getFrom());
        extendedBounds.put("max", timeRange.getTo());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("field", field);
        body.put("fixed_interval", DateHistogramSettings.AUTO_INTERVAL.equals(settings.getInterval())
                ? INTERVAL_MS_PLACEHOLDER
                : settings.getInterval());
        body.put("min_doc_count", settings.getMinDocCount());
        body.put("extended_bounds", extendedBounds);
        body.put("format", EPOCH_MILLIS_FORMAT);
        if (settings.getOffset() != null) {
            body.put("offset", settings.getOffset());
        }
        if (settings.getMissing() != null) {
            body.put("missing", settings.getMissing());
        }
        // utc is the engine default
        if (settings.getTimeZone() != null && !"utc".equals(settings.getTimeZone())) {
            body.put("time_zone", settings.getTimeZone());
        }
        return parent.addChild(bucketAgg.getId(), BucketAggType.DATE_HISTOGRAM.getValue(), body);
    }

    AggregationNode addHistogram(AggregationNode parent, BucketAgg bucketAgg) {
        HistogramSettings settings = settingsNormalizer.histogram(bucketAgg);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("field", bucketAgg.getField());
        body.put("interval", settings.getInterval());
        body.put("min_doc_count", settings.getMinDocCount());
        if (settings.getMissing() != null) {
            body.put("missing", settings.getMissing());
        }
        return parent.addChild(bucketAgg.getId(), BucketAggType.HISTOGRAM.getValue(), body);
    }

    AggregationNode addFilters(AggregationNode parent, BucketAgg bucketAgg) {
        FiltersSettings settings = settingsNormalizer.filters(bucketAgg);
        if (settings.getFilters().isEmpty()) {
            return parent;
        }
        Map<String, Object> filters = new LinkedHashMap<>();
        for (FiltersSettings.Filter filter : settings.getFilters()) {
            filters.put(filter.effectiveLabel(), queryStringFilter(filter.getQuery()));
        }
        return parent.addChild(bucketAgg.getId(), BucketAggType.FILTERS.getValue(), Map.of("filters", filters));
    }

    AggregationNode addTerms(AggregationNode parent, BucketAgg bucketAgg, Map<String, MetricAgg> metricsById) {
        TermsSettings settings = settingsNormalizer.terms(bucketAgg);

        Map<String, Object> order = new LinkedHashMap<>();
        MetricAgg orderMetric = null;
        String orderBy = settings.getOrderBy();
        if (orderBy != null) {
            Matcher matcher = LEADING_METRIC_ID.matcher(orderBy);
            if (matcher.find()) {
                MetricAgg metric = metricsById.get(matcher.group(1));
                if (metric != null && MetricAggTypes.COUNT.equals(metric.getType())) {
                    order.put(COUNT_ORDER_KEY, settings.getOrder());
                } else if (metric != null) {
                    order.put(orderBy, settings.getOrder());
                    orderMetric = metric;
                }
            } else {
                // _term, _key, _count
                order.put(orderBy, settings.getOrder());
            }
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("field", bucketAgg.getField());
        body.put("size", settings.getSize());
        if (!order.isEmpty()) {
            body.put("order", order);
        }
        if (settings.getMinDocCount() != null) {
            body.put("min_doc_count", settings.getMinDocCount());
        }
        if (settings.getMissing() != null) {
            body.put("missing", settings.getMissing());
        }

        AggregationNode terms = parent.addChild(bucketAgg.getId(), BucketAggType.TERMS.getValue(), body);
        if (orderMetric != null) {
            // the ordering value has to be computed inside each term bucket
            Map<String, Object> metricBody = new LinkedHashMap<>();
            if (!isBlank(orderMetric.getField())) {
                metricBody.put("field", orderMetric.getField());
            }
            terms.addChild(orderMetric.getId(), orderMetric.getType(), metricBody);
        }
        return terms;
    }

    AggregationNode addGeoHashGrid(AggregationNode parent, BucketAgg bucketAgg) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("field", bucketAgg.getField());
        body.put("precision", settingsNormalizer.geoHashGrid(bucketAgg).getPrecision());
        return parent.addChild(bucketAgg.getId(), BucketAggType.GEOHASH_GRID.getValue(), body);
    }

    static Map<String, Object> queryStringFilter(String query) {
        Map<String, Object> queryString = new LinkedHashMap<>();
        queryString.put("query", query);
        queryString.put("analyze_wildcard", true);
        return Map.of("query_string", queryString);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
