package com.microservices.elasticsearch.timeseries.query.service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.microservices.elasticsearch.timeseries.query.client.DatasourceClient;
import com.microservices.elasticsearch.timeseries.query.client.MultiSearchRequest;
import com.microservices.elasticsearch.timeseries.query.client.MultiSearchRequestBuilder;
import com.microservices.elasticsearch.timeseries.query.client.SearchRequestBuilder;
import com.microservices.elasticsearch.timeseries.query.dto.DataQuery;
import com.microservices.elasticsearch.timeseries.query.dto.DataResponse;
import com.microservices.elasticsearch.timeseries.query.dto.MultiSearchResponse;
import com.microservices.elasticsearch.timeseries.query.dto.QueryDataResponse;
import com.microservices.elasticsearch.timeseries.query.dto.TimeRange;
import com.microservices.elasticsearch.timeseries.query.interval.Interval;
import com.microservices.elasticsearch.timeseries.query.interval.IntervalCalculator;
import com.microservices.elasticsearch.timeseries.query.model.AggregationNode;
import com.microservices.elasticsearch.timeseries.query.model.BucketAgg;
import com.microservices.elasticsearch.timeseries.query.model.BucketAggType;
import com.microservices.elasticsearch.timeseries.query.model.MetricAgg;
import com.microservices.elasticsearch.timeseries.query.model.MetricAggTypes;
import com.microservices.elasticsearch.timeseries.query.model.Query;
import com.microservices.elasticsearch.timeseries.query.model.settings.DateHistogramSettings;
import com.microservices.elasticsearch.timeseries.query.util.SettingsValues;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Builds one multi-search request for all panel queries, executes it and maps the results back.
 * Invalid panels get an error result of their own; build and transport failures fail the whole call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TimeSeriesQueryService {

    public static final String INVALID_QUERY_MESSAGE = "invalid query, missing metrics and aggregations";
    static final int DEFAULT_DOCUMENT_SIZE = 500;
    static final String LOGS_HISTOGRAM_ID = "1";

    private final DatasourceClient client;
    private final QueryModelParser queryModelParser;
    private final SettingsNormalizer settingsNormalizer;
    private final AggregationTreeBuilder aggregationTreeBuilder;
    private final MetricAggregationResolver metricAggregationResolver;
    private final IntervalCalculator intervalCalculator;
    private final ResponseParser responseParser;
    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Non-blocking variant of {@link #execute(List)}; the round trip runs on the bounded elastic scheduler
     */
    public Mono<QueryDataResponse> executeAsync(List<DataQuery> dataQueries) {
        return Mono.fromCallable(() -> execute(dataQueries))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnSuccess(result -> log.info("Time series query completed with {} panel results",
                        result.getResponses().size()))
                .doOnError(error -> log.error("Time series query failed", error));
    }

    public QueryDataResponse execute(List<DataQuery> dataQueries) {
        if (dataQueries == null || dataQueries.isEmpty()) {
            return QueryDataResponse.empty();
        }
        List<Query> queries = queryModelParser.parse(dataQueries);
        TimeRange timeRange = dataQueries.get(0).getTimeRange();

        MultiSearchRequestBuilder multiSearch = new MultiSearchRequestBuilder(timeRange, objectMapper);
        List<Query> dispatched = new ArrayList<>();
        Map<String, DataResponse> invalid = new LinkedHashMap<>();
        for (Query query : queries) {
            Optional<Query> searched = processQuery(settingsNormalizer.normalize(query), multiSearch, timeRange);
            if (searched.isPresent()) {
                dispatched.add(searched.get());
            } else {
                log.warn("Query {} has neither bucket aggregations nor a document metric", query.getRefId());
                invalid.put(query.getRefId(), DataResponse.ofError(INVALID_QUERY_MESSAGE));
            }
        }

        QueryDataResponse parsed = QueryDataResponse.empty();
        if (!dispatched.isEmpty()) {
            MultiSearchRequest request = multiSearch.build();
            log.info("Executing multi-search with {} searches", request.getRequests().size());
            MultiSearchResponse response = client.executeMultiSearch(request);
            parsed = responseParser.parse(response.getResponses(), dispatched);
        }

        QueryDataResponse result = QueryDataResponse.empty();
        for (Query query : queries) {
            DataResponse response = invalid.containsKey(query.getRefId())
                    ? invalid.get(query.getRefId())
                    : parsed.get(query.getRefId());
            if (response != null) {
                result.put(query.getRefId(), response);
            }
        }
        return result;
    }

    /**
     * Add the search for one query to the batch. Returns the query as searched (logs queries gain
     * their histogram bucket), or empty when the query is invalid and nothing was added.
     */
    Optional<Query> processQuery(Query query, MultiSearchRequestBuilder multiSearch, TimeRange timeRange) {
        if (query.getBucketAggs().isEmpty() && !isDocumentQuery(query)) {
            return Optional.empty();
        }

        Duration minInterval = client.getMinInterval(query.getInterval());
        Interval interval = intervalCalculator.calculate(timeRange, minInterval, query.getMaxDataPoints());
        String timeField = client.getTimeField();

        SearchRequestBuilder search = multiSearch.search(interval)
                .size(0)
                .addDateRangeFilter(timeField, timeRange.getFrom(), timeRange.getTo(), AggregationTreeBuilder.EPOCH_MILLIS_FORMAT)
                .addQueryStringFilter(query.getRawQuery(), true);

        if (query.getBucketAggs().isEmpty()) {
            return Optional.of(addDocumentQuery(query, search, timeRange, timeField));
        }

        Map<String, MetricAgg> metricsById = query.metricsById();
        AggregationNode innermost = aggregationTreeBuilder.build(
                search.aggregations(), query.getBucketAggs(), metricsById, timeRange, timeField);
        metricAggregationResolver.attach(innermost, query.getMetrics(), metricsById);
        return Optional.of(query);
    }

    private Query addDocumentQuery(Query query, SearchRequestBuilder search, TimeRange timeRange, String timeField) {
        MetricAgg metric = query.getMetrics().get(0);
        search.sortDesc(timeField, "boolean")
                .sortDesc("_doc", "")
                .addDocValueField(timeField)
                .size(SettingsValues.integer(metric.getSettings(), "size", DEFAULT_DOCUMENT_SIZE));

        if (!MetricAggTypes.LOGS.equals(metric.getType())) {
            return query;
        }

        search.size(SettingsValues.integer(metric.getSettings(), "limit", DEFAULT_DOCUMENT_SIZE))
                .addHighlight();

        // log volume histogram next to the raw rows
        BucketAgg histogram = BucketAgg.builder()
                .id(LOGS_HISTOGRAM_ID)
                .type(BucketAggType.DATE_HISTOGRAM.getValue())
                .field(timeField)
                .settings(settingsNormalizer.normalizeBucketSettings(
                        Map.of("interval", DateHistogramSettings.AUTO_INTERVAL)))
                .build();
        aggregationTreeBuilder.build(search.aggregations(), List.of(histogram), Map.of(), timeRange, timeField);
        return query.toBuilder().bucketAggs(List.of(histogram)).build();
    }

    private static boolean isDocumentQuery(Query query) {
        return !query.getMetrics().isEmpty() && MetricAggTypes.isDocumentQuery(query.getMetrics().get(0).getType());
    }
}
