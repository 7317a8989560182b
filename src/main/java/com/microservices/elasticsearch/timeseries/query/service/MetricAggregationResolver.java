package com.microservices.elasticsearch.timeseries.query.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.microservices.elasticsearch.timeseries.query.model.AggregationNode;
import com.microservices.elasticsearch.timeseries.query.model.MetricAgg;
import com.microservices.elasticsearch.timeseries.query.model.MetricAggTypes;
import com.microservices.elasticsearch.timeseries.query.util.SettingsValues;

import lombok.extern.slf4j.Slf4j;

/**
 * Attaches metric and pipeline aggregations to the innermost bucket level.
 * Pipeline references that do not point at a metric of the same query are dropped.
 */
@Slf4j
@Component
public class MetricAggregationResolver {

    /** Bucket path of the implicit document count of a bucket. */
    public static final String COUNT_BUCKET_PATH = "_count";

    public void attach(AggregationNode innermost, List<MetricAgg> metrics, Map<String, MetricAgg> metricsById) {
        for (MetricAgg metric : metrics) {
            if (MetricAggTypes.COUNT.equals(metric.getType())) {
                continue;
            }
            if (!MetricAggTypes.isPipeline(metric.getType())) {
                innermost.addChild(metric.getId(), metric.getType(), metricBody(metric));
            } else if (MetricAggTypes.hasMultipleBucketPaths(metric.getType())) {
                attachMultiPathPipeline(innermost, metric, metricsById);
            } else {
                attachSinglePathPipeline(innermost, metric, metricsById);
            }
        }
    }

    private void attachMultiPathPipeline(AggregationNode innermost, MetricAgg metric, Map<String, MetricAgg> metricsById) {
        Map<String, Object> bucketPaths = new LinkedHashMap<>();
        metric.getPipelineVariables().forEach((name, reference) ->
                resolveBucketPath(reference, metricsById).ifPresent(path -> bucketPaths.put(name, path)));
        if (bucketPaths.isEmpty()) {
            log.debug("Skipping pipeline metric {}: no resolvable bucket path", metric.getId());
            return;
        }
        innermost.addChild(metric.getId(), metric.getType(), pipelineBody(bucketPaths, metric));
    }

    private void attachSinglePathPipeline(AggregationNode innermost, MetricAgg metric, Map<String, MetricAgg> metricsById) {
        Optional<String> bucketPath = resolveBucketPath(metric.getPipelineAggregate(), metricsById);
        if (bucketPath.isEmpty()) {
            log.debug("Skipping pipeline metric {}: reference '{}' does not resolve",
                    metric.getId(), metric.getPipelineAggregate());
            return;
        }
        innermost.addChild(metric.getId(), metric.getType(), pipelineBody(bucketPath.get(), metric));
    }

    /**
     * Bucket path for a reference to another metric: {@code _count} for count metrics, the metric ID otherwise.
     * Only integer-like IDs that match a metric of the query resolve.
     */
    Optional<String> resolveBucketPath(String reference, Map<String, MetricAgg> metricsById) {
        if (!SettingsValues.isInteger(reference)) {
            return Optional.empty();
        }
        MetricAgg target = metricsById.get(reference);
        if (target == null) {
            return Optional.empty();
        }
        return Optional.of(MetricAggTypes.COUNT.equals(target.getType()) ? COUNT_BUCKET_PATH : reference);
    }

    static Map<String, Object> metricBody(MetricAgg metric) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (metric.getField() != null && !metric.getField().isEmpty()) {
            body.put("field", metric.getField());
        }
        putSettings(body, metric.getSettings());
        return body;
    }

    static Map<String, Object> pipelineBody(Object bucketsPath, MetricAgg metric) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("buckets_path", bucketsPath);
        putSettings(body, metric.getSettings());
        return body;
    }

    private static void putSettings(Map<String, Object> body, Map<String, Object> settings) {
        if (settings == null) {
            return;
        }
        settings.forEach((key, value) -> {
            if (!key.isEmpty() && value != null) {
                body.put(key, value);
            }
        });
    }
}
