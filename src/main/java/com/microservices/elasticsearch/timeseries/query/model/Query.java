package com.microservices.elasticsearch.timeseries.query.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Typed form of one panel query
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Query {
    private String refId;
    private String rawQuery;
    private String interval;
    private String alias;
    private long maxDataPoints;

    @Builder.Default
    private List<BucketAgg> bucketAggs = new ArrayList<>();

    @Builder.Default
    private List<MetricAgg> metrics = new ArrayList<>();

    /**
     * Index of the metrics by ID. The first metric wins when IDs are duplicated.
     */
    public Map<String, MetricAgg> metricsById() {
        Map<String, MetricAgg> index = new LinkedHashMap<>();
        for (MetricAgg metric : metrics) {
            if (metric.getId() != null) {
                index.putIfAbsent(metric.getId(), metric);
            }
        }
        return Collections.unmodifiableMap(index);
    }
}
