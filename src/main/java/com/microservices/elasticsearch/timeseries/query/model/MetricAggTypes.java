package com.microservices.elasticsearch.timeseries.query.model;

import java.util.Set;

/**
 * Metric aggregation type names and the families they belong to.
 * Metric types are open ended: anything not listed here is forwarded as a plain metric.
 */
public final class MetricAggTypes {
    private MetricAggTypes() {}

    public static final String COUNT = "count";
    public static final String RAW_DATA = "raw_data";
    public static final String RAW_DOCUMENT = "raw_document";
    public static final String LOGS = "logs";
    public static final String MOVING_AVG = "moving_avg";
    public static final String MOVING_FN = "moving_fn";
    public static final String CUMULATIVE_SUM = "cumulative_sum";
    public static final String DERIVATIVE = "derivative";
    public static final String SERIAL_DIFF = "serial_diff";
    public static final String BUCKET_SCRIPT = "bucket_script";

    private static final Set<String> PIPELINE_TYPES = Set.of(
            MOVING_AVG, MOVING_FN, CUMULATIVE_SUM, DERIVATIVE, SERIAL_DIFF, BUCKET_SCRIPT);

    private static final Set<String> MULTIPLE_BUCKET_PATH_TYPES = Set.of(BUCKET_SCRIPT);

    private static final Set<String> DOCUMENT_TYPES = Set.of(RAW_DATA, RAW_DOCUMENT, LOGS);

    private static final Set<String> INLINE_SCRIPT_TYPES = Set.of(
            "avg", "sum", "min", "max", "extended_stats", "percentiles", BUCKET_SCRIPT);

    public static boolean isPipeline(String type) {
        return type != null && PIPELINE_TYPES.contains(type);
    }

    public static boolean hasMultipleBucketPaths(String type) {
        return type != null && MULTIPLE_BUCKET_PATH_TYPES.contains(type);
    }

    public static boolean isDocumentQuery(String type) {
        return type != null && DOCUMENT_TYPES.contains(type);
    }

    public static boolean supportsInlineScript(String type) {
        return type != null && INLINE_SCRIPT_TYPES.contains(type);
    }
}
