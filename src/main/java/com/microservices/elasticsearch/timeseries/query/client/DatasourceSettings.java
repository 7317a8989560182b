package com.microservices.elasticsearch.timeseries.query.client;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DatasourceSettings {
    public static final String DEFAULT_TIME_FIELD = "@timestamp";
    public static final int DEFAULT_MAX_CONCURRENT_SHARD_REQUESTS = 5;

    // static index name, or a pattern such as [logs-]YYYY.MM.DD when interval is set
    String index;
    // Hourly, Daily, Weekly, Monthly, Yearly or empty
    String interval;
    @Builder.Default
    String timeField = DEFAULT_TIME_FIELD;
    // minimum interval configured on the datasource, e.g. 10s
    String timeInterval;
    @Builder.Default
    int maxConcurrentShardRequests = DEFAULT_MAX_CONCURRENT_SHARD_REQUESTS;
}
