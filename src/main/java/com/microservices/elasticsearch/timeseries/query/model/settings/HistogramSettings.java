package com.microservices.elasticsearch.timeseries.query.model.settings;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class HistogramSettings {
    public static final int DEFAULT_INTERVAL = 1000;

    @Builder.Default
    int interval = DEFAULT_INTERVAL;
    int minDocCount;
    Integer missing;
}
