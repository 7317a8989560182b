package com.microservices.elasticsearch.timeseries.query.model.settings;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DateHistogramSettings {
    public static final String AUTO_INTERVAL = "auto";

    @Builder.Default
    String interval = AUTO_INTERVAL;
    int minDocCount;
    String offset;
    String missing;
    String timeZone;
}
