package com.microservices.elasticsearch.timeseries.query.model.settings;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GeoHashGridSettings {
    public static final int DEFAULT_PRECISION = 3;

    @Builder.Default
    int precision = DEFAULT_PRECISION;
}
