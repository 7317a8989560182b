package com.microservices.elasticsearch.timeseries.query.model.settings;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TermsSettings {
    public static final int DEFAULT_SIZE = 500;
    public static final String DEFAULT_ORDER = "desc";

    @Builder.Default
    int size = DEFAULT_SIZE;
    Integer minDocCount;
    String missing;
    String orderBy;
    @Builder.Default
    String order = DEFAULT_ORDER;
}
