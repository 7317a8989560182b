package com.microservices.elasticsearch.timeseries.query.model;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BucketAgg {
    private String id;
    private String type; // date_histogram, histogram, filters, terms, geohash_grid
    private String field;

    @Builder.Default
    private Map<String, Object> settings = new LinkedHashMap<>();
}
