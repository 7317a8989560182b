package com.microservices.elasticsearch.timeseries.query.model;

import java.util.Arrays;
import java.util.Optional;

public enum BucketAggType {
    DATE_HISTOGRAM("date_histogram"),
    HISTOGRAM("histogram"),
    FILTERS("filters"),
    TERMS("terms"),
    GEOHASH_GRID("geohash_grid");

    private final String value;

    BucketAggType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Resolve a wire type name, empty when the type is not supported
     */
    public static Optional<BucketAggType> fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equals(value))
                .findFirst();
    }
}
