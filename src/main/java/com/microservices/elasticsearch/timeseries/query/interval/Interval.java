package com.microservices.elasticsearch.timeseries.query.interval;

import java.time.Duration;

import lombok.Value;

/**
 * A bucket interval in both its display form ({@code 10s}) and its length
 */
@Value
public class Interval {
    String text;
    Duration value;

    public static Interval of(Duration value) {
        return new Interval(IntervalParser.format(value), value);
    }

    public long millis() {
        return value.toMillis();
    }
}
