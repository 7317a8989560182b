package com.microservices.elasticsearch.timeseries.query.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inclusive time range, both bounds in epoch milliseconds
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeRange {
    private long from;
    private long to;

    public long durationMillis() {
        return to - from;
    }
}
