package com.microservices.elasticsearch.timeseries.query.client;

import java.util.Map;

import com.microservices.elasticsearch.timeseries.query.interval.Interval;

import lombok.Value;

/**
 * One finalized search of a multi-search batch. {@code source} is the JSON encoding of
 * {@code body}, still carrying the interval placeholders.
 */
@Value
public class SearchRequest {
    Interval interval;
    Map<String, Object> body;
    String source;
}
