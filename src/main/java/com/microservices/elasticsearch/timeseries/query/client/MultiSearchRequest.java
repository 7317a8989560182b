package com.microservices.elasticsearch.timeseries.query.client;

import java.util.List;

import com.microservices.elasticsearch.timeseries.query.dto.TimeRange;

import lombok.Value;

@Value
public class MultiSearchRequest {
    TimeRange timeRange;

    List<SearchRequest> requests;
}
