package com.microservices.elasticsearch.timeseries.query.service;

import java.util.List;
import java.util.Map;

import com.microservices.elasticsearch.timeseries.query.dto.QueryDataResponse;
import com.microservices.elasticsearch.timeseries.query.model.Query;

/**
 * Maps the raw multi-search responses back onto panel results.
 * {@code responses.get(i)} answers {@code queries.get(i)}.
 */
public interface ResponseParser {

    QueryDataResponse parse(List<Map<String, Object>> responses, List<Query> queries);
}
