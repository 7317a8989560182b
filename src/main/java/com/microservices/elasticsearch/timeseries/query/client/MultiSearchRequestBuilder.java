package com.microservices.elasticsearch.timeseries.query.client;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microservices.elasticsearch.timeseries.query.dto.TimeRange;
import com.microservices.elasticsearch.timeseries.query.exception.RequestBuildException;
import com.microservices.elasticsearch.timeseries.query.interval.Interval;

/**
 * Collects the searches of one batch. Searches keep the order in which they were opened.
 */
public class MultiSearchRequestBuilder {

    private final TimeRange timeRange;
    private final ObjectMapper objectMapper;
    private final List<SearchRequestBuilder> searches = new ArrayList<>();

    public MultiSearchRequestBuilder(TimeRange timeRange, ObjectMapper objectMapper) {
        this.timeRange = timeRange;
        this.objectMapper = objectMapper;
    }

    public SearchRequestBuilder search(Interval interval) {
        SearchRequestBuilder search = new SearchRequestBuilder(interval);
        searches.add(search);
        return search;
    }

    public int size() {
        return searches.size();
    }

    /**
     * Finalize every search. Fails as a whole if any body cannot be encoded.
     */
    public MultiSearchRequest build() {
        List<SearchRequest> requests = new ArrayList<>(searches.size());
        for (SearchRequestBuilder search : searches) {
            Map<String, Object> body = search.build();
            try {
                requests.add(new SearchRequest(search.getInterval(), body, objectMapper.writeValueAsString(body)));
            } catch (JsonProcessingException e) {
                throw new RequestBuildException("Failed to encode search request", e);
            }
        }
        return new MultiSearchRequest(timeRange, List.copyOf(requests));
    }
}
