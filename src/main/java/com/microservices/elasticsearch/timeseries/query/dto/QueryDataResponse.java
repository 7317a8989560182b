package com.microservices.elasticsearch.timeseries.query.dto;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-panel results keyed by reference ID, in the order the panels were requested
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryDataResponse {
    @Builder.Default
    private Map<String, DataResponse> responses = new LinkedHashMap<>();

    public static QueryDataResponse empty() {
        return new QueryDataResponse(new LinkedHashMap<>());
    }

    public void put(String refId, DataResponse response) {
        responses.put(refId, response);
    }

    public DataResponse get(String refId) {
        return responses.get(refId);
    }
}
