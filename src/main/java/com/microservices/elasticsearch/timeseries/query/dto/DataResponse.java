package com.microservices.elasticsearch.timeseries.query.dto;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataResponse {
    private String error;
    private Map<String, Object> body;

    public static DataResponse ofError(String error) {
        return DataResponse.builder().error(error).build();
    }

    public static DataResponse ofBody(Map<String, Object> body) {
        return DataResponse.builder().body(body).build();
    }

    public boolean hasError() {
        return error != null;
    }
}
