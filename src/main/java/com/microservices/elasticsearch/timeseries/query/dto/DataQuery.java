package com.microservices.elasticsearch.timeseries.query.dto;

import java.util.Map;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One panel query as handed over by the query orchestration layer.
 * The panel model is kept as the loosely typed JSON document the editor produced.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataQuery {
    @NotBlank
    private String refId;

    private long maxDataPoints;

    @NotNull
    @Valid
    private TimeRange timeRange;

    @NotNull
    private Map<String, Object> model;
}
