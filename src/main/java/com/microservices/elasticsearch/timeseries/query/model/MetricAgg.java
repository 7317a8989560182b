package com.microservices.elasticsearch.timeseries.query.model;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MetricAgg {
    private String id;
    private String type;
    private String field;
    private boolean hide;

    @Builder.Default
    private Map<String, Object> settings = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> meta = new LinkedHashMap<>();

    // single bucket path reference, used by every pipeline type except bucket_script
    private String pipelineAggregate;

    // variable name -> referenced metric id, bucket_script only
    @Builder.Default
    private Map<String, String> pipelineVariables = new LinkedHashMap<>();
}
