package com.microservices.elasticsearch.timeseries.query.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.microservices.elasticsearch.timeseries.query.dto.DataQuery;
import com.microservices.elasticsearch.timeseries.query.exception.QueryParseException;
import com.microservices.elasticsearch.timeseries.query.model.BucketAgg;
import com.microservices.elasticsearch.timeseries.query.model.MetricAgg;
import com.microservices.elasticsearch.timeseries.query.model.MetricAggTypes;
import com.microservices.elasticsearch.timeseries.query.model.Query;
import com.microservices.elasticsearch.timeseries.query.util.SettingsValues;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns the panel models of the incoming data queries into typed {@link Query} values.
 * Any malformed query fails the whole batch.
 */
@Slf4j
@Component
public class QueryModelParser {

    // legacy editors stored cleared settings as the string "null"
    private static final String LEGACY_NULL = "null";

    private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    public List<Query> parse(List<DataQuery> dataQueries) {
        List<Query> queries = new ArrayList<>(dataQueries.size());
        for (DataQuery dataQuery : dataQueries) {
            queries.add(parseQuery(dataQuery));
        }
        log.debug("Parsed {} panel queries", queries.size());
        return queries;
    }

    Query parseQuery(DataQuery dataQuery) {
        validate(dataQuery);
        Map<String, Object> model = dataQuery.getModel();
        return Query.builder()
                .refId(dataQuery.getRefId())
                .rawQuery(SettingsValues.string(model, "query", ""))
                .interval(SettingsValues.string(model, "interval", ""))
                .alias(SettingsValues.string(model, "alias", ""))
                .maxDataPoints(dataQuery.getMaxDataPoints())
                .bucketAggs(parseBucketAggs(dataQuery.getRefId(), model))
                .metrics(parseMetrics(dataQuery.getRefId(), model))
                .build();
    }

    private void validate(DataQuery dataQuery) {
        if (dataQuery == null) {
            throw new QueryParseException("Query must not be null");
        }
        Set<ConstraintViolation<DataQuery>> violations = validator.validate(dataQuery);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new QueryParseException("Invalid query " + dataQuery.getRefId() + ": " + details);
        }
    }

    private List<BucketAgg> parseBucketAggs(String refId, Map<String, Object> model) {
        List<BucketAgg> bucketAggs = new ArrayList<>();
        for (Object entry : SettingsValues.array(model.get("bucketAggs"))) {
            Map<String, Object> json = SettingsValues.object(entry);
            bucketAggs.add(BucketAgg.builder()
                    .type(requiredString(refId, json, "type", "bucket aggregation"))
                    .id(requiredString(refId, json, "id", "bucket aggregation"))
                    .field(SettingsValues.string(json, "field", ""))
                    .settings(SettingsValues.object(json.get("settings")))
                    .build());
        }
        return bucketAggs;
    }

    private List<MetricAgg> parseMetrics(String refId, Map<String, Object> model) {
        List<MetricAgg> metrics = new ArrayList<>();
        for (Object entry : SettingsValues.array(model.get("metrics"))) {
            Map<String, Object> json = SettingsValues.object(entry);

            Map<String, Object> settings = SettingsValues.object(json.get("settings"));
            settings.values().removeIf(LEGACY_NULL::equals);

            String type = requiredString(refId, json, "type", "metric");
            MetricAgg.MetricAggBuilder metric = MetricAgg.builder()
                    .id(SettingsValues.string(json, "id", ""))
                    .type(type)
                    .field(SettingsValues.string(json, "field", ""))
                    .hide(SettingsValues.bool(json.get("hide"), false))
                    .pipelineAggregate(SettingsValues.string(json, "pipelineAgg", ""))
                    .settings(settings)
                    .meta(SettingsValues.object(json.get("meta")));

            if (MetricAggTypes.hasMultipleBucketPaths(type)) {
                metric.pipelineVariables(parsePipelineVariables(json.get("pipelineVariables")));
            }
            metrics.add(metric.build());
        }
        return metrics;
    }

    private Map<String, String> parsePipelineVariables(Object value) {
        Map<String, String> variables = new LinkedHashMap<>();
        for (Object entry : SettingsValues.array(value)) {
            Map<String, Object> variable = SettingsValues.object(entry);
            if (variable.get("name") instanceof String name && variable.get("pipelineAgg") instanceof String pipelineAgg) {
                variables.put(name, pipelineAgg);
            }
        }
        return variables;
    }

    private static String requiredString(String refId, Map<String, Object> json, String key, String what) {
        if (json.get(key) instanceof String value) {
            return value;
        }
        throw new QueryParseException("Invalid query " + refId + ": " + what + " is missing '" + key + "'");
    }
}
