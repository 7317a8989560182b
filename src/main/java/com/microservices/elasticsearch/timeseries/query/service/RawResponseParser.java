package com.microservices.elasticsearch.timeseries.query.service;

import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.microservices.elasticsearch.timeseries.query.dto.DataResponse;
import com.microservices.elasticsearch.timeseries.query.dto.QueryDataResponse;
import com.microservices.elasticsearch.timeseries.query.model.Query;

import lombok.extern.slf4j.Slf4j;

/**
 * Hands each raw search response to its panel unchanged, turning per-search failures into panel errors
 */
@Slf4j
@Component
public class RawResponseParser implements ResponseParser {

    static final String MISSING_RESPONSE = "no response received for query";

    @Override
    public QueryDataResponse parse(List<Map<String, Object>> responses, List<Query> queries) {
        QueryDataResponse result = QueryDataResponse.empty();
        for (int i = 0; i < queries.size(); i++) {
            Query query = queries.get(i);
            if (responses == null || i >= responses.size() || responses.get(i) == null) {
                result.put(query.getRefId(), DataResponse.ofError(MISSING_RESPONSE));
                continue;
            }
            Map<String, Object> response = responses.get(i);
            Object error = response.get("error");
            if (error != null) {
                String reason = errorReason(error);
                log.warn("Search for query {} failed: {}", query.getRefId(), reason);
                result.put(query.getRefId(), DataResponse.ofError(reason));
            } else {
                result.put(query.getRefId(), DataResponse.ofBody(response));
            }
        }
        return result;
    }

    private static String errorReason(Object error) {
        if (error instanceof Map<?, ?> details) {
            Object reason = details.get("reason");
            if (reason == null) {
                reason = details.get("type");
            }
            if (reason != null) {
                return String.valueOf(reason);
            }
        }
        return String.valueOf(error);
    }
}
