package com.microservices.elasticsearch.timeseries.query.client;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.http.entity.ContentType;
import org.apache.http.nio.entity.NStringEntity;
import org.elasticsearch.client.Request;
import org.elasticsearch.client.Response;
import org.elasticsearch.client.RestClient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microservices.elasticsearch.timeseries.query.dto.MultiSearchResponse;
import com.microservices.elasticsearch.timeseries.query.exception.QueryExecutionException;
import com.microservices.elasticsearch.timeseries.query.exception.RequestBuildException;
import com.microservices.elasticsearch.timeseries.query.interval.IntervalParser;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link DatasourceClient} over the Elasticsearch low-level REST client.
 * The batch goes out as one NDJSON {@code _msearch} call; there is no retry here.
 */
@Slf4j
public class RestDatasourceClient implements DatasourceClient {

    static final String MULTI_SEARCH_ENDPOINT = "/_msearch";
    static final ContentType NDJSON = ContentType.create("application/x-ndjson");

    private final RestClient restClient;
    private final DatasourceSettings settings;
    private final IndexPattern indexPattern;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public RestDatasourceClient(RestClient restClient, DatasourceSettings settings) {
        this.restClient = restClient;
        this.settings = settings;
        this.indexPattern = IndexPattern.of(settings.getIndex(), settings.getInterval());
    }

    @Override
    public Duration getMinInterval(String queryInterval) {
        return IntervalParser.minInterval(queryInterval, settings.getTimeInterval(), IntervalParser.DEFAULT_MIN_INTERVAL);
    }

    @Override
    public String getTimeField() {
        return settings.getTimeField();
    }

    @Override
    public MultiSearchResponse executeMultiSearch(MultiSearchRequest request) {
        String payload = encodeBatch(request);
        log.debug("Multi-search payload:\n{}", payload);

        Request httpRequest = new Request("POST", MULTI_SEARCH_ENDPOINT);
        httpRequest.setEntity(new NStringEntity(payload, NDJSON));
        try {
            long started = System.currentTimeMillis();
            Response response = restClient.performRequest(httpRequest);
            try (InputStream content = response.getEntity().getContent()) {
                MultiSearchResponse result = objectMapper.readValue(content, MultiSearchResponse.class);
                log.info("Multi-search with {} searches completed in {} ms",
                        request.getRequests().size(), System.currentTimeMillis() - started);
                return result;
            }
        } catch (IOException e) {
            log.error("Multi-search request failed", e);
            throw new QueryExecutionException("Multi-search request failed: " + e.getMessage(), e);
        }
    }

    /**
     * NDJSON body: a header line and a source line per search, with the interval placeholders expanded
     */
    String encodeBatch(MultiSearchRequest request) {
        String header = encodeHeader(String.join(",", indexPattern.indices(request.getTimeRange())));
        StringBuilder payload = new StringBuilder();
        for (SearchRequest search : request.getRequests()) {
            String source = search.getSource()
                    .replace("$__interval_ms", String.valueOf(search.getInterval().millis()))
                    .replace("$__interval", search.getInterval().getText());
            payload.append(header).append('\n');
            payload.append(source).append('\n');
        }
        return payload.toString();
    }

    private String encodeHeader(String indices) {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("search_type", "query_then_fetch");
        header.put("ignore_unavailable", true);
        header.put("index", indices);
        if (settings.getMaxConcurrentShardRequests() > 0) {
            header.put("max_concurrent_shard_requests", settings.getMaxConcurrentShardRequests());
        }
        try {
            return objectMapper.writeValueAsString(header);
        } catch (JsonProcessingException e) {
            throw new RequestBuildException("Failed to encode multi-search header", e);
        }
    }
}
