package com.microservices.elasticsearch.timeseries.query.client;

import java.time.Duration;

import com.microservices.elasticsearch.timeseries.query.dto.MultiSearchResponse;

/**
 * Access to one Elasticsearch datasource. Connection handling, timeouts and retries are the
 * implementation's business.
 */
public interface DatasourceClient {

    /**
     * Minimum bucket interval for a query that declares {@code queryInterval} (may be empty)
     */
    Duration getMinInterval(String queryInterval);

    String getTimeField();

    MultiSearchResponse executeMultiSearch(MultiSearchRequest request);
}
