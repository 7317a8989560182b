package com.microservices.elasticsearch.timeseries.query.config;

import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.client.CredentialsProvider;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.microservices.elasticsearch.timeseries.query.client.DatasourceClient;
import com.microservices.elasticsearch.timeseries.query.client.DatasourceSettings;
import com.microservices.elasticsearch.timeseries.query.client.RestDatasourceClient;

import lombok.extern.slf4j.Slf4j;

/**
 * Configuration class for the Elasticsearch REST client and the datasource it queries
 */
@Slf4j
@Configuration
public class ElasticsearchConfig {

    @Value("${app.elasticsearch.host:localhost}")
    private String elasticsearchHost;

    @Value("${app.elasticsearch.port:9200}")
    private int elasticsearchPort;

    @Value("${app.elasticsearch.scheme:http}")
    private String elasticsearchScheme;

    @Value("${app.elasticsearch.username:}")
    private String username;

    @Value("${app.elasticsearch.password:}")
    private String password;

    @Value("${app.elasticsearch.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${app.elasticsearch.socket-timeout-ms:30000}")
    private int socketTimeoutMs;

    @Value("${app.elasticsearch.index:}")
    private String index;

    @Value("${app.elasticsearch.interval:}")
    private String indexInterval;

    @Value("${app.elasticsearch.time-field:" + DatasourceSettings.DEFAULT_TIME_FIELD + "}")
    private String timeField;

    @Value("${app.elasticsearch.time-interval:}")
    private String timeInterval;

    @Value("${app.elasticsearch.max-concurrent-shard-requests:" + DatasourceSettings.DEFAULT_MAX_CONCURRENT_SHARD_REQUESTS + "}")
    private int maxConcurrentShardRequests;

    /**
     * Create the low-level REST client used for multi-search calls
     */
    @Bean(destroyMethod = "close")
    public RestClient elasticsearchRestClient() {
        log.info("Configuring Elasticsearch client for {}://{}:{}",
                elasticsearchScheme, elasticsearchHost, elasticsearchPort);

        RestClientBuilder builder = RestClient.builder(
                new HttpHost(elasticsearchHost, elasticsearchPort, elasticsearchScheme)
        );

        // Add authentication if credentials are provided
        if (!username.isEmpty() && !password.isEmpty()) {
            log.info("Configuring Elasticsearch with authentication for user: {}", username);
            CredentialsProvider credentialsProvider = new BasicCredentialsProvider();
            credentialsProvider.setCredentials(
                    AuthScope.ANY,
                    new UsernamePasswordCredentials(username, password)
            );

            builder.setHttpClientConfigCallback(httpClientBuilder ->
                    httpClientBuilder.setDefaultCredentialsProvider(credentialsProvider)
            );
        } else {
            log.info("Configuring Elasticsearch without authentication");
        }

        builder.setRequestConfigCallback(requestConfigBuilder ->
                requestConfigBuilder
                        .setConnectTimeout(connectTimeoutMs)
                        .setSocketTimeout(socketTimeoutMs)
        );

        return builder.build();
    }

    @Bean
    public DatasourceSettings datasourceSettings() {
        if (index.isBlank()) {
            throw new IllegalStateException("app.elasticsearch.index must be set");
        }
        log.info("Datasource index '{}' (interval: '{}'), time field '{}'", index, indexInterval, timeField);
        return DatasourceSettings.builder()
                .index(index)
                .interval(indexInterval)
                .timeField(timeField)
                .timeInterval(timeInterval)
                .maxConcurrentShardRequests(maxConcurrentShardRequests)
                .build();
    }

    @Bean
    public DatasourceClient datasourceClient(RestClient elasticsearchRestClient,
                                             DatasourceSettings datasourceSettings) {
        return new RestDatasourceClient(elasticsearchRestClient, datasourceSettings);
    }
}
