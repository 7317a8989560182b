package com.microservices.elasticsearch.timeseries.query.config;

import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * Entry point for host applications: registers the query services together with the
 * Elasticsearch client configuration.
 */
@Configuration
@Import(ElasticsearchConfig.class)
@ComponentScan(basePackages = {
        "com.microservices.elasticsearch.timeseries.query.service",
        "com.microservices.elasticsearch.timeseries.query.interval"
})
public class TimeSeriesQueryConfig {
}
