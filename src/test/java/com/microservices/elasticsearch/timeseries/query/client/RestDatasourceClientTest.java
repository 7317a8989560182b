package com.microservices.elasticsearch.timeseries.query.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.util.EntityUtils;
import org.elasticsearch.client.Request;
import org.elasticsearch.client.Response;
import org.elasticsearch.client.RestClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.microservices.elasticsearch.timeseries.query.dto.MultiSearchResponse;
import com.microservices.elasticsearch.timeseries.query.dto.TimeRange;
import com.microservices.elasticsearch.timeseries.query.exception.QueryExecutionException;
import com.microservices.elasticsearch.timeseries.query.interval.Interval;

@ExtendWith(MockitoExtension.class)
class RestDatasourceClientTest {

    // 2024-01-01T23:00Z .. 2024-01-02T01:00Z
    private static final TimeRange ACROSS_MIDNIGHT = new TimeRange(1_704_150_000_000L, 1_704_157_200_000L);

    @Mock
    private RestClient restClient;

    @Mock
    private Response response;

    private RestDatasourceClient client;

    @BeforeEach
    void setUp() {
        DatasourceSettings settings = DatasourceSettings.builder()
                .index("[logs-]YYYY.MM.DD")
                .interval("Daily")
                .timeInterval("10s")
                .build();
        client = new RestDatasourceClient(restClient, settings);
    }

    @Test
    void testGetMinInterval_ShouldPreferQueryIntervalOverDatasourceInterval() {
        assertThat(client.getMinInterval("")).isEqualTo(Duration.ofSeconds(10));
        assertThat(client.getMinInterval(">1m")).isEqualTo(Duration.ofMinutes(1));
        assertThat(client.getMinInterval("30")).isEqualTo(Duration.ofSeconds(30));
        assertThat(client.getTimeField()).isEqualTo("@timestamp");
    }

    @Test
    void testEncodeBatch_ShouldWriteHeaderPerSearchAndExpandPlaceholders() {
        // Given
        MultiSearchRequest request = new MultiSearchRequest(ACROSS_MIDNIGHT, List.of(
                new SearchRequest(Interval.of(Duration.ofSeconds(10)), Map.of(),
                        "{\"fixed_interval\":\"$__interval_msms\",\"label\":\"$__interval\"}"),
                new SearchRequest(Interval.of(Duration.ofMinutes(1)), Map.of(), "{\"size\":0}")));

        // When
        String payload = client.encodeBatch(request);

        // Then
        String header = "{\"search_type\":\"query_then_fetch\",\"ignore_unavailable\":true,"
                + "\"index\":\"logs-2024.01.01,logs-2024.01.02\",\"max_concurrent_shard_requests\":5}";
        assertThat(payload.split("\n")).containsExactly(
                header,
                "{\"fixed_interval\":\"10000ms\",\"label\":\"10s\"}",
                header,
                "{\"size\":0}");
        assertThat(payload).endsWith("\n");
    }

    @Test
    void testExecuteMultiSearch_ShouldPostNdjsonAndDecodeResponses() throws Exception {
        // Given
        when(restClient.performRequest(any(Request.class))).thenReturn(response);
        when(response.getEntity()).thenReturn(new StringEntity(
                "{\"took\":4,\"responses\":[{\"hits\":{\"total\":1}}],\"extra\":true}", ContentType.APPLICATION_JSON));
        MultiSearchRequest request = new MultiSearchRequest(ACROSS_MIDNIGHT, List.of(
                new SearchRequest(Interval.of(Duration.ofSeconds(10)), Map.of(), "{\"size\":0}")));

        // When
        MultiSearchResponse result = client.executeMultiSearch(request);

        // Then
        ArgumentCaptor<Request> captor = ArgumentCaptor.forClass(Request.class);
        verify(restClient).performRequest(captor.capture());
        Request sent = captor.getValue();
        assertThat(sent.getMethod()).isEqualTo("POST");
        assertThat(sent.getEndpoint()).isEqualTo(RestDatasourceClient.MULTI_SEARCH_ENDPOINT);
        assertThat(sent.getEntity().getContentType().getValue()).startsWith("application/x-ndjson");
        assertThat(EntityUtils.toString(sent.getEntity())).contains("\"search_type\":\"query_then_fetch\"");

        assertThat(result.getTook()).isEqualTo(4L);
        assertThat(result.getResponses()).hasSize(1);
        assertThat(result.getResponses().get(0)).containsKey("hits");
    }

    @Test
    void testExecuteMultiSearch_WhenTransportFails_ShouldWrapException() throws Exception {
        // Given
        IOException failure = new IOException("Connection refused");
        when(restClient.performRequest(any(Request.class))).thenThrow(failure);
        MultiSearchRequest request = new MultiSearchRequest(ACROSS_MIDNIGHT, List.of());

        // When & Then
        assertThatThrownBy(() -> client.executeMultiSearch(request))
                .isInstanceOf(QueryExecutionException.class)
                .hasMessageContaining("Connection refused")
                .hasCause(failure);
    }
}
