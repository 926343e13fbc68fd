package com.delta.research.pipeline.http;

import com.delta.research.config.ResearchProperties;
import com.delta.research.pipeline.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResearchHttpClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private ResearchProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
        properties = new ResearchProperties();
        properties.getHttp().setRequestTimeoutSeconds(5);
        properties.getHttp().setPerHostDelayMs(0);
        properties.getHttp().setMaxRetries(1);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void returnsBodyAndContentType() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/html; charset=utf-8")
            .setBody("<p>hello</p>"));
        ResearchHttpClient client = new ResearchHttpClient(properties, executor);

        HttpFetchResult result = client.get(server.url("/page").toString());

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(new String(result.bodyBytes(), StandardCharsets.UTF_8)).isEqualTo("<p>hello</p>");
        assertThat(result.isPdf()).isFalse();
        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("User-Agent")).isEqualTo(properties.getHttp().getUserAgent());
    }

    @Test
    void retriesServerErrorsWithinBudget() {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));
        ResearchHttpClient client = new ResearchHttpClient(properties, executor);

        HttpFetchResult result = client.get(server.url("/flaky").toString());

        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void doesNotRetryClientErrors() {
        server.enqueue(new MockResponse().setResponseCode(404));
        ResearchHttpClient client = new ResearchHttpClient(properties, executor);

        HttpFetchResult result = client.get(server.url("/missing").toString());

        assertThat(result.isSuccessful()).isFalse();
        assertThat(FetchFailureClassifier.errorKey(result)).isEqualTo("http_404");
        assertThat(FetchFailureClassifier.classify(result)).isEqualTo(FetchFailureClassifier.HTTP_ERROR_OR_STATUS);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void oversizedBodiesAreRefused() {
        properties.getHttp().setMaxFetchBytes(10);
        server.enqueue(new MockResponse().setBody("x".repeat(100)));
        ResearchHttpClient client = new ResearchHttpClient(properties, executor);

        HttpFetchResult result = client.get(server.url("/big").toString());

        assertThat(result.errorCode()).isEqualTo("response_too_large");
    }

    @Test
    void chunkedBodiesAreCappedWhileStreaming() {
        properties.getHttp().setMaxFetchBytes(10);
        server.enqueue(new MockResponse().setChunkedBody("y".repeat(5000), 64));
        ResearchHttpClient client = new ResearchHttpClient(properties, executor);

        HttpFetchResult result = client.get(server.url("/chunked").toString());

        assertThat(result.errorCode()).isEqualTo("response_too_large");
        assertThat(result.bodyBytes()).isNull();
    }

    @Test
    void bodyAtTheCapIsAccepted() {
        properties.getHttp().setMaxFetchBytes(10);
        server.enqueue(new MockResponse().setBody("0123456789"));
        ResearchHttpClient client = new ResearchHttpClient(properties, executor);

        HttpFetchResult result = client.get(server.url("/exact").toString());

        assertThat(result.errorCode()).isNull();
        assertThat(new String(result.bodyBytes(), StandardCharsets.UTF_8)).isEqualTo("0123456789");
    }

    @Test
    void nonPositiveByteCapIsRejected() {
        assertThatThrownBy(() -> properties.getHttp().setMaxFetchBytes(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("max-fetch-bytes");
    }

    @Test
    void malformedHostsClassifyAsDnsFailures() {
        assertThat(FetchFailureClassifier.classify("invalid_url", null))
            .isEqualTo(FetchFailureClassifier.DNS_OR_INVALID_HOST);
        assertThat(FetchFailureClassifier.classify("io_error", "java.net.UnknownHostException: nope"))
            .isEqualTo(FetchFailureClassifier.DNS_OR_INVALID_HOST);
        assertThat(FetchFailureClassifier.classify("timeout", "read timed out"))
            .isEqualTo(FetchFailureClassifier.HTTP_ERROR_OR_STATUS);
    }
}
