package com.leadradar.crawl.http;

import com.leadradar.config.CrawlerProperties;
import com.leadradar.crawl.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class ReviewHttpClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private CrawlerProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
        properties = new CrawlerProperties();
        properties.setPerHostDelayMs(0);
        properties.setRequestTimeoutSeconds(5);
        properties.setRequestRetryBaseDelayMs(1);
        properties.setRequestRetryMaxDelayMs(5);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void sendsBrowserLikeHeaders() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>ok</html>"));
        ReviewHttpClient client = new ReviewHttpClient(properties, executor);

        HttpFetchResult result = client.get(server.url("/reviews").toString());

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).isEqualTo("<html>ok</html>");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("User-Agent")).isEqualTo(CrawlerProperties.DEFAULT_USER_AGENT);
        assertThat(request.getHeader("Accept")).isEqualTo(ReviewHttpClient.ACCEPT_HTML);
        assertThat(request.getHeader("Accept-Language")).isEqualTo(ReviewHttpClient.ACCEPT_LANGUAGE);
        assertThat(request.getHeader("Referer")).isNull();
    }

    @Test
    void forbiddenIsReportedWithoutRetry() {
        server.enqueue(new MockResponse().setResponseCode(403).setBody("denied"));
        properties.setRequestMaxRetries(2);
        ReviewHttpClient client = new ReviewHttpClient(properties, executor);

        HttpFetchResult result = client.get(server.url("/blocked").toString());

        assertThat(result.isForbidden()).isTrue();
        assertThat(result.isSuccessful()).isFalse();
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void retriesServerErrorsWhenConfigured() {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("recovered"));
        properties.setRequestMaxRetries(1);
        ReviewHttpClient client = new ReviewHttpClient(properties, executor);

        HttpFetchResult result = client.get(server.url("/flaky").toString());

        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void malformedUrlIsAnErrorResult() {
        ReviewHttpClient client = new ReviewHttpClient(properties, executor);

        HttpFetchResult result = client.get("https://exa mple.com/ bad");

        assertThat(result.errorCode()).isEqualTo("invalid_url");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void refererMatchesKnownReviewSites() {
        assertThat(ReviewHttpClient.refererFor("www.g2.com")).isEqualTo("https://www.g2.com/");
        assertThat(ReviewHttpClient.refererFor("getapp.com")).isEqualTo("https://www.getapp.com/");
        assertThat(ReviewHttpClient.refererFor("example.com")).isNull();
        assertThat(ReviewHttpClient.refererFor(null)).isNull();
    }
}
