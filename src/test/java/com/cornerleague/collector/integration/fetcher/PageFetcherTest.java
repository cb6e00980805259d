package com.cornerleague.collector.integration.fetcher;

import com.cornerleague.collector.domain.dto.FetchResult;
import com.cornerleague.collector.domain.enums.FetchOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PageFetcherTest {

    private static final String URL = "https://www.espn.com/nba/story/_/id/1";

    private HttpClient httpClient;
    private PageFetcher fetcher;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
        fetcher = new PageFetcher();
        ReflectionTestUtils.setField(fetcher, "httpClient", httpClient);
        ReflectionTestUtils.setField(fetcher, "userAgent", "test-agent");
        ReflectionTestUtils.setField(fetcher, "timeoutSeconds", 5);
        ReflectionTestUtils.setField(fetcher, "maxBytes", 1024);
        ReflectionTestUtils.setField(fetcher, "hostBackoffMaxMs", 60_000L);
    }

    @SuppressWarnings("unchecked")
    private void respond(int status, String body, Map<String, List<String>> headers) throws Exception {
        HttpResponse<InputStream> resp = mock(HttpResponse.class);
        when(resp.statusCode()).thenReturn(status);
        when(resp.headers()).thenReturn(HttpHeaders.of(headers, (k, v) -> true));
        when(resp.uri()).thenReturn(URI.create(URL));
        when(resp.body()).thenReturn(new ByteArrayInputStream(body.getBytes(StandardCharsets.ISO_8859_1)));
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(resp);
    }

    @Test
    void success_returnsBodyWithDeclaredCharset() throws Exception {
        respond(200, "<p>café</p>", Map.of("Content-Type", List.of("text/html; charset=ISO-8859-1")));

        FetchResult result = fetcher.fetch(URL);

        assertThat(result.outcome()).isEqualTo(FetchOutcome.SUCCESS);
        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(result.charset()).isEqualTo(StandardCharsets.ISO_8859_1);
        assertThat(result.bodyAsString()).isEqualTo("<p>café</p>");
        assertThat(result.finalUrl()).isEqualTo(URL);
    }

    @Test
    void notFound_isPermanent() throws Exception {
        respond(404, "", Map.of());

        FetchResult result = fetcher.fetch(URL);

        assertThat(result.outcome()).isEqualTo(FetchOutcome.PERMANENT_FAILURE);
        assertThat(result.statusCode()).isEqualTo(404);
    }

    @Test
    void serverError_isTransient() throws Exception {
        respond(503, "", Map.of());

        FetchResult result = fetcher.fetch(URL);

        assertThat(result.outcome()).isEqualTo(FetchOutcome.TRANSIENT_FAILURE);
        assertThat(result.statusCode()).isEqualTo(503);
    }

    @Test
    void tooManyRequests_setsHostBackoff_andShortCircuitsNextFetch() throws Exception {
        respond(429, "", Map.of("Retry-After", List.of("30")));

        FetchResult first = fetcher.fetch(URL);
        FetchResult second = fetcher.fetch("https://www.espn.com/nfl/story/_/id/2");

        assertThat(first.outcome()).isEqualTo(FetchOutcome.TRANSIENT_FAILURE);
        assertThat(first.retryAfterMs()).isEqualTo(30_000L);
        assertThat(second.outcome()).isEqualTo(FetchOutcome.TRANSIENT_FAILURE);
        assertThat(second.error()).isEqualTo("host backoff active");
        assertThat(second.retryAfterMs()).isPositive().isLessThanOrEqualTo(30_000L);
        verify(httpClient, times(1)).send(any(HttpRequest.class), any());
    }

    @Test
    void oversizedBody_isPermanent() throws Exception {
        respond(200, "x".repeat(2048), Map.of("Content-Type", List.of("text/html")));

        FetchResult result = fetcher.fetch(URL);

        assertThat(result.outcome()).isEqualTo(FetchOutcome.PERMANENT_FAILURE);
        assertThat(result.error()).contains("maxBytes=1024");
    }

    @Test
    @SuppressWarnings("unchecked")
    void ioError_isTransient() throws Exception {
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenThrow(new IOException("connection reset"));

        FetchResult result = fetcher.fetch(URL);

        assertThat(result.outcome()).isEqualTo(FetchOutcome.TRANSIENT_FAILURE);
        assertThat(result.error()).contains("IOException");
    }

    @Test
    void invalidUrl_isPermanentWithoutRequest() throws Exception {
        FetchResult result = fetcher.fetch("http://bad host/x");

        assertThat(result.outcome()).isEqualTo(FetchOutcome.PERMANENT_FAILURE);
        verifyNoInteractions(httpClient);
    }

    @Test
    void statusClassification() {
        assertThat(PageFetcher.isTransientStatus(408)).isTrue();
        assertThat(PageFetcher.isTransientStatus(500)).isTrue();
        assertThat(PageFetcher.isTransientStatus(403)).isFalse();
        assertThat(PageFetcher.isTransientStatus(410)).isFalse();
    }

    @Test
    void retryAfterParsing() {
        assertThat(PageFetcher.parseRetryAfterMs(null)).isEqualTo(5_000L);
        assertThat(PageFetcher.parseRetryAfterMs("12")).isEqualTo(12_000L);
        assertThat(PageFetcher.parseRetryAfterMs("100000")).isEqualTo(300_000L);
        assertThat(PageFetcher.parseRetryAfterMs("Wed, 21 Oct 2015 07:28:00 GMT")).isEqualTo(5_000L);
    }
}
