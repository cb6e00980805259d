package com.cornerleague.collector.integration.opensearch;

import com.cornerleague.collector.exception.SearchBackendException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.*;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

@Slf4j
@Component
@ConditionalOnProperty(name = "search.backend", havingValue = "opensearch")
public class OpenSearchClient {

    private final ObjectMapper mapper;
    private final HttpClient httpClient;

    private final String baseUrl;
    private final String indexName;
    private final Duration requestTimeout;

    public OpenSearchClient(
            ObjectMapper mapper,
            @Value("${search.opensearch.base-url:http://localhost:9200}") String baseUrl,
            @Value("${search.opensearch.index:sports-content}") String indexName,
            @Value("${search.opensearch.timeout-seconds:10}") int timeoutSeconds
    ) {
        this.mapper = mapper;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.indexName = indexName;
        this.requestTimeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    public String indexName() {
        return indexName;
    }

    public boolean indexExists() {
        HttpRequest req = request("/" + indexName).method("HEAD", HttpRequest.BodyPublishers.noBody()).build();
        int status = send(req, "indexExists").statusCode();
        if (status == 404) return false;
        if (status < 200 || status >= 300) {
            throw new SearchBackendException("OpenSearch HEAD index failed status=" + status, null);
        }
        return true;
    }

    public void createIndex(ObjectNode body) {
        HttpRequest req = request("/" + indexName)
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(write(body)))
                .build();
        HttpResponse<String> resp = send(req, "createIndex");
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            log.error("OpenSearch createIndex error status={} body={}", resp.statusCode(), resp.body());
            throw new SearchBackendException("OpenSearch createIndex failed status=" + resp.statusCode(), null);
        }
    }

    public void putDocument(String id, ObjectNode document) {
        HttpRequest req = request("/" + indexName + "/_doc/" + encode(id) + "?refresh=wait_for")
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(write(document)))
                .build();
        HttpResponse<String> resp = send(req, "putDocument");
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            log.error("OpenSearch putDocument error status={} body={}", resp.statusCode(), resp.body());
            throw new SearchBackendException("OpenSearch putDocument failed status=" + resp.statusCode(), null);
        }
    }

    public void deleteDocument(String id) {
        HttpRequest req = request("/" + indexName + "/_doc/" + encode(id) + "?refresh=wait_for")
                .DELETE()
                .build();
        HttpResponse<String> resp = send(req, "deleteDocument");
        if (resp.statusCode() != 404 && (resp.statusCode() < 200 || resp.statusCode() >= 300)) {
            throw new SearchBackendException("OpenSearch deleteDocument failed status=" + resp.statusCode(), null);
        }
    }

    public JsonNode search(ObjectNode body) {
        HttpRequest req = request("/" + indexName + "/_search")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(write(body)))
                .build();
        HttpResponse<String> resp = send(req, "search");
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            log.error("OpenSearch search error status={} body={}", resp.statusCode(), resp.body());
            throw new SearchBackendException("OpenSearch search failed status=" + resp.statusCode(), null);
        }
        try {
            return mapper.readTree(resp.body());
        } catch (Exception e) {
            throw new SearchBackendException("OpenSearch search returned invalid JSON", e);
        }
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout);
    }

    private HttpResponse<String> send(HttpRequest req, String operation) {
        try {
            return httpClient.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchBackendException("OpenSearch " + operation + " interrupted", e);
        } catch (Exception e) {
            throw new SearchBackendException("OpenSearch " + operation + " failed", e);
        }
    }

    private String write(JsonNode body) {
        try {
            return mapper.writeValueAsString(body);
        } catch (Exception e) {
            throw new SearchBackendException("Failed to serialize OpenSearch request", e);
        }
    }

    private static String encode(String id) {
        return URLEncoder.encode(id, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String s) {
        if (s == null) return null;
        String x = s.trim();
        while (x.endsWith("/")) x = x.substring(0, x.length() - 1);
        return x;
    }
}
