package com.cornerleague.collector.integration.summarizer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Client for the external summarization service. Failures are reported as an empty result.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SummarizerClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;

    @Value("${summarizer.enabled:false}")
    private boolean enabled;

    @Value("${summarizer.base-url:http://localhost:8090}")
    private String baseUrl;

    public boolean isEnabled() {
        return enabled;
    }

    public Optional<SummaryResult> summarize(Long contentId, String title, String text, String correlationId) {
        if (!enabled) return Optional.empty();

        ObjectNode body = mapper.createObjectNode();
        body.put("content_id", contentId);
        body.put("title", title);
        body.put("text", text);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (correlationId != null && !correlationId.isBlank()) {
            headers.set("X-Correlation-Id", correlationId);
        }

        String url = stripTrailingSlash(baseUrl) + "/summarize";
        try {
            ResponseEntity<String> res = restTemplate.exchange(
                    url, HttpMethod.POST, new HttpEntity<>(mapper.writeValueAsString(body), headers), String.class);

            if (!res.getStatusCode().is2xxSuccessful() || res.getBody() == null) {
                log.warn("Summarizer non-2xx status={} contentId={}", res.getStatusCode(), contentId);
                return Optional.empty();
            }

            JsonNode root = mapper.readTree(res.getBody());
            String summary = root.path("summary").asText(null);
            if (summary == null || summary.isBlank()) {
                log.warn("Summarizer returned no summary contentId={}", contentId);
                return Optional.empty();
            }

            List<String> entities = new ArrayList<>();
            root.path("key_entities").forEach(n -> entities.add(n.asText()));

            return Optional.of(new SummaryResult(
                    summary.trim(),
                    root.path("confidence_score").asDouble(0.0),
                    entities,
                    root.path("generation_time_ms").asLong(0)
            ));

        } catch (RestClientException e) {
            log.warn("Summarizer call failed contentId={}: {}", contentId, e.toString());
            return Optional.empty();
        } catch (Exception e) {
            log.warn("Summarizer response unreadable contentId={}: {}", contentId, e.toString());
            return Optional.empty();
        }
    }

    private static String stripTrailingSlash(String s) {
        String x = s.trim();
        while (x.endsWith("/")) x = x.substring(0, x.length() - 1);
        return x;
    }
}
