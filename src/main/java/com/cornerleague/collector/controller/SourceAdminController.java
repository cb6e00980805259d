package com.cornerleague.collector.controller;

import com.cornerleague.collector.domain.entity.Source;
import com.cornerleague.collector.integration.fetcher.RobotsRulesCache;
import com.cornerleague.collector.repository.SourceRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;

@RestController
@RequestMapping("/admin/sources")
@RequiredArgsConstructor
public class SourceAdminController {

    private final SourceRepository sourceRepository;
    private final RobotsRulesCache robotsRulesCache;

    @GetMapping
    public ResponseEntity<List<SourceResponse>> listSources() {
        List<SourceResponse> sources = sourceRepository.findAll(Sort.by(Sort.Direction.ASC, "id"))
                .stream()
                .map(SourceResponse::from)
                .toList();
        return ResponseEntity.ok(sources);
    }

    @PostMapping
    public ResponseEntity<SourceResponse> createSource(@RequestBody @Valid SourceCreateRequest request) {
        String domain = request.domain().trim().toLowerCase(Locale.ROOT);
        Source source = Source.builder()
                .name(request.name())
                .domain(domain)
                .baseUrl(request.baseUrl())
                .crawlFrequency(request.crawlFrequency() != null ? request.crawlFrequency() : 3600)
                .robotsTxtUrl(request.robotsTxtUrl())
                .sitemapUrl(request.sitemapUrl())
                .rssUrl(request.rssUrl())
                .qualityTier(request.qualityTier() != null ? request.qualityTier() : 2)
                .reputationScore(request.reputationScore() != null ? request.reputationScore() : 0.5)
                .enabled(request.enabled() != null ? request.enabled() : true)
                .build();

        try {
            Source saved = sourceRepository.save(source);
            return ResponseEntity.ok(SourceResponse.from(saved));
        } catch (DataIntegrityViolationException e) {
            throw new IllegalArgumentException("Source domain already exists: " + domain);
        }
    }

    @PatchMapping("/{id}")
    public ResponseEntity<SourceResponse> updateSource(
            @PathVariable("id") Long id,
            @RequestBody @Valid SourceUpdateRequest request
    ) {
        Source source = sourceRepository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("Source not found: " + id));

        if (request.name() != null) source.setName(request.name());
        if (request.enabled() != null) source.setEnabled(request.enabled());
        if (request.crawlFrequency() != null) source.setCrawlFrequency(request.crawlFrequency());
        if (request.qualityTier() != null) source.setQualityTier(request.qualityTier());
        if (request.reputationScore() != null) source.setReputationScore(request.reputationScore());
        if (request.robotsTxtUrl() != null) {
            source.setRobotsTxtUrl(request.robotsTxtUrl());
            robotsRulesCache.invalidate(source.getDomain());
        }
        if (request.sitemapUrl() != null) source.setSitemapUrl(request.sitemapUrl());
        if (request.rssUrl() != null) source.setRssUrl(request.rssUrl());

        Source saved = sourceRepository.save(source);
        return ResponseEntity.ok(SourceResponse.from(saved));
    }

    public record SourceCreateRequest(
            @NotBlank String name,
            @NotBlank String domain,
            @NotBlank String baseUrl,
            @Min(60) Integer crawlFrequency,
            String robotsTxtUrl,
            String sitemapUrl,
            String rssUrl,
            @Min(1) @Max(3) Integer qualityTier,
            @Min(0) @Max(1) Double reputationScore,
            Boolean enabled
    ) {}

    public record SourceUpdateRequest(
            String name,
            Boolean enabled,
            @Min(60) Integer crawlFrequency,
            @Min(1) @Max(3) Integer qualityTier,
            @Min(0) @Max(1) Double reputationScore,
            String robotsTxtUrl,
            String sitemapUrl,
            String rssUrl
    ) {}

    public record SourceResponse(
            Long id,
            String name,
            String domain,
            String baseUrl,
            int crawlFrequency,
            String robotsTxtUrl,
            String sitemapUrl,
            String rssUrl,
            int qualityTier,
            double reputationScore,
            double successRate,
            Double avgResponseTime,
            Instant lastCrawled,
            boolean enabled,
            boolean degraded,
            int consecutiveFailures,
            Instant createdAt,
            Instant updatedAt
    ) {
        public static SourceResponse from(Source s) {
            return new SourceResponse(
                    s.getId(),
                    s.getName(),
                    s.getDomain(),
                    s.getBaseUrl(),
                    s.getCrawlFrequency(),
                    s.getRobotsTxtUrl(),
                    s.getSitemapUrl(),
                    s.getRssUrl(),
                    s.getQualityTier(),
                    s.getReputationScore(),
                    s.getSuccessRate(),
                    s.getAvgResponseTime(),
                    s.getLastCrawled(),
                    s.isEnabled(),
                    s.isDegraded(),
                    s.getConsecutiveFailures(),
                    s.getCreatedAt(),
                    s.getUpdatedAt()
            );
        }
    }
}
