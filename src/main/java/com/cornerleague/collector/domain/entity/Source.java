package com.cornerleague.collector.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "sources")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Source {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(nullable = false, unique = true, length = 255)
    private String domain;

    @Column(name = "base_url", nullable = false, columnDefinition = "text")
    private String baseUrl;

    @Builder.Default
    @Column(name = "crawl_frequency", nullable = false)
    private int crawlFrequency = 3600;

    @Column(name = "robots_txt_url", columnDefinition = "text")
    private String robotsTxtUrl;

    @Column(name = "sitemap_url", columnDefinition = "text")
    private String sitemapUrl;

    @Column(name = "rss_url", columnDefinition = "text")
    private String rssUrl;

    @Builder.Default
    @Column(name = "quality_tier", nullable = false)
    private int qualityTier = 2;

    @Builder.Default
    @Column(name = "reputation_score", nullable = false)
    private double reputationScore = 0.5;

    @Builder.Default
    @Column(name = "success_rate", nullable = false)
    private double successRate = 1.0;

    @Column(name = "avg_response_time")
    private Double avgResponseTime;

    @Column(name = "last_crawled")
    private Instant lastCrawled;

    @Builder.Default
    @Column(nullable = false)
    private boolean enabled = true;

    @Builder.Default
    @Column(nullable = false)
    private boolean degraded = false;

    @Builder.Default
    @Column(name = "consecutive_failures", nullable = false)
    private int consecutiveFailures = 0;

    @Builder.Default
    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    @Builder.Default
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void preUpdate() {
        this.updatedAt = Instant.now();
    }
}
