package com.cornerleague.collector.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "search_documents")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SearchDocument {

    @Id
    @Column(name = "canonical_url", length = 2048)
    private String canonicalUrl;

    @Column(name = "content_item_id", nullable = false)
    private Long contentItemId;

    @Column(name = "content_hash", length = 64)
    private String contentHash;

    @Column(columnDefinition = "text")
    private String title;

    @Column(length = 255)
    private String byline;

    @Column(name = "source_domain", length = 255)
    private String sourceDomain;

    @Column(length = 255)
    private String sports;

    @Column(name = "sports_keywords", columnDefinition = "text")
    private String sportsKeywords;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "quality_score", nullable = false)
    private double qualityScore;

    @Column(name = "is_spam", nullable = false)
    private boolean spam;

    @Column(name = "doc_length", nullable = false)
    private int docLength;

    @Column(name = "indexed_at", nullable = false)
    private Instant indexedAt;
}
