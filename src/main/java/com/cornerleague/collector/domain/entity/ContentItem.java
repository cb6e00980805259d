package com.cornerleague.collector.domain.entity;

import com.cornerleague.collector.domain.enums.ExtractionStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "content_items")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContentItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "source_id", nullable = false)
    private Source source;

    @Column(name = "original_url", nullable = false, columnDefinition = "text")
    private String originalUrl;

    @Column(name = "canonical_url", nullable = false, unique = true, length = 2048)
    private String canonicalUrl;

    @Column(name = "content_hash", unique = true, length = 64)
    private String contentHash;

    @Column(name = "minhash_signature", columnDefinition = "text")
    private String minhashSignature;

    @Column(columnDefinition = "text")
    private String title;

    @Column(columnDefinition = "text")
    private String text;

    @Column(length = 255)
    private String byline;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Builder.Default
    @Column(name = "word_count", nullable = false)
    private int wordCount = 0;

    @Column(name = "extraction_confidence")
    private Double extractionConfidence;

    @Column(length = 255)
    private String sports;

    @Column(name = "sports_keywords", columnDefinition = "text")
    private String sportsKeywords;

    @Column(name = "content_type", length = 50)
    private String contentType;

    @Column(name = "quality_score")
    private Double qualityScore;

    @Column(name = "relevance_score")
    private Double relevanceScore;

    @Builder.Default
    @Column(name = "needs_rescore", nullable = false)
    private boolean needsRescore = false;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "extraction_status", nullable = false, length = 20)
    private ExtractionStatus extractionStatus = ExtractionStatus.PENDING;

    @Builder.Default
    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Builder.Default
    @Column(name = "is_duplicate", nullable = false)
    private boolean duplicate = false;

    @Column(name = "duplicate_of_id")
    private Long duplicateOfId;

    @Builder.Default
    @Column(name = "is_spam", nullable = false)
    private boolean spam = false;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(columnDefinition = "text")
    private String summary;

    @Column(name = "summary_confidence")
    private Double summaryConfidence;

    @Column(name = "indexed_at")
    private Instant indexedAt;

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
