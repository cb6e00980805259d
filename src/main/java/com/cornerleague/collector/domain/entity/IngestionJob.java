package com.cornerleague.collector.domain.entity;

import com.cornerleague.collector.domain.enums.IngestionStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "ingestion_jobs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IngestionJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "source_id")
    private Source source;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private IngestionStatus status = IngestionStatus.PENDING;

    @Builder.Default
    @Column(name = "items_discovered", nullable = false)
    private int itemsDiscovered = 0;

    @Builder.Default
    @Column(name = "items_processed", nullable = false)
    private int itemsProcessed = 0;

    @Builder.Default
    @Column(name = "items_successful", nullable = false)
    private int itemsSuccessful = 0;

    @Builder.Default
    @Column(name = "items_failed", nullable = false)
    private int itemsFailed = 0;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "correlation_id", length = 64)
    private String correlationId;
}
