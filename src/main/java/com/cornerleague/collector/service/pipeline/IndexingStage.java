package com.cornerleague.collector.service.pipeline;

import com.cornerleague.collector.domain.entity.ContentItem;
import com.cornerleague.collector.exception.ProcessingFailedException;
import com.cornerleague.collector.integration.summarizer.SummarizerClient;
import com.cornerleague.collector.repository.ContentItemRepository;
import com.cornerleague.collector.service.quality.QualityAssessment;
import com.cornerleague.collector.service.quality.QualityScorer;
import com.cornerleague.collector.service.search.RankingService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Score, persist the score, index, then hand off to the summarizer without waiting for it.
 */
@Slf4j
@Component
public class IndexingStage {

    private final QualityScorer qualityScorer;
    private final RankingService rankingService;
    private final ContentItemRepository contentItemRepository;
    private final SummarizerClient summarizerClient;
    private final ExecutorService summarizerExecutor;
    private final Clock clock;

    public IndexingStage(
            QualityScorer qualityScorer,
            RankingService rankingService,
            ContentItemRepository contentItemRepository,
            SummarizerClient summarizerClient,
            @Qualifier("summarizerExecutor") ExecutorService summarizerExecutor,
            Clock clock
    ) {
        this.qualityScorer = qualityScorer;
        this.rankingService = rankingService;
        this.contentItemRepository = contentItemRepository;
        this.summarizerClient = summarizerClient;
        this.summarizerExecutor = summarizerExecutor;
        this.clock = clock;
    }

    public ContentItem process(ContentItem item, String correlationId) {
        ContentItem saved = scoreAndIndex(item);
        summarizeLater(saved, correlationId);
        return saved;
    }

    /**
     * Scores and indexes again without summarizing.
     */
    public ContentItem rescore(ContentItem item) {
        return scoreAndIndex(item);
    }

    private ContentItem scoreAndIndex(ContentItem item) {
        try {
            applyScore(item);
        } catch (RuntimeException e) {
            flagForRescore(item);
            throw new ProcessingFailedException("Failed to score " + item.getCanonicalUrl(), e);
        }

        ContentItem saved;
        try {
            saved = contentItemRepository.save(item);
        } catch (DataAccessException e) {
            flagForRescore(item);
            throw new ProcessingFailedException("Failed to store score for " + item.getCanonicalUrl(), e);
        }

        // indexedAt records the first successful index write
        if (rankingService.index(saved) && saved.getIndexedAt() == null) {
            Instant now = clock.instant();
            saved.setIndexedAt(now);
            try {
                contentItemRepository.markIndexed(saved.getId(), now);
            } catch (DataAccessException e) {
                log.warn("Indexed but failed to record indexedAt canonicalUrl={}: {}", saved.getCanonicalUrl(), e.getMessage());
            }
        }

        log.debug("Scored and indexed canonicalUrl={} quality={} spam={} degraded={}",
                saved.getCanonicalUrl(), saved.getQualityScore(), saved.isSpam(), saved.isNeedsRescore());
        return saved;
    }

    /**
     * Applies a fresh assessment to the item without persisting it.
     */
    public QualityAssessment applyScore(ContentItem item) {
        QualityAssessment assessment = qualityScorer.score(item, item.getSource());
        item.setQualityScore(assessment.score());
        item.setSpam(assessment.spam());
        item.setNeedsRescore(assessment.degraded());
        item.setRelevanceScore(assessment.signals().get("relevance"));
        return assessment;
    }

    /**
     * Leaves the stored item where the rescore job will pick it up again.
     */
    private void flagForRescore(ContentItem item) {
        if (item.getId() == null) return;
        try {
            contentItemRepository.flagForRescore(item.getId());
        } catch (DataAccessException e) {
            log.error("Failed to flag item for rescore contentId={} canonicalUrl={}: {}",
                    item.getId(), item.getCanonicalUrl(), e.getMessage());
        }
    }

    private void summarizeLater(ContentItem item, String correlationId) {
        if (!summarizerClient.isEnabled() || item.getId() == null) return;

        Long id = item.getId();
        String title = item.getTitle();
        String text = item.getText();
        try {
            summarizerExecutor.execute(() -> {
                try (MDC.MDCCloseable ignored = MDC.putCloseable("corrId", correlationId)) {
                    summarizerClient.summarize(id, title, text, correlationId)
                            .ifPresent(r -> contentItemRepository.updateSummary(id, r.summary(), r.confidenceScore()));
                } catch (DataAccessException e) {
                    log.warn("Failed to store summary contentId={}: {}", id, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Summarizer executor rejected contentId={}: {}", id, e.getMessage());
        }
    }
}
