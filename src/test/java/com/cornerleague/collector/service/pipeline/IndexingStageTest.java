package com.cornerleague.collector.service.pipeline;

import com.cornerleague.collector.domain.entity.ContentItem;
import com.cornerleague.collector.domain.entity.Source;
import com.cornerleague.collector.exception.ProcessingFailedException;
import com.cornerleague.collector.integration.summarizer.SummarizerClient;
import com.cornerleague.collector.integration.summarizer.SummaryResult;
import com.cornerleague.collector.repository.ContentItemRepository;
import com.cornerleague.collector.service.quality.QualityAssessment;
import com.cornerleague.collector.service.quality.QualityScorer;
import com.cornerleague.collector.service.search.RankingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IndexingStageTest {

    private static final Instant NOW = Instant.parse("2025-10-28T12:00:00Z");

    @Mock QualityScorer qualityScorer;
    @Mock RankingService rankingService;
    @Mock ContentItemRepository contentItemRepository;
    @Mock SummarizerClient summarizerClient;
    @Mock ExecutorService summarizerExecutor;

    private IndexingStage stage;
    private ContentItem item;

    @BeforeEach
    void setUp() {
        stage = new IndexingStage(qualityScorer, rankingService, contentItemRepository, summarizerClient,
                summarizerExecutor, Clock.fixed(NOW, ZoneOffset.UTC));
        Source source = Source.builder().id(1L).domain("espn.com").build();
        item = ContentItem.builder().id(7L).source(source).canonicalUrl("https://espn.com/a")
                .title("Celtics win").text("Tatum scored 40.").build();
    }

    private void scores(double score, boolean spam, boolean degraded) {
        when(qualityScorer.score(item, item.getSource()))
                .thenReturn(new QualityAssessment(score, spam, degraded, Map.of("relevance", 0.8)));
        when(contentItemRepository.save(item)).thenReturn(item);
    }

    @Test
    void process_scoresIndexesAndMarksIndexed() {
        scores(0.82, false, false);
        when(rankingService.index(item)).thenReturn(true);
        when(summarizerClient.isEnabled()).thenReturn(false);

        ContentItem out = stage.process(item, "cid");

        assertEquals(0.82, out.getQualityScore());
        assertEquals(0.8, out.getRelevanceScore());
        assertFalse(out.isSpam());
        assertFalse(out.isNeedsRescore());
        assertEquals(NOW, out.getIndexedAt());
        verify(contentItemRepository).markIndexed(7L, NOW);
        verifyNoInteractions(summarizerExecutor);
    }

    @Test
    void process_indexWriteQueued_leavesIndexedAtUnset() {
        scores(0.3, false, true);
        when(rankingService.index(item)).thenReturn(false);
        when(summarizerClient.isEnabled()).thenReturn(false);

        ContentItem out = stage.process(item, "cid");

        assertNull(out.getIndexedAt());
        assertTrue(out.isNeedsRescore());
        verify(contentItemRepository, never()).markIndexed(any(), any());
    }

    @Test
    void process_alreadyIndexed_doesNotRewriteIndexedAt() {
        Instant first = NOW.minusSeconds(86_400);
        item.setIndexedAt(first);
        scores(0.7, false, false);
        when(rankingService.index(item)).thenReturn(true);
        when(summarizerClient.isEnabled()).thenReturn(false);

        assertEquals(first, stage.process(item, "cid").getIndexedAt());
        verify(contentItemRepository, never()).markIndexed(any(), any());
    }

    @Test
    void process_storeFailure_isProcessingFailure() {
        when(qualityScorer.score(item, item.getSource()))
                .thenReturn(new QualityAssessment(0.5, false, false, Map.of("relevance", 0.5)));
        when(contentItemRepository.save(item)).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThrows(ProcessingFailedException.class, () -> stage.process(item, "cid"));
        verifyNoInteractions(rankingService);
        verify(contentItemRepository).flagForRescore(7L);
    }

    @Test
    void process_scorerFailure_flagsItemForRescore() {
        when(qualityScorer.score(item, item.getSource())).thenThrow(new IllegalStateException("taxonomy missing"));

        ProcessingFailedException e = assertThrows(ProcessingFailedException.class, () -> stage.process(item, "cid"));

        assertInstanceOf(IllegalStateException.class, e.getCause());
        verify(contentItemRepository).flagForRescore(7L);
        verify(contentItemRepository, never()).save(any());
        verifyNoInteractions(rankingService, summarizerExecutor);
    }

    @Test
    void process_storeFailure_withFlagFailureToo_stillReportsProcessingFailure() {
        when(qualityScorer.score(item, item.getSource()))
                .thenReturn(new QualityAssessment(0.5, false, false, Map.of("relevance", 0.5)));
        when(contentItemRepository.save(item)).thenThrow(new DataAccessResourceFailureException("db down"));
        when(contentItemRepository.flagForRescore(7L)).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThrows(ProcessingFailedException.class, () -> stage.rescore(item));
    }

    @Test
    void process_summarizesAsynchronously_andStoresSummary() {
        scores(0.8, false, false);
        when(rankingService.index(item)).thenReturn(true);
        when(summarizerClient.isEnabled()).thenReturn(true);
        doAnswer(inv -> {
            ((Runnable) inv.getArgument(0)).run();
            return null;
        }).when(summarizerExecutor).execute(any(Runnable.class));
        when(summarizerClient.summarize(7L, "Celtics win", "Tatum scored 40.", "cid"))
                .thenReturn(Optional.of(new SummaryResult("Tatum led Boston.", 0.9, List.of("Jayson Tatum"), 120)));

        stage.process(item, "cid");

        verify(contentItemRepository).updateSummary(7L, "Tatum led Boston.", 0.9);
    }

    @Test
    void process_summarizerRejected_doesNotFailIndexing() {
        scores(0.8, false, false);
        when(rankingService.index(item)).thenReturn(true);
        when(summarizerClient.isEnabled()).thenReturn(true);
        doThrow(new RejectedExecutionException("full")).when(summarizerExecutor).execute(any(Runnable.class));

        assertEquals(NOW, stage.process(item, "cid").getIndexedAt());
    }

    @Test
    void rescore_neverSummarizes() {
        scores(0.6, false, false);
        when(rankingService.index(item)).thenReturn(true);

        stage.rescore(item);

        verifyNoInteractions(summarizerClient, summarizerExecutor);
    }
}
