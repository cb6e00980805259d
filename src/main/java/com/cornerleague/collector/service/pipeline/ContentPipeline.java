package com.cornerleague.collector.service.pipeline;

import com.cornerleague.collector.domain.dto.RawDocument;
import com.cornerleague.collector.domain.entity.ContentItem;
import com.cornerleague.collector.exception.ProcessingFailedException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Two worker pools joined by bounded queues: extraction workers (extract, dedup, persist) feed
 * scoring/indexing workers. {@link #submit(RawDocument)} blocks while the extraction queue is full.
 */
@Slf4j
@Service
public class ContentPipeline {

    private static final long POLL_MS = 500;

    private final ExtractionStage extractionStage;
    private final IndexingStage indexingStage;

    private final BlockingQueue<RawDocument> extractionQueue;
    private final BlockingQueue<IndexTask> indexingQueue;
    private final int extractionWorkers;
    private final int indexingWorkers;

    private volatile boolean running = false;
    private ExecutorService extractionPool;
    private ExecutorService indexingPool;

    public ContentPipeline(
            ExtractionStage extractionStage,
            IndexingStage indexingStage,
            @Value("${ingestion.extraction-queue-capacity:1000}") int extractionQueueCapacity,
            @Value("${ingestion.indexing-queue-capacity:1000}") int indexingQueueCapacity,
            @Value("${ingestion.extraction-threads:8}") int extractionWorkers,
            @Value("${ingestion.indexing-threads:0}") int indexingWorkers
    ) {
        this.extractionStage = extractionStage;
        this.indexingStage = indexingStage;
        this.extractionQueue = new ArrayBlockingQueue<>(Math.max(1, extractionQueueCapacity));
        this.indexingQueue = new ArrayBlockingQueue<>(Math.max(1, indexingQueueCapacity));
        this.extractionWorkers = Math.max(1, extractionWorkers);
        // 0 means one worker per core
        this.indexingWorkers = indexingWorkers > 0 ? indexingWorkers : Runtime.getRuntime().availableProcessors();
    }

    @PostConstruct
    public synchronized void start() {
        if (running) return;
        running = true;

        extractionPool = Executors.newFixedThreadPool(extractionWorkers);
        indexingPool = Executors.newFixedThreadPool(indexingWorkers);
        for (int i = 0; i < extractionWorkers; i++) extractionPool.execute(this::extractionLoop);
        for (int i = 0; i < indexingWorkers; i++) indexingPool.execute(this::indexingLoop);

        log.info("Content pipeline started extractionWorkers={} indexingWorkers={}", extractionWorkers, indexingWorkers);
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) return;
        running = false;
        extractionPool.shutdownNow();
        indexingPool.shutdownNow();
        log.info("Content pipeline stopped pendingExtraction={} pendingIndexing={}", extractionQueue.size(), indexingQueue.size());
    }

    public void submit(RawDocument document) throws InterruptedException {
        extractionQueue.put(document);
    }

    /**
     * Runs both stages on the calling thread.
     *
     * @return the indexed item, or empty when the document was a no-op, duplicate or failure
     */
    public Optional<ContentItem> processDocument(RawDocument document) {
        Optional<ContentItem> extracted = extractionStage.process(document);
        if (extracted.isEmpty()) return Optional.empty();
        return Optional.of(indexingStage.process(extracted.get(), document.correlationId()));
    }

    public int pendingExtraction() {
        return extractionQueue.size();
    }

    public int pendingIndexing() {
        return indexingQueue.size();
    }

    private void extractionLoop() {
        while (running) {
            RawDocument raw;
            try {
                raw = extractionQueue.poll(POLL_MS, TimeUnit.MILLISECONDS);
                if (raw == null) continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }

            try (MDC.MDCCloseable ignored = MDC.putCloseable("corrId", raw.correlationId())) {
                Optional<ContentItem> item = extractionStage.process(raw);
                if (item.isPresent()) {
                    indexingQueue.put(new IndexTask(item.get(), raw.correlationId()));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Extraction worker interrupted url={}", raw.finalUrl());
                return;
            } catch (ProcessingFailedException e) {
                log.warn("Extraction failed url={}: {}", raw.finalUrl(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Extraction worker error url={}", raw.finalUrl(), e);
            }
        }
    }

    private void indexingLoop() {
        while (running) {
            IndexTask task;
            try {
                task = indexingQueue.poll(POLL_MS, TimeUnit.MILLISECONDS);
                if (task == null) continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }

            try (MDC.MDCCloseable ignored = MDC.putCloseable("corrId", task.correlationId())) {
                indexingStage.process(task.item(), task.correlationId());
            } catch (ProcessingFailedException e) {
                log.warn("Scoring/indexing failed canonicalUrl={}: {}", task.item().getCanonicalUrl(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Indexing worker error canonicalUrl={}", task.item().getCanonicalUrl(), e);
            }
        }
    }

    private record IndexTask(ContentItem item, String correlationId) {}
}
