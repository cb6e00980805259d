package com.cornerleague.collector.service.search;

import com.cornerleague.collector.repository.ContentItemRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Index writes that failed while the backend was unavailable. Keyed by canonical URL so only the
 * latest version of a document is replayed.
 */
@Slf4j
@Component
public class IndexWriteRetryQueue {

    private final SearchBackend backend;
    private final ContentItemRepository contentItemRepository;
    private final Clock clock;
    private final int capacity;

    private final Map<String, IndexedDocument> pending = new LinkedHashMap<>();

    public IndexWriteRetryQueue(
            SearchBackend backend,
            ContentItemRepository contentItemRepository,
            Clock clock,
            @Value("${search.write-retry-capacity:10000}") int capacity
    ) {
        this.backend = backend;
        this.contentItemRepository = contentItemRepository;
        this.clock = clock;
        this.capacity = Math.max(1, capacity);
    }

    /**
     * @return false when the queue is full and the write was not retained
     */
    public synchronized boolean enqueue(IndexedDocument document) {
        if (!pending.containsKey(document.canonicalUrl()) && pending.size() >= capacity) {
            log.error("Index retry queue full (capacity={}), dropping write for {}", capacity, document.canonicalUrl());
            return false;
        }
        pending.put(document.canonicalUrl(), document);
        return true;
    }

    public synchronized void discard(String canonicalUrl) {
        pending.remove(canonicalUrl);
    }

    public synchronized int size() {
        return pending.size();
    }

    @Scheduled(fixedDelayString = "${search.write-retry-ms:30000}")
    public void flush() {
        List<IndexedDocument> batch;
        synchronized (this) {
            if (pending.isEmpty()) return;
            batch = new ArrayList<>(pending.values());
        }

        int written = 0;
        for (IndexedDocument doc : batch) {
            try {
                backend.upsert(doc);
            } catch (RuntimeException e) {
                log.warn("Index still unavailable, {} writes pending: {}", size(), e.getMessage());
                break;
            }

            synchronized (this) {
                pending.remove(doc.canonicalUrl(), doc);
            }
            written++;
            markIndexed(doc);
        }

        if (written > 0) {
            log.info("Replayed {} pending index writes", written);
        }
    }

    private void markIndexed(IndexedDocument doc) {
        if (doc.contentItemId() == null) return;
        try {
            contentItemRepository.markIndexed(doc.contentItemId(), clock.instant());
        } catch (DataAccessException e) {
            log.warn("Failed to mark content item {} indexed: {}", doc.contentItemId(), e.getMessage());
        }
    }
}
