package com.cornerleague.collector.service.crawl;

import com.cornerleague.collector.domain.entity.Source;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory handle of one running ingestion job: outstanding task count and the cancellation flag.
 */
public final class CrawlRun {

    private final Long jobId;
    private final Source source;
    private final String correlationId;
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CompletableFuture<Void> done = new CompletableFuture<>();

    public CrawlRun(Long jobId, Source source, String correlationId) {
        this.jobId = jobId;
        this.source = source;
        this.correlationId = correlationId;
    }

    public Long jobId() {
        return jobId;
    }

    public Source source() {
        return source;
    }

    public String correlationId() {
        return correlationId;
    }

    public void expect(int tasks) {
        if (pending.addAndGet(tasks) == 0) {
            done.complete(null);
        }
    }

    public void taskFinished() {
        if (pending.decrementAndGet() == 0) {
            done.complete(null);
        }
    }

    public int pending() {
        return pending.get();
    }

    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public CompletableFuture<Void> done() {
        return done;
    }
}
