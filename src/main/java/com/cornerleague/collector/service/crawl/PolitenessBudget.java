package com.cornerleague.collector.service.crawl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Global and per-domain in-flight request caps. Callers block until a slot frees up,
 * so tasks are never dropped for lack of budget.
 */
@Slf4j
@Component
public class PolitenessBudget {

    private final Semaphore global;
    private final int perDomain;
    private final long maxCrawlDelayMs;
    private final ConcurrentHashMap<String, DomainSlot> domains = new ConcurrentHashMap<>();

    public PolitenessBudget(
            @Value("${crawler.global-concurrency:50}") int globalConcurrency,
            @Value("${crawler.per-domain-concurrency:5}") int perDomain,
            @Value("${crawler.max-crawl-delay-ms:10000}") long maxCrawlDelayMs
    ) {
        this.global = new Semaphore(Math.max(1, globalConcurrency), true);
        this.perDomain = Math.max(1, perDomain);
        this.maxCrawlDelayMs = Math.max(0, maxCrawlDelayMs);
    }

    public Permit acquire(String domain, long crawlDelayMs) throws InterruptedException {
        DomainSlot slot = domains.computeIfAbsent(domain, d -> new DomainSlot(new Semaphore(perDomain, true)));
        slot.semaphore.acquire();
        try {
            global.acquire();
        } catch (InterruptedException e) {
            slot.semaphore.release();
            throw e;
        }

        Permit permit = new Permit(slot.semaphore, global);
        long delay = Math.min(Math.max(0, crawlDelayMs), maxCrawlDelayMs);
        if (delay > 0) {
            long waitMs = slot.reserve(delay) - System.currentTimeMillis();
            if (waitMs > 0) {
                log.debug("Politeness: waiting {}ms for domain={}", waitMs, domain);
                try {
                    Thread.sleep(waitMs);
                } catch (InterruptedException e) {
                    permit.close();
                    throw e;
                }
            }
        }
        return permit;
    }

    public int inFlight(String domain) {
        DomainSlot slot = domains.get(domain);
        return slot == null ? 0 : perDomain - slot.semaphore.availablePermits();
    }

    public int perDomainLimit() {
        return perDomain;
    }

    private static final class DomainSlot {
        private final Semaphore semaphore;
        private long nextStartAt;

        private DomainSlot(Semaphore semaphore) {
            this.semaphore = semaphore;
        }

        private synchronized long reserve(long spacingMs) {
            long start = Math.max(System.currentTimeMillis(), nextStartAt);
            nextStartAt = start + spacingMs;
            return start;
        }
    }

    public static final class Permit implements AutoCloseable {
        private final Semaphore domain;
        private final Semaphore global;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit(Semaphore domain, Semaphore global) {
            this.domain = domain;
            this.global = global;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                global.release();
                domain.release();
            }
        }
    }
}
