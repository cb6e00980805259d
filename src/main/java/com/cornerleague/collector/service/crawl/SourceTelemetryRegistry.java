package com.cornerleague.collector.service.crawl;

import com.cornerleague.collector.domain.entity.Source;
import com.cornerleague.collector.repository.SourceRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the live {@link SourceTelemetry} record of every crawled source. Updates for one source are
 * serialized through {@link ConcurrentHashMap#compute}; the resulting record is written back with a
 * targeted update that leaves registry-owned columns alone.
 */
@Slf4j
@Component
public class SourceTelemetryRegistry {

    private final SourceRepository sourceRepository;
    private final Clock clock;
    private final double alpha;
    private final int degradeAfter;
    private final double degradedMultiplier;

    private final ConcurrentHashMap<Long, SourceTelemetry> states = new ConcurrentHashMap<>();

    public SourceTelemetryRegistry(
            SourceRepository sourceRepository,
            Clock clock,
            @Value("${crawler.telemetry-alpha:0.2}") double alpha,
            @Value("${crawler.degrade-after-failures:3}") int degradeAfter,
            @Value("${crawler.degraded-interval-multiplier:4.0}") double degradedMultiplier
    ) {
        if (degradedMultiplier <= 1.0) {
            throw new IllegalArgumentException("crawler.degraded-interval-multiplier must be > 1");
        }
        this.sourceRepository = sourceRepository;
        this.clock = clock;
        this.alpha = alpha;
        this.degradeAfter = Math.max(1, degradeAfter);
        this.degradedMultiplier = degradedMultiplier;
    }

    public SourceTelemetry current(Source source) {
        return states.computeIfAbsent(source.getId(), id -> SourceTelemetry.of(source));
    }

    /**
     * Stamps the start of a discovery pass so the next one is not due before the effective interval,
     * whether or not the pass produces fetch tasks.
     */
    public SourceTelemetry recordCrawlStarted(Source source) {
        Instant now = clock.instant();
        SourceTelemetry updated = states.compute(source.getId(), (id, prev) ->
                (prev != null ? prev : SourceTelemetry.of(source)).recordCrawlStarted(now));
        persist(source.getId());
        return updated;
    }

    public SourceTelemetry recordSuccess(Source source, long responseTimeMs) {
        Instant now = clock.instant();
        SourceTelemetry updated = states.compute(source.getId(), (id, prev) ->
                (prev != null ? prev : SourceTelemetry.of(source)).recordSuccess(responseTimeMs, alpha, now));
        persist(source.getId());
        return updated;
    }

    public SourceTelemetry recordTransientFailure(Source source, long responseTimeMs) {
        Instant now = clock.instant();
        SourceTelemetry updated = states.compute(source.getId(), (id, prev) ->
                (prev != null ? prev : SourceTelemetry.of(source))
                        .recordTransientFailure(responseTimeMs, alpha, degradeAfter, now));
        if (updated.consecutiveFailures() == degradeAfter) {
            log.warn("Source degraded sourceId={} domain={} consecutiveFailures={} successRate={}",
                    source.getId(), source.getDomain(), updated.consecutiveFailures(),
                    String.format("%.3f", updated.successRate()));
        }
        persist(source.getId());
        return updated;
    }

    public SourceTelemetry recordPermanentFailure(Source source) {
        Instant now = clock.instant();
        SourceTelemetry updated = states.compute(source.getId(), (id, prev) ->
                (prev != null ? prev : SourceTelemetry.of(source)).recordPermanentFailure(now));
        persist(source.getId());
        return updated;
    }

    /**
     * Interval until the next scheduled fetch. Degraded sources wait strictly longer than crawl_frequency.
     */
    public Duration effectiveInterval(Source source) {
        Duration base = Duration.ofSeconds(Math.max(1, source.getCrawlFrequency()));
        if (!current(source).degraded()) {
            return base;
        }
        return Duration.ofMillis((long) Math.ceil(base.toMillis() * degradedMultiplier));
    }

    public boolean isDue(Source source, Instant now) {
        Instant last = current(source).lastCrawled();
        return last == null || !now.isBefore(last.plus(effectiveInterval(source)));
    }

    private void persist(Long sourceId) {
        SourceTelemetry latest = states.get(sourceId);
        if (latest == null) return;
        try {
            sourceRepository.updateTelemetry(
                    sourceId,
                    latest.successRate(),
                    latest.avgResponseTimeMs(),
                    latest.consecutiveFailures(),
                    latest.degraded(),
                    latest.lastCrawled()
            );
        } catch (DataAccessException e) {
            log.warn("Failed to persist telemetry sourceId={} err={}", sourceId, e.toString());
        }
    }
}
