package com.cornerleague.collector.service.crawl;

import com.cornerleague.collector.domain.entity.Source;

import java.time.Instant;

/**
 * Immutable per-source crawl outcome state. Every transition returns a new record.
 */
public record SourceTelemetry(
        Long sourceId,
        double successRate,
        Double avgResponseTimeMs,
        int consecutiveFailures,
        boolean degraded,
        Instant lastCrawled
) {

    public static SourceTelemetry of(Source source) {
        return new SourceTelemetry(
                source.getId(),
                source.getSuccessRate(),
                source.getAvgResponseTime(),
                source.getConsecutiveFailures(),
                source.isDegraded(),
                source.getLastCrawled()
        );
    }

    public SourceTelemetry recordSuccess(long responseTimeMs, double alpha, Instant at) {
        return new SourceTelemetry(
                sourceId,
                ema(successRate, 1.0, alpha),
                emaResponse(responseTimeMs, alpha),
                0,
                false,
                at
        );
    }

    public SourceTelemetry recordTransientFailure(long responseTimeMs, double alpha, int degradeAfter, Instant at) {
        int failures = consecutiveFailures + 1;
        return new SourceTelemetry(
                sourceId,
                ema(successRate, 0.0, alpha),
                responseTimeMs > 0 ? emaResponse(responseTimeMs, alpha) : avgResponseTimeMs,
                failures,
                degraded || failures >= degradeAfter,
                at
        );
    }

    public SourceTelemetry recordCrawlStarted(Instant at) {
        return new SourceTelemetry(sourceId, successRate, avgResponseTimeMs, consecutiveFailures, degraded, at);
    }

    public SourceTelemetry recordPermanentFailure(Instant at) {
        return new SourceTelemetry(sourceId, successRate, avgResponseTimeMs, consecutiveFailures, degraded, at);
    }

    private Double emaResponse(long responseTimeMs, double alpha) {
        return avgResponseTimeMs == null
                ? (double) responseTimeMs
                : ema(avgResponseTimeMs, responseTimeMs, alpha);
    }

    private static double ema(double previous, double observed, double alpha) {
        return alpha * observed + (1.0 - alpha) * previous;
    }
}
