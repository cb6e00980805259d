package com.cornerleague.collector.service.crawl;

public record RetryPolicy(int maxRetries, long baseDelayMs, long maxDelayMs) {

    public RetryPolicy {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (baseDelayMs < 0 || maxDelayMs < 0) throw new IllegalArgumentException("delays must be >= 0");
    }

    /**
     * Delay before retrying after the given 0-based attempt failed; a server-provided
     * Retry-After wins when it is longer.
     */
    public long delayFor(int attempt, long retryAfterMs) {
        long exp = baseDelayMs * (1L << Math.min(attempt, 30));
        long backoff = Math.min(exp < 0 ? maxDelayMs : exp, maxDelayMs);
        return Math.max(backoff, Math.max(0, retryAfterMs));
    }
}
