package com.cornerleague.collector.service.trending;

import com.cornerleague.collector.domain.dto.SeedQuery;
import com.cornerleague.collector.domain.entity.ContentItem;
import com.cornerleague.collector.domain.enums.TermState;
import com.cornerleague.collector.repository.ContentItemRepository;
import com.cornerleague.collector.service.crawl.SeedQueryQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Burst detection over a sliding window of indexed items. Each term keeps an exponentially smoothed
 * baseline of its per-window count; burst = current count / max(baseline, floor).
 * The floor and the minimum count keep single mentions from ranking high, but a term whose count
 * reaches {@code ratioTrigger} times a non-zero baseline is always TRENDING.
 */
@Slf4j
@Service
public class TrendingDetector {

    private static final Comparator<TrendingTerm> RANKING = Comparator
            .comparingDouble(TrendingTerm::burstScore).reversed()
            .thenComparing(TrendingTerm::term);

    private final ContentItemRepository contentItemRepository;
    private final TermExtractor termExtractor;
    private final SeedQueryQueue seedQueue;

    private final Duration window;
    private final double alpha;
    private final double baselineFloor;
    private final double trendingThreshold;
    private final int minCount;
    private final double ratioTrigger;
    private final double risingThreshold;
    private final double discoveryThreshold;
    private final Duration discoveryCooldown;
    private final int maxTerms;

    private final ReentrantLock recomputeLock = new ReentrantLock();
    private final Map<String, TermStats> stats = new HashMap<>();
    private final Map<String, Instant> lastSeeded = new HashMap<>();

    private volatile List<TrendingTerm> ranked = List.of();
    private volatile Instant lastComputedAt;

    public TrendingDetector(
            ContentItemRepository contentItemRepository,
            TermExtractor termExtractor,
            SeedQueryQueue seedQueue,
            @Value("${trending.window-ms:3600000}") long windowMs,
            @Value("${trending.ema-alpha:0.3}") double alpha,
            @Value("${trending.baseline-floor:1.0}") double baselineFloor,
            @Value("${trending.threshold:3.0}") double trendingThreshold,
            @Value("${trending.min-count:3}") int minCount,
            @Value("${trending.rising-threshold:1.5}") double risingThreshold,
            @Value("${trending.discovery-threshold:5.0}") double discoveryThreshold,
            @Value("${trending.discovery-cooldown-ms:21600000}") long discoveryCooldownMs,
            @Value("${trending.max-terms:5000}") int maxTerms,
            @Value("${trending.ratio-trigger:5.0}") double ratioTrigger
    ) {
        if (windowMs <= 0) throw new IllegalArgumentException("trending.window-ms must be > 0");
        if (alpha <= 0 || alpha > 1) throw new IllegalArgumentException("trending.ema-alpha must be in (0,1]");
        if (baselineFloor <= 0) throw new IllegalArgumentException("trending.baseline-floor must be > 0");
        if (ratioTrigger <= 1) throw new IllegalArgumentException("trending.ratio-trigger must be > 1");

        this.contentItemRepository = contentItemRepository;
        this.termExtractor = termExtractor;
        this.seedQueue = seedQueue;
        this.window = Duration.ofMillis(windowMs);
        this.alpha = alpha;
        this.baselineFloor = baselineFloor;
        this.trendingThreshold = trendingThreshold;
        this.minCount = Math.max(1, minCount);
        this.ratioTrigger = ratioTrigger;
        this.risingThreshold = risingThreshold;
        this.discoveryThreshold = discoveryThreshold;
        this.discoveryCooldown = Duration.ofMillis(Math.max(0, discoveryCooldownMs));
        this.maxTerms = Math.max(1, maxTerms);
    }

    /**
     * Evaluates the window ending at {@code now}. A call made while another recompute is running is skipped.
     *
     * @return false when skipped
     */
    public boolean recompute(Instant now) {
        if (!recomputeLock.tryLock()) {
            log.debug("Trending recompute already running, skipping");
            return false;
        }
        try {
            List<ContentItem> items = contentItemRepository.findIndexedBetween(now.minus(window), now);
            Map<String, Integer> counts = countTerms(items);
            evaluate(counts, now);
            return true;
        } finally {
            recomputeLock.unlock();
        }
    }

    /**
     * Terms currently RISING or TRENDING, strongest burst first.
     */
    public List<TrendingTerm> topTrending(int limit) {
        if (limit < 1) throw new IllegalArgumentException("limit must be >= 1");
        List<TrendingTerm> snapshot = ranked;
        return snapshot.subList(0, Math.min(limit, snapshot.size()));
    }

    public Instant lastComputedAt() {
        return lastComputedAt;
    }

    Map<String, Integer> countTerms(List<ContentItem> items) {
        Map<String, Integer> counts = new HashMap<>();
        for (ContentItem item : items) {
            if (item.isSpam()) continue;
            for (String term : termExtractor.terms(item)) {
                counts.merge(term, 1, Integer::sum);
            }
        }
        return counts;
    }

    void evaluate(Map<String, Integer> counts, Instant now) {
        Set<String> keys = new HashSet<>(stats.keySet());
        keys.addAll(counts.keySet());

        List<TrendingTerm> visible = new ArrayList<>();
        int seeded = 0;

        for (String term : keys) {
            int count = counts.getOrDefault(term, 0);
            TermStats s = stats.computeIfAbsent(term, k -> new TermStats());

            double burst = count / Math.max(s.baseline, baselineFloor);
            TermState next = exceedsBaseline(count, s.baseline)
                    ? TermState.TRENDING
                    : nextState(s.state, burst, s.lastBurst, count);
            if (next != s.state) {
                s.since = now;
                if (next == TermState.TRENDING) {
                    log.info("Term trending term='{}' count={} burst={}", term, count, String.format("%.2f", burst));
                }
            }
            s.state = next;
            s.lastBurst = burst;
            s.lastCount = count;
            s.baseline = alpha * count + (1.0 - alpha) * s.baseline;

            if (next == TermState.TRENDING || next == TermState.RISING) {
                visible.add(new TrendingTerm(term, count, s.baseline, burst, next, s.since));
            }

            if (burst >= discoveryThreshold && count >= minCount && offCooldown(term, now)) {
                if (seedQueue.offer(new SeedQuery(term, term, burst, now))) {
                    lastSeeded.put(term, now);
                    seeded++;
                }
            }
        }

        forgetQuietTerms(now);

        visible.sort(RANKING);
        ranked = List.copyOf(visible);
        lastComputedAt = now;

        log.info("Trending recompute done terms={} visible={} seeded={}", stats.size(), visible.size(), seeded);
    }

    TermState nextState(TermState previous, double burst, double previousBurst, int count) {
        if (burst >= trendingThreshold && count >= minCount) return TermState.TRENDING;
        if (burst >= risingThreshold && burst > previousBurst) return TermState.RISING;
        if (previous != TermState.BASELINE && burst > 1.0) return TermState.DECAYING;
        return TermState.BASELINE;
    }

    /**
     * Terms seen for the first time have no baseline yet and go through the floored burst instead.
     */
    boolean exceedsBaseline(int count, double baseline) {
        return baseline > 0 && count > 0 && count >= ratioTrigger * baseline;
    }

    private boolean offCooldown(String term, Instant now) {
        Instant last = lastSeeded.get(term);
        return last == null || !now.isBefore(last.plus(discoveryCooldown));
    }

    private void forgetQuietTerms(Instant now) {
        stats.entrySet().removeIf(e -> e.getValue().state == TermState.BASELINE
                && e.getValue().lastCount == 0
                && e.getValue().baseline < 0.05);
        lastSeeded.entrySet().removeIf(e -> !now.isBefore(e.getValue().plus(discoveryCooldown)));

        if (stats.size() <= maxTerms) return;

        List<Map.Entry<String, TermStats>> evictable = new ArrayList<>();
        for (Map.Entry<String, TermStats> e : stats.entrySet()) {
            if (e.getValue().state == TermState.BASELINE) evictable.add(e);
        }
        evictable.sort(Comparator.comparingDouble((Map.Entry<String, TermStats> e) -> e.getValue().baseline)
                .thenComparing(Map.Entry::getKey));

        int excess = stats.size() - maxTerms;
        List<String> drop = new ArrayList<>();
        for (int i = 0; i < Math.min(excess, evictable.size()); i++) {
            drop.add(evictable.get(i).getKey());
        }
        drop.forEach(stats::remove);
        log.debug("Trending term table over capacity, evicted {}", drop.size());
    }

    int trackedTerms() {
        return stats.size();
    }

    private static final class TermStats {
        double baseline = 0.0;
        double lastBurst = 0.0;
        int lastCount = 0;
        TermState state = TermState.BASELINE;
        Instant since;
    }
}
