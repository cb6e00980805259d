package com.cornerleague.collector.service.crawl;

import com.cornerleague.collector.aggregator.DiscoveryAggregator;
import com.cornerleague.collector.domain.dto.DiscoveredUrl;
import com.cornerleague.collector.domain.dto.FetchResult;
import com.cornerleague.collector.domain.dto.RawDocument;
import com.cornerleague.collector.domain.entity.ContentItem;
import com.cornerleague.collector.domain.entity.Source;
import com.cornerleague.collector.domain.enums.DocumentType;
import com.cornerleague.collector.domain.enums.ExtractionStatus;
import com.cornerleague.collector.integration.fetcher.PageFetcher;
import com.cornerleague.collector.integration.fetcher.RobotsRulesCache;
import com.cornerleague.collector.repository.ContentItemRepository;
import com.cornerleague.collector.repository.SourceRepository;
import com.cornerleague.collector.service.IngestionJobService;
import com.cornerleague.collector.service.pipeline.ContentPipeline;
import com.cornerleague.collector.source.SearchFeedSeedResolver;
import crawlercommons.robots.BaseRobotRules;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Turns source crawl policy into fetch tasks. Each run is one {@code IngestionJob}; its tasks run on the
 * fetch pool under the {@link PolitenessBudget} and hand successful documents to the content pipeline.
 */
@Slf4j
@Service
public class FetchScheduler {

    private final SourceRepository sourceRepository;
    private final ContentItemRepository contentItemRepository;
    private final RobotsRulesCache robotsRulesCache;
    private final DiscoveryAggregator discoveryAggregator;
    private final SearchFeedSeedResolver seedResolver;
    private final SeedQueryQueue seedQueryQueue;
    private final PageFetcher pageFetcher;
    private final PolitenessBudget politenessBudget;
    private final SourceTelemetryRegistry telemetry;
    private final IngestionJobService ingestionJobService;
    private final ContentPipeline contentPipeline;
    private final RetryPolicy retryPolicy;
    private final ExecutorService fetchExecutor;
    private final Clock clock;

    private final ConcurrentHashMap<Long, CrawlRun> activeRuns = new ConcurrentHashMap<>();

    @Value("${ingestion.job-timeout-ms:1800000}")
    private long jobTimeoutMs;

    @Value("${ingestion.max-seeds-per-tick:10}")
    private int maxSeedsPerTick;

    @Value("${extractor.max-retries:3}")
    private int extractorMaxRetries;

    public FetchScheduler(
            SourceRepository sourceRepository,
            ContentItemRepository contentItemRepository,
            RobotsRulesCache robotsRulesCache,
            DiscoveryAggregator discoveryAggregator,
            SearchFeedSeedResolver seedResolver,
            SeedQueryQueue seedQueryQueue,
            PageFetcher pageFetcher,
            PolitenessBudget politenessBudget,
            SourceTelemetryRegistry telemetry,
            IngestionJobService ingestionJobService,
            ContentPipeline contentPipeline,
            RetryPolicy retryPolicy,
            @Qualifier("fetchExecutor") ExecutorService fetchExecutor,
            Clock clock
    ) {
        this.sourceRepository = sourceRepository;
        this.contentItemRepository = contentItemRepository;
        this.robotsRulesCache = robotsRulesCache;
        this.discoveryAggregator = discoveryAggregator;
        this.seedResolver = seedResolver;
        this.seedQueryQueue = seedQueryQueue;
        this.pageFetcher = pageFetcher;
        this.politenessBudget = politenessBudget;
        this.telemetry = telemetry;
        this.ingestionJobService = ingestionJobService;
        this.contentPipeline = contentPipeline;
        this.retryPolicy = retryPolicy;
        this.fetchExecutor = fetchExecutor;
        this.clock = clock;
    }

    /**
     * Starts a run for every enabled source that is due, plus every source that received
     * URLs from pending seed queries. Returns the started job ids.
     */
    public List<Long> runDueSources(String correlationId) {
        Instant now = clock.instant();

        Map<Long, List<DiscoveredUrl>> seeded = new HashMap<>();
        seedResolver.resolve(seedQueryQueue.drain(maxSeedsPerTick))
                .forEach((source, urls) -> seeded.computeIfAbsent(source.getId(), id -> new ArrayList<>()).addAll(urls));

        List<Long> jobIds = new ArrayList<>();
        for (Source source : sourceRepository.findAllByEnabledTrue()) {
            List<DiscoveredUrl> extra = seeded.getOrDefault(source.getId(), List.of());
            boolean due = telemetry.isDue(source, now);
            if (!due && extra.isEmpty()) {
                continue;
            }
            if (isRunning(source.getId())) {
                log.debug("Source already running sourceId={}, skipping", source.getId());
                continue;
            }
            jobIds.add(startRun(source, due, extra, correlationId));
        }

        log.info("Scheduler tick: started runs={} seededSources={}", jobIds.size(), seeded.size());
        return jobIds;
    }

    public Long runSource(Long sourceId, String correlationId) {
        Source source = sourceRepository.findById(sourceId)
                .orElseThrow(() -> new NoSuchElementException("Source not found: " + sourceId));
        if (!source.isEnabled()) {
            throw new IllegalArgumentException("Source is disabled: " + sourceId);
        }
        return startRun(source, true, List.of(), correlationId);
    }

    /**
     * Stops scheduling new fetch tasks for the job; tasks already fetching finish normally.
     */
    public boolean cancel(Long jobId) {
        CrawlRun run = activeRuns.get(jobId);
        if (run == null) {
            return false;
        }
        if (run.cancel()) {
            log.info("Cancellation requested jobId={} pendingTasks={}", jobId, run.pending());
        }
        return true;
    }

    public boolean isRunning(Long sourceId) {
        return activeRuns.values().stream().anyMatch(r -> r.source().getId().equals(sourceId));
    }

    public Optional<CrawlRun> activeRun(Long jobId) {
        return Optional.ofNullable(activeRuns.get(jobId));
    }

    Long startRun(Source source, boolean discover, List<DiscoveredUrl> extra, String correlationId) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable("corrId", correlationId)) {
            Long jobId = ingestionJobService.start(source, correlationId, clock.instant());
            CrawlRun run = new CrawlRun(jobId, source, correlationId);
            activeRuns.put(jobId, run);

            try {
                if (discover) {
                    telemetry.recordCrawlStarted(source);
                }
                BaseRobotRules rules = robotsRulesCache.rulesFor(source);

                List<DiscoveredUrl> candidates = new ArrayList<>();
                if (discover) {
                    candidates.addAll(discoveryAggregator.discover(source, rules));
                }
                candidates.addAll(extra);

                List<DiscoveredUrl> fresh = withoutSettled(candidates);
                ingestionJobService.recordDiscovered(jobId, fresh.size());
                log.info("Run started jobId={} sourceId={} domain={} candidates={} fresh={}",
                        jobId, source.getId(), source.getDomain(), candidates.size(), fresh.size());

                run.done()
                        .orTimeout(jobTimeoutMs, TimeUnit.MILLISECONDS)
                        .whenComplete((v, ex) -> finish(run, ex));

                run.expect(fresh.size());
                for (DiscoveredUrl url : fresh) {
                    fetchExecutor.execute(() -> executeTask(run, url, rules));
                }
                return jobId;

            } catch (RuntimeException e) {
                log.error("Run failed to start jobId={} sourceId={}", jobId, source.getId(), e);
                activeRuns.remove(jobId);
                ingestionJobService.fail(jobId, clock.instant(), e.toString());
                throw e;
            }
        }
    }

    void executeTask(CrawlRun run, DiscoveredUrl url, BaseRobotRules rules) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable("corrId", run.correlationId())) {
            if (run.isCancelled()) {
                log.debug("Task skipped, run cancelled jobId={} url={}", run.jobId(), url.url());
                return;
            }

            FetchResult result = fetchWithRetry(run, url.url(), rules);
            resolve(run, url, result);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Task interrupted jobId={} url={}", run.jobId(), url.url());
            ingestionJobService.recordFailure(run.jobId());
        } catch (RuntimeException e) {
            log.error("Task failed jobId={} url={}", run.jobId(), url.url(), e);
            ingestionJobService.recordFailure(run.jobId());
        } finally {
            run.taskFinished();
        }
    }

    FetchResult fetchWithRetry(CrawlRun run, String url, BaseRobotRules rules) throws InterruptedException {
        Source source = run.source();

        if (rules != null && !rules.isAllowed(url)) {
            telemetry.recordPermanentFailure(source);
            return FetchResult.permanentFailure(url, 0, 0, "robots-disallowed");
        }

        long crawlDelayMs = rules == null ? 0 : Math.max(0, rules.getCrawlDelay());

        for (int attempt = 0; ; attempt++) {
            FetchResult result;
            try (PolitenessBudget.Permit ignored = politenessBudget.acquire(source.getDomain(), crawlDelayMs)) {
                result = pageFetcher.fetch(url);
            }

            switch (result.outcome()) {
                case SUCCESS -> {
                    telemetry.recordSuccess(source, result.elapsedMs());
                    return result;
                }
                case PERMANENT_FAILURE -> {
                    telemetry.recordPermanentFailure(source);
                    return result;
                }
                default -> telemetry.recordTransientFailure(source, result.elapsedMs());
            }

            if (attempt >= retryPolicy.maxRetries() || run.isCancelled()) {
                return result;
            }

            long delay = retryPolicy.delayFor(attempt, result.retryAfterMs());
            log.debug("Transient failure attempt={} url={} retryInMs={} err={}", attempt + 1, url, delay, result.error());
            sleep(delay);
        }
    }

    private void resolve(CrawlRun run, DiscoveredUrl url, FetchResult result) throws InterruptedException {
        switch (result.outcome()) {
            case SUCCESS -> {
                Optional<DocumentType> type = DocumentType.fromContentType(result.contentType());
                if (type.isEmpty()) {
                    log.debug("Unsupported content type '{}' url={}", result.contentType(), url.url());
                    markSkipped(run, url, "unsupported content type: " + result.contentType());
                    ingestionJobService.recordFailure(run.jobId());
                    return;
                }
                RawDocument raw = new RawDocument(
                        run.source(),
                        url.url(),
                        result.finalUrl(),
                        result.bodyAsString(),
                        type.get(),
                        url.publishedHint(),
                        clock.instant(),
                        run.jobId(),
                        run.correlationId()
                );
                contentPipeline.submit(raw);
                ingestionJobService.recordSuccess(run.jobId());
            }
            case TRANSIENT_FAILURE -> {
                log.warn("Fetch gave up after retries url={} status={} err={}", url.url(), result.statusCode(), result.error());
                ingestionJobService.recordFailure(run.jobId());
            }
            case PERMANENT_FAILURE -> {
                log.debug("Permanent fetch failure url={} status={} err={}", url.url(), result.statusCode(), result.error());
                markSkipped(run, url, result.error());
                ingestionJobService.recordFailure(run.jobId());
            }
        }
    }

    /**
     * Stores a SKIPPED marker so later runs treat the URL as settled. Stored content is never overwritten.
     */
    private void markSkipped(CrawlRun run, DiscoveredUrl url, String reason) {
        try {
            ContentItem item = contentItemRepository.findByCanonicalUrl(url.canonicalUrl()).orElse(null);
            if (item != null && item.getExtractionStatus() == ExtractionStatus.EXTRACTED) {
                return;
            }
            if (item == null) {
                item = ContentItem.builder()
                        .source(run.source())
                        .originalUrl(url.url())
                        .canonicalUrl(url.canonicalUrl())
                        .build();
            }
            item.setExtractionStatus(ExtractionStatus.SKIPPED);
            item.setLastError(reason);
            item.setUpdatedAt(clock.instant());
            contentItemRepository.save(item);
        } catch (DataAccessException e) {
            log.warn("Failed to mark url skipped canonicalUrl={} err={}", url.canonicalUrl(), e.toString());
        }
    }

    private List<DiscoveredUrl> withoutSettled(List<DiscoveredUrl> candidates) {
        Map<String, DiscoveredUrl> byCanonical = new LinkedHashMap<>();
        for (DiscoveredUrl d : candidates) {
            byCanonical.putIfAbsent(d.canonicalUrl(), d);
        }
        if (byCanonical.isEmpty()) {
            return List.of();
        }

        Set<String> settled = contentItemRepository.findSettledUrls(byCanonical.keySet(), extractorMaxRetries);
        List<DiscoveredUrl> out = new ArrayList<>(byCanonical.size());
        for (DiscoveredUrl d : byCanonical.values()) {
            if (!settled.contains(d.canonicalUrl())) {
                out.add(d);
            }
        }
        return out;
    }

    private void finish(CrawlRun run, Throwable ex) {
        activeRuns.remove(run.jobId());
        Instant now = clock.instant();
        try {
            if (ex != null) {
                run.cancel();
                log.error("Run timed out jobId={} pendingTasks={}", run.jobId(), run.pending());
                ingestionJobService.fail(run.jobId(), now, "timed out after " + jobTimeoutMs + "ms");
            } else if (run.isCancelled()) {
                ingestionJobService.cancelled(run.jobId(), now);
            } else {
                ingestionJobService.complete(run.jobId(), now);
            }
        } catch (RuntimeException e) {
            log.error("Failed to close ingestion job jobId={}", run.jobId(), e);
        }
    }

    protected void sleep(long ms) throws InterruptedException {
        if (ms > 0) {
            Thread.sleep(ms);
        }
    }
}
