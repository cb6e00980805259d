package com.cornerleague.collector.integration.fetcher;

import com.cornerleague.collector.domain.dto.FetchResult;
import com.cornerleague.collector.domain.entity.Source;
import crawlercommons.robots.BaseRobotRules;
import crawlercommons.robots.SimpleRobotRules;
import crawlercommons.robots.SimpleRobotRulesParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;

/**
 * robots.txt rules per source domain, fetched at most once per refresh interval.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RobotsRulesCache {

    private final PageFetcher pageFetcher;
    private final Clock clock;

    private final SimpleRobotRulesParser parser = new SimpleRobotRulesParser();
    private final ConcurrentHashMap<String, CachedRules> cache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Object> locks = new ConcurrentHashMap<>();

    @Value("${crawler.robots-refresh-seconds:86400}")
    private long refreshSeconds;

    @Value("${crawler.robots-agent-name:sportsmediabot}")
    private String robotName;

    public BaseRobotRules rulesFor(Source source) {
        String domain = source.getDomain();
        CachedRules cached = cache.get(domain);
        if (cached != null && !cached.isExpired(clock.instant())) {
            return cached.rules();
        }

        synchronized (locks.computeIfAbsent(domain, k -> new Object())) {
            cached = cache.get(domain);
            if (cached != null && !cached.isExpired(clock.instant())) {
                return cached.rules();
            }
            BaseRobotRules rules = load(source);
            cache.put(domain, new CachedRules(rules, clock.instant().plusSeconds(refreshSeconds)));
            return rules;
        }
    }

    public void invalidate(String domain) {
        cache.remove(domain);
    }

    private BaseRobotRules load(Source source) {
        String robotsUrl = robotsUrlOf(source);
        FetchResult result = pageFetcher.fetch(robotsUrl);

        if (result.isSuccess()) {
            BaseRobotRules rules = parser.parseContent(robotsUrl, result.body(),
                    result.contentType() != null && !result.contentType().isBlank() ? result.contentType() : "text/plain",
                    List.of(robotName.toLowerCase(Locale.ROOT)));
            log.info("Robots: loaded domain={} crawlDelayMs={} sitemaps={}",
                    source.getDomain(), rules.getCrawlDelay(), rules.getSitemaps().size());
            return rules;
        }

        if (result.statusCode() > 0) {
            log.info("Robots: fetch status={} domain={}, using status-derived rules", result.statusCode(), source.getDomain());
            return parser.failedFetch(result.statusCode());
        }

        log.warn("Robots: fetch failed domain={} err={}, allowing all", source.getDomain(), result.error());
        return new SimpleRobotRules(SimpleRobotRules.RobotRulesMode.ALLOW_ALL);
    }

    static String robotsUrlOf(Source source) {
        if (source.getRobotsTxtUrl() != null && !source.getRobotsTxtUrl().isBlank()) {
            return source.getRobotsTxtUrl().trim();
        }
        String base = source.getBaseUrl().trim();
        while (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        return base + "/robots.txt";
    }

    private record CachedRules(BaseRobotRules rules, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
