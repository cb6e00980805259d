package com.cornerleague.collector.source;

import com.cornerleague.collector.domain.dto.DiscoveredUrl;
import com.cornerleague.collector.domain.dto.FetchResult;
import com.cornerleague.collector.domain.dto.SeedQuery;
import com.cornerleague.collector.domain.entity.Source;
import com.cornerleague.collector.integration.fetcher.PageFetcher;
import com.cornerleague.collector.repository.SourceRepository;
import com.cornerleague.collector.util.UrlCanonicalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns trending seed queries into candidate URLs through a news search feed,
 * keeping only URLs whose domain belongs to a registered, enabled source.
 * Result links that point at the search engine's click-through redirect are unwrapped to the
 * publisher URL they carry before routing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SearchFeedSeedResolver {

    private final PageFetcher pageFetcher;
    private final RssDiscoverySource rssDiscoverySource;
    private final SourceRepository sourceRepository;

    private static final Set<String> REDIRECT_TARGET_PARAMS = Set.of("url", "u");

    @Value("${crawler.discovery-feed-template:https://www.bing.com/news/search?q={query}&format=rss}")
    private String feedTemplate;

    public Map<Source, List<DiscoveredUrl>> resolve(List<SeedQuery> seeds) {
        if (seeds.isEmpty() || feedTemplate == null || feedTemplate.isBlank()) {
            return Map.of();
        }

        Map<String, Optional<Source>> sourcesByDomain = new HashMap<>();
        Map<Source, List<DiscoveredUrl>> out = new LinkedHashMap<>();
        int ignored = 0;

        for (SeedQuery seed : seeds) {
            String url = feedTemplate.replace("{query}", URLEncoder.encode(seed.query(), StandardCharsets.UTF_8));
            FetchResult result = pageFetcher.fetch(url);
            if (!result.isSuccess()) {
                log.warn("Seed: search feed failed query='{}' status={} err={}", seed.query(), result.statusCode(), result.error());
                continue;
            }

            for (DiscoveredUrl entry : rssDiscoverySource.parseFeed(result.body(), "seed:" + seed.term())) {
                DiscoveredUrl candidate = toPublisher(entry);
                if (candidate == null) continue;
                String domain = UrlCanonicalizer.hostOf(candidate.canonicalUrl());
                if (domain == null) continue;

                Optional<Source> source = sourcesByDomain.computeIfAbsent(domain,
                        d -> sourceRepository.findByDomain(d).filter(Source::isEnabled));
                if (source.isEmpty()) {
                    ignored++;
                    continue;
                }
                out.computeIfAbsent(source.get(), s -> new ArrayList<>()).add(candidate);
            }
        }

        log.info("Seed: resolved seeds={} sources={} ignoredUnknownDomain={}", seeds.size(), out.size(), ignored);
        return out;
    }

    private static DiscoveredUrl toPublisher(DiscoveredUrl entry) {
        String target = publisherUrl(entry.url());
        if (target.equals(entry.url())) {
            return entry;
        }
        String canonical = UrlCanonicalizer.canonicalize(target);
        return canonical == null ? null : new DiscoveredUrl(target, canonical, entry.publishedHint(), entry.origin());
    }

    /**
     * Returns the absolute http(s) URL carried in a redirect parameter of {@code link}, or the link itself.
     */
    static String publisherUrl(String link) {
        String query;
        try {
            query = URI.create(link.trim()).getRawQuery();
        } catch (IllegalArgumentException e) {
            log.debug("Seed: unparseable result link '{}': {}", link, e.getMessage());
            return link;
        }
        if (query == null) return link;

        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0 || !REDIRECT_TARGET_PARAMS.contains(pair.substring(0, eq).toLowerCase(Locale.ROOT))) continue;
            String target;
            try {
                target = URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e) {
                log.debug("Seed: undecodable redirect target in '{}': {}", link, e.getMessage());
                continue;
            }
            String lower = target.toLowerCase(Locale.ROOT);
            if (lower.startsWith("http://") || lower.startsWith("https://")) {
                return target;
            }
        }
        return link;
    }
}
