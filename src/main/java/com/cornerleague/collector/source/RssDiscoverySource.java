package com.cornerleague.collector.source;

import com.cornerleague.collector.domain.dto.DiscoveredUrl;
import com.cornerleague.collector.domain.dto.FetchResult;
import com.cornerleague.collector.domain.entity.Source;
import com.cornerleague.collector.integration.fetcher.PageFetcher;
import com.cornerleague.collector.util.UrlCanonicalizer;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import crawlercommons.robots.BaseRobotRules;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class RssDiscoverySource implements DiscoverySource {

    private final PageFetcher pageFetcher;

    @Value("${crawler.max-urls-per-source:500}")
    private int maxUrlsPerSource;

    @Override
    public String name() {
        return "rss";
    }

    @Override
    public List<DiscoveredUrl> discover(Source source, BaseRobotRules robotRules) {
        String feedUrl = source.getRssUrl();
        if (feedUrl == null || feedUrl.isBlank()) {
            return List.of();
        }

        long t0 = System.currentTimeMillis();
        log.info("RSS: fetching feed sourceId={} domain={} feedUrl={}", source.getId(), source.getDomain(), feedUrl);

        FetchResult result = pageFetcher.fetch(feedUrl);
        if (!result.isSuccess()) {
            log.warn("RSS: feed fetch failed sourceId={} feedUrl={} status={} err={}",
                    source.getId(), feedUrl, result.statusCode(), result.error());
            return List.of();
        }

        List<DiscoveredUrl> out = new ArrayList<>();
        int seen = 0;
        int skipped = 0;
        for (DiscoveredUrl candidate : parseFeed(result.body(), name())) {
            seen++;
            if (out.size() >= maxUrlsPerSource) break;
            if (robotRules != null && !robotRules.isAllowed(candidate.url())) {
                skipped++;
                continue;
            }
            out.add(candidate);
        }

        log.info("RSS: feed done sourceId={} seen={} kept={} robotsSkipped={} tookMs={}",
                source.getId(), seen, out.size(), skipped, System.currentTimeMillis() - t0);
        return out;
    }

    /**
     * Parses an RSS/Atom document into candidate URLs. Entries without a usable link are dropped.
     */
    public List<DiscoveredUrl> parseFeed(byte[] body, String origin) {
        if (body == null || body.length == 0) return List.of();

        List<DiscoveredUrl> out = new ArrayList<>();
        try (InputStream is = new ByteArrayInputStream(body); XmlReader reader = new XmlReader(is)) {
            SyndFeed feed = new SyndFeedInput().build(reader);
            for (SyndEntry entry : feed.getEntries()) {
                String link = entry.getLink();
                String canonical = UrlCanonicalizer.canonicalize(link);
                if (canonical == null) continue;

                Instant published = entry.getPublishedDate() != null
                        ? entry.getPublishedDate().toInstant()
                        : (entry.getUpdatedDate() != null ? entry.getUpdatedDate().toInstant() : null);
                out.add(new DiscoveredUrl(link.trim(), canonical, published, origin));
            }
        } catch (Exception e) {
            log.warn("RSS: failed to parse feed origin={} err={}", origin, e.toString());
        }
        return out;
    }
}
