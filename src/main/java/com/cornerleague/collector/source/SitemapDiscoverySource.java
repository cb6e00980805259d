package com.cornerleague.collector.source;

import com.cornerleague.collector.domain.dto.DiscoveredUrl;
import com.cornerleague.collector.domain.dto.FetchResult;
import com.cornerleague.collector.domain.entity.Source;
import com.cornerleague.collector.integration.fetcher.PageFetcher;
import com.cornerleague.collector.util.UrlCanonicalizer;
import crawlercommons.robots.BaseRobotRules;
import crawlercommons.sitemaps.AbstractSiteMap;
import crawlercommons.sitemaps.SiteMap;
import crawlercommons.sitemaps.SiteMapIndex;
import crawlercommons.sitemaps.SiteMapParser;
import crawlercommons.sitemaps.SiteMapURL;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URL;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Component
@RequiredArgsConstructor
public class SitemapDiscoverySource implements DiscoverySource {

    private static final int MAX_INDEX_DEPTH = 2;

    private final PageFetcher pageFetcher;
    private final Clock clock;

    @Value("${crawler.max-urls-per-source:500}")
    private int maxUrlsPerSource;

    @Value("${crawler.sitemap-max-age-days:7}")
    private int sitemapMaxAgeDays;

    @Override
    public String name() {
        return "sitemap";
    }

    @Override
    public List<DiscoveredUrl> discover(Source source, BaseRobotRules robotRules) {
        Set<String> sitemapUrls = new LinkedHashSet<>();
        if (source.getSitemapUrl() != null && !source.getSitemapUrl().isBlank()) {
            sitemapUrls.add(source.getSitemapUrl().trim());
        } else if (robotRules != null) {
            sitemapUrls.addAll(robotRules.getSitemaps());
        }
        if (sitemapUrls.isEmpty()) {
            return List.of();
        }

        Instant cutoff = clock.instant().minus(Duration.ofDays(sitemapMaxAgeDays));
        SiteMapParser parser = new SiteMapParser(false);
        List<DiscoveredUrl> out = new ArrayList<>();

        for (String sitemapUrl : sitemapUrls) {
            collect(parser, sitemapUrl, 0, cutoff, robotRules, out);
            if (out.size() >= maxUrlsPerSource) break;
        }

        log.info("Sitemap: done sourceId={} sitemaps={} urls={}", source.getId(), sitemapUrls.size(), out.size());
        return out;
    }

    private void collect(SiteMapParser parser, String sitemapUrl, int depth, Instant cutoff,
                         BaseRobotRules robotRules, List<DiscoveredUrl> out) {
        if (out.size() >= maxUrlsPerSource) return;

        FetchResult result = pageFetcher.fetch(sitemapUrl);
        if (!result.isSuccess()) {
            log.warn("Sitemap: fetch failed url={} status={} err={}", sitemapUrl, result.statusCode(), result.error());
            return;
        }

        AbstractSiteMap siteMap;
        try {
            String contentType = result.contentType() == null || result.contentType().isBlank()
                    ? "text/xml" : result.contentType();
            siteMap = parser.parseSiteMap(contentType, result.body(), new URL(sitemapUrl));
        } catch (Exception e) {
            log.warn("Sitemap: parse failed url={} err={}", sitemapUrl, e.toString());
            return;
        }

        if (siteMap.isIndex()) {
            if (depth >= MAX_INDEX_DEPTH) {
                log.debug("Sitemap: index depth limit reached url={}", sitemapUrl);
                return;
            }
            for (AbstractSiteMap child : ((SiteMapIndex) siteMap).getSitemaps()) {
                collect(parser, child.getUrl().toString(), depth + 1, cutoff, robotRules, out);
                if (out.size() >= maxUrlsPerSource) return;
            }
            return;
        }

        for (SiteMapURL entry : ((SiteMap) siteMap).getSiteMapUrls()) {
            if (out.size() >= maxUrlsPerSource) return;

            String url = entry.getUrl().toString();
            Instant lastModified = entry.getLastModified() != null ? entry.getLastModified().toInstant() : null;
            if (lastModified != null && lastModified.isBefore(cutoff)) continue;
            if (robotRules != null && !robotRules.isAllowed(url)) continue;

            String canonical = UrlCanonicalizer.canonicalize(url);
            if (canonical == null) continue;
            out.add(new DiscoveredUrl(url, canonical, lastModified, name()));
        }
    }
}
