package com.cornerleague.collector.source;

import com.cornerleague.collector.domain.dto.DiscoveredUrl;
import com.cornerleague.collector.domain.dto.FetchResult;
import com.cornerleague.collector.domain.entity.Source;
import com.cornerleague.collector.integration.fetcher.PageFetcher;
import crawlercommons.robots.SimpleRobotRules;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SitemapDiscoverySourceTest {

    private static final Instant NOW = Instant.parse("2025-10-28T12:00:00Z");

    private static final String INDEX = """
            <?xml version="1.0" encoding="UTF-8"?>
            <sitemapindex xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
              <sitemap><loc>https://espn.com/sitemap-nba.xml</loc></sitemap>
            </sitemapindex>
            """;

    private static final String URLSET = """
            <?xml version="1.0" encoding="UTF-8"?>
            <urlset xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
              <url><loc>https://espn.com/nba/story/fresh</loc><lastmod>2025-10-27T08:00:00Z</lastmod></url>
              <url><loc>https://espn.com/nba/story/stale</loc><lastmod>2025-09-01T08:00:00Z</lastmod></url>
              <url><loc>https://espn.com/nba/story/undated</loc></url>
              <url><loc>https://espn.com/admin/preview</loc></url>
            </urlset>
            """;

    @Mock
    PageFetcher pageFetcher;

    private SitemapDiscoverySource sitemap;

    @BeforeEach
    void setUp() {
        sitemap = new SitemapDiscoverySource(pageFetcher, Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(sitemap, "maxUrlsPerSource", 500);
        ReflectionTestUtils.setField(sitemap, "sitemapMaxAgeDays", 7);
    }

    private static FetchResult xml(String url, String body) {
        return FetchResult.success(url, url, 200, body.getBytes(StandardCharsets.UTF_8),
                "application/xml", StandardCharsets.UTF_8, 8);
    }

    @Test
    void discover_followsIndexFromRobots_andDropsStaleAndDisallowedUrls() {
        SimpleRobotRules rules = new SimpleRobotRules();
        rules.addRule("/admin/", false);
        rules.addSitemap("https://espn.com/sitemap.xml");
        when(pageFetcher.fetch("https://espn.com/sitemap.xml")).thenReturn(xml("https://espn.com/sitemap.xml", INDEX));
        when(pageFetcher.fetch("https://espn.com/sitemap-nba.xml")).thenReturn(xml("https://espn.com/sitemap-nba.xml", URLSET));

        List<DiscoveredUrl> out = sitemap.discover(Source.builder().id(1L).domain("espn.com").build(), rules);

        assertThat(out).extracting(DiscoveredUrl::canonicalUrl)
                .containsExactly("https://espn.com/nba/story/fresh", "https://espn.com/nba/story/undated");
        assertThat(out.get(0).publishedHint()).isEqualTo(Instant.parse("2025-10-27T08:00:00Z"));
        assertThat(out.get(0).origin()).isEqualTo("sitemap");
    }

    @Test
    void discover_explicitSitemapUrl_winsOverRobots() {
        Source source = Source.builder().id(1L).domain("espn.com").sitemapUrl("https://espn.com/sitemap-nba.xml").build();
        when(pageFetcher.fetch("https://espn.com/sitemap-nba.xml")).thenReturn(xml("https://espn.com/sitemap-nba.xml", URLSET));

        List<DiscoveredUrl> out = sitemap.discover(source, null);

        assertThat(out).hasSize(3);
    }

    @Test
    void discover_withoutAnySitemap_returnsEmpty() {
        assertThat(sitemap.discover(Source.builder().id(1L).domain("espn.com").build(), new SimpleRobotRules())).isEmpty();
        verifyNoInteractions(pageFetcher);
    }

    @Test
    void discover_unparseableSitemap_returnsEmpty() {
        Source source = Source.builder().id(1L).domain("espn.com").sitemapUrl("https://espn.com/sitemap.xml").build();
        when(pageFetcher.fetch("https://espn.com/sitemap.xml")).thenReturn(xml("https://espn.com/sitemap.xml", "not xml at all"));

        assertThat(sitemap.discover(source, null)).isEmpty();
    }
}
