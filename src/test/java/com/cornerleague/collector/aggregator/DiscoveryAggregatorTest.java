package com.cornerleague.collector.aggregator;

import com.cornerleague.collector.domain.dto.DiscoveredUrl;
import com.cornerleague.collector.domain.entity.Source;
import com.cornerleague.collector.source.DiscoverySource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DiscoveryAggregatorTest {

    private final Source source = Source.builder().id(1L).domain("espn.com").build();

    @Test
    void discover_mergesSources_keepingFirstOccurrencePerCanonicalUrl() {
        DiscoverySource rss = mock(DiscoverySource.class);
        DiscoverySource sitemap = mock(DiscoverySource.class);
        when(rss.discover(any(), any())).thenReturn(List.of(
                new DiscoveredUrl("https://www.espn.com/a", "https://espn.com/a", null, "rss")));
        when(sitemap.discover(any(), any())).thenReturn(List.of(
                new DiscoveredUrl("https://espn.com/a/", "https://espn.com/a", null, "sitemap"),
                new DiscoveredUrl("https://espn.com/b", "https://espn.com/b", null, "sitemap")));

        DiscoveryAggregator aggregator = new DiscoveryAggregator(List.of(rss, sitemap), Runnable::run);
        List<DiscoveredUrl> out = aggregator.discover(source, null);

        assertEquals(2, out.size());
        assertEquals("rss", out.get(0).origin());
        assertEquals("https://espn.com/b", out.get(1).canonicalUrl());
    }

    @Test
    void discover_failingSource_isIgnored() {
        DiscoverySource broken = mock(DiscoverySource.class);
        DiscoverySource ok = mock(DiscoverySource.class);
        when(broken.name()).thenReturn("sitemap");
        when(broken.discover(any(), any())).thenThrow(new IllegalStateException("boom"));
        when(ok.discover(any(), any())).thenReturn(List.of(
                new DiscoveredUrl("https://espn.com/c", "https://espn.com/c", null, "rss")));

        DiscoveryAggregator aggregator = new DiscoveryAggregator(List.of(broken, ok), Runnable::run);

        assertEquals(1, aggregator.discover(source, null).size());
    }
}
