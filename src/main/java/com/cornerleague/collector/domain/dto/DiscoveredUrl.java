package com.cornerleague.collector.domain.dto;

import java.time.Instant;

public record DiscoveredUrl(
        String url,
        String canonicalUrl,
        Instant publishedHint,
        String origin
) {}
