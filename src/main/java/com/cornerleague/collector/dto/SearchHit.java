package com.cornerleague.collector.dto;

import java.time.Instant;
import java.util.List;

public record SearchHit(
        Long id,
        String canonicalUrl,
        String title,
        String byline,
        String sourceDomain,
        List<String> sports,
        Instant publishedAt,
        double qualityScore,
        double score
) {}
