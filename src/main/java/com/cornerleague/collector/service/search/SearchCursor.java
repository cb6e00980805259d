package com.cornerleague.collector.service.search;

import com.cornerleague.collector.domain.enums.SortOrder;

/**
 * Position of the last returned hit. Instants are epoch millis; {@code asOf} pins the freshness clock
 * so every page of one traversal is scored against the same instant.
 */
public record SearchCursor(
        SortOrder sort,
        double score,
        double quality,
        Long publishedAt,
        String canonicalUrl,
        long asOf
) {}
