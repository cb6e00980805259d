package com.cornerleague.collector.dto;

import java.util.List;

public record SearchResponse(
        List<SearchHit> items,
        int totalCount,
        boolean hasMore,
        String nextCursor,
        String engine,
        boolean fromCache,
        long searchTimeMs
) {

    public SearchResponse asCached(long searchTimeMs) {
        return new SearchResponse(items, totalCount, hasMore, nextCursor, engine, true, searchTimeMs);
    }
}
