package com.cornerleague.collector.service.search;

import com.cornerleague.collector.domain.enums.SortOrder;

import java.util.List;
import java.util.Set;

/**
 * Normalized query handed to a backend: tokenized terms plus filters. An empty term list means "browse".
 */
public record SearchQuery(
        List<String> terms,
        Set<String> sports,
        Set<String> sources,
        double minQuality,
        boolean includeSpam,
        SortOrder sort,
        int maxCandidates
) {

    public boolean hasTerms() {
        return !terms.isEmpty();
    }

    public boolean accepts(IndexedDocument doc) {
        if (!includeSpam && doc.spam()) return false;
        if (doc.qualityScore() < minQuality) return false;
        if (!sources.isEmpty() && (doc.sourceDomain() == null || !sources.contains(doc.sourceDomain()))) return false;
        if (!sports.isEmpty() && doc.sports().stream().noneMatch(sports::contains)) return false;
        return true;
    }
}
