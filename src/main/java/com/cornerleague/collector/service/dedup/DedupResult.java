package com.cornerleague.collector.service.dedup;

import com.cornerleague.collector.domain.enums.DedupDecision;

/**
 * Routing decision for an extracted item. {@code representativeKey} is the canonical URL of the item
 * this one duplicates; it is null for {@link DedupDecision#UNIQUE}.
 */
public record DedupResult(DedupDecision decision, String representativeKey, Long representativeId, double similarity) {

    public static DedupResult unique() {
        return new DedupResult(DedupDecision.UNIQUE, null, null, 0.0);
    }

    public static DedupResult exact(String canonicalUrl, Long id) {
        return new DedupResult(DedupDecision.EXACT_DUPLICATE, canonicalUrl, id, 1.0);
    }

    public static DedupResult near(String canonicalUrl, double similarity) {
        return new DedupResult(DedupDecision.NEAR_DUPLICATE, canonicalUrl, null, similarity);
    }

    public boolean isUnique() {
        return decision == DedupDecision.UNIQUE;
    }
}
