package com.cornerleague.collector.service.search;

/**
 * Storage and candidate retrieval for ranked search. Backends return candidates and corpus statistics;
 * scoring and ordering happen in {@link RankingService} so every backend ranks identically.
 */
public interface SearchBackend {

    String engine();

    void upsert(IndexedDocument document);

    void delete(String canonicalUrl);

    /**
     * Documents containing at least one query term (or, for a term-less query, the best documents by
     * quality) that pass the query filters, together with statistics over the whole index.
     */
    CandidateSet candidates(SearchQuery query);
}
