package com.cornerleague.collector.service.search;

import java.util.Map;

public record CorpusStats(long documentCount, double averageLength, Map<String, Long> documentFrequencies) {

    public long documentFrequency(String term) {
        return documentFrequencies.getOrDefault(term, 0L);
    }
}
