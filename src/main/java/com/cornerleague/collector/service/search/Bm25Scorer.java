package com.cornerleague.collector.service.search;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Component
public class Bm25Scorer {

    private final double k1;
    private final double b;

    public Bm25Scorer(@Value("${search.bm25.k1:1.2}") double k1, @Value("${search.bm25.b:0.75}") double b) {
        if (k1 < 0) throw new IllegalArgumentException("search.bm25.k1 must be >= 0");
        if (b < 0 || b > 1) throw new IllegalArgumentException("search.bm25.b must be in [0,1]");
        this.k1 = k1;
        this.b = b;
    }

    /**
     * BM25 with the length penalty taken over the tokens that do not match the query, so one more
     * matching occurrence raises its term's share and leaves every other term's share unchanged.
     */
    public double score(IndexedDocument doc, List<String> queryTerms, CorpusStats stats) {
        Set<String> terms = new LinkedHashSet<>(queryTerms);

        int matched = 0;
        for (String term : terms) {
            matched += doc.termFrequency(term);
        }
        if (matched == 0) return 0.0;

        int unmatchedLength = Math.max(0, doc.docLength() - matched);
        double avgdl = stats.averageLength() > 0 ? stats.averageLength() : Math.max(1, doc.docLength());
        double norm = k1 * (1.0 - b + b * unmatchedLength / avgdl);

        double total = 0.0;
        for (String term : terms) {
            int tf = doc.termFrequency(term);
            if (tf == 0) continue;
            total += idf(stats.documentCount(), stats.documentFrequency(term)) * (tf * (k1 + 1.0)) / (tf + norm);
        }
        return total;
    }

    /**
     * Non-negative idf variant; df is clamped into [0, N].
     */
    static double idf(long n, long df) {
        long docs = Math.max(n, 1);
        long d = Math.min(Math.max(df, 0), docs);
        return Math.log(1.0 + (docs - d + 0.5) / (d + 0.5));
    }
}
