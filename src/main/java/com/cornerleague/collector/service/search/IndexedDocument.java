package com.cornerleague.collector.service.search;

import com.cornerleague.collector.domain.entity.ContentItem;
import com.cornerleague.collector.util.TextNormalizer;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Backend-neutral view of an indexed item. {@code termFrequencies} covers title, text and byline;
 * documents returned as query candidates may carry only the query terms.
 */
public record IndexedDocument(
        String canonicalUrl,
        Long contentItemId,
        String contentHash,
        String title,
        String byline,
        String sourceDomain,
        List<String> sports,
        List<String> sportsKeywords,
        Instant publishedAt,
        double qualityScore,
        boolean spam,
        int docLength,
        Map<String, Integer> termFrequencies
) {

    static final int MAX_TERM_LENGTH = 64;

    public static IndexedDocument from(ContentItem item) {
        Map<String, Integer> tf = new HashMap<>();
        int length = 0;
        for (String field : new String[]{item.getTitle(), item.getText(), item.getByline()}) {
            for (String token : TextNormalizer.tokenize(field)) {
                length++;
                if (token.length() <= MAX_TERM_LENGTH) tf.merge(token, 1, Integer::sum);
            }
        }

        return new IndexedDocument(
                item.getCanonicalUrl(),
                item.getId(),
                item.getContentHash(),
                item.getTitle(),
                item.getByline(),
                item.getSource() != null ? item.getSource().getDomain() : null,
                TextNormalizer.splitCsv(item.getSports()),
                TextNormalizer.splitCsv(item.getSportsKeywords()),
                item.getPublishedAt(),
                item.getQualityScore() != null ? item.getQualityScore() : 0.0,
                item.isSpam(),
                length,
                tf
        );
    }

    public int termFrequency(String term) {
        return termFrequencies == null ? 0 : termFrequencies.getOrDefault(term, 0);
    }
}
