package com.cornerleague.collector.service.search;

import com.cornerleague.collector.domain.entity.SearchDocument;
import com.cornerleague.collector.domain.entity.SearchPosting;
import com.cornerleague.collector.repository.SearchDocumentRepository;
import com.cornerleague.collector.repository.SearchPostingRepository;
import com.cornerleague.collector.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Inverted postings kept next to the content tables.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "search.backend", havingValue = "relational", matchIfMissing = true)
public class RelationalSearchBackend implements SearchBackend {

    public static final String ENGINE = "relational";

    private final SearchDocumentRepository documentRepository;
    private final SearchPostingRepository postingRepository;
    private final Clock clock;

    @Override
    public String engine() {
        return ENGINE;
    }

    @Override
    @Transactional
    public void upsert(IndexedDocument doc) {
        postingRepository.deleteByCanonicalUrl(doc.canonicalUrl());

        documentRepository.save(SearchDocument.builder()
                .canonicalUrl(doc.canonicalUrl())
                .contentItemId(doc.contentItemId())
                .contentHash(doc.contentHash())
                .title(doc.title())
                .byline(doc.byline())
                .sourceDomain(doc.sourceDomain())
                .sports(TextNormalizer.joinCsv(doc.sports()))
                .sportsKeywords(TextNormalizer.joinCsv(doc.sportsKeywords()))
                .publishedAt(doc.publishedAt())
                .qualityScore(doc.qualityScore())
                .spam(doc.spam())
                .docLength(doc.docLength())
                .indexedAt(clock.instant())
                .build());

        List<SearchPosting> postings = new ArrayList<>(doc.termFrequencies().size());
        doc.termFrequencies().forEach((term, tf) -> postings.add(SearchPosting.builder()
                .term(term)
                .canonicalUrl(doc.canonicalUrl())
                .termFrequency(tf)
                .build()));
        postingRepository.saveAll(postings);

        log.debug("Indexed {} with {} postings", doc.canonicalUrl(), postings.size());
    }

    @Override
    @Transactional
    public void delete(String canonicalUrl) {
        postingRepository.deleteByCanonicalUrl(canonicalUrl);
        if (documentRepository.existsById(canonicalUrl)) {
            documentRepository.deleteById(canonicalUrl);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public CandidateSet candidates(SearchQuery query) {
        long n = documentRepository.count();
        double avgdl = documentRepository.averageDocLength();

        if (!query.hasTerms()) {
            List<IndexedDocument> docs = documentRepository
                    .findTopByQuality(PageRequest.of(0, query.maxCandidates()))
                    .stream()
                    .map(d -> toIndexed(d, Map.of()))
                    .filter(query::accepts)
                    .toList();
            return new CandidateSet(docs, new CorpusStats(n, avgdl, Map.of()));
        }

        Map<String, Long> df = new HashMap<>();
        for (Object[] row : postingRepository.countDocumentFrequencies(query.terms())) {
            df.put((String) row[0], ((Number) row[1]).longValue());
        }

        Map<String, Map<String, Integer>> tfByUrl = new HashMap<>();
        for (SearchPosting p : postingRepository.findByTermIn(query.terms())) {
            tfByUrl.computeIfAbsent(p.getCanonicalUrl(), k -> new HashMap<>()).put(p.getTerm(), p.getTermFrequency());
        }

        List<IndexedDocument> docs = new ArrayList<>(tfByUrl.size());
        for (SearchDocument d : documentRepository.findAllById(tfByUrl.keySet())) {
            IndexedDocument doc = toIndexed(d, tfByUrl.get(d.getCanonicalUrl()));
            if (query.accepts(doc)) docs.add(doc);
        }

        return new CandidateSet(docs, new CorpusStats(n, avgdl, df));
    }

    private static IndexedDocument toIndexed(SearchDocument d, Map<String, Integer> tf) {
        return new IndexedDocument(
                d.getCanonicalUrl(),
                d.getContentItemId(),
                d.getContentHash(),
                d.getTitle(),
                d.getByline(),
                d.getSourceDomain(),
                TextNormalizer.splitCsv(d.getSports()),
                TextNormalizer.splitCsv(d.getSportsKeywords()),
                d.getPublishedAt(),
                d.getQualityScore(),
                d.isSpam(),
                d.getDocLength(),
                tf
        );
    }
}
