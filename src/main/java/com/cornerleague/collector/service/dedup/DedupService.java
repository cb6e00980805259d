package com.cornerleague.collector.service.dedup;

import com.cornerleague.collector.domain.entity.ContentItem;
import com.cornerleague.collector.repository.ContentItemRepository;
import com.cornerleague.collector.service.extract.MinHasher;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Exact duplicates are found through the content_hash column, near duplicates through the
 * in-memory {@link NearDuplicateIndex} window.
 */
@Slf4j
@Service
public class DedupService {

    static final Comparator<NearDuplicateIndex.Match> REPRESENTATIVE_ORDER = Comparator
            .comparing((NearDuplicateIndex.Match m) -> m.entry().publishedAt(), Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(m -> m.entry().reputation(), Comparator.reverseOrder())
            .thenComparing(m -> m.entry().key());

    private final ContentItemRepository contentItemRepository;
    private final NearDuplicateIndex index;
    private final double threshold;
    private final int warmUpSize;

    public DedupService(
            ContentItemRepository contentItemRepository,
            @Value("${dedup.threshold:0.8}") double threshold,
            @Value("${dedup.bands:32}") int bands,
            @Value("${dedup.rows:4}") int rows,
            @Value("${dedup.window-size:50000}") int windowSize,
            @Value("${dedup.shards:64}") int shards,
            @Value("${dedup.warm-up-size:5000}") int warmUpSize
    ) {
        if (threshold <= 0 || threshold > 1) throw new IllegalArgumentException("dedup.threshold must be in (0,1]");
        this.contentItemRepository = contentItemRepository;
        this.threshold = threshold;
        this.index = new NearDuplicateIndex(bands, rows, windowSize, shards);
        this.warmUpSize = warmUpSize;
    }

    @PostConstruct
    void warmUp() {
        if (warmUpSize <= 0) return;
        try {
            List<ContentItem> recent = contentItemRepository.findRecentWithSignature(PageRequest.of(0, warmUpSize));
            for (int i = recent.size() - 1; i >= 0; i--) {
                ContentItem item = recent.get(i);
                // a threshold above 1 never matches, so every stored signature goes in
                index.insertIfUnique(item.getCanonicalUrl(), MinHasher.decode(item.getMinhashSignature()),
                        item.getPublishedAt(), item.getSource().getReputationScore(), 1.01);
            }
            log.info("Dedup window warmed up with {} signatures", index.size());
        } catch (DataAccessException e) {
            log.warn("Dedup warm-up skipped err={}", e.toString());
        }
    }

    public double threshold() {
        return threshold;
    }

    /**
     * Classifies an item and, when it is unique, claims its place in the signature window.
     * The caller must call {@link #release(String)} if the unique item is not persisted.
     */
    public DedupResult classifyAndRegister(String canonicalUrl, String contentHash, long[] signature,
                                           Instant publishedAt, double reputation) {
        Optional<ContentItem> exact = contentItemRepository.findFirstByContentHash(contentHash)
                .filter(c -> !c.getCanonicalUrl().equals(canonicalUrl));
        if (exact.isPresent()) {
            ContentItem match = exact.get();
            Long repId = match.isDuplicate() ? match.getDuplicateOfId() : match.getId();
            return DedupResult.exact(match.getCanonicalUrl(), repId);
        }

        List<NearDuplicateIndex.Match> matches = index.insertIfUnique(canonicalUrl, signature, publishedAt, reputation, threshold);
        if (matches.isEmpty()) {
            return DedupResult.unique();
        }

        NearDuplicateIndex.Match rep = matches.stream().min(REPRESENTATIVE_ORDER).orElseThrow();
        log.debug("Near duplicate url={} of={} similarity={}", canonicalUrl, rep.entry().key(), rep.similarity());
        return DedupResult.near(rep.entry().key(), rep.similarity());
    }

    /**
     * Drops a canonical URL from the window, e.g. before re-registering changed text or after a failed save.
     */
    public void release(String canonicalUrl) {
        index.remove(canonicalUrl);
    }

    NearDuplicateIndex index() {
        return index;
    }
}
