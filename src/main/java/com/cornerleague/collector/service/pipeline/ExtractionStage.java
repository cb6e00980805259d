package com.cornerleague.collector.service.pipeline;

import com.cornerleague.collector.domain.dto.RawDocument;
import com.cornerleague.collector.domain.entity.ContentItem;
import com.cornerleague.collector.domain.entity.Source;
import com.cornerleague.collector.domain.enums.ExtractionStatus;
import com.cornerleague.collector.exception.ExtractionException;
import com.cornerleague.collector.repository.ContentItemRepository;
import com.cornerleague.collector.service.dedup.DedupResult;
import com.cornerleague.collector.service.dedup.DedupService;
import com.cornerleague.collector.service.extract.ContentExtractionService;
import com.cornerleague.collector.service.extract.ContentHasher;
import com.cornerleague.collector.service.extract.ExtractedContent;
import com.cornerleague.collector.service.extract.MinHasher;
import com.cornerleague.collector.service.search.RankingService;
import com.cornerleague.collector.util.SportsTaxonomy;
import com.cornerleague.collector.util.TextNormalizer;
import com.cornerleague.collector.util.UrlCanonicalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;

/**
 * Extract, canonicalize, hash, dedup and persist. Returns the item only when it is new or changed
 * unique content that must be scored and indexed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExtractionStage {

    private final ContentExtractionService extractionService;
    private final ContentHasher contentHasher;
    private final MinHasher minHasher;
    private final DedupService dedupService;
    private final ContentItemRepository contentItemRepository;
    private final RankingService rankingService;
    private final Clock clock;

    @Value("${extractor.max-retries:3}")
    private int maxRetries = 3;

    public Optional<ContentItem> process(RawDocument raw) {
        String fetchedCanonical = UrlCanonicalizer.canonicalize(raw.finalUrl() != null ? raw.finalUrl() : raw.originalUrl());
        if (fetchedCanonical == null) {
            log.warn("Dropping document with unusable url original={} final={}", raw.originalUrl(), raw.finalUrl());
            return Optional.empty();
        }

        ExtractedContent extracted;
        try {
            extracted = extractionService.extract(raw);
        } catch (ExtractionException e) {
            recordFailure(raw, fetchedCanonical, e.getMessage());
            return Optional.empty();
        }

        String hinted = UrlCanonicalizer.canonicalize(extracted.canonicalUrlHint());
        String canonical = hinted != null ? hinted : fetchedCanonical;

        String hash = contentHasher.contentHash(extracted.title(), extracted.text());
        long[] signature = minHasher.signature(extracted.text());

        Optional<ContentItem> existing = contentItemRepository.findByCanonicalUrl(canonical);
        if (existing.isPresent() && hash.equals(existing.get().getContentHash())
                && existing.get().getExtractionStatus() == ExtractionStatus.EXTRACTED) {
            log.debug("Unchanged content canonicalUrl={}, nothing to do", canonical);
            return Optional.empty();
        }

        ContentItem item = existing.orElseGet(() -> ContentItem.builder()
                .source(raw.source())
                .canonicalUrl(canonical)
                .build());
        boolean wasIndexed = existing.isPresent() && !item.isDuplicate() && item.getIndexedAt() != null;
        if (existing.isPresent()) {
            dedupService.release(canonical);
        }

        Source source = raw.source();
        DedupResult dedup = dedupService.classifyAndRegister(
                canonical, hash, signature, extracted.publishedAt(), source.getReputationScore());

        switch (dedup.decision()) {
            case EXACT_DUPLICATE -> {
                log.debug("Exact duplicate canonicalUrl={} of={}", canonical, dedup.representativeKey());
                if (existing.isPresent()) {
                    // content_hash stays unique, so the changed row keeps no hash
                    apply(item, raw, extracted, null, signature);
                    markDuplicate(item, dedup.representativeId(), wasIndexed);
                }
                return Optional.empty();
            }
            case NEAR_DUPLICATE -> {
                Long repId = dedup.representativeId() != null ? dedup.representativeId()
                        : contentItemRepository.findByCanonicalUrl(dedup.representativeKey()).map(ContentItem::getId).orElse(null);
                log.debug("Near duplicate canonicalUrl={} of={} similarity={}", canonical, dedup.representativeKey(), dedup.similarity());
                apply(item, raw, extracted, hash, signature);
                markDuplicate(item, repId, wasIndexed);
                return Optional.empty();
            }
            default -> {
                apply(item, raw, extracted, hash, signature);
                item.setDuplicate(false);
                item.setDuplicateOfId(null);
                try {
                    return Optional.of(contentItemRepository.save(item));
                } catch (DataIntegrityViolationException e) {
                    dedupService.release(canonical);
                    log.debug("Concurrent duplicate canonicalUrl={}, skipping: {}", canonical, e.getMostSpecificCause().getMessage());
                    return Optional.empty();
                }
            }
        }
    }

    private void apply(ContentItem item, RawDocument raw, ExtractedContent extracted, String hash, long[] signature) {
        Set<String> keywords = SportsTaxonomy.matchedKeywords(extracted.title() + " " + extracted.text());

        item.setSource(raw.source());
        item.setOriginalUrl(raw.originalUrl());
        item.setContentHash(hash);
        item.setMinhashSignature(MinHasher.encode(signature));
        item.setTitle(extracted.title());
        item.setText(extracted.text());
        item.setByline(extracted.byline());
        item.setPublishedAt(extracted.publishedAt());
        item.setWordCount(TextNormalizer.tokenize(extracted.text()).size());
        item.setExtractionConfidence(extracted.confidence());
        item.setSportsKeywords(TextNormalizer.joinCsv(keywords));
        item.setSports(TextNormalizer.joinCsv(SportsTaxonomy.detectSports(keywords)));
        item.setContentType(SportsTaxonomy.classifyContentType(extracted.title(), extracted.text()));
        item.setExtractionStatus(ExtractionStatus.EXTRACTED);
        item.setLastError(null);
        item.setActive(true);
    }

    private void markDuplicate(ContentItem item, Long representativeId, boolean wasIndexed) {
        item.setDuplicate(true);
        item.setDuplicateOfId(representativeId);
        item.setIndexedAt(null);
        try {
            contentItemRepository.save(item);
        } catch (DataIntegrityViolationException e) {
            log.debug("Duplicate row not stored canonicalUrl={}: {}", item.getCanonicalUrl(), e.getMostSpecificCause().getMessage());
            return;
        }
        if (wasIndexed) {
            rankingService.remove(item.getCanonicalUrl());
        }
    }

    private void recordFailure(RawDocument raw, String canonical, String error) {
        ContentItem item = contentItemRepository.findByCanonicalUrl(canonical).orElse(null);
        if (item != null && item.getExtractionStatus() == ExtractionStatus.EXTRACTED) {
            log.warn("Extraction failed for already extracted canonicalUrl={}, keeping stored content: {}", canonical, error);
            return;
        }

        if (item == null) {
            item = ContentItem.builder()
                    .source(raw.source())
                    .originalUrl(raw.originalUrl())
                    .canonicalUrl(canonical)
                    .build();
        }

        int attempts = item.getRetryCount() + 1;
        item.setRetryCount(attempts);
        item.setLastError(error);
        item.setExtractionStatus(attempts >= maxRetries ? ExtractionStatus.FAILED : ExtractionStatus.PENDING);
        item.setUpdatedAt(clock.instant());

        try {
            contentItemRepository.save(item);
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent failure record canonicalUrl={}: {}", canonical, e.getMostSpecificCause().getMessage());
            return;
        }

        if (item.getExtractionStatus() == ExtractionStatus.FAILED) {
            log.warn("Extraction permanently failed canonicalUrl={} attempts={} err={}", canonical, attempts, error);
        } else {
            log.info("Extraction failed canonicalUrl={} attempt={} err={}", canonical, attempts, error);
        }
    }
}
