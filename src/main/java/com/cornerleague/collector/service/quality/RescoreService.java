package com.cornerleague.collector.service.quality;

import com.cornerleague.collector.domain.entity.ContentItem;
import com.cornerleague.collector.repository.ContentItemRepository;
import com.cornerleague.collector.service.pipeline.IndexingStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Retries items whose last score was assigned with missing inputs. Batches walk the flagged items
 * in id order and wrap around, so items that stay degraded never hold back newer ones.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RescoreService {

    private final ContentItemRepository contentItemRepository;
    private final IndexingStage indexingStage;

    private final AtomicLong resumeAfterId = new AtomicLong();

    @Value("${quality.rescore-batch-size:500}")
    private int batchSize = 500;

    @Scheduled(fixedDelayString = "${quality.rescore-ms:600000}", initialDelayString = "${quality.rescore-initial-delay-ms:120000}")
    public int rescoreFlagged() {
        int size = Math.max(1, batchSize);
        long after = resumeAfterId.get();

        List<ContentItem> flagged;
        try {
            flagged = contentItemRepository.findNeedingRescoreAfter(after, PageRequest.of(0, size));
            if (flagged.isEmpty() && after > 0) {
                after = 0;
                flagged = contentItemRepository.findNeedingRescoreAfter(0L, PageRequest.of(0, size));
            }
        } catch (DataAccessException e) {
            log.error("Rescore batch could not be loaded", e);
            return 0;
        }
        if (flagged.isEmpty()) {
            resumeAfterId.set(0);
            return 0;
        }

        // a short batch reached the end of the flagged items
        resumeAfterId.set(flagged.size() < size ? 0 : flagged.get(flagged.size() - 1).getId());

        int recovered = 0;
        for (ContentItem item : flagged) {
            try {
                ContentItem saved = indexingStage.rescore(item);
                if (!saved.isNeedsRescore()) recovered++;
            } catch (RuntimeException e) {
                log.warn("Rescore failed canonicalUrl={}: {}", item.getCanonicalUrl(), e.getMessage());
            }
        }

        log.info("Rescored flagged items total={} recovered={} fromId={}", flagged.size(), recovered, after);
        return recovered;
    }
}
