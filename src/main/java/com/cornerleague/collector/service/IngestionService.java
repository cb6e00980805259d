package com.cornerleague.collector.service;

import com.cornerleague.collector.service.crawl.FetchScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    private final FetchScheduler fetchScheduler;

    public List<Long> ingestAllSources(String correlationId) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable("corrId", correlationId)) {
            List<Long> jobIds = fetchScheduler.runDueSources(correlationId);
            log.info("Ingestion triggered for due sources jobs={}", jobIds);
            return jobIds;
        }
    }

    public Long ingestSource(Long sourceId, String correlationId) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable("corrId", correlationId)) {
            Long jobId = fetchScheduler.runSource(sourceId, correlationId);
            log.info("Ingestion triggered sourceId={} jobId={}", sourceId, jobId);
            return jobId;
        }
    }

    /**
     * @return false when the job is not running
     */
    public boolean cancel(Long jobId) {
        return fetchScheduler.cancel(jobId);
    }
}
