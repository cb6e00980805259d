package com.cornerleague.collector.service;

import com.cornerleague.collector.domain.entity.IngestionJob;
import com.cornerleague.collector.domain.entity.Source;
import com.cornerleague.collector.domain.enums.IngestionStatus;
import com.cornerleague.collector.repository.IngestionJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionJobService {

    private final IngestionJobRepository ingestionJobRepository;

    public Long start(Source source, String correlationId, Instant startedAt) {
        IngestionJob job = IngestionJob.builder()
                .source(source)
                .status(IngestionStatus.RUNNING)
                .correlationId(correlationId)
                .startedAt(startedAt)
                .build();
        ingestionJobRepository.save(job);
        return job.getId();
    }

    public void recordDiscovered(Long jobId, int count) {
        if (count > 0) {
            ingestionJobRepository.incrementDiscovered(jobId, count);
        }
    }

    public void recordSuccess(Long jobId) {
        ingestionJobRepository.incrementSuccessful(jobId);
    }

    public void recordFailure(Long jobId) {
        ingestionJobRepository.incrementFailed(jobId);
    }

    public void complete(Long jobId, Instant completedAt) {
        close(jobId, completedAt, IngestionStatus.COMPLETED, null);
    }

    public void cancelled(Long jobId, Instant completedAt) {
        close(jobId, completedAt, IngestionStatus.CANCELLED, "cancelled");
    }

    public void fail(Long jobId, Instant completedAt, String errorMessage) {
        close(jobId, completedAt, IngestionStatus.FAILED, errorMessage);
    }

    private void close(Long jobId, Instant completedAt, IngestionStatus status, String errorMessage) {
        IngestionJob job = ingestionJobRepository.findById(jobId)
                .orElseThrow(() -> new IllegalStateException("IngestionJob not found: " + jobId));

        job.setStatus(status);
        job.setCompletedAt(completedAt);
        if (errorMessage != null) {
            job.setErrorMessage(errorMessage);
        }
        ingestionJobRepository.save(job);

        log.info("Ingestion job closed id={} status={} discovered={} processed={} successful={} failed={}",
                jobId, status, job.getItemsDiscovered(), job.getItemsProcessed(),
                job.getItemsSuccessful(), job.getItemsFailed());
    }
}
