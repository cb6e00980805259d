package com.cornerleague.collector.controller;

import com.cornerleague.collector.domain.entity.IngestionJob;
import com.cornerleague.collector.domain.entity.Source;
import com.cornerleague.collector.repository.IngestionJobRepository;
import com.cornerleague.collector.service.IngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/admin/ingestion")
@RequiredArgsConstructor
public class IngestionController {

    private final IngestionService ingestionService;
    private final IngestionJobRepository ingestionJobRepository;

    @PostMapping("/run")
    public ResponseEntity<RunTriggerResponse> runIngestion(
            @RequestParam(required = false) String correlationId
    ) {
        String cid = resolveCorrelationId(correlationId);

        log.info("Manual ingestion trigger, correlationId={}", cid);
        List<Long> jobIds = ingestionService.ingestAllSources(cid);

        return ResponseEntity.ok(new RunTriggerResponse(cid, jobIds));
    }

    @PostMapping("/run/{sourceId}")
    public ResponseEntity<RunTriggerResponse> runIngestionForSource(
            @PathVariable("sourceId") Long sourceId,
            @RequestParam(required = false) String correlationId
    ) {
        String cid = resolveCorrelationId(correlationId);

        log.info("Manual ingestion trigger for sourceId={}, correlationId={}", sourceId, cid);
        Long jobId = ingestionService.ingestSource(sourceId, cid);

        return ResponseEntity.ok(new RunTriggerResponse(cid, List.of(jobId)));
    }

    @PostMapping("/runs/{id}/cancel")
    public ResponseEntity<IngestionRunResponse> cancelRun(@PathVariable("id") Long runId) {
        IngestionJob run = ingestionJobRepository.findById(runId)
                .orElseThrow(() -> new NoSuchElementException("Ingestion run not found: " + runId));

        if (!ingestionService.cancel(runId)) {
            throw new IllegalArgumentException("Ingestion run is not active: " + runId);
        }
        return ResponseEntity.accepted().body(IngestionRunResponse.from(run));
    }

    @GetMapping("/logs")
    public ResponseEntity<IngestionLogPageResponse> listLogs(
            @RequestParam(name = "page", required = false, defaultValue = "0") int page,
            @RequestParam(name = "size", required = false, defaultValue = "20") int size
    ) {
        if (page < 0) {
            throw new IllegalArgumentException("page must be >= 0");
        }
        if (size < 1 || size > 200) {
            throw new IllegalArgumentException("size must be between 1 and 200");
        }

        Page<IngestionJob> result = ingestionJobRepository.findAll(
                PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "id")));
        return ResponseEntity.ok(IngestionLogPageResponse.from(result, page, size));
    }

    @GetMapping("/runs/{id}")
    public ResponseEntity<IngestionRunResponse> getRun(@PathVariable("id") Long runId) {
        IngestionJob run = ingestionJobRepository.findById(runId)
                .orElseThrow(() -> new NoSuchElementException("Ingestion run not found: " + runId));
        return ResponseEntity.ok(IngestionRunResponse.from(run));
    }

    private static String resolveCorrelationId(String correlationId) {
        return (correlationId != null && !correlationId.isBlank())
                ? correlationId
                : UUID.randomUUID().toString();
    }

    public record RunTriggerResponse(String correlationId, List<Long> jobIds) {}

    public record IngestionLogPageResponse(
            int page,
            int size,
            long totalElements,
            int totalPages,
            List<IngestionRunResponse> items
    ) {
        static IngestionLogPageResponse from(Page<IngestionJob> pageResult, int page, int size) {
            var items = pageResult.getContent().stream().map(IngestionRunResponse::from).toList();
            return new IngestionLogPageResponse(page, size, pageResult.getTotalElements(), pageResult.getTotalPages(), items);
        }
    }

    public record IngestionRunResponse(
            Long id,
            Long sourceId,
            String sourceDomain,
            String status,
            int itemsDiscovered,
            int itemsProcessed,
            int itemsSuccessful,
            int itemsFailed,
            Instant startedAt,
            Instant completedAt,
            String errorMessage,
            String correlationId
    ) {
        static IngestionRunResponse from(IngestionJob job) {
            Source source = job.getSource();
            return new IngestionRunResponse(
                    job.getId(),
                    source != null ? source.getId() : null,
                    source != null ? source.getDomain() : null,
                    job.getStatus() != null ? job.getStatus().name() : null,
                    job.getItemsDiscovered(),
                    job.getItemsProcessed(),
                    job.getItemsSuccessful(),
                    job.getItemsFailed(),
                    job.getStartedAt(),
                    job.getCompletedAt(),
                    job.getErrorMessage(),
                    job.getCorrelationId()
            );
        }
    }
}
