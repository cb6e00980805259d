package com.cornerleague.collector.scheduler;

import com.cornerleague.collector.service.IngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class IngestionScheduler {

    private final IngestionService ingestionService;

    @Scheduled(fixedDelayString = "${ingestion.tick-ms:60000}", initialDelayString = "${ingestion.initial-delay-ms:10000}")
    public void run() {
        String correlationId = UUID.randomUUID().toString();
        log.info("Scheduled ingestion tick correlationId={}", correlationId);
        List<Long> jobIds = ingestionService.ingestAllSources(correlationId);
        log.info("Scheduled ingestion tick started {} runs correlationId={}", jobIds.size(), correlationId);
    }
}
