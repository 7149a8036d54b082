package com.fantasyreport.collector.scheduler;

import com.fantasyreport.collector.domain.dto.IngestRunSummary;
import com.fantasyreport.collector.exception.IngestAbortedException;
import com.fantasyreport.collector.service.IngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class IngestionScheduler {

    private final IngestionService ingestionService;

    @Scheduled(cron = "${ingest.scheduler-cron:0 0 */2 * * *}", zone = "${ingest.scheduler-zone:UTC}")
    public void run() {
        String correlationId = UUID.randomUUID().toString();
        log.info("Scheduled ingestion started correlationId={}", correlationId);
        try {
            IngestRunSummary summary = ingestionService.ingestAllSources(correlationId);
            log.info("Scheduled ingestion finished correlationId={} inserted={} errors={}",
                    correlationId, summary.inserted(), summary.errors());
        } catch (IngestAbortedException e) {
            // next tick retries
            log.error("Scheduled ingestion aborted correlationId={} err={}", correlationId, e.getMessage());
        }
    }
}
