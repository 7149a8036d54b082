package com.fantasyreport.collector.controller;

import com.fantasyreport.collector.domain.dto.IngestRunSummary;
import com.fantasyreport.collector.service.IngestionService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/admin/ingestion")
@RequiredArgsConstructor
public class IngestionController {

    private final IngestionService ingestionService;

    @PostMapping("/run")
    public ResponseEntity<IngestRunSummary> runIngestion(
            @RequestParam(required = false) Long sourceId,
            @RequestParam(required = false) @Min(1) @Max(1000) Integer limit,
            @RequestParam(required = false, defaultValue = "false") boolean verbose,
            @RequestParam(required = false) String correlationId
    ) {
        String cid = correlationIdOrNew(correlationId);

        log.info("Manual ingestion trigger sourceId={} limit={} verbose={} correlationId={}",
                sourceId, limit, verbose, cid);
        return ResponseEntity.ok(ingestionService.run(cid, sourceId, limit, verbose));
    }

    @PostMapping("/run/{sourceId}")
    public ResponseEntity<IngestRunSummary> runIngestionForSource(
            @PathVariable("sourceId") Long sourceId,
            @RequestParam(required = false) @Min(1) @Max(1000) Integer limit,
            @RequestParam(required = false, defaultValue = "true") boolean verbose,
            @RequestParam(required = false) String correlationId
    ) {
        String cid = correlationIdOrNew(correlationId);

        log.info("Manual ingestion trigger for sourceId={}, correlationId={}", sourceId, cid);
        return ResponseEntity.ok(ingestionService.run(cid, sourceId, limit, verbose));
    }

    private static String correlationIdOrNew(String correlationId) {
        return (correlationId != null && !correlationId.isBlank())
                ? correlationId
                : UUID.randomUUID().toString();
    }
}
