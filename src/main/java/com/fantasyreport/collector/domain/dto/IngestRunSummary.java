package com.fantasyreport.collector.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate result of one batch. {@code sources} is only filled in verbose mode.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestRunSummary(
        String correlationId,
        Instant startedAt,
        long tookMs,
        int sourcesProcessed,
        int discovered,
        int inserted,
        int updated,
        int skipped,
        int errors,
        List<String> errorMessages,
        List<SourceRunReport> sources
) {}
