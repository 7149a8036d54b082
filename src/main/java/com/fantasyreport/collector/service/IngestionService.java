package com.fantasyreport.collector.service;

import com.fantasyreport.collector.domain.dto.IngestRunSummary;
import com.fantasyreport.collector.domain.dto.SourceRunReport;
import com.fantasyreport.collector.domain.entity.Source;
import com.fantasyreport.collector.domain.enums.SourceRunState;
import com.fantasyreport.collector.exception.IngestAbortedException;
import com.fantasyreport.collector.repository.SourceRepository;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Drives one ingest batch across all allowed sources, highest priority first.
 * <p>
 * Sources fan out over the bounded ingestion pool; reports are collected back in source order.
 * A failing source only shows up in the summary. An unreachable datastore aborts the whole run.
 */
@Slf4j
@Service
public class IngestionService {

    private static final int MAX_LIMIT = 1000;

    private final SourceRepository sourceRepository;
    private final SourceIngestionService sourceIngestionService;
    private final Executor executor;

    @Value("${ingest.per-source-limit:150}")
    private int defaultLimit = 150;

    public IngestionService(SourceRepository sourceRepository,
                            SourceIngestionService sourceIngestionService,
                            @Qualifier("ingestionExecutor") Executor executor) {
        this.sourceRepository = sourceRepository;
        this.sourceIngestionService = sourceIngestionService;
        this.executor = executor;
    }

    public IngestRunSummary ingestAllSources(String correlationId) {
        return run(correlationId, null, null, false);
    }

    public IngestRunSummary ingestSource(Long sourceId, String correlationId) {
        return run(correlationId, sourceId, null, false);
    }

    public IngestRunSummary run(String correlationId, Long sourceId, Integer limit, boolean verbose) {
        int perSource = limit != null ? limit : defaultLimit;
        if (perSource < 1 || perSource > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }

        Instant startedAt = Instant.now();
        try (MDC.MDCCloseable ignored = MDC.putCloseable("corrId", correlationId)) {
            List<Source> sources = selectSources(sourceId);
            log.info("Ingest: run started sources={} limit={} sourceId={}", sources.size(), perSource, sourceId);
            sources.forEach(src -> log.debug("Ingest: queued sourceId={} priority={} state={}",
                    src.getId(), src.getPriority(), SourceRunState.PENDING));

            List<CompletableFuture<SourceRunReport>> futures = sources.stream()
                    .map(src -> CompletableFuture.supplyAsync(() -> runOne(src, perSource, correlationId), executor))
                    .toList();

            List<SourceRunReport> reports = new ArrayList<>(futures.size());
            for (CompletableFuture<SourceRunReport> f : futures) {
                reports.add(join(f));
            }

            IngestRunSummary summary = summarize(correlationId, startedAt, reports, verbose);
            log.info("Ingest: run done sources={} discovered={} inserted={} skipped={} errors={} tookMs={}",
                    summary.sourcesProcessed(), summary.discovered(), summary.inserted(), summary.skipped(),
                    summary.errors(), summary.tookMs());
            return summary;

        } catch (IngestAbortedException e) {
            log.error("Ingest: run aborted correlationId={}", correlationId, e);
            throw e;
        }
    }

    private List<Source> selectSources(Long sourceId) {
        if (sourceId == null) {
            return sourceRepository.findAllByAllowedTrueOrderByPriorityDescIdAsc();
        }
        Source source = sourceRepository.findById(sourceId)
                .orElseThrow(() -> new IllegalArgumentException("Source not found: " + sourceId));
        if (!source.isAllowed()) {
            log.info("Ingest: running disallowed source on explicit request sourceId={}", sourceId);
        }
        return List.of(source);
    }

    private SourceRunReport runOne(Source source, int limit, String correlationId) {
        long t0 = System.currentTimeMillis();
        try (MDC.MDCCloseable ignored = MDC.putCloseable("corrId", correlationId)) {
            return sourceIngestionService.ingestSource(source, limit);
        } catch (IngestAbortedException e) {
            throw e;
        } catch (RuntimeException e) {
            SourceIngestionService.abortIfStoreUnavailable(e);
            log.warn("Ingest: source crashed sourceId={} err={}", source.getId(), e.toString(), e);
            return SourceRunReport.failed(source.getId(), source.getName(), List.of(), e.toString(),
                    System.currentTimeMillis() - t0);
        }
    }

    private static SourceRunReport join(CompletableFuture<SourceRunReport> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw e;
        }
    }

    private static IngestRunSummary summarize(String correlationId, Instant startedAt,
                                              List<SourceRunReport> reports, boolean verbose) {
        int discovered = 0;
        int inserted = 0;
        int skipped = 0;
        int errors = 0;
        List<String> errorMessages = new ArrayList<>();

        for (SourceRunReport r : reports) {
            discovered += r.seen();
            inserted += r.added();
            skipped += r.skipped();
            errors += r.errors();
            if (r.error() != null) {
                errorMessages.add("sourceId=" + r.sourceId() + " " + r.error());
            }
        }

        long tookMs = Instant.now().toEpochMilli() - startedAt.toEpochMilli();
        return new IngestRunSummary(correlationId, startedAt, tookMs, reports.size(),
                discovered, inserted, 0, skipped, errors, errorMessages,
                verbose ? reports : null);
    }
}
