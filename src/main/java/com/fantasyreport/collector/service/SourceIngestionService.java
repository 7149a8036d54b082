package com.fantasyreport.collector.service;

import com.fantasyreport.collector.classifier.TopicClassifier;
import com.fantasyreport.collector.domain.dto.AdmissionDecision;
import com.fantasyreport.collector.domain.dto.Classification;
import com.fantasyreport.collector.domain.dto.FeedItem;
import com.fantasyreport.collector.domain.dto.FetchBatch;
import com.fantasyreport.collector.domain.dto.NormalizedCandidate;
import com.fantasyreport.collector.domain.dto.SourceRunReport;
import com.fantasyreport.collector.domain.entity.Source;
import com.fantasyreport.collector.domain.enums.IngestReason;
import com.fantasyreport.collector.domain.enums.SourceRunState;
import com.fantasyreport.collector.domain.enums.UpsertOutcome;
import com.fantasyreport.collector.exception.FetchException;
import com.fantasyreport.collector.exception.IngestAbortedException;
import com.fantasyreport.collector.exception.ResolveException;
import com.fantasyreport.collector.filter.AdmissionFilter;
import com.fantasyreport.collector.processor.ArticleNormalizer;
import com.fantasyreport.collector.source.SourceFetcher;
import com.fantasyreport.collector.source.SourceFetcherRegistry;
import com.fantasyreport.collector.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.List;

/**
 * Runs one source end to end: fetch, then per item admit, normalize, classify and upsert.
 * <p>
 * A source that cannot be fetched ends in FETCH_FAILED; a bad item is logged and skipped. Only an
 * unreachable datastore escapes, as {@link IngestAbortedException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SourceIngestionService {

    private final SourceFetcherRegistry fetcherRegistry;
    private final AdmissionFilter admissionFilter;
    private final ArticleNormalizer normalizer;
    private final TopicClassifier classifier;
    private final ArticleStore articleStore;
    private final IngestLogService ingestLogService;

    private enum ItemResult { ADDED, SKIPPED, REJECTED, ERROR }

    public SourceRunReport ingestSource(Source source, int limit) {
        long t0 = System.currentTimeMillis();
        SourceFetcher fetcher = fetcherRegistry.forSource(source);

        log.info("Ingest: fetching sourceId={} sourceName='{}' method={} state={}",
                source.getId(), source.getName(), fetcher.method(), SourceRunState.FETCHING);

        FetchBatch batch;
        try {
            batch = fetcher.listCandidates(source, limit);
        } catch (ResolveException e) {
            return fetchFailed(source, e.getAttemptedUrls(), e.getMessage(), t0);
        } catch (FetchException e) {
            return fetchFailed(source, List.of(), e.getMessage(), t0);
        } catch (RuntimeException e) {
            abortIfStoreUnavailable(e);
            return fetchFailed(source, List.of(), e.toString(), t0);
        }
        log.debug("Ingest: listed sourceId={} items={} url={} state={}",
                source.getId(), batch.items().size(), batch.resolvedUrl(), SourceRunState.PARSED);

        if (batch.warningReason() != null) {
            ingestLogService.sourceFailure(source.getId(), batch.resolvedUrl(), batch.warningReason(), batch.warningDetail());
        }
        if (batch.discoveredUrl() != null) {
            articleStore.healFeedUrl(source.getId(), batch.discoveredUrl());
        }

        List<FeedItem> items = batch.items().size() > limit ? batch.items().subList(0, limit) : batch.items();
        log.debug("Ingest: filtering sourceId={} items={} state={}", source.getId(), items.size(), SourceRunState.FILTERING);

        int added = 0;
        int skipped = 0;
        int rejected = 0;
        int errors = 0;

        for (FeedItem item : items) {
            switch (processItem(source, fetcher, item)) {
                case ADDED -> added++;
                case SKIPPED -> skipped++;
                case REJECTED -> rejected++;
                case ERROR -> errors++;
            }
        }

        long tookMs = System.currentTimeMillis() - t0;
        log.info("Ingest: source done sourceId={} seen={} added={} skipped={} rejected={} errors={} url={} tookMs={} state={}",
                source.getId(), items.size(), added, skipped, rejected, errors, batch.resolvedUrl(), tookMs, SourceRunState.DONE);

        return new SourceRunReport(source.getId(), source.getName(), SourceRunState.DONE,
                items.size(), added, skipped, rejected, errors,
                batch.resolvedUrl(), batch.candidatesTried(), null, tookMs);
    }

    private ItemResult processItem(Source source, SourceFetcher fetcher, FeedItem listed) {
        Long sourceId = source.getId();
        try {
            FeedItem item = fetcher.loadItem(listed);

            if (TextUtils.isBlank(item.title()) || !TextUtils.isHttpUrl(item.link())) {
                ingestLogService.record(sourceId, item.link(), item.title(), IngestReason.INVALID_ITEM,
                        "missing title or non-http link");
                return ItemResult.REJECTED;
            }

            AdmissionDecision decision = admissionFilter.evaluate(item, sourceId);
            if (!decision.admitted()) {
                log.debug("Ingest: rejected sourceId={} reason={} detail={} url={}",
                        sourceId, decision.reason().code(), decision.detail(), item.link());
                ingestLogService.record(sourceId, item.link(), item.title(), decision.reason(), decision.detail());
                return ItemResult.REJECTED;
            }

            NormalizedCandidate candidate = normalizer.normalize(item, source.getName());

            if (articleStore.isBlocked(candidate.canonicalUrl())) {
                ingestLogService.record(sourceId, candidate.canonicalUrl(), item.title(), IngestReason.FILTERED_OUT, "blocked_url");
                return ItemResult.REJECTED;
            }

            Classification classification = classifier.classify(candidate.cleanedTitle(), candidate.summary(),
                    source.getName(), candidate.week(), candidate.canonicalUrl());
            candidate = candidate.withClassification(classification);

            UpsertOutcome outcome = articleStore.upsert(candidate, source);
            if (outcome == UpsertOutcome.INSERTED) {
                ingestLogService.record(sourceId, candidate.canonicalUrl(), candidate.cleanedTitle(),
                        IngestReason.UPSERT_INSERTED, "primary=" + classification.primary());
                return ItemResult.ADDED;
            }
            ingestLogService.record(sourceId, candidate.canonicalUrl(), candidate.cleanedTitle(),
                    IngestReason.UPSERT_SKIPPED, "duplicate");
            return ItemResult.SKIPPED;

        } catch (FetchException e) {
            ingestLogService.record(sourceId, listed.link(), listed.title(), IngestReason.FETCH_ERROR, e.getMessage());
            return ItemResult.ERROR;
        } catch (RuntimeException e) {
            abortIfStoreUnavailable(e);
            log.warn("Ingest: item failed sourceId={} url={} err={}", sourceId, listed.link(), e.toString());
            ingestLogService.record(sourceId, listed.link(), listed.title(), IngestReason.INVALID_ITEM, e.toString());
            return ItemResult.ERROR;
        }
    }

    private SourceRunReport fetchFailed(Source source, List<String> tried, String error, long t0) {
        long tookMs = System.currentTimeMillis() - t0;
        log.warn("Ingest: source fetch failed sourceId={} state={} tried={} err={}",
                source.getId(), SourceRunState.FETCH_FAILED, tried.size(), error);

        String url = source.getFeedUrl() != null ? source.getFeedUrl() : source.getHomepageUrl();
        ingestLogService.sourceFailure(source.getId(), url, IngestReason.FETCH_ERROR, error);
        return SourceRunReport.failed(source.getId(), source.getName(), tried, error, tookMs);
    }

    static void abortIfStoreUnavailable(RuntimeException e) {
        if (e instanceof IngestAbortedException aborted) throw aborted;
        if (e instanceof DataAccessResourceFailureException || e instanceof CannotCreateTransactionException) {
            throw new IngestAbortedException("Datastore unavailable: " + e.getMessage(), e);
        }
    }
}
