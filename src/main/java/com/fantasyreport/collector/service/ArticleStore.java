package com.fantasyreport.collector.service;

import com.fantasyreport.collector.domain.dto.NormalizedCandidate;
import com.fantasyreport.collector.domain.entity.Article;
import com.fantasyreport.collector.domain.entity.Source;
import com.fantasyreport.collector.domain.enums.UpsertOutcome;
import com.fantasyreport.collector.repository.ArticleRepository;
import com.fantasyreport.collector.repository.BlockedUrlRepository;
import com.fantasyreport.collector.repository.SourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;

/**
 * Idempotent article writes keyed on canonical URL and fingerprint. A conflicting insert is a skip,
 * never an error; other data-access failures propagate to the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArticleStore {

    private final ArticleRepository articleRepository;
    private final SourceRepository sourceRepository;
    private final BlockedUrlRepository blockedUrlRepository;

    public boolean isBlocked(String canonicalUrl) {
        return canonicalUrl != null && blockedUrlRepository.existsByUrl(canonicalUrl);
    }

    public UpsertOutcome upsert(NormalizedCandidate c, Source source) {
        if (articleRepository.existsByCanonicalUrlOrFingerprint(c.canonicalUrl(), c.fingerprint())) {
            log.debug("Store: duplicate (lookup) canonical={}", c.canonicalUrl());
            return UpsertOutcome.SKIPPED_DUPLICATE;
        }

        Article article = Article.builder()
                .source(source)
                .url(c.url())
                .canonicalUrl(c.canonicalUrl())
                .domain(c.domain())
                .title(c.title())
                .cleanedTitle(c.cleanedTitle())
                .slug(c.slug())
                .fingerprint(c.fingerprint())
                .summary(c.summary())
                .publishedAt(c.publishedAt())
                .discoveredAt(Instant.now())
                .topics(new ArrayList<>(c.topics()))
                .primaryTopic(c.primaryTopic())
                .secondaryTopic(c.secondaryTopic())
                .topicConfidence(c.confidence())
                .week(c.week())
                .build();

        try {
            articleRepository.saveAndFlush(article);
            return UpsertOutcome.INSERTED;
        } catch (DataIntegrityViolationException dup) {
            // lost a race with a concurrent run
            log.debug("Store: duplicate (db) canonical={}", c.canonicalUrl());
            return UpsertOutcome.SKIPPED_DUPLICATE;
        }
    }

    /**
     * Best-effort single-field write of a discovered feed URL. Never throws, so it cannot affect item inserts.
     */
    public boolean healFeedUrl(Long sourceId, String feedUrl) {
        try {
            int updated = sourceRepository.updateFeedUrl(sourceId, feedUrl, Instant.now());
            log.info("Store: healed feed url sourceId={} feedUrl={} rows={}", sourceId, feedUrl, updated);
            return updated > 0;
        } catch (Exception e) {
            log.warn("Store: feed url heal failed sourceId={} feedUrl={} err={}", sourceId, feedUrl, e.toString());
            return false;
        }
    }
}
