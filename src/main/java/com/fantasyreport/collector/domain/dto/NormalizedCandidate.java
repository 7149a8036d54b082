package com.fantasyreport.collector.domain.dto;

import java.time.Instant;
import java.util.List;

public record NormalizedCandidate(
        String url,
        String canonicalUrl,
        String domain,
        String title,
        String cleanedTitle,
        String slug,
        String fingerprint,
        String summary,
        Instant publishedAt,
        Integer week,
        List<String> topics,
        String primaryTopic,
        String secondaryTopic,
        Double confidence
) {
    public NormalizedCandidate withClassification(Classification c) {
        return new NormalizedCandidate(url, canonicalUrl, domain, title, cleanedTitle, slug, fingerprint, summary,
                publishedAt, c.week(), c.topics(), c.primary(), c.secondary(), c.confidence());
    }
}
