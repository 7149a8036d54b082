package com.fantasyreport.collector.domain.dto;

import java.time.Instant;

/**
 * One entry pulled from a feed, sitemap or scraped page. Lives only for the duration of a source run.
 *
 * @param canonicalHint the page's own {@code rel=canonical}, when a strategy read the article page
 */
public record FeedItem(
        String title,
        String link,
        String description,
        Instant publishedAt,
        String canonicalHint
) {
    public FeedItem(String title, String link, String description, Instant publishedAt) {
        this(title, link, description, publishedAt, null);
    }

    public static FeedItem of(String title, String link) {
        return new FeedItem(title, link, null, null, null);
    }
}
