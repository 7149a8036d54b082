package com.fantasyreport.collector.source;

import com.fantasyreport.collector.domain.dto.FeedItem;
import com.fantasyreport.collector.domain.dto.FetchBatch;
import com.fantasyreport.collector.domain.entity.Source;
import com.fantasyreport.collector.domain.enums.FetchMethod;
import com.fantasyreport.collector.exception.ResolveException;
import com.fantasyreport.collector.integration.fetcher.FetchResponse;
import com.fantasyreport.collector.integration.fetcher.ResilientFetcher;
import com.fantasyreport.collector.util.PublishedDates;
import com.fantasyreport.collector.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured adapter over XML sitemaps (plain and Google News flavoured).
 * Listing only needs {@code <loc>}; titles and dates missing from the sitemap are filled from the
 * article page's meta tags in {@link #loadItem}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SitemapSourceFetcher implements SourceFetcher {

    private final ResilientFetcher fetcher;

    @Override
    public FetchMethod method() {
        return FetchMethod.ADAPTER;
    }

    @Override
    public FetchBatch listCandidates(Source source, int limit) {
        String sitemapUrl = source.getFeedUrl();
        if (TextUtils.isBlank(sitemapUrl)) {
            throw new ResolveException("Adapter source has no sitemap URL sourceId=" + source.getId(), List.of(), null);
        }

        List<String> tried = new ArrayList<>();
        tried.add(sitemapUrl);
        Document doc = parseXml(fetcher.fetch(sitemapUrl));

        // sitemap index: follow the first child sitemap
        Element child = doc.selectFirst("sitemapindex > sitemap > loc");
        String resolvedUrl = sitemapUrl;
        if (child != null && TextUtils.isHttpUrl(child.text().trim())) {
            resolvedUrl = child.text().trim();
            tried.add(resolvedUrl);
            doc = parseXml(fetcher.fetch(resolvedUrl));
        }

        Map<String, FeedItem> byUrl = new LinkedHashMap<>();
        for (Element url : doc.select("urlset > url")) {
            if (byUrl.size() >= limit) break;

            Element loc = url.selectFirst("loc");
            if (loc == null) continue;
            String link = loc.text().trim();
            if (!TextUtils.isHttpUrl(link)) continue;

            Element newsTitle = url.selectFirst("news|title");
            Element newsDate = url.selectFirst("news|publication_date");
            Element lastmod = url.selectFirst("lastmod");

            String title = newsTitle != null ? TextUtils.collapseWhitespace(newsTitle.text()) : null;
            Instant published = PublishedDates.parseIso(newsDate != null ? newsDate.text()
                    : lastmod != null ? lastmod.text() : null);

            byUrl.putIfAbsent(link, new FeedItem(title, link, null, published));
        }

        log.debug("Adapter: sitemap listed sourceId={} url={} items={}", source.getId(), resolvedUrl, byUrl.size());
        return new FetchBatch(new ArrayList<>(byUrl.values()), resolvedUrl, null, List.copyOf(tried), null, null);
    }

    @Override
    public FeedItem loadItem(FeedItem candidate) {
        if (!TextUtils.isBlank(candidate.title()) && candidate.publishedAt() != null) return candidate;

        FetchResponse page = fetcher.fetch(candidate.link());
        Document doc = Jsoup.parse(page.body(), candidate.link());

        String title = candidate.title();
        if (TextUtils.isBlank(title)) {
            title = firstNonBlank(meta(doc, "meta[property=og:title]"), meta(doc, "meta[name=twitter:title]"), doc.title());
        }

        String description = candidate.description() != null ? candidate.description()
                : firstNonBlank(meta(doc, "meta[property=og:description]"), meta(doc, "meta[name=description]"));

        Instant published = candidate.publishedAt() != null ? candidate.publishedAt()
                : PublishedDates.parseIso(meta(doc, "meta[property=article:published_time]"));

        Element canonical = doc.selectFirst("link[rel=canonical][href]");
        String canonicalHint = canonical != null ? canonical.absUrl("href") : null;

        return new FeedItem(TextUtils.collapseWhitespace(title), candidate.link(), description, published, canonicalHint);
    }

    private static Document parseXml(FetchResponse resp) {
        return Jsoup.parse(resp.body(), resp.url(), Parser.xmlParser());
    }

    private static String meta(Document doc, String selector) {
        Element el = doc.selectFirst(selector);
        return el == null ? null : el.attr("content");
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (!TextUtils.isBlank(v)) return v.trim();
        }
        return null;
    }
}
