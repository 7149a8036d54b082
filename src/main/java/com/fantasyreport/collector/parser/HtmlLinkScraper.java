package com.fantasyreport.collector.parser;

import com.fantasyreport.collector.domain.dto.FeedItem;
import com.fantasyreport.collector.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Pulls article-looking links out of HTML, both as the fallback when a "feed" turns out to be a web page
 * and for sources configured to be scraped.
 */
@Slf4j
@Component
public class HtmlLinkScraper {

    public static final List<String> DEFAULT_SELECTORS = List.of(
            "h2 a[href]",
            "h3 a[href]",
            "article a[href]",
            "a.card[href]",
            "a[href*=/fantasy-football]",
            "a[href*=/nfl/]",
            "a[href^=/articles/]"
    );

    private static final Set<String> DENIED_SEGMENTS = Set.of(
            "about", "about-us", "privacy", "privacy-policy", "terms", "terms-of-use", "contact", "contact-us",
            "login", "signin", "sign-in", "signup", "sign-up", "register", "account", "subscribe", "subscription",
            "newsletter", "pricing", "careers", "jobs", "advertise", "store", "shop", "cart",
            "tag", "tags", "category", "categories", "author", "authors", "page", "search"
    );

    private static final int MIN_FALLBACK_TEXT = 6;
    private static final int MIN_SELECTOR_TEXT = 4;

    /**
     * Same-host anchors with non-trivial text, excluding navigation and account pages,
     * deduplicated by absolute URL in document order.
     */
    public List<FeedItem> scrapeLinks(String html, String baseUrl, int cap) {
        if (TextUtils.isBlank(html) || cap <= 0) return List.of();

        Document doc = Jsoup.parse(html, baseUrl);
        String baseHost = TextUtils.hostOf(baseUrl);

        Map<String, FeedItem> byUrl = new LinkedHashMap<>();
        for (Element a : doc.select("a[href]")) {
            if (byUrl.size() >= cap) break;

            String abs = stripFragment(a.absUrl("href"));
            if (!TextUtils.isHttpUrl(abs)) continue;
            if (baseHost != null && !Objects.equals(baseHost, TextUtils.hostOf(abs))) continue;

            String text = TextUtils.collapseWhitespace(a.text());
            if (text == null || text.length() < MIN_FALLBACK_TEXT) continue;
            if (looksLikeNonArticle(abs)) continue;

            byUrl.putIfAbsent(abs, FeedItem.of(text, abs));
        }

        log.debug("Scraper: fallback links base={} found={}", baseUrl, byUrl.size());
        return new ArrayList<>(byUrl.values());
    }

    /**
     * Tries the selectors in order and returns the matches of the first one that yields anything.
     */
    public List<FeedItem> scrapeWithSelectors(String html, String baseUrl, List<String> selectors, int cap) {
        if (TextUtils.isBlank(html) || cap <= 0) return List.of();

        Document doc = Jsoup.parse(html, baseUrl);

        for (String selector : selectors) {
            Elements matched;
            try {
                matched = doc.select(selector);
            } catch (Selector.SelectorParseException | IllegalArgumentException e) {
                log.warn("Scraper: invalid selector='{}' base={} err={}", selector, baseUrl, e.getMessage());
                continue;
            }

            Map<String, FeedItem> byUrl = new LinkedHashMap<>();
            for (Element el : matched) {
                if (byUrl.size() >= cap) break;

                Element anchor = el.is("a[href]") ? el : el.selectFirst("a[href]");
                if (anchor == null) continue;

                String abs = stripFragment(anchor.absUrl("href"));
                if (!TextUtils.isHttpUrl(abs) || looksLikeNonArticle(abs)) continue;

                String title = TextUtils.collapseWhitespace(anchor.text());
                if (TextUtils.isBlank(title)) title = TextUtils.collapseWhitespace(el.text());
                if (title == null || title.length() < MIN_SELECTOR_TEXT) continue;

                byUrl.putIfAbsent(abs, FeedItem.of(title, abs));
            }

            if (!byUrl.isEmpty()) {
                log.debug("Scraper: selector matched selector='{}' base={} found={}", selector, baseUrl, byUrl.size());
                return new ArrayList<>(byUrl.values());
            }
        }
        return List.of();
    }

    static boolean looksLikeNonArticle(String absUrl) {
        String path = TextUtils.pathOf(absUrl).toLowerCase(Locale.ROOT);
        if (path.isEmpty() || path.equals("/")) return true;
        if (path.endsWith("/fantasy") || path.endsWith("/fantasy/")) return true;

        for (String segment : path.split("/")) {
            if (DENIED_SEGMENTS.contains(segment)) return true;
        }
        return false;
    }

    private static String stripFragment(String url) {
        if (url == null) return null;
        int hash = url.indexOf('#');
        return hash >= 0 ? url.substring(0, hash) : url;
    }
}
