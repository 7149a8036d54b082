package com.fantasyreport.collector.source;

import com.fantasyreport.collector.domain.dto.ResolvedFeed;
import com.fantasyreport.collector.domain.entity.Source;
import com.fantasyreport.collector.exception.FetchException;
import com.fantasyreport.collector.exception.ResolveException;
import com.fantasyreport.collector.integration.fetcher.FetchResponse;
import com.fantasyreport.collector.integration.fetcher.ResilientFetcher;
import com.fantasyreport.collector.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Finds a working feed for a source.
 * <p>
 * Stored-URL variants are tried first, in order. When all of them fail, the homepage is scanned for a
 * {@code <link rel="alternate">} pointing at an RSS or Atom feed. A discovered URL that works and differs
 * from the stored one is reported back so the caller can heal the source record.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeedResolver {

    private static final Pattern FEED_LINK_TYPE = Pattern.compile("application/(rss|atom)\\+xml", Pattern.CASE_INSENSITIVE);

    private final ResilientFetcher fetcher;

    public ResolvedFeed resolveFeed(Source source) {
        String stored = source.getFeedUrl() == null ? null : source.getFeedUrl().trim();
        List<String> attempted = new ArrayList<>();

        if (!TextUtils.isBlank(stored)) {
            for (String candidate : buildCandidates(stored)) {
                attempted.add(candidate);
                Optional<FetchResponse> ok = tryXml(candidate, source);
                if (ok.isPresent()) {
                    log.debug("Feed: resolved sourceId={} url={} tried={}", source.getId(), candidate, attempted.size());
                    return new ResolvedFeed(ok.get().body(), candidate, null, List.copyOf(attempted));
                }
            }
        }

        String homepage = source.getHomepageUrl();
        if (TextUtils.isBlank(homepage)) {
            throw new ResolveException("No working feed candidate and no homepage sourceId=" + source.getId(), attempted, null);
        }

        attempted.add(homepage);
        FetchResponse page;
        try {
            page = fetcher.fetch(homepage);
        } catch (FetchException e) {
            throw new ResolveException("Homepage fetch failed sourceId=" + source.getId() + " err=" + e.getMessage(), attempted, e);
        }

        String discovered = discoverFeedLink(page.body(), homepage)
                .orElseThrow(() -> new ResolveException(
                        "No feed candidate worked and homepage exposes no feed link sourceId=" + source.getId(), attempted, null));

        attempted.add(discovered);
        FetchResponse feed = tryXml(discovered, source)
                .orElseThrow(() -> new ResolveException(
                        "Discovered feed did not return XML sourceId=" + source.getId() + " url=" + discovered, attempted, null));

        String heal = discovered.equals(stored) ? null : discovered;
        log.info("Feed: discovered via homepage sourceId={} url={} heal={}", source.getId(), discovered, heal != null);
        return new ResolvedFeed(feed.body(), discovered, heal, List.copyOf(attempted));
    }

    /**
     * Ordered, deduplicated variants of a stored feed URL: as-is, without trailing slash, upgraded to https,
     * and with {@code /feed} and {@code /rss} appended when the path does not already look like a feed.
     */
    static List<String> buildCandidates(String feedUrl) {
        Set<String> out = new LinkedHashSet<>();
        String url = feedUrl.trim();
        out.add(url);

        String noSlash = stripTrailingSlash(url);
        out.add(noSlash);

        String secure = noSlash.regionMatches(true, 0, "http://", 0, 7)
                ? "https://" + noSlash.substring(7)
                : noSlash;
        out.add(secure);

        if (!looksLikeFeedPath(noSlash)) {
            out.add(secure + "/feed");
            out.add(secure + "/rss");
        }
        return new ArrayList<>(out);
    }

    static boolean looksLikeFeedPath(String url) {
        String path = TextUtils.pathOf(url).toLowerCase(Locale.ROOT);
        return path.contains("feed") || path.contains("rss") || path.contains("atom") || path.endsWith(".xml");
    }

    static Optional<String> discoverFeedLink(String html, String homepageUrl) {
        if (TextUtils.isBlank(html)) return Optional.empty();

        Document doc = Jsoup.parse(html, homepageUrl);
        for (Element link : doc.select("link[rel][href][type]")) {
            boolean alternate = false;
            for (String rel : link.attr("rel").toLowerCase(Locale.ROOT).split("\\s+")) {
                if (rel.equals("alternate")) alternate = true;
            }
            if (!alternate || !FEED_LINK_TYPE.matcher(link.attr("type")).find()) continue;

            String abs = link.absUrl("href");
            if (TextUtils.isHttpUrl(abs)) return Optional.of(abs);
        }
        return Optional.empty();
    }

    /** Heuristic sniff: anything whose trimmed body opens with markup is handed to the parser. */
    static boolean looksLikeXml(String body) {
        if (body == null) return false;
        String s = body.startsWith("\uFEFF") ? body.substring(1) : body;
        return s.stripLeading().startsWith("<");
    }

    private Optional<FetchResponse> tryXml(String url, Source source) {
        try {
            FetchResponse resp = fetcher.fetch(url);
            if (looksLikeXml(resp.body())) return Optional.of(resp);
            log.debug("Feed: candidate is not markup sourceId={} url={}", source.getId(), url);
        } catch (FetchException e) {
            log.debug("Feed: candidate failed sourceId={} url={} err={}", source.getId(), url, e.getMessage());
        }
        return Optional.empty();
    }

    private static String stripTrailingSlash(String url) {
        String s = url;
        while (s.endsWith("/") && !s.endsWith("://")) {
            s = s.substring(0, s.length() - 1);
        }
        return s;
    }
}
