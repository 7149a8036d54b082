package com.fantasyreport.collector.processor;

import com.fantasyreport.collector.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the dedup key form of an article URL. Canonicalizing an already canonical URL returns it unchanged.
 */
@Slf4j
@Component
public class UrlCanonicalizer {

    private static final Set<String> TRACKING_PARAMS = Set.of("fbclid", "gclid", "mc_cid", "mc_eid", "ref", "cn", "cmp", "igshid");

    private static final List<String> REDIRECT_PARAMS = List.of(
            "url", "u", "to", "dest", "destination", "redirect", "r", "rd", "redir", "link", "target", "go",
            "out", "next", "continue", "ref", "referrer"
    );

    private static final List<String> REDIRECTOR_HOSTS = List.of(
            "l.facebook.com", "out.reddit.com", "news.google.com", "flip.it", "apple.news", "r.zemanta.com",
            "t.co", "lnkd.in", "bit.ly", "tinyurl.com", "yhoo.it", "news.ycombinator.com", "feedproxy.google.com"
    );

    private static final Pattern EMBEDDED_URL = Pattern.compile("https?://.+$");
    private static final Pattern REPEATED_SLASHES = Pattern.compile("/{2,}");
    private static final int MAX_HOPS = 4;

    private static final Set<String> GENERIC_PATHS = Set.of(
            "", "/", "/research", "/news", "/blog", "/articles", "/sports", "/nfl", "/fantasy", "/fantasy-football"
    );

    public String canonicalize(String url) {
        if (TextUtils.isBlank(url)) return null;
        String raw = url.trim();
        if (raw.startsWith("//")) raw = "https:" + raw;
        raw = unwrapRedirects(raw);

        URI uri;
        try {
            uri = URI.create(raw);
        } catch (IllegalArgumentException e) {
            log.debug("Canonical: unparseable url={} err={}", raw, e.getMessage());
            return raw;
        }

        String scheme = uri.getScheme();
        String host = uri.getHost();
        if (scheme == null || host == null) return raw;
        scheme = scheme.toLowerCase(Locale.ROOT);

        StringBuilder sb = new StringBuilder(raw.length());
        sb.append(scheme).append("://").append(host.toLowerCase(Locale.ROOT));
        if (uri.getPort() != -1 && !isDefaultPort(scheme, uri.getPort())) {
            sb.append(':').append(uri.getPort());
        }

        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        path = REPEATED_SLASHES.matcher(path).replaceAll("/");
        while (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        sb.append(path);

        String query = stripTracking(uri.getRawQuery());
        if (!query.isEmpty()) sb.append('?').append(query);

        return sb.toString();
    }

    /**
     * Prefers a page-declared canonical URL unless it points at a generic landing page or, on the same host,
     * at a shallower path than the article itself.
     */
    public String chooseCanonical(String originalUrl, String alternateCanonical) {
        String original = canonicalize(originalUrl);
        if (TextUtils.isBlank(alternateCanonical)) return original;

        String alternate = canonicalize(alternateCanonical);
        if (!TextUtils.isHttpUrl(alternate)) return original;

        String altPath = TextUtils.pathOf(alternate);
        if (GENERIC_PATHS.contains(stripTrailing(altPath).toLowerCase(Locale.ROOT))) return original;

        if (original != null && sameHost(original, alternate) && segments(altPath) < segments(TextUtils.pathOf(original))) {
            return original;
        }
        return alternate;
    }

    /** Follows redirector hops (query-carried or path-embedded targets) until the URL stops changing. */
    static String unwrapRedirects(String url) {
        String current = url;
        for (int hop = 0; hop < MAX_HOPS; hop++) {
            Optional<String> next = unwrapOnce(current);
            if (next.isEmpty() || next.get().equals(current)) break;
            current = next.get();
        }
        return current;
    }

    private static Optional<String> unwrapOnce(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        if (uri.getHost() == null) return Optional.empty();

        String rawQuery = uri.getRawQuery();
        if (rawQuery != null) {
            for (String key : REDIRECT_PARAMS) {
                String value = queryValue(rawQuery, key);
                // only absolute targets; relative values like ref=home are plain tracking
                if (value != null && TextUtils.isHttpUrl(value)) return Optional.of(value);
            }
        }

        if (isRedirectorHost(uri.getHost()) && uri.getRawPath() != null) {
            Matcher m = EMBEDDED_URL.matcher(decode(uri.getRawPath()));
            if (m.find()) return Optional.of(m.group());
        }
        return Optional.empty();
    }

    private static String queryValue(String rawQuery, String key) {
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) continue;
            if (pair.substring(0, eq).equalsIgnoreCase(key)) {
                String value = decode(pair.substring(eq + 1)).trim();
                if (!value.isEmpty()) return value;
            }
        }
        return null;
    }

    private static boolean isRedirectorHost(String host) {
        String h = host.toLowerCase(Locale.ROOT);
        for (String r : REDIRECTOR_HOSTS) {
            if (h.equals(r) || h.endsWith("." + r)) return true;
        }
        return false;
    }

    private static String decode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return s;
        }
    }

    private static String stripTracking(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) return "";
        List<String> kept = new ArrayList<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String key = (eq >= 0 ? pair.substring(0, eq) : pair).toLowerCase(Locale.ROOT);
            if (key.startsWith("utm_") || TRACKING_PARAMS.contains(key)) continue;
            kept.add(pair);
        }
        // stable sort keeps repeated keys in their original order
        kept.sort(Comparator.comparing(UrlCanonicalizer::queryKey));
        return String.join("&", kept);
    }

    private static String queryKey(String pair) {
        int eq = pair.indexOf('=');
        return eq >= 0 ? pair.substring(0, eq) : pair;
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
    }

    private static boolean sameHost(String a, String b) {
        String ha = TextUtils.hostOf(a);
        return ha != null && ha.equals(TextUtils.hostOf(b));
    }

    private static int segments(String path) {
        int n = 0;
        for (String s : path.split("/")) {
            if (!s.isEmpty()) n++;
        }
        return n;
    }

    private static String stripTrailing(String path) {
        String p = path;
        while (p.endsWith("/")) p = p.substring(0, p.length() - 1);
        return p;
    }
}
