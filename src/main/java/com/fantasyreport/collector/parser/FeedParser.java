package com.fantasyreport.collector.parser;

import com.fantasyreport.collector.domain.dto.FeedItem;
import com.fantasyreport.collector.exception.UnrecognizedFeedFormatException;
import com.fantasyreport.collector.util.TextUtils;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.feed.synd.SyndLink;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.io.StringReader;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses RSS 2.0, Atom and RDF (RSS 1.0) into {@link FeedItem}s.
 * Rome maps all three dialects onto one entry model: Atom's alternate link becomes the entry link
 * and RDF's dc:date becomes the published date.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeedParser {

    private static final Pattern ROOT_ELEMENT = Pattern.compile("<([A-Za-z][\\w:.-]*)");
    private static final Pattern DECLARATIONS = Pattern.compile("<\\?.*?\\?>|<!--.*?-->|<!DOCTYPE[^>]*>",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private final FeedSanitizer sanitizer;

    public List<FeedItem> parse(String rawText) {
        String xml = sanitizer.sanitize(rawText);

        SyndFeed feed;
        try {
            feed = new SyndFeedInput().build(new StringReader(xml));
        } catch (FeedException | IllegalArgumentException e) {
            throw new UnrecognizedFeedFormatException(rootElementOf(xml), e);
        }

        List<FeedItem> out = new ArrayList<>();
        int dropped = 0;
        for (SyndEntry entry : feed.getEntries()) {
            FeedItem item = toItem(entry);
            if (item == null) {
                dropped++;
                continue;
            }
            out.add(item);
        }

        log.debug("Parser: parsed feedType={} entries={} kept={} dropped={}",
                feed.getFeedType(), feed.getEntries().size(), out.size(), dropped);
        return out;
    }

    private FeedItem toItem(SyndEntry entry) {
        String title = plainText(entry.getTitle());
        String link = unwrapLink(pickLink(entry));

        if (TextUtils.isBlank(title) || !TextUtils.isHttpUrl(link)) return null;

        return new FeedItem(title, link, description(entry), publishedAt(entry));
    }

    private static String pickLink(SyndEntry entry) {
        if (!TextUtils.isBlank(entry.getLink())) return entry.getLink();

        if (entry.getLinks() != null) {
            for (SyndLink l : entry.getLinks()) {
                String rel = l.getRel();
                if ((rel == null || "alternate".equalsIgnoreCase(rel)) && !TextUtils.isBlank(l.getHref())) {
                    return l.getHref();
                }
            }
        }

        String uri = entry.getUri();
        return TextUtils.isHttpUrl(unwrapLink(uri)) ? uri : null;
    }

    /** Some feeds emit links as {@code <https://example.com/a>}. */
    static String unwrapLink(String link) {
        if (link == null) return null;
        String t = link.trim();
        if (t.startsWith("<") && t.endsWith(">") && t.length() > 2) {
            t = t.substring(1, t.length() - 1).trim();
        }
        return t;
    }

    private static String description(SyndEntry entry) {
        SyndContent d = entry.getDescription();
        if (d != null && !TextUtils.isBlank(d.getValue())) return plainText(d.getValue());

        List<SyndContent> contents = entry.getContents();
        if (contents != null) {
            for (SyndContent c : contents) {
                if (c != null && !TextUtils.isBlank(c.getValue())) return plainText(c.getValue());
            }
        }
        return null;
    }

    private static Instant publishedAt(SyndEntry entry) {
        Date d = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
        return d == null ? null : d.toInstant();
    }

    private static String plainText(String s) {
        if (s == null) return null;
        String t = s.indexOf('<') >= 0 ? Jsoup.parse(s).text() : s;
        return TextUtils.collapseWhitespace(t);
    }

    static String rootElementOf(String xml) {
        if (xml == null) return "empty";
        String body = DECLARATIONS.matcher(xml).replaceAll("");
        Matcher m = ROOT_ELEMENT.matcher(body);
        return m.find() ? m.group(1) : "empty";
    }
}
