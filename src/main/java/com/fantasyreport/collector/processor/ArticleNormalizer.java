package com.fantasyreport.collector.processor;

import com.fantasyreport.collector.domain.dto.FeedItem;
import com.fantasyreport.collector.domain.dto.NormalizedCandidate;
import com.fantasyreport.collector.util.PublishedDates;
import com.fantasyreport.collector.util.TextUtils;
import com.fantasyreport.collector.util.WeekParser;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns an admitted item into a candidate row: canonical URL, cleaned title, slug, fingerprint, week and
 * publish date. Topic fields are left empty for the classifier.
 */
@Component
@RequiredArgsConstructor
public class ArticleNormalizer {

    static final int SLUG_MAX_LENGTH = 80;
    private static final int SUMMARY_MAX_LENGTH = 2000;

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9]+");

    private final UrlCanonicalizer canonicalizer;
    private final TitleCleaner titleCleaner;

    public NormalizedCandidate normalize(FeedItem item, String sourceName) {
        String url = item.link().trim();
        String canonical = canonicalizer.chooseCanonical(url, item.canonicalHint());

        String cleaned = titleCleaner.clean(sourceName, item.title());
        if (cleaned.isEmpty()) cleaned = canonical;

        String summary = item.description() == null ? null
                : TextUtils.abbreviate(TextUtils.collapseWhitespace(item.description()), SUMMARY_MAX_LENGTH);

        Instant published = PublishedDates.resolve(item.publishedAt(), url, Instant.now());

        return new NormalizedCandidate(
                url,
                canonical,
                TextUtils.hostOf(canonical),
                TextUtils.collapseWhitespace(item.title()),
                cleaned,
                slug(sourceName, cleaned, canonical),
                fingerprint(canonical, cleaned),
                summary,
                published,
                WeekParser.extract(cleaned),
                List.of(),
                null,
                null,
                null
        );
    }

    /**
     * Slug of {@code "<source> <title>"}. Titles with no Latin letters or digits get a short hash of the
     * canonical URL instead.
     */
    static String slug(String sourceName, String cleanedTitle, String canonical) {
        if (slugify(cleanedTitle).isEmpty()) {
            return TextUtils.sha1Hex(canonical).substring(0, 10);
        }

        String s = slugify((sourceName == null ? "" : sourceName) + " " + cleanedTitle);
        if (s.length() > SLUG_MAX_LENGTH) {
            s = trimDashes(s.substring(0, SLUG_MAX_LENGTH));
        }
        return s;
    }

    private static String slugify(String text) {
        if (text == null) return "";
        String ascii = COMBINING_MARKS.matcher(Normalizer.normalize(text, Normalizer.Form.NFD)).replaceAll("");
        return trimDashes(NON_SLUG.matcher(ascii.toLowerCase(Locale.ROOT)).replaceAll("-"));
    }

    static String fingerprint(String canonical, String cleanedTitle) {
        return TextUtils.sha1Hex(canonical + "|" + cleanedTitle);
    }

    private static String trimDashes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '-') start++;
        while (end > start && s.charAt(end - 1) == '-') end--;
        return s.substring(start, end);
    }
}
