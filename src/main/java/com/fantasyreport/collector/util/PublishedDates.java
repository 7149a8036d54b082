package com.fantasyreport.collector.util;

import lombok.experimental.UtilityClass;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@UtilityClass
public class PublishedDates {

    private static final Pattern DATE_IN_PATH = Pattern.compile("/(20\\d{2})[/-](\\d{1,2})[/-](\\d{1,2})(?:[/-]|$)");

    private static final long MAX_FUTURE_SECONDS = 86_400;

    /** ISO-8601 instant, offset date-time or plain date (taken as UTC midnight). */
    public static Instant parseIso(String value) {
        if (value == null || value.isBlank()) return null;
        String v = value.trim();
        try {
            return OffsetDateTime.parse(v).toInstant();
        } catch (DateTimeParseException ignored) {
            // not an offset date-time, try the next shape
        }
        try {
            return Instant.parse(v);
        } catch (DateTimeParseException ignored) {
            // not an instant either
        }
        try {
            return LocalDate.parse(v.length() > 10 ? v.substring(0, 10) : v).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /** Dates like {@code /2024/09/12/} or {@code /2024-09-12-} embedded in an article path. */
    public static Instant fromUrlPath(String url) {
        Matcher m = DATE_IN_PATH.matcher(TextUtils.pathOf(url));
        if (!m.find()) return null;
        try {
            return LocalDate.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)))
                    .atStartOfDay()
                    .toInstant(ZoneOffset.UTC);
        } catch (DateTimeException e) {
            return null;
        }
    }

    /** First plausible candidate; anything more than a day in the future is treated as bad data. */
    public static Instant resolve(Instant fromFeed, String url, Instant now) {
        Instant limit = now.plusSeconds(MAX_FUTURE_SECONDS);
        if (fromFeed != null && !fromFeed.isAfter(limit)) return fromFeed;

        Instant fromPath = fromUrlPath(url);
        if (fromPath != null && !fromPath.isAfter(limit)) return fromPath;

        return null;
    }
}
