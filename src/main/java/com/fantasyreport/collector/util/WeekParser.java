package com.fantasyreport.collector.util;

import lombok.experimental.UtilityClass;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

@UtilityClass
public class WeekParser {

    public static final int MIN_WEEK = 1;
    public static final int MAX_WEEK = 18;

    private static final Pattern WEEK = Pattern.compile("\\b(?:week|wk)\\s*[#.-]?\\s*(\\d{1,2})\\b",
            Pattern.CASE_INSENSITIVE);

    /** Regular-season week mentioned in the text, clamped to [1, 18], or null. */
    public static Integer extract(String text) {
        if (text == null || text.isBlank()) return null;
        Matcher m = WEEK.matcher(text);
        if (!m.find()) return null;
        int n = Integer.parseInt(m.group(1));
        return Math.min(MAX_WEEK, Math.max(MIN_WEEK, n));
    }
}
