package com.fantasyreport.collector.processor;

import com.fantasyreport.collector.util.TextUtils;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

@Component
public class TitleCleaner {

    private static final List<Pattern> PUBLISHER_SUFFIXES = List.of(
            Pattern.compile("\\s*[-–—]\\s*fantasypros.*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s*[-–—]\\s*cbs sports.*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s*[-–—]\\s*yahoo sports.*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s*[-–—]\\s*rotowire.*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s*[-–—]\\s*numberfire.*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s*[-–—]\\s*nbc sports edge.*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s*\\|\\s*.*$")
    );

    private static final Pattern NEWS_LABEL = Pattern.compile("^(?:NEWS[:\\s-]+|NEWS(?=[A-Z][a-z])|News:\\s*)");

    private static final Map<String, UnaryOperator<String>> BY_SOURCE = Map.of(
            "Yahoo Sports NFL", t -> t.replaceAll("(?i)\\s*-\\s*Yahoo Sports.*$", ""),
            "Rotowire NFL", t -> t.replaceAll("(?i)\\s*-\\s*RotoWire.*$", "").replaceAll("(?i)^RotoWire:\\s*", "")
    );

    /**
     * Decoded, whitespace-collapsed title without publisher attribution. Returns an empty string when
     * nothing is left, never null.
     */
    public String clean(String sourceName, String rawTitle) {
        if (rawTitle == null) return "";

        String s = TextUtils.collapseWhitespace(Parser.unescapeEntities(rawTitle, false));
        s = NEWS_LABEL.matcher(s).replaceFirst("").trim();

        for (Pattern p : PUBLISHER_SUFFIXES) {
            String stripped = p.matcher(s).replaceFirst("").trim();
            if (!stripped.isEmpty()) s = stripped;
        }

        UnaryOperator<String> bySource = sourceName != null ? BY_SOURCE.get(sourceName) : null;
        if (bySource != null) {
            String stripped = bySource.apply(s).trim();
            if (!stripped.isEmpty()) s = stripped;
        }

        return TextUtils.collapseWhitespace(s);
    }
}
