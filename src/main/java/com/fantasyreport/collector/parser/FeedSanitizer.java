package com.fantasyreport.collector.parser;

import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Repairs the most common ways publisher feeds break XML before they reach the parser.
 * CDATA sections are copied through untouched.
 */
@Component
public class FeedSanitizer {

    private static final Pattern CDATA = Pattern.compile("<!\\[CDATA\\[.*?]]>", Pattern.DOTALL);

    private static final Pattern BARE_AMPERSAND =
            Pattern.compile("&(?!(?:amp|lt|gt|quot|apos|#\\d+|#[xX][0-9a-fA-F]+);)");

    // XML 1.0 forbids C0 controls other than tab, LF and CR
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    public String sanitize(String raw) {
        if (raw == null) return "";

        String text = raw;
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        text = text.stripLeading();

        StringBuilder out = new StringBuilder(text.length() + 64);
        Matcher m = CDATA.matcher(text);
        int pos = 0;
        while (m.find()) {
            out.append(repair(text.substring(pos, m.start())));
            out.append(CONTROL_CHARS.matcher(m.group()).replaceAll(""));
            pos = m.end();
        }
        out.append(repair(text.substring(pos)));
        return out.toString();
    }

    private static String repair(String segment) {
        String noControls = CONTROL_CHARS.matcher(segment).replaceAll("");
        return BARE_AMPERSAND.matcher(noControls).replaceAll("&amp;");
    }
}
