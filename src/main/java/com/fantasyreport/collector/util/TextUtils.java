package com.fantasyreport.collector.util;

import lombok.experimental.UtilityClass;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

@UtilityClass
public class TextUtils {

    private static final Pattern MULTI_WS = Pattern.compile("\\s+");

    public static String abbreviate(String s, int max) {
        if (s == null) return "";
        String t = s.trim();
        if (t.length() <= max) return t;
        return t.substring(0, Math.max(0, max - 1)) + "…";
    }

    public static String collapseWhitespace(String s) {
        if (s == null) return null;
        return MULTI_WS.matcher(s).replaceAll(" ").trim();
    }

    public static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public static String sha1Hex(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-1");
            byte[] digest = md.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    /** Absolute http(s) URL with a host. */
    public static boolean isHttpUrl(String url) {
        if (isBlank(url)) return false;
        try {
            URI uri = URI.create(url.trim());
            String scheme = uri.getScheme();
            return scheme != null
                    && (scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    && uri.getHost() != null;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /** Lowercased host without a leading "www.", or null when the URL does not parse. */
    public static String hostOf(String url) {
        if (isBlank(url)) return null;
        try {
            String host = URI.create(url.trim()).getHost();
            if (host == null) return null;
            host = host.toLowerCase(Locale.ROOT);
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public static String pathOf(String url) {
        if (isBlank(url)) return "";
        try {
            String path = URI.create(url.trim()).getRawPath();
            return path == null ? "" : path;
        } catch (IllegalArgumentException e) {
            return "";
        }
    }
}
