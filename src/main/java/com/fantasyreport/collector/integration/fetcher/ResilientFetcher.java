package com.fantasyreport.collector.integration.fetcher;

import com.fantasyreport.collector.exception.FetchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Single outbound HTTP path for feeds, homepages and article pages.
 * <p>
 * Every attempt has its own deadline. 5xx, 429 and network failures are retried with linear backoff
 * ({@code backoffBaseMs * attemptNumber}); any other non-2xx status is terminal for that URL.
 */
@Slf4j
@Service
public class ResilientFetcher {

    private final HttpClient httpClient;

    @Value("${crawler.user-agent:FantasyReportBot/1.0 (+https://fantasyreport.app/bot)}")
    private String userAgent;

    @Value("${crawler.timeout-ms:12000}")
    private long timeoutMs;

    @Value("${crawler.max-retries:2}")
    private int maxRetries;

    @Value("${crawler.backoff-base-ms:400}")
    private long backoffBaseMs;

    @Value("${crawler.max-body-bytes:5242880}")
    private int maxBodyBytes;

    public ResilientFetcher() {
        this.httpClient = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(7))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    public FetchResponse fetch(String url) {
        return fetch(url, Duration.ofMillis(timeoutMs), maxRetries);
    }

    public FetchResponse fetch(String url, Duration timeout, int retries) {
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (Exception e) {
            throw new FetchException("Invalid URL url=" + url, null, false, e);
        }

        FetchException last = null;
        int attempts = Math.max(0, retries) + 1;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return attemptOnce(uri, timeout, attempt);
            } catch (FetchException fe) {
                if (!fe.isRetryable()) throw fe;
                last = fe;
                if (attempt < attempts) {
                    long waitMs = backoffBaseMs * attempt;
                    log.debug("Fetch: retrying url={} attempt={} status={} waitMs={}",
                            uri, attempt, fe.getStatus(), waitMs);
                    sleep(waitMs, uri);
                }
            }
        }

        throw new FetchException("Gave up after attempts=" + attempts + " url=" + uri + " last=" + last.getMessage(),
                last.getStatus(), true, last);
    }

    private FetchResponse attemptOnce(URI uri, Duration timeout, int attempt) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .GET()
                .header("User-Agent", userAgent)
                .header("Accept", "application/rss+xml, application/atom+xml, application/xml;q=0.9, text/xml;q=0.9, text/html;q=0.8, */*;q=0.1")
                .header("Accept-Language", "en-US,en;q=0.9")
                .build();

        HttpResponse<InputStream> resp;
        try {
            resp = httpClient.send(req, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw new FetchException("Network failure url=" + uri + " cause=" + e.getClass().getSimpleName(), null, true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("Interrupted url=" + uri, null, false, e);
        }

        int status = resp.statusCode();
        if (status == 429 || status >= 500) {
            closeQuietly(resp.body());
            throw new FetchException("Retryable status=" + status + " url=" + uri, status, true, null);
        }
        if (status < 200 || status >= 300) {
            closeQuietly(resp.body());
            throw new FetchException("Non-2xx status=" + status + " url=" + uri, status, false, null);
        }

        String ct = resp.headers().firstValue("Content-Type").orElse("");
        Charset charset = parseCharsetFromContentType(ct).orElse(StandardCharsets.UTF_8);

        try (InputStream in = resp.body()) {
            byte[] body = readUpTo(in, maxBodyBytes);
            if (body == null) {
                throw new FetchException("Body exceeded maxBodyBytes=" + maxBodyBytes + " url=" + uri, status, false, null);
            }
            log.debug("Fetch: OK url={} status={} bytes={} contentType='{}' attempt={}",
                    uri, status, body.length, ct, attempt);
            return new FetchResponse(uri.toString(), status, ct, new String(body, charset), attempt);
        } catch (IOException e) {
            throw new FetchException("Body read failed url=" + uri + " cause=" + e.getClass().getSimpleName(), status, true, e);
        }
    }

    private static byte[] readUpTo(InputStream in, int maxBytes) throws IOException {
        if (in == null) return new byte[0];
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.min(maxBytes, 64 * 1024));
        byte[] buf = new byte[8192];
        int total = 0;
        int n;
        while ((n = in.read(buf)) != -1) {
            total += n;
            if (total > maxBytes) return null;
            out.write(buf, 0, n);
        }
        return out.toByteArray();
    }

    private static Optional<Charset> parseCharsetFromContentType(String contentType) {
        if (contentType == null) return Optional.empty();
        String ct = contentType.toLowerCase(Locale.ROOT);
        int i = ct.indexOf("charset=");
        if (i < 0) return Optional.empty();
        String cs = ct.substring(i + "charset=".length()).trim();
        int semi = cs.indexOf(';');
        if (semi >= 0) cs = cs.substring(0, semi).trim();
        cs = cs.replace("\"", "").trim();
        try {
            return Optional.of(Charset.forName(cs));
        } catch (Exception ignored) {
            return Optional.empty();
        }
    }

    private static void closeQuietly(InputStream in) {
        if (in == null) return;
        try {
            in.close();
        } catch (IOException e) {
            log.debug("Fetch: failed closing body err={}", e.toString());
        }
    }

    private static void sleep(long ms, URI uri) {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("Interrupted during backoff url=" + uri, null, false, e);
        }
    }
}
