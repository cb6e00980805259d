package com.cornerleague.collector.integration.fetcher;

import com.cornerleague.collector.domain.dto.FetchResult;
import com.cornerleague.collector.exception.FetchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

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
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single HTTP GET with status classification. Retries and politeness are the caller's concern;
 * this class only remembers per-host 429 backoff windows.
 */
@Slf4j
@Component
public class PageFetcher {

    private final HttpClient httpClient;

    @Value("${crawler.user-agent:SportsMediaBot/1.0 (+https://sportsmedia.com/bot)}")
    private String userAgent;

    @Value("${crawler.timeout-seconds:30}")
    private int timeoutSeconds;

    @Value("${crawler.max-bytes:10485760}")
    private int maxBytes;

    @Value("${crawler.host-backoff-max-ms:300000}") // 5 min cap
    private long hostBackoffMaxMs;

    private final ConcurrentHashMap<String, Long> hostBackoffUntilMs = new ConcurrentHashMap<>();

    public PageFetcher() {
        this.httpClient = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(7))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    public FetchResult fetch(String url) {
        long t0 = System.currentTimeMillis();

        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (Exception e) {
            return FetchResult.permanentFailure(url, 0, 0, "Invalid URL: " + e.getMessage());
        }

        String host = uri.getHost() == null ? "unknown" : uri.getHost();
        long backoffUntil = hostBackoffUntilMs.getOrDefault(host, 0L);
        if (t0 < backoffUntil) {
            log.debug("Fetcher: host backoff active host={} untilMs={} url={}", host, backoffUntil, url);
            return FetchResult.transientFailure(url, 429, 0, backoffUntil - t0, "host backoff active");
        }

        try {
            return fetchOnce(uri, t0);
        } catch (FetchException fe) {
            long took = System.currentTimeMillis() - t0;
            log.debug("Fetcher: failed url={} transient={} err={}", url, fe.isTransientFailure(), fe.getMessage());
            return fe.isTransientFailure()
                    ? FetchResult.transientFailure(url, 0, took, 0L, fe.getMessage())
                    : FetchResult.permanentFailure(url, 0, took, fe.getMessage());
        }
    }

    private FetchResult fetchOnce(URI uri, long t0) {
        log.debug("Fetcher: GET url={}", uri);

        HttpRequest req = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .GET()
                .header("User-Agent", userAgent)
                .header("Accept", "text/html,application/xhtml+xml,application/rss+xml,application/xml;q=0.9,text/plain;q=0.8,*/*;q=0.5")
                .header("Accept-Language", "en-US,en;q=0.9")
                .build();

        try {
            HttpResponse<InputStream> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofInputStream());
            int status = resp.statusCode();
            String ct = resp.headers().firstValue("Content-Type").orElse("");
            String finalUrl = resp.uri() != null ? resp.uri().toString() : uri.toString();

            if (status == 429) {
                long ms = Math.min(parseRetryAfterMs(resp.headers().firstValue("Retry-After").orElse(null)), hostBackoffMaxMs);
                String host = uri.getHost() == null ? "unknown" : uri.getHost();
                hostBackoffUntilMs.put(host, System.currentTimeMillis() + ms);
                closeQuietly(resp.body());
                return FetchResult.transientFailure(uri.toString(), status, elapsed(t0), ms,
                        "status=429 retryAfterMs=" + ms);
            }

            if (status < 200 || status >= 300) {
                closeQuietly(resp.body());
                String error = "Non-2xx status=" + status + " contentType=" + ct + " url=" + uri;
                return isTransientStatus(status)
                        ? FetchResult.transientFailure(uri.toString(), status, elapsed(t0), 0L, error)
                        : FetchResult.permanentFailure(uri.toString(), status, elapsed(t0), error);
            }

            Charset charset = parseCharsetFromContentType(ct).orElse(StandardCharsets.UTF_8);

            try (InputStream in = resp.body()) {
                byte[] body = readUpTo(in, maxBytes);
                if (body == null) {
                    throw new FetchException("Body exceeded maxBytes=" + maxBytes + " url=" + uri, null, false);
                }

                log.debug("Fetcher: OK url={} status={} bytes={} contentType='{}' charset={}",
                        uri, status, body.length, ct, charset);

                return FetchResult.success(uri.toString(), finalUrl, status, body, ct, charset, elapsed(t0));
            }

        } catch (FetchException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("Interrupted fetching url=" + uri, e, true);
        } catch (Exception e) {
            throw new FetchException("Failed to fetch url=" + uri + " cause=" + e.getClass().getSimpleName(), e, true);
        }
    }

    static boolean isTransientStatus(int status) {
        return status == 408 || status == 425 || status == 429 || status >= 500;
    }

    private static long elapsed(long t0) {
        return System.currentTimeMillis() - t0;
    }

    private static byte[] readUpTo(InputStream in, int maxBytes) throws IOException {
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

    private static void closeQuietly(InputStream in) {
        if (in == null) return;
        try {
            in.close();
        } catch (IOException e) {
            log.debug("Fetcher: failed to close response body err={}", e.toString());
        }
    }

    private Optional<Charset> parseCharsetFromContentType(String contentType) {
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

    static long parseRetryAfterMs(String retryAfter) {
        try {
            if (retryAfter == null || retryAfter.isBlank()) return 5_000L;

            long sec = Long.parseLong(retryAfter.trim());
            if (sec > 0) return Math.min(sec * 1000L, 300_000L);

            return 5_000L;
        } catch (NumberFormatException ignored) {
            return 5_000L;
        }
    }
}
