package com.siteready.audit.http;

import com.siteready.audit.model.HttpFetchResult;
import com.siteready.audit.model.HttpHeadResult;
import com.siteready.config.SiteReadyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Timed HTTP client shared by every audit component. Redirects are followed, bodies are capped,
 * and failures come back as typed error codes instead of exceptions.
 */
@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);

    public static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8";
    public static final String TEXT_ACCEPT = "text/plain,*/*;q=0.5";
    public static final String XML_ACCEPT = "application/xml,text/xml;q=0.9,*/*;q=0.1";

    private final SiteReadyProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;

    public PoliteHttpClient(
        SiteReadyProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(properties.getGlobalConcurrency());
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        return get(url, acceptHeader, Duration.ofSeconds(properties.getRequestTimeoutSeconds()));
    }

    public HttpFetchResult get(String url, String acceptHeader, Duration timeout) {
        int maxAttempts = 1 + properties.getRequestMaxRetries();
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(url, acceptHeader, timeout);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            log.debug("Retrying {} after attempt {} ({})", url, attempt, lastResult.describeFailure());
            if (!sleepBackoff(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    /**
     * Single HEAD request, no retries. Only the status and response headers are kept.
     */
    public HttpHeadResult head(String url, Duration timeout) {
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return new HttpHeadResult(url, 0, null, "invalid_url", "URL missing host or malformed");
        }

        boolean acquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(effectiveTimeout(timeout))
                .header("User-Agent", properties.getUserAgent())
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .build();
            HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
            return new HttpHeadResult(url, response.statusCode(), response.headers(), null, null);
        } catch (HttpTimeoutException e) {
            return new HttpHeadResult(url, 0, null, "timeout", e.getMessage());
        } catch (IOException e) {
            return new HttpHeadResult(url, 0, null, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new HttpHeadResult(url, 0, null, "interrupted", e.getMessage());
        } catch (Exception e) {
            return new HttpHeadResult(url, 0, null, "http_error", e.getMessage());
        } finally {
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private HttpFetchResult executeOnce(String url, String acceptHeader, Duration timeout) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }

        boolean acquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;

            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(effectiveTimeout(timeout))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", safeAccept)
                .header("Accept-Language", "en-US,en;q=0.8")
                .GET()
                .build();

            HttpResponse<InputStream> response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
            byte[] responseBytes;
            try (InputStream body = response.body()) {
                responseBytes = readCapped(body, properties.getMaxBodyBytes());
            }
            if (responseBytes == null) {
                return errorResult(
                    url,
                    startedAt,
                    "body_too_large",
                    "Response exceeded " + properties.getMaxBodyBytes() + " bytes"
                );
            }
            String contentType = response.headers().firstValue("Content-Type").orElse(null);
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                new String(responseBytes, charsetOf(contentType)),
                responseBytes,
                contentType,
                response.headers().firstValue("Content-Encoding").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        } finally {
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private Duration effectiveTimeout(Duration timeout) {
        return timeout == null || timeout.isZero() || timeout.isNegative()
            ? Duration.ofSeconds(properties.getRequestTimeoutSeconds())
            : timeout;
    }

    private byte[] readCapped(InputStream body, int maxBytes) throws IOException {
        if (body == null) {
            return new byte[0];
        }
        byte[] bytes = body.readNBytes(maxBytes + 1);
        return bytes.length > maxBytes ? null : bytes;
    }

    private Charset charsetOf(String contentType) {
        if (contentType == null) {
            return StandardCharsets.UTF_8;
        }
        for (String part : contentType.split(";")) {
            String token = part.trim();
            if (token.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = token.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (RuntimeException e) {
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    private boolean shouldRetry(HttpFetchResult result) {
        String errorCode = result.errorCode();
        if (errorCode != null && !errorCode.isBlank()) {
            return !errorCode.equals("invalid_url")
                && !errorCode.equals("interrupted")
                && !errorCode.equals("body_too_large");
        }
        int status = result.statusCode();
        return status == 408 || status == 429 || status >= 500;
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getRequestRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = properties.getRequestRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.max(0, attempt - 1));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 0) {
            return true;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        long sleepMs = (delay / 2) + jitter;
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
