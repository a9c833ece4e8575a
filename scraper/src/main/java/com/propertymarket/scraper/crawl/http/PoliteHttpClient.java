package com.propertymarket.scraper.crawl.http;

import com.propertymarket.scraper.config.ScraperProperties;
import com.propertymarket.scraper.crawl.model.FetchRequest;
import com.propertymarket.scraper.crawl.model.FetchResult;
import com.propertymarket.scraper.crawl.model.FetchStatus;
import com.propertymarket.scraper.crawl.model.SiteId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
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
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;

/**
 * HTTP GET with a bounded number of in-flight requests per site, a minimum delay between
 * requests to the same site and bounded retries with exponential backoff.
 * Failures are returned as {@link FetchResult} states, never thrown.
 */
@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final ScraperProperties properties;
    private final HttpClient client;
    private final Map<SiteId, SiteGate> gates = new ConcurrentHashMap<>();

    public PoliteHttpClient(
        ScraperProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofMillis(properties.getRequestTimeoutMs()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public FetchResult fetch(FetchRequest request) {
        int maxAttempts = properties.getRequestMaxAttempts();
        FetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(request, attempt).withAttempts(attempt);
            if (!lastResult.isRetryable() || attempt >= maxAttempts) {
                return lastResult;
            }
            if (!pauseBeforeRetry(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private FetchResult executeOnce(FetchRequest request, int attempt) {
        Instant startedAt = Instant.now();
        URI uri = toUri(request.url());
        if (uri == null || uri.getHost() == null) {
            FetchResult invalid = errorResult(
                request,
                startedAt,
                FetchStatus.NETWORK_ERROR,
                FetchResult.INVALID_URL,
                "URL missing host or malformed"
            );
            logAttempt(invalid, attempt);
            return invalid;
        }

        SiteId site = request.site();
        SiteGate gate = gates.computeIfAbsent(site, ignored -> new SiteGate(properties.getPerSiteConcurrency()));
        boolean acquired = false;
        FetchResult result;
        try {
            gate.permits.acquire();
            acquired = true;
            gate.awaitTurn(properties.getPerSiteDelayMs());

            HttpRequest httpRequest = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofMillis(properties.getRequestTimeoutMs()))
                .header("User-Agent", properties.userAgentFor(site))
                .header("Accept", HTML_ACCEPT)
                .header("Accept-Language", "en-IN,en;q=0.8")
                .GET()
                .build();

            HttpResponse<byte[]> response = client.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
            int statusCode = response.statusCode();
            if (statusCode == 403 || statusCode == 429) {
                gate.holdOff(properties.getRateLimitBackoffMs());
                log.info("site={} httpStatus={} holding requests for {}ms", site.key(), statusCode, properties.getRateLimitBackoffMs());
            }
            String contentType = response.headers().firstValue("Content-Type").orElse(null);
            byte[] responseBytes = response.body();
            String responseBody = responseBytes == null ? null : new String(responseBytes, charsetOf(contentType));
            boolean ok = statusCode >= 200 && statusCode < 300;
            result = new FetchResult(
                request,
                ok ? FetchStatus.OK : FetchStatus.HTTP_ERROR,
                statusCode,
                responseBody,
                contentType,
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                attempt,
                ok ? null : "http_" + statusCode,
                null
            );
        } catch (HttpTimeoutException e) {
            result = errorResult(request, startedAt, FetchStatus.TIMEOUT, "timeout", e.getMessage());
        } catch (IOException e) {
            result = errorResult(request, startedAt, FetchStatus.NETWORK_ERROR, "io_error", describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = errorResult(request, startedAt, FetchStatus.NETWORK_ERROR, FetchResult.INTERRUPTED, e.getMessage());
        } catch (RuntimeException e) {
            result = errorResult(request, startedAt, FetchStatus.NETWORK_ERROR, "http_error", describe(e));
        } finally {
            if (acquired) {
                gate.permits.release();
            }
        }
        logAttempt(result, attempt);
        return result;
    }

    private void logAttempt(FetchResult result, int attempt) {
        FetchRequest request = result.request();
        if (result.isOk()) {
            log.info(
                "fetch site={} url={} page={} attempt={} status={} httpStatus={} latencyMs={}",
                request.site().key(),
                request.url(),
                request.page(),
                attempt,
                result.status(),
                result.httpStatus(),
                result.duration().toMillis()
            );
        } else {
            log.warn(
                "fetch site={} url={} page={} attempt={} status={} httpStatus={} latencyMs={} error={}",
                request.site().key(),
                request.url(),
                request.page(),
                attempt,
                result.status(),
                result.httpStatus(),
                result.duration().toMillis(),
                result.errorMessage() == null ? result.errorCode() : result.errorMessage()
            );
        }
    }

    /**
     * Sleeps before the next attempt: half of the exponential step plus random jitter up to
     * the other half, capped by the configured maximum. Returns false when interrupted.
     */
    private boolean pauseBeforeRetry(int attempt) {
        long step = retryStepMs(attempt);
        if (step <= 0) {
            return true;
        }
        long half = step / 2;
        try {
            Thread.sleep(half + ThreadLocalRandom.current().nextLong(Math.max(1L, half)));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    long retryStepMs(int attempt) {
        long step = (long) properties.getRequestRetryBaseDelayMs() << Math.min(20, Math.max(0, attempt - 1));
        int capMs = properties.getRequestRetryMaxDelayMs();
        return capMs > 0 ? Math.min(step, capMs) : step;
    }

    private FetchResult errorResult(FetchRequest request, Instant startedAt, FetchStatus status, String code, String message) {
        return new FetchResult(
            request,
            status,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            1,
            code,
            message
        );
    }

    private String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private Charset charsetOf(String contentType) {
        if (contentType == null) {
            return StandardCharsets.UTF_8;
        }
        for (String part : contentType.split(";")) {
            String trimmed = part.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = trimmed.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException ignored) {
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    private URI toUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            return null;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /** Politeness state of one site: in-flight permits and the earliest next request time. */
    private static final class SiteGate {
        private final Semaphore permits;
        private Instant nextAllowed = Instant.EPOCH;

        private SiteGate(int concurrency) {
            this.permits = new Semaphore(concurrency);
        }

        // sleeps under the monitor so permit holders stay spaced by the delay
        private synchronized void awaitTurn(long delayMs) throws InterruptedException {
            long waitMs = Duration.between(Instant.now(), nextAllowed).toMillis();
            if (waitMs > 0) {
                Thread.sleep(waitMs);
            }
            nextAllowed = Instant.now().plusMillis(delayMs);
        }

        private synchronized void holdOff(long backoffMs) {
            Instant until = Instant.now().plusMillis(backoffMs);
            if (until.isAfter(nextAllowed)) {
                nextAllowed = until;
            }
        }
    }
}
