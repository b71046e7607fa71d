package com.delta.lottracker.discovery.http;

import com.delta.lottracker.config.DiscoveryProperties;
import com.delta.lottracker.discovery.model.HttpFetchResult;
import com.delta.lottracker.discovery.model.SourceTag;
import com.delta.lottracker.discovery.util.FailureClassifier;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
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
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Shared HTTP path for all three marketplace channels. Every attempt, retries included, takes a
 * permit from the channel's rate limiter; retryable failures back off exponentially with jitter.
 */
@Service
public class MarketplaceHttpClient {
    private static final Logger log = LoggerFactory.getLogger(MarketplaceHttpClient.class);
    private static final Duration PERMIT_POLL_INTERVAL = Duration.ofMillis(20);

    private final DiscoveryProperties properties;
    private final HttpClient client;
    private final Map<SourceTag, RateLimiter> limiters = new EnumMap<>(SourceTag.class);
    private final Map<SourceTag, Instant> cooldownUntil = new ConcurrentHashMap<>();

    public MarketplaceHttpClient(
        DiscoveryProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        limiters.put(SourceTag.SUMMARY, buildLimiter(SourceTag.SUMMARY, properties.getSummary().getRequestsPerSecond()));
        limiters.put(SourceTag.SEARCH, buildLimiter(SourceTag.SEARCH, properties.getSearch().getRequestsPerSecond()));
        limiters.put(SourceTag.RENDERED, buildLimiter(SourceTag.RENDERED, properties.getRendered().getRequestsPerSecond()));
    }

    public HttpFetchResult get(SourceTag source, String url, String acceptHeader, Map<String, String> headers) {
        return send(source, url, "GET", acceptHeader, null, headers);
    }

    public HttpFetchResult postJson(
        SourceTag source,
        String url,
        String jsonBody,
        String acceptHeader,
        Map<String, String> headers
    ) {
        return send(source, url, "POST", acceptHeader, jsonBody == null ? "" : jsonBody, headers);
    }

    private HttpFetchResult send(
        SourceTag source,
        String url,
        String method,
        String acceptHeader,
        String body,
        Map<String, String> headers
    ) {
        RunCancellation cancellation = DiscoveryRunContext.current();
        if (cancellation == null) {
            cancellation = RunCancellation.none();
        }
        int maxAttempts = Math.max(1, properties.getMaxAttempts());
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            cancellation.checkActive();
            waitForCooldown(source, cancellation);
            lastResult = executeOnce(source, url, method, acceptHeader, body, headers, cancellation)
                .withAttempts(attempt);
            cancellation.checkActive();
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            Duration delay = backoffDelay(attempt);
            log.debug(
                "retrying {} {} after {}ms (attempt {}/{}, status={}, error={})",
                source.key(),
                url,
                delay.toMillis(),
                attempt,
                maxAttempts,
                lastResult.statusCode(),
                lastResult.errorCode()
            );
            if (!cancellation.sleep(delay)) {
                cancellation.checkActive();
                return lastResult;
            }
        }
        return lastResult;
    }

    private HttpFetchResult executeOnce(
        SourceTag source,
        String url,
        String method,
        String acceptHeader,
        String body,
        Map<String, String> headers,
        RunCancellation cancellation
    ) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        RateLimiter limiter = limiters.get(source);
        if (limiter != null && !acquirePermit(limiter, cancellation)) {
            cancellation.checkActive();
            return errorResult(url, startedAt, "rate_limiter_timeout", "no " + source.key() + " permit available");
        }

        String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
        int timeoutSeconds = properties.getRequestTimeoutSeconds();
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .header("User-Agent", DiscoveryProperties.normalizeUserAgent(properties.getUserAgent()))
            .header("Accept", safeAccept)
            .header("Accept-Language", "en-US,en;q=0.8");
        if (headers != null) {
            headers.forEach((name, value) -> {
                if (name != null && value != null && !value.isBlank()) {
                    builder.header(name, value);
                }
            });
        }
        HttpRequest request;
        if ("POST".equalsIgnoreCase(method)) {
            request = builder
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body == null ? "" : body, StandardCharsets.UTF_8))
                .build();
        } else {
            request = builder.GET().build();
        }

        CompletableFuture<HttpResponse<byte[]>> future = client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
        cancellation.register(future);
        try {
            HttpResponse<byte[]> response = future.get(timeoutSeconds + 1L, TimeUnit.SECONDS);
            if (response.statusCode() == 429) {
                extendCooldown(source, retryAfter(response).orElse(backoffDelay(1)));
            }
            byte[] responseBytes = response.body();
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8),
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                1,
                null,
                null
            );
        } catch (TimeoutException e) {
            future.cancel(true);
            return errorResult(url, startedAt, "timeout", "no response within " + timeoutSeconds + "s");
        } catch (CancellationException e) {
            return errorResult(url, startedAt, "cancelled", cancellation.reason());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof HttpTimeoutException) {
                return errorResult(url, startedAt, "timeout", cause.getMessage());
            }
            if (cause instanceof IOException) {
                return errorResult(url, startedAt, "io_error", cause.getClass().getSimpleName() + ": " + cause.getMessage());
            }
            return errorResult(url, startedAt, "http_error", cause.getMessage());
        } finally {
            cancellation.unregister(future);
        }
    }

    private boolean shouldRetry(HttpFetchResult result) {
        if (result == null || result.isSuccessful()) {
            return false;
        }
        return FailureClassifier.isRetryable(FailureClassifier.reasonCode(result));
    }

    private Duration backoffDelay(int attempt) {
        int baseDelayMs = properties.getRetryBaseDelayMs();
        int maxDelayMs = properties.getRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.max(0, Math.min(20, attempt - 1)));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 0) {
            return Duration.ZERO;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        return Duration.ofMillis((delay / 2) + jitter);
    }

    private Optional<Duration> retryAfter(HttpResponse<?> response) {
        return response.headers().firstValue("Retry-After").flatMap(value -> {
            try {
                long seconds = Long.parseLong(value.trim());
                long capped = Math.min(seconds * 1000L, Math.max(0, properties.getRetryMaxDelayMs()));
                return Optional.of(Duration.ofMillis(Math.max(0, capped)));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        });
    }

    private void waitForCooldown(SourceTag source, RunCancellation cancellation) {
        Instant until = cooldownUntil.get(source);
        if (until == null) {
            return;
        }
        Duration wait = Duration.between(Instant.now(), until);
        if (!wait.isNegative() && !wait.isZero() && !cancellation.sleep(wait)) {
            cancellation.checkActive();
        }
    }

    private void extendCooldown(SourceTag source, Duration duration) {
        Instant candidate = Instant.now().plus(duration);
        cooldownUntil.merge(source, candidate, (current, next) -> next.isAfter(current) ? next : current);
    }

    /**
     * Polls the limiter so a stopped run never waits out the full permit timeout.
     */
    private boolean acquirePermit(RateLimiter limiter, RunCancellation cancellation) {
        Duration maxWait = Duration.ofSeconds(properties.getRequestTimeoutSeconds());
        Duration remaining = cancellation.remaining();
        if (remaining != null && remaining.compareTo(maxWait) < 0) {
            maxWait = remaining;
        }
        long waitUntil = System.nanoTime() + maxWait.toNanos();
        while (!limiter.acquirePermission()) {
            if (System.nanoTime() - waitUntil >= 0 || !cancellation.sleep(PERMIT_POLL_INTERVAL)) {
                return false;
            }
        }
        return true;
    }

    private RateLimiter buildLimiter(SourceTag source, double requestsPerSecond) {
        double rate = requestsPerSecond <= 0 ? 1.0 : requestsPerSecond;
        int permits = (int) Math.max(1, Math.ceil(rate));
        long periodNanos = (long) (TimeUnit.SECONDS.toNanos(1) * (permits / rate));
        RateLimiterConfig config = RateLimiterConfig.custom()
            .limitForPeriod(permits)
            .limitRefreshPeriod(Duration.ofNanos(Math.max(1_000_000L, periodNanos)))
            .timeoutDuration(Duration.ZERO)
            .build();
        return RateLimiter.of("marketplace-" + source.key(), config);
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
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
