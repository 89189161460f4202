package com.storescout.scan.http;

import com.storescout.config.StoreScoutProperties;
import com.storescout.scan.model.HttpFetchResult;
import com.storescout.scan.util.UrlRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * GET with bounded retries. Rate limits (429) back off from the rate-limit base wait, server
 * errors, 408 and transport failures from the server-error wait; both grow exponentially per
 * attempt and are jittered. A block (403) waits out the blocked cool-down once and is not retried.
 * Other client errors fail immediately.
 */
@Service
public class RetryingHttpClient {
    private static final Logger log = LoggerFactory.getLogger(RetryingHttpClient.class);

    private final StoreScoutProperties properties;

    public RetryingHttpClient(StoreScoutProperties properties) {
        this.properties = properties;
    }

    public Optional<HttpFetchResult> getWithRetry(SearchSession session, String url, Supplier<Map<String, String>> headersFunc) {
        return getWithRetry(
            session,
            url,
            properties.getRequestMaxRetries(),
            Duration.ofSeconds(properties.getRequestTimeoutSeconds()),
            headersFunc
        );
    }

    /**
     * @return the successful (2xx) response, or empty once retries are exhausted or the failure is not retryable
     */
    public Optional<HttpFetchResult> getWithRetry(
        SearchSession session,
        String url,
        int maxRetries,
        Duration timeout,
        Supplier<Map<String, String>> headersFunc
    ) {
        int maxAttempts = Math.max(1, maxRetries);
        Map<String, String> headers = headersFunc == null ? Map.of() : headersFunc.get();
        String safeUrl = UrlRedactor.redact(url);
        HttpFetchResult lastResult = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (!politenessDelay()) {
                return Optional.empty();
            }
            lastResult = session.get(url, headers, timeout);
            Outcome outcome = classify(lastResult);
            switch (outcome) {
                case SUCCESS -> {
                    log.debug("Fetched {} (attempt {}/{})", safeUrl, attempt, maxAttempts);
                    return Optional.of(lastResult);
                }
                case BLOCKED -> {
                    log.error("Blocked (403) for {}. Cooling down {}ms before giving up.", safeUrl, properties.getBlockedWaitMs());
                    sleep(properties.getBlockedWaitMs());
                    return Optional.empty();
                }
                case FAIL_FAST -> {
                    log.warn("Client error ({}) for {}. Failing immediately.", lastResult.statusCode(), safeUrl);
                    return Optional.empty();
                }
                case ABORT -> {
                    log.warn("Giving up on {}: {}", safeUrl, describe(lastResult));
                    return Optional.empty();
                }
                default -> {
                    if (attempt >= maxAttempts) {
                        break;
                    }
                    long waitMs = backoffMs(outcome, attempt);
                    log.warn(
                        "{} for {}. Waiting {}ms (attempt {}/{})",
                        describe(lastResult),
                        safeUrl,
                        waitMs,
                        attempt,
                        maxAttempts
                    );
                    if (!sleep(waitMs)) {
                        return Optional.empty();
                    }
                }
            }
        }
        log.warn("Failed to fetch {} after {} attempts (last status: {})", safeUrl, maxAttempts, describe(lastResult));
        return Optional.empty();
    }

    private Outcome classify(HttpFetchResult result) {
        if (result == null) {
            return Outcome.RETRYABLE;
        }
        if (result.isTransportError()) {
            String code = result.errorCode();
            if ("interrupted".equals(code) || "invalid_url".equals(code) || "session_closed".equals(code)) {
                return Outcome.ABORT;
            }
            return Outcome.RETRYABLE;
        }
        if (result.isSuccessful()) {
            return Outcome.SUCCESS;
        }
        int status = result.statusCode();
        if (status == 429) {
            return Outcome.RATE_LIMITED;
        }
        if (status == 403) {
            return Outcome.BLOCKED;
        }
        if (status == 408 || status >= 500) {
            return Outcome.RETRYABLE;
        }
        if (status >= 400) {
            return Outcome.FAIL_FAST;
        }
        return Outcome.ABORT;
    }

    long backoffMs(Outcome outcome, int attempt) {
        long base = outcome == Outcome.RATE_LIMITED ? properties.getRateLimitBaseWaitMs() : properties.getServerErrorWaitMs();
        if (base <= 0) {
            return 0;
        }
        long delay = base * (1L << Math.min(20, Math.max(0, attempt - 1)));
        long cap = properties.getMaxBackoffMs();
        if (cap > 0) {
            delay = Math.min(delay, cap);
        }
        long half = delay / 2;
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay - half));
        return half + jitter;
    }

    private boolean politenessDelay() {
        long min = properties.getMinRequestDelayMs();
        long max = properties.getMaxRequestDelayMs();
        if (max <= 0) {
            return true;
        }
        long delay = min >= max ? min : ThreadLocalRandom.current().nextLong(min, max + 1);
        return sleep(delay);
    }

    private boolean sleep(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String describe(HttpFetchResult result) {
        if (result == null) {
            return "no response";
        }
        if (result.isTransportError()) {
            return "Request error " + result.errorCode() + " (" + UrlRedactor.redact(result.errorMessage()) + ")";
        }
        return "HTTP " + result.statusCode();
    }

    enum Outcome {
        SUCCESS,
        RATE_LIMITED,
        BLOCKED,
        RETRYABLE,
        FAIL_FAST,
        ABORT
    }
}
