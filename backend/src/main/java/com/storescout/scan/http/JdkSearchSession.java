package com.storescout.scan.http;

import com.storescout.scan.model.HttpFetchResult;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Session over a shared JDK {@link HttpClient}. The client pools connections and is thread-safe;
 * the session itself is not meant to be shared between workers.
 */
public class JdkSearchSession implements SearchSession {
    private final HttpClient client;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public JdkSearchSession(HttpClient client) {
        this.client = client;
    }

    @Override
    public HttpFetchResult get(String url, Map<String, String> headers, Duration timeout) {
        Instant startedAt = Instant.now();
        if (closed.get()) {
            return errorResult(url, startedAt, "session_closed", "Session already closed");
        }
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return errorResult(url, startedAt, "invalid_url", e.getMessage());
        }
        if (uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host");
        }
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri).timeout(timeout).GET();
            if (headers != null) {
                headers.forEach(builder::header);
            }
            HttpResponse<byte[]> response = client.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
            byte[] bytes = response.body();
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                bytes == null ? null : new String(bytes, StandardCharsets.UTF_8),
                response.headers().firstValue("Content-Type").orElse(null),
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
        } catch (RuntimeException e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        }
    }

    @Override
    public void close() {
        closed.set(true);
    }

    public boolean isClosed() {
        return closed.get();
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
            code,
            message
        );
    }
}
