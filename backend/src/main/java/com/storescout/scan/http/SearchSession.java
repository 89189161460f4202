package com.storescout.scan.http;

import com.storescout.scan.model.HttpFetchResult;

import java.time.Duration;
import java.util.Map;

/**
 * A request-capable handle owned by a single worker for the duration of one grid point.
 * Transport failures are reported through {@link HttpFetchResult#errorCode()}, never thrown.
 */
public interface SearchSession extends AutoCloseable {

    HttpFetchResult get(String url, Map<String, String> headers, Duration timeout);

    @Override
    void close();
}
