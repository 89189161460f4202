package com.storescout.scan.cache;

import com.storescout.scan.util.HashUtils;

/**
 * Raw response bodies keyed by the SHA-256 of the request URL.
 */
public class ResponseBodyFlavor implements CacheFlavor<String> {

    @Override
    public String cacheKey(String url) {
        return HashUtils.sha256Hex(url);
    }

    @Override
    public String serialize(String body) {
        return body;
    }

    @Override
    public String deserialize(String raw) {
        return raw;
    }
}
