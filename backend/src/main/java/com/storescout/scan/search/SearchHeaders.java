package com.storescout.scan.search;

import com.storescout.config.RetailerProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Request headers for the search API. Each call picks a user agent at random.
 */
public final class SearchHeaders {
    private SearchHeaders() {
    }

    public static Supplier<Map<String, String>> forRetailer(RetailerProperties.Api api, List<String> userAgents) {
        return () -> {
            Map<String, String> headers = new LinkedHashMap<>();
            headers.put("User-Agent", userAgents.get(ThreadLocalRandom.current().nextInt(userAgents.size())));
            headers.put("Accept", "application/json");
            headers.put("Accept-Language", "en-US,en;q=0.9");
            String referer = api == null ? null : api.getReferer();
            if (referer != null && !referer.isBlank()) {
                headers.put("Referer", referer.trim());
                headers.put("Origin", origin(referer.trim()));
            }
            return headers;
        };
    }

    private static String origin(String referer) {
        int schemeEnd = referer.indexOf("://");
        if (schemeEnd < 0) {
            return referer;
        }
        int pathStart = referer.indexOf('/', schemeEnd + 3);
        return pathStart < 0 ? referer : referer.substring(0, pathStart);
    }
}
