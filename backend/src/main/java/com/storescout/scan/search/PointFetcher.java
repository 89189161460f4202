package com.storescout.scan.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storescout.config.RetailerProperties;
import com.storescout.config.StoreScoutProperties;
import com.storescout.scan.cache.ScanCaches;
import com.storescout.scan.cache.TtlCache;
import com.storescout.scan.http.RetryingHttpClient;
import com.storescout.scan.http.SearchSession;
import com.storescout.scan.model.GridPoint;
import com.storescout.scan.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs one location search per grid point and returns the provider's raw result objects.
 * Every runtime failure degrades to an empty list so a dead point never aborts a scan.
 */
@Service
public class PointFetcher {
    private static final Logger log = LoggerFactory.getLogger(PointFetcher.class);

    private final RetryingHttpClient httpClient;
    private final ScanCaches caches;
    private final ObjectMapper objectMapper;
    private final StoreScoutProperties properties;

    public PointFetcher(
        RetryingHttpClient httpClient,
        ScanCaches caches,
        ObjectMapper objectMapper,
        StoreScoutProperties properties
    ) {
        this.httpClient = httpClient;
        this.caches = caches;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public List<JsonNode> fetch(
        SearchSession session,
        GridPoint point,
        String retailer,
        RetailerProperties retailerProperties,
        boolean forceRefresh
    ) {
        String url = SearchUrlBuilder.build(retailerProperties.getApi(), point, retailerProperties.getSearchRadiusMiles());
        try {
            TtlCache<String> cache = caches.isEnabled() ? caches.responses(retailer) : null;
            if (cache != null) {
                Optional<List<JsonNode>> cached = cache.get(url, forceRefresh)
                    .flatMap(body -> parseResults(retailer, point, body));
                if (cached.isPresent()) {
                    log.debug("[{}] Cache hit for point {}", retailer, point);
                    return cached.get();
                }
            }

            Optional<HttpFetchResult> response = httpClient.getWithRetry(
                session,
                url,
                SearchHeaders.forRetailer(retailerProperties.getApi(), properties.getUserAgents())
            );
            if (response.isEmpty()) {
                log.debug("[{}] No response for point {}", retailer, point);
                return List.of();
            }
            String body = response.get().body();
            Optional<List<JsonNode>> results = parseResults(retailer, point, body);
            if (results.isEmpty()) {
                return List.of();
            }
            if (cache != null) {
                cache.set(url, body);
            }
            if (!results.get().isEmpty()) {
                log.debug("[{}] Found {} stores at {}", retailer, results.get().size(), point);
            }
            return results.get();
        } catch (RuntimeException e) {
            log.warn("[{}] Failed to fetch point {}: {}", retailer, point, e.getMessage());
            return List.of();
        }
    }

    /**
     * Results live at {@code response.modules[0].results}. A body without modules is a valid empty answer;
     * an unparsable body is not.
     */
    Optional<List<JsonNode>> parseResults(String retailer, GridPoint point, String body) {
        if (body == null || body.isBlank()) {
            log.warn("[{}] Empty response body for {}", retailer, point);
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                log.warn("[{}] Unexpected response shape for {}", retailer, point);
                return Optional.empty();
            }
            JsonNode modules = root.path("response").path("modules");
            if (!modules.isArray() || modules.isEmpty()) {
                return Optional.of(List.of());
            }
            JsonNode results = modules.get(0).path("results");
            if (!results.isArray()) {
                return Optional.of(List.of());
            }
            List<JsonNode> out = new ArrayList<>(results.size());
            results.forEach(out::add);
            return Optional.of(out);
        } catch (IOException e) {
            log.warn("[{}] Failed to parse response for {}: {}", retailer, point, e.getMessage());
            return Optional.empty();
        }
    }
}
