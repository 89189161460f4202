package com.storescout.scan.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storescout.config.StoreScoutProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-retailer cache instances. Response bodies live under {@code {dir}/{retailer}/response_cache},
 * URL lists directly under {@code {dir}/{retailer}}.
 */
@Component
public class ScanCaches {
    private final StoreScoutProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, TtlCache<String>> responseCaches = new ConcurrentHashMap<>();
    private final Map<String, TtlCache<List<String>>> urlListCaches = new ConcurrentHashMap<>();
    private final Map<String, TtlCache<List<Map<String, Object>>>> richUrlListCaches = new ConcurrentHashMap<>();

    public ScanCaches(StoreScoutProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return properties.getCache().isEnabled();
    }

    public TtlCache<String> responses(String retailer) {
        return responseCaches.computeIfAbsent(retailer, name -> FileTtlCache.ofDays(
            retailerDir(name).resolve("response_cache"),
            properties.getCache().getResponseTtlDays(),
            new ResponseBodyFlavor(),
            objectMapper,
            clock
        ));
    }

    public TtlCache<List<String>> urlLists(String retailer) {
        return urlListCaches.computeIfAbsent(retailer, name -> FileTtlCache.ofDays(
            retailerDir(name),
            properties.getCache().getUrlTtlDays(),
            new UrlListFlavor(objectMapper),
            objectMapper,
            clock
        ));
    }

    public TtlCache<List<Map<String, Object>>> richUrlLists(String retailer) {
        return richUrlListCaches.computeIfAbsent(retailer, name -> FileTtlCache.ofDays(
            retailerDir(name),
            properties.getCache().getUrlTtlDays(),
            new RichUrlListFlavor(objectMapper),
            objectMapper,
            clock
        ));
    }

    private Path retailerDir(String retailer) {
        return Path.of(properties.getCache().getDir()).resolve(retailer);
    }
}
