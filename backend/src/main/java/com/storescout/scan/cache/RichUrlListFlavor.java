package com.storescout.scan.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * URL lists that carry extra per-store metadata (store id, slug, ...).
 */
public class RichUrlListFlavor implements CacheFlavor<List<Map<String, Object>>> {
    private static final TypeReference<List<Map<String, Object>>> TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public RichUrlListFlavor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String cacheKey(String identifier) {
        return identifier + "_rich_urls";
    }

    @Override
    public String serialize(List<Map<String, Object>> storeInfos) throws IOException {
        return objectMapper.writeValueAsString(storeInfos);
    }

    @Override
    public List<Map<String, Object>> deserialize(String raw) throws IOException {
        return objectMapper.readValue(raw, TYPE);
    }
}
