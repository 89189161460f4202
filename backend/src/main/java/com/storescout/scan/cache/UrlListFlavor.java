package com.storescout.scan.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.List;

public class UrlListFlavor implements CacheFlavor<List<String>> {
    private static final TypeReference<List<String>> TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public UrlListFlavor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String cacheKey(String identifier) {
        return identifier + "_urls";
    }

    @Override
    public String serialize(List<String> urls) throws IOException {
        return objectMapper.writeValueAsString(urls);
    }

    @Override
    public List<String> deserialize(String raw) throws IOException {
        return objectMapper.readValue(raw, TYPE);
    }
}
