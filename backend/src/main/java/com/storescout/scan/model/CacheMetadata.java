package com.storescout.scan.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Duration;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CacheMetadata(
    Instant cachedAt,
    Duration age,
    boolean expired
) {
    public long ageDays() {
        return age.toDays();
    }
}
