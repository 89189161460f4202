package com.storescout.scan.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScanResult(
    String retailer,
    List<StoreRecord> stores,
    int count,
    boolean checkpointsUsed,
    boolean limitReached,
    int gridPoints,
    int pointsCompleted,
    ValidationSummary validation
) {}
