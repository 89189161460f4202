package com.storescout.scan.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ValidationSummary(
    int total,
    int valid,
    int invalid,
    List<String> invalidStoreIds,
    int errorCount,
    int warningCount,
    List<ValidationResult> results
) {
    public static ValidationSummary empty() {
        return new ValidationSummary(0, 0, 0, List.of(), 0, 0, List.of());
    }
}
