package com.storescout.scan.model;

public record ScanRequest(
    Integer limit,
    boolean testMode,
    boolean forceRefresh
) {
    public static ScanRequest defaults() {
        return new ScanRequest(null, false, false);
    }

    public Integer effectiveLimit() {
        if (limit == null || limit <= 0) {
            return null;
        }
        return limit;
    }
}
