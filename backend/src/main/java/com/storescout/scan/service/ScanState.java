package com.storescout.scan.service;

import com.storescout.scan.model.StoreRecord;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Deduplicated results of one scan. The seen-id set and the result list are only touched while
 * holding {@link #lock}; the first record seen for a store id is the one kept.
 */
final class ScanState {
    private final ReentrantLock lock = new ReentrantLock();
    private final Set<String> seenIds = new HashSet<>();
    private final List<StoreRecord> results = new ArrayList<>();

    /**
     * @return true when the limit has been reached; remaining records of the batch are dropped
     */
    boolean merge(List<StoreRecord> batch, Integer limit) {
        lock.lock();
        try {
            for (StoreRecord record : batch) {
                if (reached(limit)) {
                    return true;
                }
                if (seenIds.add(record.storeId())) {
                    results.add(record);
                }
            }
            return reached(limit);
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return results.size();
        } finally {
            lock.unlock();
        }
    }

    List<StoreRecord> snapshot(Integer limit) {
        lock.lock();
        try {
            if (limit != null && results.size() > limit) {
                return List.copyOf(results.subList(0, limit));
            }
            return List.copyOf(results);
        } finally {
            lock.unlock();
        }
    }

    private boolean reached(Integer limit) {
        return limit != null && results.size() >= limit;
    }
}
