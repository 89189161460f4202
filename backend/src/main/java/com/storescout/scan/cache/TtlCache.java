package com.storescout.scan.cache;

import com.storescout.scan.model.CacheMetadata;

import java.util.Optional;

/**
 * Key/value store whose entries expire once {@code now - cachedAt} exceeds the TTL.
 *
 * <p>Reads never throw: missing, malformed and expired entries are all reported as absent.
 * {@link #isValid(String)} always agrees with {@link #get(String)}.
 */
public interface TtlCache<T> {

    /**
     * @param forceRefresh when true the storage is not read and the result is always empty
     */
    Optional<T> get(String identifier, boolean forceRefresh);

    default Optional<T> get(String identifier) {
        return get(identifier, false);
    }

    /**
     * Overwrites any previous entry. Storage failures are logged and otherwise ignored.
     */
    void set(String identifier, T value);

    void clear(String identifier);

    boolean isValid(String identifier);

    Optional<CacheMetadata> metadata(String identifier);
}
