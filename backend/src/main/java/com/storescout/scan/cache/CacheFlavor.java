package com.storescout.scan.cache;

import java.io.IOException;

/**
 * Key derivation and payload encoding for one kind of cached value.
 */
public interface CacheFlavor<T> {

    String cacheKey(String identifier);

    String serialize(T value) throws IOException;

    T deserialize(String raw) throws IOException;
}
