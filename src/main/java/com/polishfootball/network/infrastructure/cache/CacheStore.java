package com.polishfootball.network.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Process-wide key/value cache used by every query handler.
 * Implementations keep their own key registry so callers never do eviction bookkeeping.
 */
public interface CacheStore extends AutoCloseable {

    /**
     * Read a live entry.
     * @return Optional.empty() on a miss, on an expired entry, or when the entry cannot be read
     */
    <T> Optional<T> get(String key, CacheValueType<T> type);

    /**
     * Store a value under the default expiration, replacing any previous entry.
     * @throws CacheOperationException if the value could not be stored
     */
    <T> void set(String key, T value, CacheValueType<T> type);

    /**
     * Store a value, replacing any previous entry. A zero ttl leaves nothing readable.
     * @throws CacheOperationException if the value could not be stored
     */
    <T> void set(String key, T value, CacheValueType<T> type, Duration ttl);

    /**
     * Remove a single entry. Removing an absent key is a no-op.
     */
    void remove(String key);

    /**
     * Remove every entry whose key matches the case-insensitive regular expression.
     * @return number of registered keys that matched
     */
    int removeByPattern(String pattern);

    /**
     * Existence check that does not decode the stored value.
     */
    boolean exists(String key);

    CacheStats stats();

    @Override
    default void close() {
    }
}
