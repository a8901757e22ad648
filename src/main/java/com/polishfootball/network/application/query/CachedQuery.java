package com.polishfootball.network.application.query;

import com.polishfootball.network.infrastructure.cache.CacheValueType;

import java.time.Duration;

/**
 * A read-only query whose results are served through the cache.
 *
 * @param <Q> validated request type
 * @param <R> cached response payload
 */
public interface CachedQuery<Q, R> {

    /**
     * Short name used in logs and failure messages, e.g. "clubs".
     */
    String name();

    /**
     * Deterministic key for a request that already passed validation.
     */
    String cacheKey(Q request);

    CacheValueType<R> resultType();

    Duration ttl();

    /**
     * Fetch from the backing store and shape the response.
     * @throws ResourceNotFoundException when the request refers to a missing entity
     */
    R load(Q request);
}
