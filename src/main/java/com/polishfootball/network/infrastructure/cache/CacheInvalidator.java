package com.polishfootball.network.infrastructure.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import static com.polishfootball.network.infrastructure.cache.CacheNamespaces.CLUBS;
import static com.polishfootball.network.infrastructure.cache.CacheNamespaces.CLUB_CONNECTIONS;
import static com.polishfootball.network.infrastructure.cache.CacheNamespaces.CLUB_DETAIL;
import static com.polishfootball.network.infrastructure.cache.CacheNamespaces.CONNECTIONS;
import static com.polishfootball.network.infrastructure.cache.CacheNamespaces.DASHBOARD_STATS;
import static com.polishfootball.network.infrastructure.cache.CacheNamespaces.GRAPH_DATA;

/**
 * Evicts the cached query results a mutation can make stale.
 */
@Component
public class CacheInvalidator {

    private static final Logger logger = LoggerFactory.getLogger(CacheInvalidator.class);

    private final CacheStore cacheStore;

    public CacheInvalidator(CacheStore cacheStore) {
        this.cacheStore = cacheStore;
    }

    public void onClubChanged() {
        evict(CLUBS, CLUB_DETAIL, CLUB_CONNECTIONS, CONNECTIONS, GRAPH_DATA, DASHBOARD_STATS);
    }

    public void onConnectionChanged() {
        evict(CLUB_DETAIL, CLUB_CONNECTIONS, CONNECTIONS, GRAPH_DATA, DASHBOARD_STATS);
    }

    private void evict(String... namespaces) {
        int removed = 0;
        for (String namespace : namespaces) {
            try {
                removed += cacheStore.removeByPattern(CacheNamespaces.pattern(namespace));
            } catch (RuntimeException e) {
                logger.warn("Cache invalidation failed for namespace {}: {}", namespace, e.getMessage());
            }
        }
        logger.debug("Invalidated {} cache entries across {} namespaces", removed, namespaces.length);
    }
}
