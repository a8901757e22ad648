package com.polishfootball.network.infrastructure.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cache performance metrics
 */
public record CacheStats(
        long hits,
        long misses,
        long errors,
        long evictions,
        long activeEntries
) {
    @JsonProperty("hitRatio")
    public double hitRatio() {
        long total = hits + misses;
        return total > 0 ? (double) hits / total : 0.0;
    }

    public String summary() {
        return String.format("Hit ratio: %.1f%%, Active entries: %d, Evictions: %d",
                hitRatio() * 100, activeEntries, evictions);
    }
}
