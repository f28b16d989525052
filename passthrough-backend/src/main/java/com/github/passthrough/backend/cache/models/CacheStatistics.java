package com.github.passthrough.backend.cache.models;

import lombok.Builder;
import lombok.Value;

/**
 * The hit and miss counters of a single cache.
 */
@Value
@Builder
public class CacheStatistics {
    long hits;
    long misses;

    public long getRequests() {
        return hits + misses;
    }

    /**
     * Get the hit rate as a percentage.
     *
     * @return Returns the hit rate between 0 and 100.
     */
    public double getHitRate() {
        var requests = getRequests();
        return requests > 0 ? hits * 100.0 / requests : 0.0;
    }
}
