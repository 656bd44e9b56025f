package org.carball.probe.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time view of the result cache counters.
 */
public record CacheStats(
        @JsonProperty("hits") long hits,
        @JsonProperty("misses") long misses,
        @JsonProperty("bypassed") long bypassed,
        @JsonProperty("size") int size,
        @JsonProperty("max_items") int maxItems,
        @JsonProperty("ttl_seconds") long ttlSeconds) {

    @JsonProperty("hit_rate")
    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
