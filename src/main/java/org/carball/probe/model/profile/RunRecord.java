package org.carball.probe.model.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * One execution of a profiled query. Wall time is always present; engine timings only when
 * the trace delivered the corresponding events in time.
 */
public record RunRecord(
        @JsonProperty("run") int runNumber,
        @JsonProperty("wall_ms") double wallMs,
        @JsonProperty("se_ms") Double seMs,
        @JsonProperty("fe_ms") Double feMs,
        @JsonProperty("engine_total_ms") Double engineTotalMs,
        @JsonProperty("engine_cpu_ms") Double engineCpuMs,
        @JsonProperty("se_query_count") int seQueryCount,
        @JsonProperty("se_cache_hits") int seCacheHits,
        @JsonProperty("se_cache_misses") int seCacheMisses,
        @JsonProperty("row_count") int rowCount,
        @JsonProperty("cache_state") CacheState cacheState,
        @JsonProperty("success") boolean success,
        @JsonProperty("error") String error,
        @JsonProperty("event_count") int eventCount,
        @JsonProperty("event_counts") Map<String, Integer> eventCounts,
        @JsonProperty("trace_complete") boolean traceComplete) {

    public RunRecord {
        eventCounts = eventCounts == null ? Map.of() : eventCounts;
    }

    public boolean hasEngineBreakdown() {
        return seMs != null || feMs != null;
    }
}
