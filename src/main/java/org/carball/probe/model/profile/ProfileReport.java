package org.carball.probe.model.profile;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of profiling one query: every run plus the aggregated summary.
 */
@Data
@Builder
public class ProfileReport {

    @JsonProperty("query")
    private String query;

    @Builder.Default
    @JsonProperty("runs")
    private List<RunRecord> runs = new ArrayList<>();

    @JsonProperty("summary")
    private TimingSummary summary;

    @JsonProperty("trace_source")
    private String traceSource;

    @JsonProperty("trace_available")
    private boolean traceAvailable;

    @JsonProperty("clear_cache_first")
    private boolean clearCacheFirst;

    @JsonProperty("engine_cache_cleared")
    private boolean engineCacheCleared;

    @JsonProperty("deadline_reached")
    private boolean deadlineReached;
}
