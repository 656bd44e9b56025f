package org.carball.probe.model.profile;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TimingSummary {

    @JsonProperty("wall_ms")
    private MetricStats wall;

    @JsonProperty("se_ms")
    private MetricStats storageEngine;

    @JsonProperty("fe_ms")
    private MetricStats formulaEngine;

    @JsonProperty("metrics_available")
    private boolean metricsAvailable;

    @JsonProperty("run_count")
    private int runCount;

    @JsonProperty("successful_runs")
    private int successfulRuns;

    @JsonProperty("se_percent")
    private Double storageEnginePercent;

    @JsonProperty("fe_percent")
    private Double formulaEnginePercent;

    @JsonProperty("total_se_queries")
    private int totalSeQueries;

    @JsonProperty("total_se_cache_hits")
    private int totalSeCacheHits;

    @JsonProperty("total_se_cache_misses")
    private int totalSeCacheMisses;
}
