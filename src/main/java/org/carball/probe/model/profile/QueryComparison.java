package org.carball.probe.model.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Before/after profile of two variants of a query. Improvements are positive when the
 * second variant is faster; they are null when either side lacks the metric.
 */
public record QueryComparison(
        @JsonProperty("before") ProfileReport before,
        @JsonProperty("after") ProfileReport after,
        @JsonProperty("wall_improvement_ms") Double wallImprovementMs,
        @JsonProperty("wall_improvement_percent") Double wallImprovementPercent,
        @JsonProperty("se_improvement_ms") Double seImprovementMs,
        @JsonProperty("fe_improvement_ms") Double feImprovementMs) {

    @JsonProperty("faster")
    public boolean isFaster() {
        return wallImprovementMs != null && wallImprovementMs > 0;
    }
}
