package org.carball.probe.model.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Minimum, mean and maximum of one timing metric across runs, in milliseconds.
 */
public record MetricStats(
        @JsonProperty("min") double min,
        @JsonProperty("mean") double mean,
        @JsonProperty("max") double max,
        @JsonProperty("samples") int samples) {

    /**
     * Aggregates the non-null values, or returns null when there are none.
     */
    public static MetricStats of(List<Double> values) {
        List<Double> present = values.stream().filter(Objects::nonNull).toList();
        if (present.isEmpty()) {
            return null;
        }
        double min = present.stream().mapToDouble(Double::doubleValue).min().orElse(0);
        double max = present.stream().mapToDouble(Double::doubleValue).max().orElse(0);
        double mean = present.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        return new MetricStats(round(min), round(mean), round(max), present.size());
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
