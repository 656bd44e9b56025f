package org.carball.probe.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

@Data
@Builder(toBuilder = true)
@Slf4j
public class ProbeSettings {

    // Result cache
    @Builder.Default
    private int cacheTtlSeconds = 300;

    @Builder.Default
    private int maxCacheItems = 200;

    // Profiling
    @Builder.Default
    private int eventTimeoutSeconds = 30;

    @Builder.Default
    private int defaultRuns = 3;

    @Builder.Default
    private long pollIntervalMillis = 200;

    // Engine access
    @Builder.Default
    private int commandTimeoutSeconds = 60;

    @Builder.Default
    private int safetyMaxRows = 10000;

    @Builder.Default
    private int defaultInfoLimit = 100;

    /** Engine command that drops its caches, e.g. an XMLA ClearCache statement. */
    private String clearCacheCommand;

    /**
     * Creates the built-in settings.
     */
    public static ProbeSettings defaults() {
        return ProbeSettings.builder().build();
    }

    public Duration cacheTtl() {
        return Duration.ofSeconds(cacheTtlSeconds);
    }

    public Duration eventTimeout() {
        return Duration.ofSeconds(eventTimeoutSeconds);
    }

    public Duration pollInterval() {
        return Duration.ofMillis(pollIntervalMillis);
    }

    /**
     * Validates the settings and logs warnings for values that will behave unexpectedly.
     */
    public void validate() {
        if (cacheTtlSeconds <= 0) {
            log.warn("Cache TTL ({}s) is not positive; result caching is disabled", cacheTtlSeconds);
        }

        if (maxCacheItems <= 0) {
            log.warn("Max cache items ({}) should be positive", maxCacheItems);
        }

        if (eventTimeoutSeconds <= 0) {
            log.warn("Event timeout ({}s) should be positive; profiling will report wall-clock time only",
                    eventTimeoutSeconds);
        }

        if (pollIntervalMillis <= 0) {
            log.warn("Poll interval ({}ms) should be positive", pollIntervalMillis);
        } else if (pollIntervalMillis >= eventTimeoutSeconds * 1000L) {
            log.warn("Poll interval ({}ms) should be shorter than the event timeout ({}s)",
                    pollIntervalMillis, eventTimeoutSeconds);
        }

        if (defaultRuns < 1) {
            log.warn("Default runs ({}) should be at least 1", defaultRuns);
        }

        if (commandTimeoutSeconds <= 0) {
            log.warn("Command timeout ({}s) should be positive", commandTimeoutSeconds);
        }

        if (safetyMaxRows <= 0) {
            log.warn("Safety row cap ({}) should be positive", safetyMaxRows);
        }

        log.debug("Using settings - Cache TTL: {}s, Max items: {}, Event timeout: {}s, Runs: {}",
                cacheTtlSeconds, maxCacheItems, eventTimeoutSeconds, defaultRuns);
    }

    /**
     * Returns a one-line description of the settings for user feedback.
     */
    public String getConfigurationSummary() {
        return String.format("Cache TTL: %ds | Max items: %d | Event timeout: %ds | Runs: %d | Row cap: %d",
                cacheTtlSeconds, maxCacheItems, eventTimeoutSeconds, defaultRuns, safetyMaxRows);
    }
}
