package org.carball.probe.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Settings as written in a YAML settings file. Absent keys leave the lower-priority value in place.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SettingsFile {

    @JsonProperty("cache_ttl_seconds")
    private Integer cacheTtlSeconds;

    @JsonProperty("max_cache_items")
    private Integer maxCacheItems;

    @JsonProperty("event_timeout_seconds")
    private Integer eventTimeoutSeconds;

    @JsonProperty("default_runs")
    private Integer defaultRuns;

    @JsonProperty("poll_interval_millis")
    private Long pollIntervalMillis;

    @JsonProperty("command_timeout_seconds")
    private Integer commandTimeoutSeconds;

    @JsonProperty("safety_max_rows")
    private Integer safetyMaxRows;

    @JsonProperty("default_info_limit")
    private Integer defaultInfoLimit;

    @JsonProperty("clear_cache_command")
    private String clearCacheCommand;

    public static SettingsFile read(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Settings file not found: " + path);
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        SettingsFile file = mapper.readValue(path.toFile(), SettingsFile.class);
        return file == null ? new SettingsFile() : file;
    }

    /**
     * Overlays every key present in this file onto the builder.
     */
    public void applyTo(ProbeSettings.ProbeSettingsBuilder builder) {
        if (cacheTtlSeconds != null) builder.cacheTtlSeconds(cacheTtlSeconds);
        if (maxCacheItems != null) builder.maxCacheItems(maxCacheItems);
        if (eventTimeoutSeconds != null) builder.eventTimeoutSeconds(eventTimeoutSeconds);
        if (defaultRuns != null) builder.defaultRuns(defaultRuns);
        if (pollIntervalMillis != null) builder.pollIntervalMillis(pollIntervalMillis);
        if (commandTimeoutSeconds != null) builder.commandTimeoutSeconds(commandTimeoutSeconds);
        if (safetyMaxRows != null) builder.safetyMaxRows(safetyMaxRows);
        if (defaultInfoLimit != null) builder.defaultInfoLimit(defaultInfoLimit);
        if (clearCacheCommand != null) builder.clearCacheCommand(clearCacheCommand);
    }
}
