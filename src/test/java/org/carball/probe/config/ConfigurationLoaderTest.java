package org.carball.probe.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    private Map<String, String> environment;
    private ConfigurationLoader loader;

    @BeforeEach
    void setUp() {
        environment = new HashMap<>();
        loader = new ConfigurationLoader(environment);
    }

    @Test
    void shouldLoadDefaultConfiguration() {
        // When
        ProbeSettings settings = loader.loadConfiguration(new String[0]);

        // Then
        assertThat(settings.getCacheTtlSeconds()).isEqualTo(300);
        assertThat(settings.getMaxCacheItems()).isEqualTo(200);
        assertThat(settings.getEventTimeoutSeconds()).isEqualTo(30);
        assertThat(settings.getDefaultRuns()).isEqualTo(3);
        assertThat(settings.getPollIntervalMillis()).isEqualTo(200L);
        assertThat(settings.getSafetyMaxRows()).isEqualTo(10000);
        assertThat(settings.getClearCacheCommand()).isNull();
    }

    @Test
    void shouldApplyCliArguments() {
        // Given
        String[] args = {
                "query", "jdbc:olap:test", "EVALUATE Sales",
                "--settings.cache-ttl", "60",
                "--settings.runs", "5",
                "--settings.poll-interval", "50",
                "--settings.info-limit", "20",
                "--settings.clear-cache-command", "CLEAR CACHE"
        };

        // When
        ProbeSettings settings = loader.loadConfiguration(args);

        // Then
        assertThat(settings.getCacheTtlSeconds()).isEqualTo(60);
        assertThat(settings.getDefaultRuns()).isEqualTo(5);
        assertThat(settings.getPollIntervalMillis()).isEqualTo(50L);
        assertThat(settings.getDefaultInfoLimit()).isEqualTo(20);
        assertThat(settings.getClearCacheCommand()).isEqualTo("CLEAR CACHE");
    }

    @Test
    void shouldApplyEnvironmentVariables() {
        environment.put("PROBE_CACHE_TTL_SECONDS", "120");
        environment.put("PROBE_EVENT_TIMEOUT_SECONDS", "10");
        environment.put("PROBE_SAFETY_MAX_ROWS", "500");

        ProbeSettings settings = loader.loadConfiguration(new String[0]);

        assertThat(settings.getCacheTtlSeconds()).isEqualTo(120);
        assertThat(settings.getEventTimeoutSeconds()).isEqualTo(10);
        assertThat(settings.getSafetyMaxRows()).isEqualTo(500);
    }

    @Test
    void shouldApplyInfoLimitFromEnvironmentBelowCli() {
        environment.put("PROBE_DEFAULT_INFO_LIMIT", "25");

        ProbeSettings fromEnvironment = loader.loadConfiguration(new String[0]);
        ProbeSettings fromCli = loader.loadConfiguration(new String[]{"--settings.info-limit", "40"});

        assertThat(fromEnvironment.getDefaultInfoLimit()).isEqualTo(25);
        assertThat(fromCli.getDefaultInfoLimit()).isEqualTo(40);
    }

    @Test
    void shouldListEveryEnvironmentVariableInHelp() {
        assertThat(ConfigurationLoader.getSettingsHelp())
                .contains("PROBE_DEFAULT_INFO_LIMIT              Same as --settings.info-limit");
    }

    @Test
    void shouldPreferCliOverEnvironmentOverFileOverDefaults() throws IOException {
        // Given
        Path settingsFile = tempDir.resolve("probe.yaml");
        Files.writeString(settingsFile, """
                cache_ttl_seconds: 30
                max_cache_items: 50
                default_runs: 7
                unknown_key: ignored
                """);
        environment.put("PROBE_CACHE_TTL_SECONDS", "90");
        environment.put("PROBE_MAX_CACHE_ITEMS", "75");
        String[] args = {"--settings.cache-ttl", "15"};

        // When
        ProbeSettings settings = loader.loadConfiguration(settingsFile, args);

        // Then
        assertThat(settings.getCacheTtlSeconds()).isEqualTo(15);
        assertThat(settings.getMaxCacheItems()).isEqualTo(75);
        assertThat(settings.getDefaultRuns()).isEqualTo(7);
        assertThat(settings.getEventTimeoutSeconds()).isEqualTo(30);
    }

    @Test
    void shouldIgnoreInvalidNumbers() {
        environment.put("PROBE_DEFAULT_RUNS", "many");
        String[] args = {"--settings.cache-ttl", "soon"};

        ProbeSettings settings = loader.loadConfiguration(args);

        assertThat(settings.getDefaultRuns()).isEqualTo(3);
        assertThat(settings.getCacheTtlSeconds()).isEqualTo(300);
    }

    @Test
    void shouldFailOnMissingSettingsFile() {
        Path missing = tempDir.resolve("missing.yaml");

        assertThatThrownBy(() -> loader.loadConfiguration(missing, new String[0]))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("missing.yaml");
    }

    @Test
    void shouldDescribeSettingsOptions() {
        assertThat(ConfigurationLoader.getSettingsHelp())
                .contains("--settings.cache-ttl")
                .contains("PROBE_EVENT_TIMEOUT_SECONDS");
    }
}
