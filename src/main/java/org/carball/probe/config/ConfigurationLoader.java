package org.carball.probe.config;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Consumer;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads settings using the hierarchy: CLI args > env vars > defaults.
     */
    public ProbeSettings loadConfiguration(String[] args) {
        return loadConfiguration(null, args);
    }

    /**
     * Loads settings using the hierarchy: CLI args > env vars > settings file > defaults.
     */
    public ProbeSettings loadConfiguration(Path settingsFile, String[] args) {
        log.debug("Loading configuration");

        // Start with defaults
        ProbeSettings.ProbeSettingsBuilder builder = ProbeSettings.builder();

        // 1. Apply settings file
        if (settingsFile != null) {
            applySettingsFile(builder, settingsFile);
        }

        // 2. Apply environment variables
        applyEnvironmentVariables(builder);

        // 3. Apply CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        ProbeSettings settings = builder.build();
        settings.validate();

        log.info("Configuration loaded: {}", settings.getConfigurationSummary());
        return settings;
    }

    private void applySettingsFile(ProbeSettings.ProbeSettingsBuilder builder, Path settingsFile) {
        try {
            SettingsFile.read(settingsFile).applyTo(builder);
            log.debug("Applied settings file {}", settingsFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read settings file " + settingsFile, e);
        }
    }

    private void applyEnvironmentVariables(ProbeSettings.ProbeSettingsBuilder builder) {
        applyInt("PROBE_CACHE_TTL_SECONDS", environment.get("PROBE_CACHE_TTL_SECONDS"), builder::cacheTtlSeconds);
        applyInt("PROBE_MAX_CACHE_ITEMS", environment.get("PROBE_MAX_CACHE_ITEMS"), builder::maxCacheItems);
        applyInt("PROBE_EVENT_TIMEOUT_SECONDS", environment.get("PROBE_EVENT_TIMEOUT_SECONDS"),
                builder::eventTimeoutSeconds);
        applyInt("PROBE_DEFAULT_RUNS", environment.get("PROBE_DEFAULT_RUNS"), builder::defaultRuns);
        applyLong("PROBE_POLL_INTERVAL_MILLIS", environment.get("PROBE_POLL_INTERVAL_MILLIS"),
                builder::pollIntervalMillis);
        applyInt("PROBE_COMMAND_TIMEOUT_SECONDS", environment.get("PROBE_COMMAND_TIMEOUT_SECONDS"),
                builder::commandTimeoutSeconds);
        applyInt("PROBE_SAFETY_MAX_ROWS", environment.get("PROBE_SAFETY_MAX_ROWS"), builder::safetyMaxRows);
        applyInt("PROBE_DEFAULT_INFO_LIMIT", environment.get("PROBE_DEFAULT_INFO_LIMIT"), builder::defaultInfoLimit);
        if (environment.containsKey("PROBE_CLEAR_CACHE_COMMAND")) {
            builder.clearCacheCommand(environment.get("PROBE_CLEAR_CACHE_COMMAND"));
        }
    }

    private void applyCLIArguments(ProbeSettings.ProbeSettingsBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            switch (arg) {
                case "--settings.cache-ttl":
                    applyInt(arg, value, builder::cacheTtlSeconds);
                    break;
                case "--settings.max-cache-items":
                    applyInt(arg, value, builder::maxCacheItems);
                    break;
                case "--settings.event-timeout":
                    applyInt(arg, value, builder::eventTimeoutSeconds);
                    break;
                case "--settings.runs":
                    applyInt(arg, value, builder::defaultRuns);
                    break;
                case "--settings.poll-interval":
                    applyLong(arg, value, builder::pollIntervalMillis);
                    break;
                case "--settings.command-timeout":
                    applyInt(arg, value, builder::commandTimeoutSeconds);
                    break;
                case "--settings.max-rows":
                    applyInt(arg, value, builder::safetyMaxRows);
                    break;
                case "--settings.info-limit":
                    applyInt(arg, value, builder::defaultInfoLimit);
                    break;
                case "--settings.clear-cache-command":
                    builder.clearCacheCommand(value);
                    break;
            }
        }
    }

    private void applyInt(String source, String value, Consumer<Integer> setter) {
        if (value == null) {
            return;
        }
        try {
            setter.accept(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        }
    }

    private void applyLong(String source, String value, Consumer<Long> setter) {
        if (value == null) {
            return;
        }
        try {
            setter.accept(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        }
    }

    /**
     * Returns help text for settings options.
     */
    public static String getSettingsHelp() {
        return """
            Settings Options:

            CLI Arguments:
              --settings.cache-ttl <sec>            Result cache time-to-live (default 300)
              --settings.max-cache-items <num>      Result cache capacity (default 200)
              --settings.event-timeout <sec>        Wait for trace events per run (default 30)
              --settings.runs <num>                 Profiling runs per query (default 3)
              --settings.poll-interval <ms>         Trace buffer poll interval (default 200)
              --settings.command-timeout <sec>      Engine command timeout (default 60)
              --settings.max-rows <num>             Safety cap on rows read (default 10000)
              --settings.info-limit <num>           Default TOPN for INFO queries (default 100)
              --settings.clear-cache-command <cmd>  Engine command that clears its caches

            Environment Variables:
              PROBE_CACHE_TTL_SECONDS               Same as --settings.cache-ttl
              PROBE_MAX_CACHE_ITEMS                 Same as --settings.max-cache-items
              PROBE_EVENT_TIMEOUT_SECONDS           Same as --settings.event-timeout
              PROBE_DEFAULT_RUNS                    Same as --settings.runs
              PROBE_POLL_INTERVAL_MILLIS            Same as --settings.poll-interval
              PROBE_COMMAND_TIMEOUT_SECONDS         Same as --settings.command-timeout
              PROBE_SAFETY_MAX_ROWS                 Same as --settings.max-rows
              PROBE_DEFAULT_INFO_LIMIT              Same as --settings.info-limit
              PROBE_CLEAR_CACHE_COMMAND             Same as --settings.clear-cache-command

            Settings File (--settings <yaml>):
              snake_case keys, e.g. cache_ttl_seconds: 120

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Settings file
              4. Built-in defaults
            """;
    }
}
