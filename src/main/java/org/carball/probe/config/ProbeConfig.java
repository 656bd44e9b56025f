package org.carball.probe.config;

import lombok.Data;

import java.nio.file.Path;

@Data
public class ProbeConfig {
    private String command;
    private String connectionString;
    private String query;
    private Path modelFile;
    private Path traceFile;
    private Path settingsFile;
    private int runs;
    private boolean clearCacheFirst = true;
    private int maxRows;
    private boolean bypassCache;
    private String outputFile;
    private OutputFormat outputFormat = OutputFormat.JSON;
    private boolean verbose;
    private ProbeSettings settings;
}
