package org.carball.probe.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
