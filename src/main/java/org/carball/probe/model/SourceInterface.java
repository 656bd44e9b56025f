package org.carball.probe.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which query surface answered a request.
 */
public enum SourceInterface {
    INTROSPECTION("introspection"),
    OBJECT_MODEL("object_model"),
    CACHE("cache");

    private final String wireName;

    SourceInterface(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
