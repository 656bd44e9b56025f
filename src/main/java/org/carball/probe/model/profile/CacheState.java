package org.carball.probe.model.profile;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CacheState {
    COLD("cold"),
    WARM("warm");

    private final String label;

    CacheState(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
