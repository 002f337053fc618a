package com.kmg.blend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum InitializeMode {
    IDENTITY("identity"),
    RANDOM("random");

    private final String value;

    InitializeMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static InitializeMode fromValue(String value) {
        for (InitializeMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown initialize mode: " + value);
    }
}
