package com.kmg.blend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Stage {
    STARTING("starting"),
    SETUP("setup"),
    LOADING("loading"),
    PROCESSING("processing"),
    ENCODING("encoding"),
    COMPLETED("completed"),
    ERROR("error"),
    ERROR_MEMORY("error_memory");

    private final String value;

    Stage(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isFailure() {
        return this == ERROR || this == ERROR_MEMORY;
    }

    @JsonCreator
    public static Stage fromValue(String value) {
        for (Stage stage : values()) {
            if (stage.value.equals(value)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + value);
    }
}
