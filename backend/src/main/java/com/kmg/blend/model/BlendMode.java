package com.kmg.blend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BlendMode {
    FAST("Fast"),
    BALANCED("Balanced"),
    ACCURATE("Accurate");

    private final String label;

    BlendMode(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static BlendMode fromLabel(String value) {
        for (BlendMode mode : values()) {
            if (mode.label.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown blend mode: " + value);
    }
}
