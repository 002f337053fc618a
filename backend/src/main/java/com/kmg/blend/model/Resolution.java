package com.kmg.blend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public record Resolution(int width, int height) {

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Resolution parse(String text) {
        if (text == null) {
            return null;
        }
        int separator = text.toLowerCase().indexOf('x');
        if (separator <= 0 || separator == text.length() - 1) {
            throw new IllegalArgumentException("Invalid resolution: " + text);
        }
        return new Resolution(
                Integer.parseInt(text.substring(0, separator).trim()),
                Integer.parseInt(text.substring(separator + 1).trim())
        );
    }

    @JsonValue
    @Override
    public String toString() {
        return width + "x" + height;
    }
}
