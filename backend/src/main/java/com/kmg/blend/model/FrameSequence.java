package com.kmg.blend.model;

import java.nio.file.Path;

public record FrameSequence(
        Path source,
        int frameCount,
        int width,
        int height
) {
    public Resolution resolution() {
        return new Resolution(width, height);
    }
}
