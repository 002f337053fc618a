package com.kmg.blend.media;

import java.nio.file.Path;

public interface VideoEncoder {
    void encode(Path framesDir, Path outputPath, int frameCount, double fps);
}
