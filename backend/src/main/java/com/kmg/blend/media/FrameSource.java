package com.kmg.blend.media;

import com.kmg.blend.model.FrameSequence;

import java.nio.file.Path;

public interface FrameSource {
    FrameSequence open(Path video);

    double fps(Path video);
}
