package com.kmg.blend.smoother;

import com.kmg.blend.model.BlendMode;
import com.kmg.blend.model.BlendParameters;
import com.kmg.blend.model.FrameSequence;

import java.nio.file.Path;

public interface BlendingStrategy {
    BlendMode mode();

    void run(FrameSequence guide, FrameSequence style, int batchSize, int windowSize,
             BlendParameters parameters, Path outputDir);
}
