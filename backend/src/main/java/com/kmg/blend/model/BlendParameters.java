package com.kmg.blend.model;

public record BlendParameters(
        int minimumPatchSize,
        int threadsPerBlock,
        int numIter,
        int gpuId,
        double guideWeight,
        InitializeMode initialize,
        int trackingWindowSize
) {
    public static BlendParameters of(BlendSettings settings, int gpuId, int threadsPerBlock) {
        return new BlendParameters(
                settings.minimumPatchSize(),
                threadsPerBlock,
                settings.numIter(),
                gpuId,
                settings.guideWeight(),
                settings.initialize(),
                settings.trackingWindowSize()
        );
    }
}
