package com.kmg.blend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BlendSettings(
        @JsonProperty("mode") BlendMode mode,
        @JsonProperty("window_size") int windowSize,
        @JsonProperty("batch_size") int batchSize,
        @JsonProperty("tracking_window_size") int trackingWindowSize,
        @JsonProperty("minimum_patch_size") int minimumPatchSize,
        @JsonProperty("num_iter") int numIter,
        @JsonProperty("guide_weight") double guideWeight,
        @JsonProperty("initialize") InitializeMode initialize
) {

    public BlendSettings withDefaults(BlendSettings defaults) {
        return new BlendSettings(
                mode != null ? mode : defaults.mode(),
                windowSize > 0 ? windowSize : defaults.windowSize(),
                batchSize > 0 ? batchSize : defaults.batchSize(),
                trackingWindowSize >= 0 ? trackingWindowSize : defaults.trackingWindowSize(),
                minimumPatchSize > 0 ? minimumPatchSize : defaults.minimumPatchSize(),
                numIter > 0 ? numIter : defaults.numIter(),
                guideWeight > 0 ? guideWeight : defaults.guideWeight(),
                initialize != null ? initialize : defaults.initialize()
        );
    }
}
