package com.kmg.blend.model;

import java.nio.file.Path;

public record BatchRequest(
        Path sourceDir,
        Path outputRoot,
        BlendSettings settings
) {
}
