package com.kmg.blend.smoother;

import com.kmg.blend.config.BlendProperties;
import com.kmg.blend.model.BlendMode;
import org.springframework.stereotype.Service;

@Service
public class FastBlendingStrategy extends ProcessBlendingStrategy {

    public FastBlendingStrategy(SmootherProcess smootherProcess, BlendProperties properties) {
        super(smootherProcess, properties);
    }

    @Override
    public BlendMode mode() {
        return BlendMode.FAST;
    }
}
