package com.kmg.blend.smoother;

import com.kmg.blend.config.BlendProperties;
import com.kmg.blend.model.BlendMode;
import org.springframework.stereotype.Service;

@Service
public class BalancedBlendingStrategy extends ProcessBlendingStrategy {

    public BalancedBlendingStrategy(SmootherProcess smootherProcess, BlendProperties properties) {
        super(smootherProcess, properties);
    }

    @Override
    public BlendMode mode() {
        return BlendMode.BALANCED;
    }
}
