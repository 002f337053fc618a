package com.kmg.blend.smoother;

import com.kmg.blend.model.BlendMode;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class BlendingStrategyRegistry {
    private final Map<BlendMode, BlendingStrategy> strategies = new EnumMap<>(BlendMode.class);

    public BlendingStrategyRegistry(List<BlendingStrategy> strategies) {
        for (BlendingStrategy strategy : strategies) {
            BlendingStrategy previous = this.strategies.put(strategy.mode(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate blending strategy for mode " + strategy.mode().label());
            }
        }
    }

    public BlendingStrategy forMode(BlendMode mode) {
        BlendingStrategy strategy = strategies.get(mode);
        if (strategy == null) {
            throw new IllegalStateException("No blending strategy registered for mode " + mode.label());
        }
        return strategy;
    }
}
