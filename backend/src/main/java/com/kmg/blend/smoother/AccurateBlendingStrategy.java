package com.kmg.blend.smoother;

import com.kmg.blend.config.BlendProperties;
import com.kmg.blend.model.BlendMode;
import com.kmg.blend.model.BlendParameters;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class AccurateBlendingStrategy extends ProcessBlendingStrategy {
    public AccurateBlendingStrategy(SmootherProcess smootherProcess, BlendProperties properties) {
        super(smootherProcess, properties);
    }

    @Override
    public BlendMode mode() {
        return BlendMode.ACCURATE;
    }

    @Override
    protected void addModeArguments(List<String> command, BlendParameters parameters) {
        command.add("--tracking-window-size");
        command.add(String.valueOf(parameters.trackingWindowSize()));
    }
}
