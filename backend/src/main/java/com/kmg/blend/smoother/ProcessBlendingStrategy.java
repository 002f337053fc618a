package com.kmg.blend.smoother;

import com.kmg.blend.config.BlendProperties;
import com.kmg.blend.media.ResourceExhaustedException;
import com.kmg.blend.media.VideoProcessingException;
import com.kmg.blend.model.BlendParameters;
import com.kmg.blend.model.FrameSequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public abstract class ProcessBlendingStrategy implements BlendingStrategy {
    private static final Logger log = LoggerFactory.getLogger(ProcessBlendingStrategy.class);

    private final SmootherProcess smootherProcess;
    private final List<String> baseCommand;

    protected ProcessBlendingStrategy(SmootherProcess smootherProcess, BlendProperties properties) {
        this.smootherProcess = smootherProcess;
        this.baseCommand = List.copyOf(properties.getSmoother().getCommand());
    }

    @Override
    public void run(FrameSequence guide, FrameSequence style, int batchSize, int windowSize,
                    BlendParameters parameters, Path outputDir) {
        List<String> command = buildCommand(guide, style, batchSize, windowSize, parameters, outputDir);
        String context = guide.source().getFileName() + "/" + mode().label();
        log.info("Starting {} blending of {} frames: {}", mode().label(), guide.frameCount(), command);

        SmootherProcess.ProcessResult result;
        try {
            result = smootherProcess.run(command, context);
        } catch (IOException e) {
            throw new VideoProcessingException("Failed to launch smoother: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VideoProcessingException("Interrupted while blending " + guide.source(), e);
        }

        if (result.exitCode() != 0) {
            String detail = result.stderr().isBlank() ? result.stdout() : result.stderr();
            if (SmootherProcess.indicatesMemoryExhaustion(detail)) {
                throw new ResourceExhaustedException("Smoother ran out of memory: " + lastLine(detail));
            }
            throw new VideoProcessingException(
                    "Smoother exited with code " + result.exitCode() + ": " + lastLine(detail));
        }
    }

    List<String> buildCommand(FrameSequence guide, FrameSequence style, int batchSize, int windowSize,
                              BlendParameters parameters, Path outputDir) {
        List<String> command = new ArrayList<>(baseCommand);
        command.add("--mode");
        command.add(mode().label());
        command.add("--guide");
        command.add(guide.source().toAbsolutePath().toString());
        command.add("--style");
        command.add(style.source().toAbsolutePath().toString());
        command.add("--batch-size");
        command.add(String.valueOf(batchSize));
        command.add("--window-size");
        command.add(String.valueOf(windowSize));
        command.add("--minimum-patch-size");
        command.add(String.valueOf(parameters.minimumPatchSize()));
        command.add("--threads-per-block");
        command.add(String.valueOf(parameters.threadsPerBlock()));
        command.add("--num-iter");
        command.add(String.valueOf(parameters.numIter()));
        command.add("--gpu-id");
        command.add(String.valueOf(parameters.gpuId()));
        command.add("--guide-weight");
        command.add(String.valueOf(parameters.guideWeight()));
        command.add("--initialize");
        command.add(parameters.initialize().value());
        addModeArguments(command, parameters);
        command.add("--save-path");
        command.add(outputDir.toAbsolutePath().toString());
        return command;
    }

    protected void addModeArguments(List<String> command, BlendParameters parameters) {
    }

    private static String lastLine(String text) {
        if (text == null || text.isBlank()) {
            return "no output";
        }
        String trimmed = text.trim();
        int newline = trimmed.lastIndexOf('\n');
        return newline < 0 ? trimmed : trimmed.substring(newline + 1);
    }
}
