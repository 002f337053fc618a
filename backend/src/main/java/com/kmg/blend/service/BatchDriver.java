package com.kmg.blend.service;

import com.kmg.blend.model.BatchRequest;
import com.kmg.blend.model.JobOutcome;
import com.kmg.blend.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Service
public class BatchDriver {
    private static final Logger log = LoggerFactory.getLogger(BatchDriver.class);

    private final StageExecutor stageExecutor;
    private final InputScanner inputScanner;
    private final ProgressReporter reporter;

    public BatchDriver(StageExecutor stageExecutor, InputScanner inputScanner, ProgressReporter reporter) {
        this.stageExecutor = stageExecutor;
        this.inputScanner = inputScanner;
        this.reporter = reporter;
    }

    public RunSummary run(BatchRequest request) {
        Path source = request.sourceDir();
        if (!Files.isDirectory(source)) {
            log.warn("Source directory not found: {}", source);
            reporter.sourceMissing(source);
            return RunSummary.missing(source);
        }

        List<Path> videos;
        try {
            videos = inputScanner.listVideos(source);
        } catch (UncheckedIOException e) {
            log.warn("Source directory not readable: {}", source, e);
            reporter.sourceUnreadable(source, e.getCause().getMessage());
            return RunSummary.missing(source);
        }
        if (videos.isEmpty()) {
            log.info("No videos found in {}", source);
            reporter.noVideos(source);
            return RunSummary.of(source, List.of());
        }

        reporter.batchStarted(request, videos.size());
        createOutputRoot(request.outputRoot());

        List<JobOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < videos.size(); i++) {
            Path video = videos.get(i);
            reporter.jobQueued(i + 1, videos.size(), video.getFileName().toString());
            outcomes.add(runOne(video, request));
        }

        RunSummary summary = RunSummary.of(source, outcomes);
        log.info("Batch finished: {} succeeded, {} failed", summary.successCount(), summary.failureCount());
        reporter.summary(summary);
        return summary;
    }

    public RunSummary runSingle(Path video, BatchRequest request) {
        if (!Files.isRegularFile(video)) {
            log.warn("Video not found: {}", video);
            reporter.sourceMissing(video);
            return RunSummary.missing(video);
        }
        createOutputRoot(request.outputRoot());
        RunSummary summary = RunSummary.of(video, List.of(runOne(video, request)));
        reporter.summary(summary);
        return summary;
    }

    private JobOutcome runOne(Path video, BatchRequest request) {
        Path outputDir = request.outputRoot().resolve(InputScanner.stem(video));
        JobOutcome outcome = stageExecutor.execute(video, outputDir, request.settings());
        switch (outcome.status()) {
            case COMPLETED -> log.info("{} completed", outcome.inputName());
            case ALREADY_COMPLETED -> log.info("{} was already completed", outcome.inputName());
            case FAILED -> log.warn("{} failed at {}: {}", outcome.inputName(), outcome.stage().value(),
                    outcome.message());
        }
        return outcome;
    }

    private void createOutputRoot(Path outputRoot) {
        try {
            Files.createDirectories(outputRoot);
        } catch (IOException e) {
            // Each job creates its own directory during setup and records the failure there.
            log.warn("Failed to create output root {}: {}", outputRoot, e.getMessage());
        }
    }
}
