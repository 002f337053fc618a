package com.kmg.blend.service;

import com.kmg.blend.model.BatchRequest;
import com.kmg.blend.model.BlendSettings;
import com.kmg.blend.model.CheckpointStatus;
import com.kmg.blend.model.JobOutcome;
import com.kmg.blend.model.JobRecord;
import com.kmg.blend.model.RunSummary;
import com.kmg.blend.model.Stage;
import org.springframework.stereotype.Service;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

@Service
public class ProgressReporter {
    private static final String HEAVY_RULE = "#".repeat(60);
    private static final String RULE = "=".repeat(60);

    private final PrintStream out;

    public ProgressReporter() {
        this(System.out);
    }

    public ProgressReporter(PrintStream out) {
        this.out = out;
    }

    public void batchStarted(BatchRequest request, int videoCount) {
        out.println();
        out.println(HEAVY_RULE);
        out.println("FastBlend batch processing");
        out.println(HEAVY_RULE);
        out.println("Source: " + request.sourceDir());
        out.println("Output: " + request.outputRoot());
        out.println("Videos found: " + videoCount);
        out.println("Settings: " + describe(request.settings()));
        out.println(HEAVY_RULE);
    }

    public void jobQueued(int index, int total, String inputName) {
        out.println();
        out.printf("[%d/%d] %s%n", index, total, inputName);
    }

    public void jobStarted(String inputName, Path outputDir, BlendSettings settings) {
        out.println(RULE);
        out.println("Processing: " + inputName);
        out.println("Output: " + outputDir);
        out.println(describe(settings));
        out.println(RULE);
    }

    public void checkpointFound(JobRecord record) {
        out.println("Found checkpoint from " + (record.lastUpdated() == null ? "unknown time" : record.lastUpdated()));
        out.println("Stage: " + record.stage().value());
    }

    public void alreadyCompleted(String inputName) {
        out.println("Video already processed. Skipping: " + inputName);
    }

    public void stageEntered(Stage stage) {
        out.println("-> " + stage.value());
    }

    public void videoLoaded(int frames, String resolution, double fps) {
        out.printf("Frames: %d | Resolution: %s | FPS: %s%n", frames, resolution, fps);
    }

    public void jobSucceeded(String inputName, String outputVideo) {
        out.println(RULE);
        out.println("SUCCESS: " + inputName);
        out.println("Output: " + outputVideo);
        out.println(RULE);
    }

    public void jobFailed(JobOutcome outcome) {
        if (outcome.stage() == Stage.ERROR_MEMORY) {
            out.println("MEMORY ERROR: " + outcome.message());
            out.println("Try reducing blend.settings.batch-size");
        } else {
            out.println("ERROR: " + outcome.message());
        }
    }

    public void sourceMissing(Path source) {
        out.println("Source not found: " + source);
    }

    public void sourceUnreadable(Path source, String reason) {
        out.println("Source not readable: " + source + " (" + reason + ")");
    }

    public void noVideos(Path source) {
        out.println("No videos found in " + source);
    }

    public void summary(RunSummary summary) {
        out.println();
        out.println(HEAVY_RULE);
        out.println("PROCESSING COMPLETE");
        out.println(HEAVY_RULE);
        out.println("Successful: " + summary.successCount());
        out.println("Failed: " + summary.failureCount());

        List<JobOutcome> failures = summary.failures();
        if (!failures.isEmpty()) {
            out.println();
            out.println("Failed videos:");
            for (JobOutcome failure : failures) {
                out.println("  - " + failure.inputName() + " (" + failure.stage().value() + ")");
            }
            out.println();
            out.println("To retry failed videos, run the batch again.");
        }
    }

    public void status(List<CheckpointStatus> statuses) {
        if (statuses.isEmpty()) {
            out.println("No checkpoints found.");
            return;
        }
        out.println(RULE);
        out.println("CHECKPOINT STATUS");
        out.println(RULE);
        for (CheckpointStatus status : statuses) {
            out.println();
            if (!status.readable()) {
                out.println(status.fileName() + ": Unable to read");
                continue;
            }
            JobRecord record = status.record();
            out.println(record.jobId() + " (" + record.videoName() + "):");
            out.println("  Stage: " + record.stage().value());
            out.println("  Updated: " + (record.lastUpdated() == null ? "unknown" : record.lastUpdated()));
            if (record.error() != null && !record.error().isBlank()) {
                out.println("  Error: " + record.error());
            }
        }
    }

    public void cleared(int removed) {
        if (removed == 0) {
            out.println("No checkpoints to clear.");
        } else {
            out.println("Cleared " + removed + " checkpoint(s).");
        }
    }

    public void reset(String inputName, boolean removed) {
        out.println(removed ? "Checkpoint removed for " + inputName : "No checkpoint for " + inputName);
    }

    private String describe(BlendSettings settings) {
        return "Mode: " + settings.mode().label()
                + " | Window: " + settings.windowSize()
                + " | Iterations: " + settings.numIter()
                + " | Batch: " + settings.batchSize();
    }
}
