package com.kmg.blend.service;

import com.kmg.blend.config.BlendProperties;
import com.kmg.blend.media.FrameSource;
import com.kmg.blend.media.ResourceExhaustedException;
import com.kmg.blend.media.VideoEncoder;
import com.kmg.blend.media.VideoProcessingException;
import com.kmg.blend.model.BlendParameters;
import com.kmg.blend.model.BlendSettings;
import com.kmg.blend.model.FrameSequence;
import com.kmg.blend.model.JobOutcome;
import com.kmg.blend.model.JobRecord;
import com.kmg.blend.model.Stage;
import com.kmg.blend.repo.CheckpointRepository;
import com.kmg.blend.repo.CheckpointStoreException;
import com.kmg.blend.repo.JobIds;
import com.kmg.blend.smoother.BlendingStrategyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

// Only a completed checkpoint short-circuits; anything else restarts at setup.
@Service
public class StageExecutor {
    private static final Logger log = LoggerFactory.getLogger(StageExecutor.class);

    private final CheckpointRepository checkpointRepository;
    private final FrameSource frameSource;
    private final BlendingStrategyRegistry strategyRegistry;
    private final VideoEncoder videoEncoder;
    private final ProgressReporter reporter;
    private final BlendProperties properties;

    public StageExecutor(
            CheckpointRepository checkpointRepository,
            FrameSource frameSource,
            BlendingStrategyRegistry strategyRegistry,
            VideoEncoder videoEncoder,
            ProgressReporter reporter,
            BlendProperties properties
    ) {
        this.checkpointRepository = checkpointRepository;
        this.frameSource = frameSource;
        this.strategyRegistry = strategyRegistry;
        this.videoEncoder = videoEncoder;
        this.reporter = reporter;
        this.properties = properties;
    }

    public JobOutcome execute(Path inputPath, Path outputDir, BlendSettings defaults) {
        String inputName = inputPath.getFileName().toString();
        String jobId = JobIds.fromInput(inputPath);
        JobRecord job = JobRecord.start(jobId, inputPath, outputDir, defaults);

        try {
            Optional<JobRecord> existing = checkpointRepository.load(jobId);
            if (existing.isPresent()) {
                JobRecord previous = existing.get();
                reporter.checkpointFound(previous);
                if (previous.stage() == Stage.COMPLETED) {
                    log.info("Job {} already completed; skipping", jobId);
                    reporter.alreadyCompleted(inputName);
                    return JobOutcome.alreadyCompleted(jobId, inputName, previous.outputVideo());
                }
                log.info("Job {} resuming from stage {}; restarting at setup", jobId, previous.stage().value());
                job = previous.retry(inputPath, outputDir, defaults);
            }
            BlendSettings settings = job.settings();
            reporter.jobStarted(inputName, outputDir, settings);

            job = enter(job, Stage.SETUP);
            Path framesDir = prepareDirectories(outputDir);

            job = enter(job, Stage.LOADING);
            FrameSequence guide = frameSource.open(inputPath);
            FrameSequence style = frameSource.open(inputPath);
            if (guide.frameCount() <= 0) {
                throw new VideoProcessingException("No decodable frames in " + inputPath);
            }
            double fps = frameSource.fps(inputPath);
            log.info("Job {} loaded {} frames at {} ({} fps)", jobId, guide.frameCount(), guide.resolution(), fps);
            reporter.videoLoaded(guide.frameCount(), guide.resolution().toString(), fps);
            job = checkpointRepository.save(job.withVideoInfo(guide.frameCount(), guide.resolution(), fps));

            job = enter(job, Stage.PROCESSING);
            BlendParameters parameters = BlendParameters.of(
                    settings,
                    properties.getSmoother().getGpuId(),
                    properties.getSmoother().getThreadsPerBlock()
            );
            strategyRegistry.forMode(settings.mode())
                    .run(guide, style, settings.batchSize(), settings.windowSize(), parameters, framesDir);

            job = enter(job, Stage.ENCODING);
            Path videoOutput = outputDir.resolve(properties.getOutput().getVideoName());
            videoEncoder.encode(framesDir, videoOutput, guide.frameCount(), fps);

            job = checkpointRepository.save(job.completed(videoOutput));
            reporter.stageEntered(Stage.COMPLETED);
            log.info("Job {} completed: {}", jobId, videoOutput);
            reporter.jobSucceeded(inputName, job.outputVideo());
            return JobOutcome.completed(jobId, inputName, job.outputVideo());
        } catch (ResourceExhaustedException | OutOfMemoryError e) {
            log.error("Job {} ran out of memory during {}: {}", jobId, job.stage().value(), describe(e));
            return fail(job, Stage.ERROR_MEMORY, e);
        } catch (Exception e) {
            log.error("Job {} failed during {}", jobId, job.stage().value(), e);
            return fail(job, Stage.ERROR, e);
        }
    }

    private JobRecord enter(JobRecord job, Stage stage) {
        reporter.stageEntered(stage);
        return checkpointRepository.save(job.withStage(stage));
    }

    private Path prepareDirectories(Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        return Files.createDirectories(outputDir.resolve(properties.getOutput().getFramesDirName()));
    }

    private JobOutcome fail(JobRecord job, Stage failureStage, Throwable cause) {
        String message = describe(cause);
        try {
            checkpointRepository.save(job.failed(failureStage, message));
        } catch (CheckpointStoreException e) {
            log.error("Could not record failure of job {}: {}", job.jobId(), e.getMessage(), e);
        }
        JobOutcome outcome = JobOutcome.failed(job.jobId(), job.videoName(), failureStage, message);
        reporter.jobFailed(outcome);
        return outcome;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }
}
