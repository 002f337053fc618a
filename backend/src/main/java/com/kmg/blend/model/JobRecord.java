package com.kmg.blend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.nio.file.Path;
import java.time.OffsetDateTime;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JobRecord(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("video_name") String videoName,
        @JsonProperty("video_path") String videoPath,
        @JsonProperty("output_dir") String outputDir,
        @JsonProperty("stage") Stage stage,
        @JsonProperty("settings") BlendSettings settings,
        @JsonProperty("num_frames") Integer numFrames,
        @JsonProperty("resolution") Resolution resolution,
        @JsonProperty("fps") Double fps,
        @JsonProperty("output_video") String outputVideo,
        @JsonProperty("error") String error,
        @JsonProperty("last_updated") @JsonDeserialize(using = LenientTimestampDeserializer.class)
        OffsetDateTime lastUpdated
) {
    public static JobRecord start(String jobId, Path inputPath, Path outputDir, BlendSettings settings) {
        return new JobRecord(
                jobId,
                inputPath.getFileName().toString(),
                inputPath.toString(),
                outputDir.toString(),
                Stage.STARTING,
                settings,
                null,
                null,
                null,
                null,
                null,
                null
        );
    }

    public JobRecord retry(Path inputPath, Path outputDir, BlendSettings fallbackSettings) {
        return new JobRecord(
                jobId,
                inputPath.getFileName().toString(),
                inputPath.toString(),
                outputDir.toString(),
                stage,
                settings != null ? settings.withDefaults(fallbackSettings) : fallbackSettings,
                numFrames,
                resolution,
                fps,
                outputVideo,
                error,
                lastUpdated
        );
    }

    public JobRecord withJobId(String id) {
        return new JobRecord(id, videoName, videoPath, outputDir, stage, settings, numFrames, resolution, fps,
                outputVideo, error, lastUpdated);
    }

    public JobRecord withStage(Stage next) {
        return new JobRecord(jobId, videoName, videoPath, outputDir, next, settings, numFrames, resolution, fps,
                outputVideo, error, lastUpdated);
    }

    public JobRecord withVideoInfo(int frames, Resolution size, double framesPerSecond) {
        return new JobRecord(jobId, videoName, videoPath, outputDir, stage, settings, frames, size, framesPerSecond,
                outputVideo, error, lastUpdated);
    }

    public JobRecord completed(Path videoOutput) {
        return new JobRecord(jobId, videoName, videoPath, outputDir, Stage.COMPLETED, settings, numFrames, resolution,
                fps, videoOutput.toString(), null, lastUpdated);
    }

    public JobRecord failed(Stage failureStage, String message) {
        return new JobRecord(jobId, videoName, videoPath, outputDir, failureStage, settings, numFrames, resolution,
                fps, outputVideo, message, lastUpdated);
    }

    public JobRecord touchedAt(OffsetDateTime updatedAt) {
        return new JobRecord(jobId, videoName, videoPath, outputDir, stage, settings, numFrames, resolution, fps,
                outputVideo, error, updatedAt);
    }
}
