package com.kmg.blend.config;

import com.kmg.blend.model.BlendMode;
import com.kmg.blend.model.BlendSettings;
import com.kmg.blend.model.InitializeMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Validated
@ConfigurationProperties(prefix = "blend")
public class BlendProperties {
    @NotBlank
    private String baseDir;
    @Valid
    @NotNull
    private Source source = new Source();
    @Valid
    @NotNull
    private Output output = new Output();
    @Valid
    @NotNull
    private Checkpoint checkpoint = new Checkpoint();
    @Valid
    @NotNull
    private Logs logs = new Logs();
    @Valid
    @NotNull
    private Settings settings = new Settings();
    @Valid
    @NotNull
    private Smoother smoother = new Smoother();
    @Valid
    @NotNull
    private Video video = new Video();

    public String getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(String baseDir) {
        this.baseDir = baseDir;
    }

    public Source getSource() {
        return source;
    }

    public void setSource(Source source) {
        this.source = source;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Checkpoint getCheckpoint() {
        return checkpoint;
    }

    public void setCheckpoint(Checkpoint checkpoint) {
        this.checkpoint = checkpoint;
    }

    public Logs getLogs() {
        return logs;
    }

    public void setLogs(Logs logs) {
        this.logs = logs;
    }

    public Settings getSettings() {
        return settings;
    }

    public void setSettings(Settings settings) {
        this.settings = settings;
    }

    public Smoother getSmoother() {
        return smoother;
    }

    public void setSmoother(Smoother smoother) {
        this.smoother = smoother;
    }

    public Video getVideo() {
        return video;
    }

    public void setVideo(Video video) {
        this.video = video;
    }

    public Path checkpointDirPath() {
        return Path.of(checkpoint.getDir());
    }

    public static class Source {
        @NotBlank
        private String dir;
        @NotEmpty
        private Set<String> extensions = new LinkedHashSet<>(List.of("mp4", "avi", "mov", "mkv", "webm"));

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }

        public Set<String> getExtensions() {
            return extensions;
        }

        public void setExtensions(Set<String> extensions) {
            this.extensions = extensions;
        }
    }

    public static class Output {
        @NotBlank
        private String dir;
        @NotBlank
        private String videoName = "video.mp4";
        @NotBlank
        private String framesDirName = "frames";

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }

        public String getVideoName() {
            return videoName;
        }

        public void setVideoName(String videoName) {
            this.videoName = videoName;
        }

        public String getFramesDirName() {
            return framesDirName;
        }

        public void setFramesDirName(String framesDirName) {
            this.framesDirName = framesDirName;
        }
    }

    public static class Checkpoint {
        @NotBlank
        private String dir;

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }

    public static class Logs {
        @NotBlank
        private String dir;

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }

    public static class Settings {
        @NotNull
        private BlendMode mode = BlendMode.ACCURATE;
        @Positive
        private int windowSize = 15;
        @Positive
        private int batchSize = 2;
        @PositiveOrZero
        private int trackingWindowSize = 1;
        @Positive
        private int minimumPatchSize = 7;
        @Positive
        private int numIter = 5;
        @Positive
        private double guideWeight = 10.0;
        @NotNull
        private InitializeMode initialize = InitializeMode.IDENTITY;

        public BlendMode getMode() {
            return mode;
        }

        public void setMode(BlendMode mode) {
            this.mode = mode;
        }

        public int getWindowSize() {
            return windowSize;
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = windowSize;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getTrackingWindowSize() {
            return trackingWindowSize;
        }

        public void setTrackingWindowSize(int trackingWindowSize) {
            this.trackingWindowSize = trackingWindowSize;
        }

        public int getMinimumPatchSize() {
            return minimumPatchSize;
        }

        public void setMinimumPatchSize(int minimumPatchSize) {
            this.minimumPatchSize = minimumPatchSize;
        }

        public int getNumIter() {
            return numIter;
        }

        public void setNumIter(int numIter) {
            this.numIter = numIter;
        }

        public double getGuideWeight() {
            return guideWeight;
        }

        public void setGuideWeight(double guideWeight) {
            this.guideWeight = guideWeight;
        }

        public InitializeMode getInitialize() {
            return initialize;
        }

        public void setInitialize(InitializeMode initialize) {
            this.initialize = initialize;
        }

        public BlendSettings toBlendSettings() {
            return new BlendSettings(
                    mode,
                    windowSize,
                    batchSize,
                    trackingWindowSize,
                    minimumPatchSize,
                    numIter,
                    guideWeight,
                    initialize
            );
        }
    }

    public static class Smoother {
        @NotEmpty
        private List<String> command = new ArrayList<>(List.of("python", "-m", "FastBlend.cli"));
        @PositiveOrZero
        private int gpuId = 0;
        @Positive
        private int threadsPerBlock = 8;

        public List<String> getCommand() {
            return command;
        }

        public void setCommand(List<String> command) {
            this.command = command;
        }

        public int getGpuId() {
            return gpuId;
        }

        public void setGpuId(int gpuId) {
            this.gpuId = gpuId;
        }

        public int getThreadsPerBlock() {
            return threadsPerBlock;
        }

        public void setThreadsPerBlock(int threadsPerBlock) {
            this.threadsPerBlock = threadsPerBlock;
        }
    }

    public static class Video {
        @NotBlank
        private String ffmpegPath = "ffmpeg";
        @NotBlank
        private String ffprobePath = "ffprobe";
        @NotBlank
        private String framePattern = "%05d.png";
        @NotBlank
        private String codec = "libx264";
        @NotBlank
        private String pixelFormat = "yuv420p";

        public String getFfmpegPath() {
            return ffmpegPath;
        }

        public void setFfmpegPath(String ffmpegPath) {
            this.ffmpegPath = ffmpegPath;
        }

        public String getFfprobePath() {
            return ffprobePath;
        }

        public void setFfprobePath(String ffprobePath) {
            this.ffprobePath = ffprobePath;
        }

        public String getFramePattern() {
            return framePattern;
        }

        public void setFramePattern(String framePattern) {
            this.framePattern = framePattern;
        }

        public String getCodec() {
            return codec;
        }

        public void setCodec(String codec) {
            this.codec = codec;
        }

        public String getPixelFormat() {
            return pixelFormat;
        }

        public void setPixelFormat(String pixelFormat) {
            this.pixelFormat = pixelFormat;
        }
    }
}
