package com.kmg.blend.media;

import com.kmg.blend.config.BlendProperties;
import net.bramp.ffmpeg.FFmpeg;
import net.bramp.ffmpeg.FFmpegExecutor;
import net.bramp.ffmpeg.FFprobe;
import net.bramp.ffmpeg.builder.FFmpegBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

@Service
public class FfmpegVideoEncoder implements VideoEncoder {
    private static final Logger log = LoggerFactory.getLogger(FfmpegVideoEncoder.class);

    private final BlendProperties.Video video;

    public FfmpegVideoEncoder(BlendProperties properties) {
        this.video = properties.getVideo();
    }

    @Override
    public void encode(Path framesDir, Path outputPath, int frameCount, double fps) {
        if (!Files.isDirectory(framesDir)) {
            throw new VideoProcessingException("Frames directory not found: " + framesDir);
        }

        FFmpegBuilder builder = buildCommand(framesDir, outputPath, frameCount, fps);
        try {
            // FFmpeg's constructor runs "ffmpeg -version"; create it per call so startup never needs the binary.
            FFmpeg ffmpeg = new FFmpeg(video.getFfmpegPath());
            FFprobe ffprobe = new FFprobe(video.getFfprobePath());
            log.info("Encoding {} frames at {} fps into {}", frameCount, fps, outputPath);
            new FFmpegExecutor(ffmpeg, ffprobe).createJob(builder).run();
        } catch (IOException e) {
            throw new VideoProcessingException("ffmpeg unavailable: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new VideoProcessingException("Encoding failed for " + outputPath + ": " + e.getMessage(), e);
        }
    }

    FFmpegBuilder buildCommand(Path framesDir, Path outputPath, int frameCount, double fps) {
        String rate = String.format(Locale.ROOT, "%.6f", fps);
        return new FFmpegBuilder()
                .overrideOutputFiles(true)
                .setFormat("image2")
                .addExtraArgs("-framerate", rate)
                .setInput(framesDir.resolve(video.getFramePattern()).toString())
                .addOutput(outputPath.toString())
                .setVideoCodec(video.getCodec())
                .setVideoPixelFormat(video.getPixelFormat())
                .addExtraArgs("-frames:v", String.valueOf(frameCount))
                .done();
    }
}
