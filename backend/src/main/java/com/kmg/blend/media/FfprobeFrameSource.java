package com.kmg.blend.media;

import com.kmg.blend.config.BlendProperties;
import com.kmg.blend.model.FrameSequence;
import net.bramp.ffmpeg.FFprobe;
import net.bramp.ffmpeg.probe.FFmpegProbeResult;
import net.bramp.ffmpeg.probe.FFmpegStream;
import org.apache.commons.lang3.math.Fraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Service
public class FfprobeFrameSource implements FrameSource {
    private static final Logger log = LoggerFactory.getLogger(FfprobeFrameSource.class);

    private final String ffprobePath;

    public FfprobeFrameSource(BlendProperties properties) {
        this.ffprobePath = properties.getVideo().getFfprobePath();
    }

    @Override
    public FrameSequence open(Path video) {
        FFmpegStream stream = probeVideoStream(video);
        int frameCount = frameCount(stream, video);
        return new FrameSequence(video, frameCount, stream.width, stream.height);
    }

    @Override
    public double fps(Path video) {
        return frameRate(probeVideoStream(video));
    }

    private FFmpegStream probeVideoStream(Path video) {
        if (!Files.isRegularFile(video)) {
            throw new VideoProcessingException("Video not found: " + video);
        }
        try {
            FFprobe ffprobe = new FFprobe(ffprobePath);
            FFmpegProbeResult result = ffprobe.probe(video.toAbsolutePath().toString());
            return result.getStreams().stream()
                    .filter(stream -> stream.codec_type == FFmpegStream.CodecType.VIDEO)
                    .findFirst()
                    .orElseThrow(() -> new VideoProcessingException("No video stream in " + video));
        } catch (IOException e) {
            throw new VideoProcessingException("Failed to probe " + video + ": " + e.getMessage(), e);
        }
    }

    private int frameCount(FFmpegStream stream, Path video) {
        if (stream.nb_frames > 0) {
            return Math.toIntExact(stream.nb_frames);
        }
        // Matroska and WebM usually leave nb_frames empty.
        double rate = frameRate(stream);
        long estimated = Math.round(stream.duration * rate);
        log.debug("nb_frames missing for {}; estimated {} frames from duration", video, estimated);
        return (int) Math.max(0, estimated);
    }

    private double frameRate(FFmpegStream stream) {
        Fraction rate = stream.avg_frame_rate;
        if (rate == null || rate.getNumerator() == 0) {
            rate = stream.r_frame_rate;
        }
        if (rate == null || rate.getNumerator() == 0 || rate.getDenominator() == 0) {
            throw new VideoProcessingException("Unknown frame rate for stream " + stream.index);
        }
        return rate.doubleValue();
    }
}
