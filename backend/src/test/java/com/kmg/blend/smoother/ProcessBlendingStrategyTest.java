package com.kmg.blend.smoother;

import com.kmg.blend.config.BlendProperties;
import com.kmg.blend.media.ResourceExhaustedException;
import com.kmg.blend.media.VideoProcessingException;
import com.kmg.blend.model.BlendParameters;
import com.kmg.blend.model.FrameSequence;
import com.kmg.blend.model.InitializeMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProcessBlendingStrategyTest {

    private final Path video = Path.of("/data/sources/clip.mp4");
    private final FrameSequence guide = new FrameSequence(video, 10, 1280, 720);
    private final FrameSequence style = new FrameSequence(video, 10, 1280, 720);
    private final BlendParameters parameters =
            new BlendParameters(7, 8, 5, 1, 10.0, InitializeMode.RANDOM, 3);
    private final Path framesDir = Path.of("/data/results/clip/frames");

    private SmootherProcess smootherProcess;
    private BlendProperties properties;

    @BeforeEach
    void setUp() {
        smootherProcess = mock(SmootherProcess.class);
        properties = new BlendProperties();
        properties.getSmoother().setCommand(List.of("python3", "-m", "FastBlend.cli"));
    }

    @Test
    void passesEveryParameterToTheSmoother() {
        List<String> command = new FastBlendingStrategy(smootherProcess, properties)
                .buildCommand(guide, style, 4, 9, parameters, framesDir);

        assertThat(command).startsWith("python3", "-m", "FastBlend.cli");
        assertThat(command).containsSubsequence("--mode", "Fast");
        assertThat(command).containsSubsequence("--guide", video.toAbsolutePath().toString());
        assertThat(command).containsSubsequence("--batch-size", "4");
        assertThat(command).containsSubsequence("--window-size", "9");
        assertThat(command).containsSubsequence("--minimum-patch-size", "7");
        assertThat(command).containsSubsequence("--threads-per-block", "8");
        assertThat(command).containsSubsequence("--num-iter", "5");
        assertThat(command).containsSubsequence("--gpu-id", "1");
        assertThat(command).containsSubsequence("--guide-weight", "10.0");
        assertThat(command).containsSubsequence("--initialize", "random");
        assertThat(command).endsWith("--save-path", framesDir.toAbsolutePath().toString());
        assertThat(command).doesNotContain("--tracking-window-size");
    }

    @Test
    void onlyAccurateModeTracksAcrossFrames() {
        List<String> balanced = new BalancedBlendingStrategy(smootherProcess, properties)
                .buildCommand(guide, style, 2, 15, parameters, framesDir);
        List<String> accurate = new AccurateBlendingStrategy(smootherProcess, properties)
                .buildCommand(guide, style, 2, 15, parameters, framesDir);

        assertThat(balanced).containsSubsequence("--mode", "Balanced").doesNotContain("--tracking-window-size");
        assertThat(accurate).containsSubsequence("--mode", "Accurate")
                .containsSubsequence("--tracking-window-size", "3");
    }

    @Test
    void successfulRunReturnsNormally() throws Exception {
        when(smootherProcess.run(anyList(), anyString()))
                .thenReturn(new SmootherProcess.ProcessResult(0, "done", ""));

        new FastBlendingStrategy(smootherProcess, properties).run(guide, style, 2, 15, parameters, framesDir);

        verify(smootherProcess).run(any(), anyString());
    }

    @Test
    void memoryMarkersRaiseResourceExhaustion() throws Exception {
        when(smootherProcess.run(anyList(), anyString()))
                .thenReturn(new SmootherProcess.ProcessResult(1, "", "Traceback\nRuntimeError: CUDA out of memory"));

        assertThatThrownBy(() -> new AccurateBlendingStrategy(smootherProcess, properties)
                .run(guide, style, 2, 15, parameters, framesDir))
                .isInstanceOf(ResourceExhaustedException.class)
                .hasMessageContaining("CUDA out of memory");
    }

    @Test
    void otherFailuresRaiseProcessingError() throws Exception {
        when(smootherProcess.run(anyList(), anyString()))
                .thenReturn(new SmootherProcess.ProcessResult(2, "", "ValueError: window too large"));

        assertThatThrownBy(() -> new FastBlendingStrategy(smootherProcess, properties)
                .run(guide, style, 2, 15, parameters, framesDir))
                .isInstanceOf(VideoProcessingException.class)
                .isNotInstanceOf(ResourceExhaustedException.class)
                .hasMessageContaining("code 2")
                .hasMessageContaining("window too large");
    }

    @Test
    void launchFailureRaisesProcessingError() throws Exception {
        when(smootherProcess.run(anyList(), anyString())).thenThrow(new IOException("No such file"));

        assertThatThrownBy(() -> new FastBlendingStrategy(smootherProcess, properties)
                .run(guide, style, 2, 15, parameters, framesDir))
                .isInstanceOf(VideoProcessingException.class)
                .hasMessageContaining("Failed to launch smoother");
    }
}
