package com.kmg.blend.smoother;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class SmootherProcessTest {

    private final SmootherProcess process = new SmootherProcess();

    @Test
    void recognisesMemoryExhaustionMessages() {
        assertThat(SmootherProcess.indicatesMemoryExhaustion("RuntimeError: CUDA out of memory. Tried to allocate")).isTrue();
        assertThat(SmootherProcess.indicatesMemoryExhaustion("numpy.core._exceptions.MemoryError")).isTrue();
        assertThat(SmootherProcess.indicatesMemoryExhaustion("cupy.cuda.runtime.CUDARuntimeError: cudaErrorMemoryAllocation")).isTrue();
        assertThat(SmootherProcess.indicatesMemoryExhaustion("CUDA_ERROR_OUT_OF_MEMORY")).isTrue();
        assertThat(SmootherProcess.indicatesMemoryExhaustion("ValueError: bad window size")).isFalse();
        assertThat(SmootherProcess.indicatesMemoryExhaustion("")).isFalse();
        assertThat(SmootherProcess.indicatesMemoryExhaustion(null)).isFalse();
    }

    @Test
    void capturesExitCodeAndOutput() throws Exception {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")));

        SmootherProcess.ProcessResult result = process.run(
                List.of("/bin/sh", "-c", "echo blending; echo 'CUDA out of memory' 1>&2; exit 3"), "test");

        assertThat(result.exitCode()).isEqualTo(3);
        assertThat(result.stdout()).isEqualTo("blending");
        assertThat(result.stderr()).isEqualTo("CUDA out of memory");
    }

    @Test
    void keepsOnlyTheTailOfLongOutput() throws Exception {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")));

        SmootherProcess.ProcessResult result = process.run(
                List.of("/bin/sh", "-c", "i=1; while [ $i -le 100 ]; do echo line$i 1>&2; i=$((i+1)); done"), "test");

        List<String> lines = List.of(result.stderr().split("\n"));
        assertThat(result.exitCode()).isZero();
        assertThat(lines).hasSize(SmootherProcess.TAIL_LINES);
        assertThat(lines.get(lines.size() - 1)).isEqualTo("line100");
    }
}
