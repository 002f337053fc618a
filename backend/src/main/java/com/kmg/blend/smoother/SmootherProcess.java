package com.kmg.blend.smoother;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Consumer;

@Component
public class SmootherProcess {
    private static final Logger log = LoggerFactory.getLogger(SmootherProcess.class);

    static final int TAIL_LINES = 40;

    private static final List<String> MEMORY_MARKERS = List.of(
            "out of memory",
            "memoryerror",
            "outofmemoryerror",
            "cudaerrormemoryallocation",
            "cuda_error_out_of_memory"
    );

    public ProcessResult run(List<String> command, String contextInfo) throws IOException, InterruptedException {
        Process process = new ProcessBuilder(command).start();
        TailBuffer stdoutTail = new TailBuffer();
        TailBuffer stderrTail = new TailBuffer();

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> stdout = executor.submit(new StreamConsumer(process.getInputStream(), stdoutTail,
                    line -> log.info("[{}] [smoother] {}", contextInfo, line)));
            Future<?> stderr = executor.submit(new StreamConsumer(process.getErrorStream(), stderrTail,
                    line -> log.warn("[{}] [smoother-stderr] {}", contextInfo, line)));

            int exitCode = process.waitFor();
            awaitQuietly(stdout);
            awaitQuietly(stderr);
            return new ProcessResult(exitCode, stdoutTail.text(), stderrTail.text());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        } finally {
            executor.shutdownNow();
        }
    }

    public static boolean indicatesMemoryExhaustion(String output) {
        if (output == null || output.isBlank()) {
            return false;
        }
        String lower = output.toLowerCase(Locale.ROOT);
        return MEMORY_MARKERS.stream().anyMatch(lower::contains);
    }

    private void awaitQuietly(Future<?> future) throws InterruptedException {
        try {
            future.get();
        } catch (ExecutionException e) {
            log.warn("Smoother output reader failed: {}", e.getCause().getMessage());
        }
    }

    private static class TailBuffer {
        private final Deque<String> lines = new ArrayDeque<>();

        synchronized void add(String line) {
            if (lines.size() == TAIL_LINES) {
                lines.removeFirst();
            }
            lines.addLast(line);
        }

        synchronized String text() {
            return String.join("\n", lines).trim();
        }
    }

    private static class StreamConsumer implements Runnable {
        private final InputStream inputStream;
        private final TailBuffer tail;
        private final Consumer<String> lineLogger;

        StreamConsumer(InputStream inputStream, TailBuffer tail, Consumer<String> lineLogger) {
            this.inputStream = inputStream;
            this.tail = tail;
            this.lineLogger = lineLogger;
        }

        @Override
        public void run() {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    lineLogger.accept(line);
                    tail.add(line);
                }
            } catch (IOException e) {
                log.error("Error reading smoother output.", e);
            }
        }
    }

    public record ProcessResult(int exitCode, String stdout, String stderr) {
    }
}
