package com.kmg.blend.cli;

import com.kmg.blend.config.BlendProperties;
import com.kmg.blend.model.BatchRequest;
import com.kmg.blend.model.RunSummary;
import com.kmg.blend.service.BatchDriver;
import com.kmg.blend.service.CheckpointInspector;
import com.kmg.blend.service.ProgressReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Component
@ConditionalOnProperty(prefix = "blend.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BatchCommandRunner implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(BatchCommandRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_JOB_FAILED = 1;
    static final int EXIT_NOT_FOUND = 2;

    private final BlendProperties properties;
    private final BatchDriver batchDriver;
    private final CheckpointInspector checkpointInspector;
    private final ProgressReporter reporter;

    private int exitCode = EXIT_OK;

    public BatchCommandRunner(
            BlendProperties properties,
            BatchDriver batchDriver,
            CheckpointInspector checkpointInspector,
            ProgressReporter reporter
    ) {
        this.properties = properties;
        this.batchDriver = batchDriver;
        this.checkpointInspector = checkpointInspector;
        this.reporter = reporter;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        if (args.containsOption("status")) {
            reporter.status(checkpointInspector.status());
            return;
        }
        if (args.containsOption("clear")) {
            reporter.cleared(checkpointInspector.clearAll());
            return;
        }
        String reset = optionValue(args, "reset");
        if (reset != null) {
            reporter.reset(reset, checkpointInspector.clear(reset));
            return;
        }

        BatchRequest request = buildRequest(args);
        createDirectories(request);

        String video = optionValue(args, "video");
        RunSummary summary = video != null
                ? batchDriver.runSingle(Path.of(video), request)
                : batchDriver.run(request);
        exitCode = exitCodeFor(summary, video != null);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    BatchRequest buildRequest(ApplicationArguments args) {
        String source = optionValue(args, "source");
        String output = optionValue(args, "output");
        return new BatchRequest(
                Path.of(source != null ? source : properties.getSource().getDir()),
                Path.of(output != null ? output : properties.getOutput().getDir()),
                properties.getSettings().toBlendSettings()
        );
    }

    static int exitCodeFor(RunSummary summary, boolean singleVideo) {
        if (summary.sourceMissing() && singleVideo) {
            return EXIT_NOT_FOUND;
        }
        return summary.hasFailures() ? EXIT_JOB_FAILED : EXIT_OK;
    }

    private void createDirectories(BatchRequest request) throws IOException {
        Files.createDirectories(properties.checkpointDirPath());
        Files.createDirectories(Path.of(properties.getLogs().getDir()));
        log.info("Source {} -> output {} ({})", request.sourceDir(), request.outputRoot(),
                request.settings().mode().label());
    }

    private static String optionValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.get(values.size() - 1);
        return value == null || value.isBlank() ? null : value;
    }
}
