package com.kmg.blend.model;

import java.nio.file.Path;
import java.util.List;

public record RunSummary(
        Path source,
        boolean sourceMissing,
        List<JobOutcome> outcomes
) {
    public RunSummary {
        outcomes = List.copyOf(outcomes);
    }

    public static RunSummary missing(Path source) {
        return new RunSummary(source, true, List.of());
    }

    public static RunSummary of(Path source, List<JobOutcome> outcomes) {
        return new RunSummary(source, false, outcomes);
    }

    public long successCount() {
        return outcomes.stream().filter(JobOutcome::success).count();
    }

    public long failureCount() {
        return outcomes.size() - successCount();
    }

    public List<JobOutcome> failures() {
        return outcomes.stream().filter(outcome -> !outcome.success()).toList();
    }

    public boolean hasFailures() {
        return failureCount() > 0;
    }
}
