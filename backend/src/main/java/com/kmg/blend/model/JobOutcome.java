package com.kmg.blend.model;

public record JobOutcome(
        String jobId,
        String inputName,
        Status status,
        Stage stage,
        String message
) {
    public enum Status {
        COMPLETED,
        ALREADY_COMPLETED,
        FAILED
    }

    public static JobOutcome completed(String jobId, String inputName, String outputVideo) {
        return new JobOutcome(jobId, inputName, Status.COMPLETED, Stage.COMPLETED, outputVideo);
    }

    public static JobOutcome alreadyCompleted(String jobId, String inputName, String outputVideo) {
        return new JobOutcome(jobId, inputName, Status.ALREADY_COMPLETED, Stage.COMPLETED, outputVideo);
    }

    public static JobOutcome failed(String jobId, String inputName, Stage failureStage, String message) {
        return new JobOutcome(jobId, inputName, Status.FAILED, failureStage, message);
    }

    public boolean success() {
        return status != Status.FAILED;
    }
}
