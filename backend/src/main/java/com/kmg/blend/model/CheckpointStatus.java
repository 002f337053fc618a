package com.kmg.blend.model;

public record CheckpointStatus(
        String fileName,
        JobRecord record,
        String readError
) {
    public boolean readable() {
        return record != null;
    }
}
