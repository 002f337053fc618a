package com.kmg.blend.service;

import com.kmg.blend.model.CheckpointStatus;
import com.kmg.blend.repo.CheckpointRepository;
import com.kmg.blend.repo.JobIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

@Service
public class CheckpointInspector {
    private static final Logger log = LoggerFactory.getLogger(CheckpointInspector.class);

    private final CheckpointRepository checkpointRepository;

    public CheckpointInspector(CheckpointRepository checkpointRepository) {
        this.checkpointRepository = checkpointRepository;
    }

    public List<CheckpointStatus> status() {
        return checkpointRepository.readAll();
    }

    public int clearAll() {
        int removed = checkpointRepository.deleteAll();
        log.info("Cleared {} checkpoint(s) from {}", removed, checkpointRepository.checkpointDir());
        return removed;
    }

    public boolean clear(String inputName) {
        String jobId = JobIds.fromInput(Path.of(inputName));
        boolean removed = checkpointRepository.delete(jobId);
        log.info("Checkpoint {} {}", jobId, removed ? "removed" : "not found");
        return removed;
    }
}
