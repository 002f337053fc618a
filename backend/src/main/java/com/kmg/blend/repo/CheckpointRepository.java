package com.kmg.blend.repo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.kmg.blend.config.BlendProperties;
import com.kmg.blend.model.CheckpointStatus;
import com.kmg.blend.model.JobRecord;
import com.kmg.blend.service.TimeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

// Unreadable files load as absent so the job starts over.
@Repository
public class CheckpointRepository {
    private static final Logger log = LoggerFactory.getLogger(CheckpointRepository.class);

    public static final String FILE_SUFFIX = ".checkpoint.json";

    private final Path checkpointDir;
    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;
    private final TimeService timeService;

    @Autowired
    public CheckpointRepository(BlendProperties properties, ObjectMapper objectMapper, TimeService timeService) {
        this(properties.checkpointDirPath(), objectMapper, timeService);
    }

    public CheckpointRepository(Path checkpointDir, ObjectMapper objectMapper, TimeService timeService) {
        this.checkpointDir = checkpointDir;
        this.objectMapper = objectMapper;
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
        this.timeService = timeService;
    }

    public Optional<JobRecord> load(String jobId) {
        Path path = pathFor(jobId);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(read(path, jobId));
        } catch (IOException e) {
            log.warn("Ignoring unreadable checkpoint {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    public JobRecord save(JobRecord record) {
        JobRecord stamped = record.touchedAt(timeService.now());
        Path path = pathFor(stamped.jobId());
        try {
            Files.createDirectories(checkpointDir);
            Path temp = Files.createTempFile(checkpointDir, stamped.jobId(), ".tmp");
            try {
                writer.writeValue(temp.toFile(), stamped);
                moveIntoPlace(temp, path);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new CheckpointStoreException("Failed to write checkpoint: " + path, e);
        }
        log.debug("Checkpoint {} saved at stage {}", stamped.jobId(), stamped.stage().value());
        return stamped;
    }

    public boolean delete(String jobId) {
        try {
            return Files.deleteIfExists(pathFor(jobId));
        } catch (IOException e) {
            throw new CheckpointStoreException("Failed to delete checkpoint for " + jobId, e);
        }
    }

    public List<String> listIds() {
        return listFiles().stream()
                .map(this::jobIdOf)
                .toList();
    }

    public List<CheckpointStatus> readAll() {
        List<CheckpointStatus> statuses = new ArrayList<>();
        for (Path file : listFiles()) {
            String fileName = file.getFileName().toString();
            try {
                statuses.add(new CheckpointStatus(fileName, read(file, jobIdOf(file)), null));
            } catch (IOException e) {
                statuses.add(new CheckpointStatus(fileName, null, e.getMessage()));
            }
        }
        return statuses;
    }

    public int deleteAll() {
        int removed = 0;
        for (Path file : listFiles()) {
            try {
                if (Files.deleteIfExists(file)) {
                    removed++;
                }
            } catch (IOException e) {
                throw new CheckpointStoreException("Failed to delete checkpoint: " + file, e);
            }
        }
        return removed;
    }

    public Path checkpointDir() {
        return checkpointDir;
    }

    Path pathFor(String jobId) {
        return checkpointDir.resolve(jobId + FILE_SUFFIX);
    }

    private JobRecord read(Path path, String jobId) throws IOException {
        JobRecord record = objectMapper.readValue(path.toFile(), JobRecord.class);
        if (record == null || record.stage() == null) {
            throw new IOException("Checkpoint has no stage");
        }
        return record.jobId() == null ? record.withJobId(jobId) : record;
    }

    private List<Path> listFiles() {
        if (!Files.isDirectory(checkpointDir)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(checkpointDir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(FILE_SUFFIX))
                    .sorted(Comparator.comparing(Path::toString))
                    .toList();
        } catch (IOException e) {
            throw new CheckpointStoreException("Failed to list checkpoints in " + checkpointDir, e);
        }
    }

    private String jobIdOf(Path file) {
        String name = file.getFileName().toString();
        return name.substring(0, name.length() - FILE_SUFFIX.length());
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
