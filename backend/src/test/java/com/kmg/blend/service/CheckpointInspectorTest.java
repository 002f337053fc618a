package com.kmg.blend.service;

import com.kmg.blend.model.BlendMode;
import com.kmg.blend.model.CheckpointStatus;
import com.kmg.blend.model.JobRecord;
import com.kmg.blend.model.Stage;
import com.kmg.blend.repo.CheckpointRepository;
import com.kmg.blend.testutil.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CheckpointInspectorTest {

    @TempDir
    Path tempDir;

    private Path checkpointDir;
    private CheckpointRepository repository;
    private CheckpointInspector inspector;

    @BeforeEach
    void setUp() {
        checkpointDir = tempDir.resolve("checkpoints");
        repository = new CheckpointRepository(checkpointDir, Fixtures.objectMapper(), Fixtures.fixedTime());
        inspector = new CheckpointInspector(repository);
    }

    private void saveJob(String inputName, Stage stage) {
        Path input = tempDir.resolve(inputName);
        JobRecord record = JobRecord.start(
                inputName.replace('.', '_'), input, tempDir.resolve("out"), Fixtures.settings(BlendMode.FAST));
        repository.save(record.withStage(stage));
    }

    @Test
    void statusListsEveryCheckpointIncludingUnreadableOnes() throws Exception {
        saveJob("a.mp4", Stage.COMPLETED);
        saveJob("b.mp4", Stage.ERROR_MEMORY);
        Files.writeString(checkpointDir.resolve("broken.checkpoint.json"), "not json");

        List<CheckpointStatus> statuses = inspector.status();

        assertThat(statuses).extracting(CheckpointStatus::fileName).containsExactly(
                "a_mp4.checkpoint.json", "b_mp4.checkpoint.json", "broken.checkpoint.json");
        assertThat(statuses.get(1).record().stage()).isEqualTo(Stage.ERROR_MEMORY);
        assertThat(statuses.get(2).readable()).isFalse();
        assertThat(statuses.get(2).readError()).isNotBlank();
    }

    @Test
    void clearAllRemovesEverything() {
        saveJob("a.mp4", Stage.COMPLETED);
        saveJob("b.mp4", Stage.PROCESSING);

        assertThat(inspector.clearAll()).isEqualTo(2);
        assertThat(inspector.status()).isEmpty();
    }

    @Test
    void clearAllIsANoOpWithoutCheckpointDirectory() {
        assertThat(inspector.clearAll()).isZero();
        assertThat(inspector.status()).isEmpty();
    }

    @Test
    void clearRemovesOnlyTheNamedVideo() {
        saveJob("a.mp4", Stage.COMPLETED);
        saveJob("b.mp4", Stage.COMPLETED);

        assertThat(inspector.clear("a.mp4")).isTrue();
        assertThat(inspector.clear("a.mp4")).isFalse();
        assertThat(repository.listIds()).containsExactly("b_mp4");
    }
}
