package com.codeforge.orchestrator.cli;

import com.codeforge.orchestrator.checkpoint.Checkpoint;
import com.codeforge.orchestrator.checkpoint.FileCheckpointStore;
import com.codeforge.orchestrator.model.Project;
import com.codeforge.orchestrator.model.Stage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class StatusCommandTest {

    @TempDir Path tmp;

    @Test
    void noCheckpoint_exitsOne() {
        FileCheckpointStore store = new FileCheckpointStore(tmp, new ObjectMapper());

        assertThat(new CommandLine(new StatusCommand(store)).execute("--name", "calc")).isEqualTo(1);
    }

    @Test
    void existingCheckpoint_exitsZero() {
        FileCheckpointStore store = new FileCheckpointStore(tmp, new ObjectMapper());
        store.save(Checkpoint.capture(new Project("calc", tmp.resolve("calc"), "build a calculator"),
                Stage.PLANNING));

        assertThat(new CommandLine(new StatusCommand(store)).execute("--name", "calc")).isZero();
    }
}
