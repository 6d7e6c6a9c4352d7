package com.codeforge.orchestrator.cli;

import com.codeforge.orchestrator.checkpoint.Checkpoint;
import com.codeforge.orchestrator.checkpoint.CheckpointStore;
import com.codeforge.orchestrator.checkpoint.TaskSnapshot;
import com.codeforge.orchestrator.model.TaskStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: codeforge status --name &lt;project&gt;
 * <p>
 * Shows the last checkpoint of a project: completed stage, time and task statuses.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show the last checkpoint of a project")
@Component
public class StatusCommand implements Callable<Integer> {

    @Option(names = {"--name", "-n"}, required = true, description = "Project name")
    private String name;

    private final CheckpointStore checkpoints;

    public StatusCommand(CheckpointStore checkpoints) {
        this.checkpoints = checkpoints;
    }

    @Override
    public Integer call() {
        Optional<Checkpoint> saved = checkpoints.load(name);
        if (saved.isEmpty()) {
            ConsoleOutput.error("No checkpoint for project '" + name + "'");
            return 1;
        }
        Checkpoint cp = saved.get();
        ConsoleOutput.info("Project:              " + cp.projectId());
        ConsoleOutput.info("Last completed stage: " + cp.lastCompletedStage());
        ConsoleOutput.info("Checkpoint written:   " + cp.timestamp());
        ConsoleOutput.info("Checkpoint file:      " + checkpoints.locationOf(name));

        Map<String, TaskStatus> statuses = cp.orderedStatuses();
        if (!statuses.isEmpty()) {
            System.out.println();
            System.out.println("TASKS:");
            for (TaskSnapshot t : cp.taskGraph()) {
                ConsoleOutput.task(t.id(), t.filePath(), statuses.get(t.id()));
            }
        }
        if (!cp.skippedFiles().isEmpty()) {
            ConsoleOutput.warn("Skipped by optional stages: " + cp.skippedFiles());
        }
        return 0;
    }
}
