package com.codeforge.orchestrator.pipeline.stage;

import com.codeforge.orchestrator.agent.CodingSession;
import com.codeforge.orchestrator.agent.TaskOutcome;
import com.codeforge.orchestrator.agent.ToolCallingExecutor;
import com.codeforge.orchestrator.model.ErrorKind;
import com.codeforge.orchestrator.model.Stage;
import com.codeforge.orchestrator.model.Task;
import com.codeforge.orchestrator.model.TaskStatus;
import com.codeforge.orchestrator.pipeline.StageContext;
import com.codeforge.orchestrator.pipeline.StageFailedException;
import com.codeforge.orchestrator.pipeline.StageHandler;
import com.codeforge.orchestrator.pipeline.TaskDispatcher;
import com.codeforge.orchestrator.taskgraph.TaskGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * CODING: runs the coding loop for every task that is not done yet.
 *
 * A progress checkpoint is written after each task completes, so a resumed
 * run only executes the tasks that were still pending. The stage fails if
 * any task fails; the first failure's kind is what gets recorded.
 */
@Component
public class CodingStage implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(CodingStage.class);

    private final ToolCallingExecutor executor;

    public CodingStage(ToolCallingExecutor executor) {
        this.executor = executor;
    }

    @Override
    public Stage stage() {
        return Stage.CODING;
    }

    @Override
    public void run(StageContext ctx) {
        TaskGraph graph = ctx.project().getTaskGraph();
        List<Task> done = graph.tasksWithStatus(TaskStatus.DONE);
        if (!done.isEmpty()) {
            log.info("Skipping {} task(s) already done: {}", done.size(), done.stream().map(Task::getId).toList());
        }

        CodingSession session = new CodingSession(ctx.project().getId(), ctx.project().getPlan(), ctx.gateway(),
                ctx.generator(), ctx.config().effectiveModel(), ctx.budget(), ctx.cancellation(),
                ctx.config().enabledTools());
        TaskDispatcher dispatcher = new TaskDispatcher(executor, ctx.config().workers(),
                ctx.config().continueOnTaskFailure());

        List<TaskOutcome> outcomes = dispatcher.dispatch(graph, session, task -> ctx.progressCheckpoint().run());

        ctx.checkCancelled();

        Optional<TaskOutcome> firstFailure = outcomes.stream().filter(o -> !o.completed()).findFirst();
        if (firstFailure.isPresent()) {
            TaskOutcome f = firstFailure.get();
            Task task = graph.get(f.taskId());
            throw new StageFailedException(f.reason().errorKind(),
                    "Task " + f.taskId() + " (" + task.getFilePath() + ") failed: " + f.message());
        }
        if (!graph.isComplete()) {
            List<String> open = graph.tasksWithStatus(TaskStatus.PENDING).stream().map(Task::getId).toList();
            throw new StageFailedException(ErrorKind.BUDGET_EXHAUSTED, "Tasks left unfinished: " + open);
        }
        log.info("All {} tasks done; {} iterations of {} used",
                graph.size(), ctx.budget().consumed(), ctx.budget().limit());
    }
}
