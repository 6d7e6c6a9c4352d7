package com.codeforge.orchestrator.pipeline;

import com.codeforge.orchestrator.agent.CancellationToken;
import com.codeforge.orchestrator.agent.IterationBudget;
import com.codeforge.orchestrator.checkpoint.Checkpoint;
import com.codeforge.orchestrator.checkpoint.CheckpointException;
import com.codeforge.orchestrator.checkpoint.CheckpointStore;
import com.codeforge.orchestrator.llm.ExternalServiceException;
import com.codeforge.orchestrator.llm.TextGenerationClient;
import com.codeforge.orchestrator.model.ErrorKind;
import com.codeforge.orchestrator.model.FailureRecord;
import com.codeforge.orchestrator.model.Project;
import com.codeforge.orchestrator.model.ProjectStatus;
import com.codeforge.orchestrator.model.Stage;
import com.codeforge.orchestrator.sandbox.PathViolationException;
import com.codeforge.orchestrator.sandbox.SandboxedFileGateway;
import com.codeforge.orchestrator.validation.ValidationException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives one Project through
 * {@code PLANNING → ARCHITECTING → CODING → [REVIEWING] → [TESTING] → FINALIZING → DONE}.
 *
 * <p>{@link #advance} runs the current stage's handler, retries it with the
 * validation error as feedback up to {@code stageRetries} times, and writes a
 * checkpoint only once the stage's output has been validated and attached.
 * Disabled optional stages are still entered: they complete without work and
 * still checkpoint.
 *
 * <p>The only side effects are the handlers' collaborator calls and tool calls
 * and the checkpoint writes. Everything else a run needs (configuration,
 * collaborator, sandbox, budget, cancellation) is fixed at construction.
 *
 * <p>One instance drives one project; it is not shared between runs.
 */
public class PipelineStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PipelineStateMachine.class);

    private final RunConfig                  config;
    private final Map<Stage, StageHandler>   handlers = new EnumMap<>(Stage.class);
    private final CheckpointStore            checkpoints;
    private final TextGenerationClient       generator;
    private final SandboxedFileGateway       gateway;
    private final IterationBudget            budget;
    private final CancellationToken          cancellation;
    private final MeterRegistry              meterRegistry;

    public PipelineStateMachine(RunConfig config,
                                List<StageHandler> stageHandlers,
                                CheckpointStore checkpoints,
                                TextGenerationClient generator,
                                SandboxedFileGateway gateway,
                                CancellationToken cancellation,
                                MeterRegistry meterRegistry) {
        this.config        = config;
        this.checkpoints   = checkpoints;
        this.generator     = generator;
        this.gateway       = gateway;
        this.budget        = new IterationBudget(config.recursionLimit());
        this.cancellation  = cancellation;
        this.meterRegistry = meterRegistry;
        for (StageHandler h : stageHandlers) {
            handlers.put(h.stage(), h);
        }
        for (Stage s : Stage.values()) {
            if (!s.isTerminal() && !handlers.containsKey(s)) {
                throw new IllegalArgumentException("No handler for stage " + s);
            }
        }
    }

    // ------------------------------------------------------------------
    // Opening a project: fresh or resumed
    // ------------------------------------------------------------------

    /**
     * Restore the project from its checkpoint if one exists, positioned at the
     * stage after the last completed one; otherwise start a new project at PLANNING.
     *
     * @param prompt the user's request; may be null only when a checkpoint exists,
     *               and is ignored in favour of the stored one when it does
     * @throws IllegalArgumentException if there is neither a prompt nor a checkpoint
     */
    public Project open(String prompt) {
        String id = config.projectName();
        Optional<Checkpoint> saved = checkpoints.load(id);
        if (saved.isPresent()) {
            Checkpoint cp = saved.get();
            if (prompt != null && !prompt.isBlank() && !prompt.equals(cp.prompt())) {
                log.warn("Ignoring new prompt for {}; resuming with the prompt stored in its checkpoint", id);
            }
            Project project = cp.restore(gateway.root());
            project.setStage(cp.lastCompletedStage().next());
            project.setCheckpointLocation(checkpoints.locationOf(id));
            log.info("Resuming project {} after {} (checkpoint {})", id, cp.lastCompletedStage(), cp.timestamp());
            return project;
        }
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("No checkpoint for project '" + id + "'; a prompt is required");
        }
        return new Project(id, gateway.root(), prompt);
    }

    // ------------------------------------------------------------------
    // Running
    // ------------------------------------------------------------------

    /** Advance until DONE or FAILED. */
    public PipelineOutcome run(Project project) {
        MDC.put("projectId", project.getId());
        try {
            project.setStatus(ProjectStatus.RUNNING);
            log.info("Run started for {} at stage {}", project.getId(), project.getStage());
            while (!project.getStage().isTerminal()) {
                if (cancellation.isCancelled()) {
                    interrupt(project, project.getStage(), "run cancelled");
                    break;
                }
                advance(project);
            }
            if (project.getStage() == Stage.DONE) {
                // Also covers resuming a project whose last checkpoint is FINALIZING.
                project.setStatus(ProjectStatus.SUCCEEDED);
                log.info("Project {} done; output in {}", project.getId(), project.getRootDir());
            }
            return new PipelineOutcome(project, project.getStatus(), project.getFailure(),
                    project.getCheckpointLocation());
        } finally {
            MDC.remove("projectId");
        }
    }

    /**
     * Execute the current stage and move to the next one, or to FAILED.
     *
     * @return the project's new stage
     */
    public Stage advance(Project project) {
        Stage stage = project.getStage();
        if (stage.isTerminal()) {
            throw new IllegalStateException("Project " + project.getId() + " is already " + stage);
        }
        MDC.put("stage", stage.name());
        try {
            if (stage.isOptional() && !config.isEnabled(stage)) {
                log.info("Stage {} disabled; skipping", stage);
                count(stage, "skipped");
                return complete(project, stage);
            }
            return runWithRetries(project, stage);
        } finally {
            MDC.remove("stage");
        }
    }

    private Stage runWithRetries(Project project, Stage stage) {
        StageHandler handler = handlers.get(stage);
        int maxAttempts = config.stageRetries() + 1;
        String feedback = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (cancellation.isCancelled()) {
                return interrupt(project, stage, "run cancelled");
            }
            log.info("Stage {} attempt {}/{}", stage, attempt, maxAttempts);
            StageContext ctx = new StageContext(project, config, feedback, attempt, generator, gateway,
                    budget, cancellation, () -> saveProgress(project));
            try {
                handler.run(ctx);
                count(stage, "success");
                return complete(project, stage);
            } catch (ValidationException e) {
                feedback = e.toFeedback();
                count(stage, "retry");
                log.warn("Stage {} output rejected (attempt {}/{}): {}", stage, attempt, maxAttempts, e.getMessage());
                if (attempt == maxAttempts) {
                    return fail(project, stage, ErrorKind.VALIDATION, e.getMessage());
                }
            } catch (StageFailedException e) {
                if (e.getKind() == ErrorKind.INTERRUPTED) {
                    return interrupt(project, stage, e.getMessage());
                }
                return fail(project, stage, e.getKind(), e.getMessage());
            } catch (ExternalServiceException e) {
                return fail(project, stage, ErrorKind.EXTERNAL_SERVICE, e.getMessage());
            } catch (PathViolationException e) {
                return fail(project, stage, ErrorKind.PATH_VIOLATION, e.getMessage());
            } catch (CheckpointException | UncheckedIOException e) {
                return fail(project, stage, ErrorKind.TOOL_EXECUTION, e.getMessage());
            }
        }
        throw new IllegalStateException("unreachable");
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    private Stage complete(Project project, Stage stage) {
        try {
            project.setCheckpointLocation(checkpoints.save(Checkpoint.capture(project, stage)));
        } catch (CheckpointException e) {
            log.error("Checkpoint after {} failed: {}", stage, e.getMessage());
            return fail(project, stage, ErrorKind.TOOL_EXECUTION, e.getMessage());
        }
        Stage next = stage.next();
        project.setStage(next);
        if (next == Stage.DONE) {
            project.setStatus(ProjectStatus.SUCCEEDED);
        }
        log.info("Stage {} complete; next {}", stage, next);
        return next;
    }

    private Stage fail(Project project, Stage stage, ErrorKind kind, String message) {
        project.setFailure(new FailureRecord(stage, kind, message));
        project.setStage(Stage.FAILED);
        project.setStatus(ProjectStatus.FAILED);
        count(stage, "failed");
        log.error("Stage {} failed ({}): {}", stage, kind, message);
        return Stage.FAILED;
    }

    /** Cancellation: keep the last checkpoint, refreshing it with any coding progress. */
    private Stage interrupt(Project project, Stage stage, String message) {
        if (stage == Stage.CODING) {
            try {
                saveProgress(project);
            } catch (CheckpointException e) {
                log.error("Could not flush coding progress; resume will use the previous checkpoint: {}",
                        e.getMessage());
            }
        }
        project.setFailure(new FailureRecord(stage, ErrorKind.INTERRUPTED, message));
        project.setStage(Stage.FAILED);
        project.setStatus(ProjectStatus.INTERRUPTED);
        count(stage, "interrupted");
        log.warn("Run interrupted during {}; last checkpoint: {}", stage, project.getCheckpointLocation());
        return Stage.FAILED;
    }

    /** Intermediate checkpoint during CODING; the last completed stage stays ARCHITECTING. */
    private void saveProgress(Project project) {
        Stage lastCompleted = project.getStage().previous();
        if (lastCompleted == null) {
            return;
        }
        project.setCheckpointLocation(checkpoints.save(Checkpoint.capture(project, lastCompleted)));
    }

    private void count(Stage stage, String outcome) {
        meterRegistry.counter("codeforge.stage.runs", "stage", stage.name().toLowerCase(), "outcome", outcome)
                .increment();
    }

    public IterationBudget budget() {
        return budget;
    }
}
