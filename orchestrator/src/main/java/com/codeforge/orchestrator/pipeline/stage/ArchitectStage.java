package com.codeforge.orchestrator.pipeline.stage;

import com.codeforge.orchestrator.agent.SystemPrompts;
import com.codeforge.orchestrator.llm.Message;
import com.codeforge.orchestrator.model.Plan;
import com.codeforge.orchestrator.model.Stage;
import com.codeforge.orchestrator.pipeline.StageContext;
import com.codeforge.orchestrator.pipeline.StageHandler;
import com.codeforge.orchestrator.sandbox.PathViolationException;
import com.codeforge.orchestrator.taskgraph.TaskDraft;
import com.codeforge.orchestrator.taskgraph.TaskGraph;
import com.codeforge.orchestrator.taskgraph.TaskGraphBuilder;
import com.codeforge.orchestrator.taskgraph.TaskPlanDraft;
import com.codeforge.orchestrator.validation.StageSchemas;
import com.codeforge.orchestrator.validation.StructuredOutputValidator;
import com.codeforge.orchestrator.validation.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * ARCHITECTING: breaks the Plan into tasks and builds the {@link TaskGraph}.
 * Undefined dependencies and cycles are validation failures, so they are
 * retried with feedback like any malformed output.
 */
@Component
public class ArchitectStage implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(ArchitectStage.class);

    private final StructuredOutputValidator validator;
    private final SystemPrompts             prompts;
    private final ObjectMapper              objectMapper;

    public ArchitectStage(StructuredOutputValidator validator, SystemPrompts prompts, ObjectMapper objectMapper) {
        this.validator    = validator;
        this.prompts      = prompts;
        this.objectMapper = objectMapper;
    }

    @Override
    public Stage stage() {
        return Stage.ARCHITECTING;
    }

    @Override
    public void run(StageContext ctx) {
        Plan plan = ctx.project().getPlan();
        String request = ctx.withFeedback("PROJECT PLAN:\n" + toJson(plan));
        String reply = ctx.generator().complete(ctx.config().effectiveModel(),
                List.of(Message.user(request)), prompts.architect());

        TaskPlanDraft draft = validator.validate(reply, StageSchemas.TASK_PLAN, TaskPlanDraft.class);
        checkTargets(draft, ctx);
        TaskGraph graph = TaskGraphBuilder.build(plan, draft);

        ctx.project().setTaskGraph(graph);
        log.info("Task graph with {} tasks, execution order {}", graph.size(),
                graph.executionOrder().stream().map(t -> t.getId() + ":" + t.getFilePath()).toList());
    }

    private static void checkTargets(TaskPlanDraft draft, StageContext ctx) {
        List<String> violations = new ArrayList<>();
        if (draft.tasks().isEmpty()) {
            violations.add("tasks: must contain at least one task");
        }
        for (int i = 0; i < draft.tasks().size(); i++) {
            TaskDraft t = draft.tasks().get(i);
            try {
                ctx.gateway().resolve(t.filepath());
            } catch (PathViolationException e) {
                violations.add("tasks[" + i + "].filepath: '" + t.filepath() + "' " + e.getReason());
            }
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(StageSchemas.TASK_PLAN.name(), violations);
        }
    }

    private String toJson(Plan plan) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(plan);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise plan", e);
        }
    }
}
