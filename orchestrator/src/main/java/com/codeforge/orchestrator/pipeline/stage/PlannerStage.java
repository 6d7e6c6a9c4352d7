package com.codeforge.orchestrator.pipeline.stage;

import com.codeforge.orchestrator.agent.SystemPrompts;
import com.codeforge.orchestrator.llm.Message;
import com.codeforge.orchestrator.model.Plan;
import com.codeforge.orchestrator.model.PlannedFile;
import com.codeforge.orchestrator.model.Stage;
import com.codeforge.orchestrator.pipeline.StageContext;
import com.codeforge.orchestrator.pipeline.StageHandler;
import com.codeforge.orchestrator.sandbox.PathViolationException;
import com.codeforge.orchestrator.validation.StageSchemas;
import com.codeforge.orchestrator.validation.StructuredOutputValidator;
import com.codeforge.orchestrator.validation.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * PLANNING: turns the user's prompt into a {@link Plan}.
 *
 * Besides the schema, every planned path must stay inside the project root
 * and appear only once.
 */
@Component
public class PlannerStage implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(PlannerStage.class);

    private final StructuredOutputValidator validator;
    private final SystemPrompts             prompts;

    public PlannerStage(StructuredOutputValidator validator, SystemPrompts prompts) {
        this.validator = validator;
        this.prompts   = prompts;
    }

    @Override
    public Stage stage() {
        return Stage.PLANNING;
    }

    @Override
    public void run(StageContext ctx) {
        String request = ctx.withFeedback("USER REQUEST:\n" + ctx.project().getPrompt());
        String reply = ctx.generator().complete(ctx.config().effectiveModel(),
                List.of(Message.user(request)), prompts.planner());

        Plan plan = validator.validate(reply, StageSchemas.PLAN, Plan.class);
        checkPaths(plan, ctx);

        ctx.project().setPlan(plan);
        log.info("Plan '{}' with {} files: {}", plan.name(), plan.files().size(),
                plan.files().stream().map(PlannedFile::path).toList());
    }

    private static void checkPaths(Plan plan, StageContext ctx) {
        List<String> violations = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < plan.files().size(); i++) {
            String path = plan.files().get(i).path();
            String where = "files[" + i + "].path";
            if (path.isBlank()) {
                violations.add(where + ": must not be blank");
                continue;
            }
            try {
                ctx.gateway().resolve(path);
            } catch (PathViolationException e) {
                violations.add(where + ": '" + path + "' " + e.getReason());
                continue;
            }
            if (!seen.add(path)) {
                violations.add(where + ": '" + path + "' is listed more than once");
            }
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(StageSchemas.PLAN.name(), violations);
        }
    }
}
