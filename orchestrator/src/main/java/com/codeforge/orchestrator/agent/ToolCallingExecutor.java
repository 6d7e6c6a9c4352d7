package com.codeforge.orchestrator.agent;

import com.codeforge.orchestrator.llm.ExternalServiceException;
import com.codeforge.orchestrator.llm.Message;
import com.codeforge.orchestrator.model.Task;
import com.codeforge.orchestrator.model.TaskStatus;
import com.codeforge.orchestrator.model.ToolCall;
import com.codeforge.orchestrator.skill.Skill;
import com.codeforge.orchestrator.skill.SkillException;
import com.codeforge.orchestrator.skill.SkillExecutionContext;
import com.codeforge.orchestrator.skill.SkillRegistry;
import com.codeforge.orchestrator.skill.ToolArguments;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The coding loop: drives one Task to completion by alternating a call to the
 * text-generation collaborator with at most one tool call.
 *
 * The loop is bounded and its exits are enumerable ({@link ExitReason}):
 * <ul>
 *   <li>the collaborator writes {@code <result>} and the task's file exists: COMPLETED</li>
 *   <li>the shared {@link IterationBudget} is spent: BUDGET_EXHAUSTED</li>
 *   <li>a tool call raises a fatal error (sandbox escape): FATAL_TOOL_ERROR</li>
 *   <li>the collaborator stays unreachable after its retries: EXTERNAL_SERVICE_ERROR</li>
 *   <li>the run was cancelled: CANCELLED</li>
 * </ul>
 * Every other tool failure is returned to the collaborator as an error
 * observation and the loop continues. Tool calls within one task run strictly
 * one after another on the calling thread.
 */
@Component
public class ToolCallingExecutor {

    private static final Logger log = LoggerFactory.getLogger(ToolCallingExecutor.class);

    static final String NUDGE =
            "Continue. Call a tool with a ```tool block, or write <result>...</result> when the file is complete.";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final SkillRegistry registry;
    private final SystemPrompts systemPrompts;
    private final ObjectMapper  objectMapper;

    public ToolCallingExecutor(SkillRegistry registry, SystemPrompts systemPrompts, ObjectMapper objectMapper) {
        this.registry      = registry;
        this.systemPrompts = systemPrompts;
        this.objectMapper  = objectMapper;
    }

    /** A decoded tool-call request. */
    record ToolRequest(String tool, Map<String, Object> args) {}

    /**
     * Run the loop for one task. Sets the task's status to IN_PROGRESS on entry
     * and to DONE or FAILED on exit; a cancelled task goes back to PENDING so a
     * resumed run picks it up again.
     */
    public TaskOutcome execute(Task task, CodingSession session) {
        String previousTaskId = MDC.get("taskId");
        MDC.put("taskId", task.getId());
        try {
            task.setStatus(TaskStatus.IN_PROGRESS);
            log.info("Starting coding loop for {} ({})", task.getId(), task.getFilePath());
            TaskOutcome outcome = loop(task, session);
            task.setStatus(switch (outcome.reason()) {
                case COMPLETED -> TaskStatus.DONE;
                case CANCELLED -> TaskStatus.PENDING;
                default        -> TaskStatus.FAILED;
            });
            if (outcome.completed()) {
                log.info("Task {} completed after {} iterations", task.getId(), outcome.iterations());
            } else {
                log.warn("Task {} stopped: {} ({})", task.getId(), outcome.reason(), outcome.message());
            }
            return outcome;
        } finally {
            if (previousTaskId == null) {
                MDC.remove("taskId");
            } else {
                MDC.put("taskId", previousTaskId);
            }
        }
    }

    private TaskOutcome loop(Task task, CodingSession session) {
        SkillExecutionContext ctx = new SkillExecutionContext(
                session.gateway(), session.projectId(), task.getId(), session.plan().requiredPackages());
        String systemPrompt = systemPrompts.coder(session.enabledTools());

        List<Message> conversation = new ArrayList<>();
        conversation.add(Message.user(initialPrompt(task, session)));
        Map<String, Integer> callCounts = new HashMap<>();
        int iterations = 0;

        while (true) {
            if (session.cancellation().isCancelled()) {
                return new TaskOutcome(task.getId(), ExitReason.CANCELLED, iterations, "run cancelled");
            }
            if (!session.budget().tryConsume()) {
                return new TaskOutcome(task.getId(), ExitReason.BUDGET_EXHAUSTED, iterations,
                        "iteration budget of " + session.budget().limit() + " exhausted");
            }
            iterations++;
            log.debug("Iteration {} for {} ({} left in budget)", iterations, task.getId(), session.budget().remaining());

            String reply;
            try {
                reply = session.generator().complete(session.model(), conversation, systemPrompt);
            } catch (ExternalServiceException e) {
                return new TaskOutcome(task.getId(), ExitReason.EXTERNAL_SERVICE_ERROR, iterations, e.getMessage());
            }
            conversation.add(Message.assistant(reply));

            Optional<String> toolJson = ResponseParser.extractToolCall(reply);
            Optional<String> result   = ResponseParser.extractResult(reply);

            String observation = null;
            if (toolJson.isPresent()) {
                try {
                    observation = runTool(task, toolJson.get(), ctx, session.enabledTools(), callCounts);
                } catch (SkillException e) {
                    // Only fatal errors escape runTool.
                    return new TaskOutcome(task.getId(), ExitReason.FATAL_TOOL_ERROR, iterations, e.getMessage());
                }
            }

            if (result.isPresent()) {
                if (session.gateway().exists(task.getFilePath())) {
                    return new TaskOutcome(task.getId(), ExitReason.COMPLETED, iterations, result.get());
                }
                observation = (observation == null ? "" : observation + "\n\n")
                        + "Not done yet: " + task.getFilePath() + " has not been written. Write it with write_file.";
            }

            conversation.add(Message.user(observation == null ? NUDGE : "Observation:\n" + observation));
        }
    }

    /**
     * Decode and run one tool call, returning the observation text.
     *
     * @throws SkillException only for fatal errors; every recoverable failure
     *                        becomes an error observation
     */
    private String runTool(Task task, String json, SkillExecutionContext ctx,
                           Set<String> enabledTools, Map<String, Integer> callCounts) {
        ToolRequest request;
        try {
            request = decode(json);
        } catch (IllegalArgumentException e) {
            return "ERROR [INVALID_ARGUMENTS] " + e.getMessage();
        }

        String tool = request.tool();
        try {
            if (!enabledTools.contains(tool)) {
                throw new SkillException(SkillException.Kind.UNKNOWN_TOOL,
                        "tool '" + tool + "' is not available in this run");
            }
            Skill<?, ?> skill = registry.get(tool);
            int max = skill.policy().maxCallsPerTask();
            int used = callCounts.getOrDefault(tool, 0);
            if (max > 0 && used >= max) {
                throw new SkillException(SkillException.Kind.RATE_LIMITED,
                        tool + " may be called at most " + max + " times per task");
            }
            callCounts.put(tool, used + 1);

            String payload = registry.execute(tool, ToolArguments.of(request.args()), ctx);
            task.recordToolCall(new ToolCall(tool, request.args(), true, payload));
            log.info("Tool {} succeeded", tool);
            return payload;
        } catch (SkillException e) {
            task.recordToolCall(new ToolCall(tool, request.args(), false, e.getMessage()));
            if (e.isFatal()) {
                log.error("Fatal tool error in {}: {}", tool, e.getMessage());
                throw e;
            }
            log.info("Tool {} failed: {}", tool, e.getMessage());
            return "ERROR " + e.getMessage();
        }
    }

    ToolRequest decode(String json) {
        Map<String, Object> raw;
        try {
            raw = objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed tool call: " + e.getOriginalMessage(), e);
        }
        if (!(raw.get("tool") instanceof String name) || name.isBlank()) {
            throw new IllegalArgumentException("tool call must name a \"tool\"");
        }
        Object args = raw.getOrDefault("args", Map.of());
        if (!(args instanceof Map<?, ?> argMap)) {
            throw new IllegalArgumentException("\"args\" must be an object");
        }
        Map<String, Object> typed = new HashMap<>();
        argMap.forEach((k, v) -> typed.put(String.valueOf(k), v));
        return new ToolRequest(name, typed);
    }

    private String initialPrompt(Task task, CodingSession session) {
        StringBuilder sb = new StringBuilder();
        sb.append("PROJECT: ").append(session.plan().name()).append("\n")
          .append(session.plan().description()).append("\n")
          .append("Tech stack: ").append(String.join(", ", session.plan().techStack())).append("\n\n");

        sb.append("YOUR TASK (").append(task.getId()).append("): implement ").append(task.getFilePath()).append("\n")
          .append(task.getInstruction()).append("\n");
        session.plan().findFile(task.getFilePath())
                .ifPresent(f -> sb.append("Purpose: ").append(f.purpose()).append("\n"));
        if (!task.getDependencies().isEmpty()) {
            sb.append("Depends on tasks: ").append(String.join(", ", task.getDependencies())).append("\n");
        }

        List<ToolCall> prior = task.getHistory();
        if (!prior.isEmpty()) {
            sb.append("\nTool calls already made for this task:\n");
            prior.forEach(c -> sb.append("  - ").append(c.tool()).append(c.arguments().keySet())
                    .append(c.success() ? " ok" : " failed").append("\n"));
        }
        sb.append("\nWrite the complete file, then reply with <result>summary</result>.");
        return sb.toString();
    }
}
