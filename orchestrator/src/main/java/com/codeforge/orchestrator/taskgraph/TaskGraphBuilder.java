package com.codeforge.orchestrator.taskgraph;

import com.codeforge.orchestrator.model.Plan;
import com.codeforge.orchestrator.model.Task;
import com.codeforge.orchestrator.validation.StageSchemas;
import com.codeforge.orchestrator.validation.ValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps the Architect's output 1:1 onto Tasks and resolves its file-path
 * dependencies into task identifiers.
 *
 * A dependency must name a file that is both declared in the Plan and
 * produced by some task. Every unresolvable reference is reported, then the
 * graph is ordered; a cycle is reported the same way.
 */
public final class TaskGraphBuilder {

    private static final String DEFAULT_COMPLEXITY = "medium";

    private TaskGraphBuilder() {}

    public static String taskId(int listingIndex) {
        return "task-" + (listingIndex + 1);
    }

    /**
     * @throws ValidationException if a dependency is undefined or the graph has a cycle
     */
    public static TaskGraph build(Plan plan, TaskPlanDraft draft) {
        List<TaskDraft> drafts = draft.tasks();

        Map<String, List<String>> producers = new LinkedHashMap<>();
        for (int i = 0; i < drafts.size(); i++) {
            producers.computeIfAbsent(drafts.get(i).filepath(), k -> new ArrayList<>()).add(taskId(i));
        }

        List<String> violations = new ArrayList<>();
        List<Task> tasks = new ArrayList<>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            TaskDraft d = drafts.get(i);
            String id = taskId(i);
            Set<String> depIds = new LinkedHashSet<>();

            for (int j = 0; j < d.dependsOn().size(); j++) {
                String path = d.dependsOn().get(j);
                String where = "tasks[" + i + "].depends_on[" + j + "]";
                if (!plan.declaresFile(path)) {
                    violations.add(where + ": '" + path + "' is not a file in the plan");
                    continue;
                }
                List<String> ids = producers.getOrDefault(path, List.of()).stream()
                        .filter(p -> !p.equals(id))
                        .toList();
                if (ids.isEmpty()) {
                    violations.add(where + ": no other task produces '" + path + "'");
                    continue;
                }
                depIds.addAll(ids);
            }

            tasks.add(new Task(id, d.filepath(), d.description(), List.copyOf(depIds),
                    d.priority() == null ? 0 : d.priority(),
                    d.complexity() == null || d.complexity().isBlank() ? DEFAULT_COMPLEXITY : d.complexity(),
                    i));
        }

        if (!violations.isEmpty()) {
            throw new ValidationException(StageSchemas.TASK_PLAN.name(), violations);
        }
        return TaskGraph.of(tasks);
    }
}
