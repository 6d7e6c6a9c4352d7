package com.codeforge.orchestrator.taskgraph;

import com.codeforge.orchestrator.model.Task;
import com.codeforge.orchestrator.model.TaskStatus;
import com.codeforge.orchestrator.validation.StageSchemas;
import com.codeforge.orchestrator.validation.ValidationException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * The dependency-ordered collection of Tasks for one project.
 *
 * Construction computes a single deterministic execution order: a
 * topological order in which ties are broken by ascending priority, then by
 * the Architect's original listing order. Every task's dependencies occupy
 * strictly earlier positions. A graph that cannot be ordered (cycle, unknown
 * dependency id) is rejected at construction with a {@link ValidationException};
 * there is no such thing as an invalid TaskGraph instance.
 */
public final class TaskGraph {

    private static final Comparator<Task> TIE_BREAK = Comparator
            .comparingInt(Task::getPriority)
            .thenComparingInt(Task::getListingIndex);

    private final List<Task>        tasks;
    private final List<Task>        executionOrder;
    private final Map<String, Task> byId;

    private TaskGraph(List<Task> tasks, List<Task> executionOrder, Map<String, Task> byId) {
        this.tasks          = tasks;
        this.executionOrder = executionOrder;
        this.byId           = byId;
    }

    /**
     * Build a graph from tasks whose dependencies are task identifiers.
     *
     * @throws ValidationException on duplicate ids, unknown dependencies or cycles
     */
    public static TaskGraph of(List<Task> tasks) {
        List<String> violations = new ArrayList<>();
        Map<String, Task> byId = new LinkedHashMap<>();
        for (Task t : tasks) {
            if (byId.putIfAbsent(t.getId(), t) != null) {
                violations.add("duplicate task id '" + t.getId() + "'");
            }
        }
        for (Task t : tasks) {
            for (String dep : t.getDependencies()) {
                if (!byId.containsKey(dep)) {
                    violations.add("task " + t.getId() + " depends on undefined task '" + dep + "'");
                } else if (dep.equals(t.getId())) {
                    violations.add("task " + t.getId() + " (" + t.getFilePath() + ") depends on itself");
                }
            }
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(StageSchemas.TASK_PLAN.name(), violations);
        }

        // Kahn's algorithm with a priority queue as the ready set.
        Map<String, Integer>      indegree   = new HashMap<>();
        Map<String, List<Task>>   dependents = new HashMap<>();
        for (Task t : tasks) {
            Set<String> distinctDeps = new HashSet<>(t.getDependencies());
            indegree.put(t.getId(), distinctDeps.size());
            for (String dep : distinctDeps) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(t);
            }
        }
        PriorityQueue<Task> ready = new PriorityQueue<>(TIE_BREAK);
        tasks.stream().filter(t -> indegree.get(t.getId()) == 0).forEach(ready::add);

        List<Task> order = new ArrayList<>(tasks.size());
        while (!ready.isEmpty()) {
            Task next = ready.poll();
            order.add(next);
            for (Task dependent : dependents.getOrDefault(next.getId(), List.of())) {
                if (indegree.merge(dependent.getId(), -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() < tasks.size()) {
            List<String> stuck = tasks.stream()
                    .filter(t -> indegree.get(t.getId()) > 0)
                    .map(t -> t.getId() + " (" + t.getFilePath() + ")")
                    .toList();
            throw new ValidationException(StageSchemas.TASK_PLAN.name(), "dependency cycle among tasks " + String.join(", ", stuck));
        }
        return new TaskGraph(List.copyOf(tasks), List.copyOf(order), byId);
    }

    // ------------------------------------------------------------------
    // Structure
    // ------------------------------------------------------------------

    /** Tasks in the Architect's listing order. */
    public List<Task> tasks()          { return tasks; }

    /** Tasks in execution order. */
    public List<Task> executionOrder() { return executionOrder; }

    public int size()                  { return tasks.size(); }

    public Optional<Task> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public Task get(String id) {
        Task t = byId.get(id);
        if (t == null) {
            throw new IllegalArgumentException("No task with id '" + id + "'");
        }
        return t;
    }

    public int positionOf(String id) {
        return executionOrder.indexOf(get(id));
    }

    /** True if {@code taskId} depends on {@code otherId} directly or transitively. */
    public boolean dependsOn(String taskId, String otherId) {
        Deque<String> stack = new ArrayDeque<>(get(taskId).getDependencies());
        Set<String> seen = new HashSet<>();
        while (!stack.isEmpty()) {
            String dep = stack.pop();
            if (dep.equals(otherId)) {
                return true;
            }
            if (seen.add(dep)) {
                stack.addAll(get(dep).getDependencies());
            }
        }
        return false;
    }

    /** True if neither task depends on the other, even transitively. */
    public boolean independent(String a, String b) {
        return !a.equals(b) && !dependsOn(a, b) && !dependsOn(b, a);
    }

    // ------------------------------------------------------------------
    // Progress
    // ------------------------------------------------------------------

    /** PENDING tasks whose dependencies are all DONE, in execution order. */
    public List<Task> eligibleTasks() {
        return executionOrder.stream()
                .filter(t -> t.getStatus() == TaskStatus.PENDING)
                .filter(t -> t.getDependencies().stream()
                        .allMatch(dep -> byId.get(dep).getStatus() == TaskStatus.DONE))
                .toList();
    }

    public boolean isComplete() {
        return tasks.stream().allMatch(t -> t.getStatus() == TaskStatus.DONE);
    }

    public List<Task> tasksWithStatus(TaskStatus status) {
        return executionOrder.stream().filter(t -> t.getStatus() == status).toList();
    }

    /** Current status of every task, keyed by id in execution order. */
    public Map<String, TaskStatus> statuses() {
        Map<String, TaskStatus> m = new LinkedHashMap<>();
        executionOrder.forEach(t -> m.put(t.getId(), t.getStatus()));
        return m;
    }
}
