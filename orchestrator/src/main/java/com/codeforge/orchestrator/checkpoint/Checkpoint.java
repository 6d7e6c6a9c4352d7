package com.codeforge.orchestrator.checkpoint;

import com.codeforge.orchestrator.model.Plan;
import com.codeforge.orchestrator.model.Project;
import com.codeforge.orchestrator.model.ProjectMetadata;
import com.codeforge.orchestrator.model.QualityReport;
import com.codeforge.orchestrator.model.Stage;
import com.codeforge.orchestrator.model.Task;
import com.codeforge.orchestrator.model.TaskStatus;
import com.codeforge.orchestrator.model.TestArtifact;
import com.codeforge.orchestrator.taskgraph.TaskGraph;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable snapshot of a project's pipeline progress.
 *
 * Unknown fields are ignored and every optional-stage field may be absent, so
 * a checkpoint written with different feature toggles is still readable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Checkpoint(
        @JsonProperty("project_id")           String projectId,
        @JsonProperty("last_completed_stage") Stage lastCompletedStage,
        String prompt,
        @JsonProperty("created_at")           Instant createdAt,
        Plan plan,
        @JsonProperty("task_graph")           List<TaskSnapshot> taskGraph,
        @JsonProperty("task_statuses")        Map<String, TaskStatus> taskStatuses,
        @JsonProperty("quality_reports")      List<QualityReport> qualityReports,
        @JsonProperty("test_artifacts")       List<TestArtifact> testArtifacts,
        @JsonProperty("skipped_files")        List<String> skippedFiles,
        ProjectMetadata metadata,
        Instant timestamp) {

    public Checkpoint {
        taskGraph      = taskGraph == null ? List.of() : List.copyOf(taskGraph);
        taskStatuses   = taskStatuses == null ? Map.of() : Map.copyOf(taskStatuses);
        qualityReports = qualityReports == null ? List.of() : List.copyOf(qualityReports);
        testArtifacts  = testArtifacts == null ? List.of() : List.copyOf(testArtifacts);
        skippedFiles   = skippedFiles == null ? List.of() : List.copyOf(skippedFiles);
    }

    /** Capture the project's current state as of {@code lastCompletedStage}. */
    public static Checkpoint capture(Project project, Stage lastCompletedStage) {
        TaskGraph graph = project.getTaskGraph();
        List<TaskSnapshot> tasks = graph == null ? List.of()
                : graph.tasks().stream().map(TaskSnapshot::of).toList();
        Map<String, TaskStatus> statuses = graph == null ? Map.of() : graph.statuses();
        return new Checkpoint(project.getId(), lastCompletedStage, project.getPrompt(), project.getCreatedAt(),
                project.getPlan(), tasks, statuses, project.getQualityReports(), project.getTestArtifacts(),
                project.getSkippedFiles(), project.getMetadata(), Instant.now());
    }

    /**
     * Rebuild the in-memory project. Tasks that were in progress or failed go
     * back to pending; done tasks stay done. The stored prompt is kept, since
     * the saved plan and tasks were derived from it.
     */
    public Project restore(Path rootDir) {
        Project project = new Project(projectId, rootDir, prompt,
                createdAt == null ? Instant.now() : createdAt);
        if (plan != null) {
            project.setPlan(plan);
        }
        if (!taskGraph.isEmpty()) {
            List<Task> tasks = taskGraph.stream().map(TaskSnapshot::toTask).toList();
            for (Task task : tasks) {
                TaskStatus saved = taskStatuses.get(task.getId());
                task.setStatus(saved == TaskStatus.DONE ? TaskStatus.DONE : TaskStatus.PENDING);
            }
            project.setTaskGraph(TaskGraph.of(tasks));
        }
        project.setQualityReports(qualityReports);
        project.setTestArtifacts(testArtifacts);
        project.setSkippedFiles(skippedFiles);
        project.setMetadata(metadata);
        return project;
    }

    /** Statuses in task-graph listing order, for display. */
    public Map<String, TaskStatus> orderedStatuses() {
        Map<String, TaskStatus> ordered = new LinkedHashMap<>();
        taskGraph.forEach(t -> ordered.put(t.id(), taskStatuses.getOrDefault(t.id(), TaskStatus.PENDING)));
        return ordered;
    }
}
