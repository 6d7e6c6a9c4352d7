package com.codeforge.orchestrator.model;

import com.codeforge.orchestrator.taskgraph.TaskGraph;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One generation run, from prompt to finished output directory.
 *
 * A Project owns its Plan, its Task Graph and its checkpoint history. It is
 * mutated only by the pipeline state machine (and, for task statuses, by the
 * coding loop). Everything here except {@code prompt} and {@code rootDir} can
 * be rebuilt from the latest checkpoint.
 */
public class Project {

    private final String  id;
    private final Path    rootDir;
    private final String  prompt;
    private final Instant createdAt;

    private Stage         stage  = Stage.PLANNING;
    private ProjectStatus status = ProjectStatus.PENDING;

    // Set once by PLANNING / ARCHITECTING, immutable afterwards.
    private Plan      plan;
    private TaskGraph taskGraph;

    // Optional stage results; never required for completion.
    private List<QualityReport> qualityReports = new ArrayList<>();
    private List<TestArtifact>  testArtifacts  = new ArrayList<>();
    private List<String>        skippedFiles   = new ArrayList<>();

    private ProjectMetadata metadata;
    private FailureRecord   failure;

    // Where the last successful checkpoint lives (reported on failure).
    private String checkpointLocation;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    public Project(String id, Path rootDir, String prompt) {
        this(id, rootDir, prompt, Instant.now());
    }

    public Project(String id, Path rootDir, String prompt, Instant createdAt) {
        this.id        = id;
        this.rootDir   = rootDir;
        this.prompt    = prompt;
        this.createdAt = createdAt;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String          getId()                 { return id; }
    public Path            getRootDir()            { return rootDir; }
    public String          getPrompt()             { return prompt; }
    public Instant         getCreatedAt()          { return createdAt; }
    public Stage           getStage()              { return stage; }
    public ProjectStatus   getStatus()             { return status; }
    public Plan            getPlan()               { return plan; }
    public TaskGraph       getTaskGraph()          { return taskGraph; }
    public ProjectMetadata getMetadata()           { return metadata; }
    public FailureRecord   getFailure()            { return failure; }
    public String          getCheckpointLocation() { return checkpointLocation; }

    public List<QualityReport> getQualityReports() { return List.copyOf(qualityReports); }
    public List<TestArtifact>  getTestArtifacts()  { return List.copyOf(testArtifacts); }
    public List<String>        getSkippedFiles()   { return List.copyOf(skippedFiles); }

    public void setStage(Stage stage)                       { this.stage = stage; }
    public void setStatus(ProjectStatus status)             { this.status = status; }
    public void setMetadata(ProjectMetadata metadata)       { this.metadata = metadata; }
    public void setFailure(FailureRecord failure)           { this.failure = failure; }
    public void setCheckpointLocation(String location)      { this.checkpointLocation = location; }

    public void setQualityReports(List<QualityReport> v)    { this.qualityReports = new ArrayList<>(v); }
    public void setTestArtifacts(List<TestArtifact> v)      { this.testArtifacts  = new ArrayList<>(v); }
    public void setSkippedFiles(List<String> v)             { this.skippedFiles   = new ArrayList<>(v); }

    public void setPlan(Plan plan) {
        if (this.plan != null && this.plan != plan) {
            throw new IllegalStateException("Plan of project " + id + " is already set");
        }
        this.plan = plan;
    }

    public void setTaskGraph(TaskGraph taskGraph) {
        if (this.taskGraph != null && this.taskGraph != taskGraph) {
            throw new IllegalStateException("Task graph of project " + id + " is already set");
        }
        this.taskGraph = taskGraph;
    }
}
