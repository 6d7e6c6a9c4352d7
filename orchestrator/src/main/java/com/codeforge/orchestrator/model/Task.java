package com.codeforge.orchestrator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One file-scoped unit of implementation work derived from the Plan.
 *
 * Created by the Architect stage; after construction only the coding loop
 * changes its status and appends to its tool-call history. Status is read by
 * the checkpoint writer from another thread, hence volatile.
 */
public class Task {

    private final String       id;
    private final String       filePath;
    private final String       instruction;
    private final List<String> dependencies;
    private final int          priority;
    private final String       complexity;

    // Position in the Architect's original listing; the final tie-breaker.
    private final int          listingIndex;

    private volatile TaskStatus status = TaskStatus.PENDING;

    private final List<ToolCall> history = Collections.synchronizedList(new ArrayList<>());

    public Task(String id, String filePath, String instruction, List<String> dependencies,
                int priority, String complexity, int listingIndex) {
        this.id           = id;
        this.filePath     = filePath;
        this.instruction  = instruction;
        this.dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        this.priority     = priority;
        this.complexity   = complexity == null ? "medium" : complexity;
        this.listingIndex = listingIndex;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String       getId()           { return id; }
    public String       getFilePath()     { return filePath; }
    public String       getInstruction()  { return instruction; }
    public List<String> getDependencies() { return dependencies; }
    public int          getPriority()     { return priority; }
    public String       getComplexity()   { return complexity; }
    public int          getListingIndex() { return listingIndex; }
    public TaskStatus   getStatus()       { return status; }

    public void setStatus(TaskStatus status) { this.status = status; }

    public void recordToolCall(ToolCall call) { history.add(call); }

    /** Snapshot of the tool calls issued for this task so far, in issue order. */
    public List<ToolCall> getHistory() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    @Override
    public String toString() {
        return "Task[" + id + " " + filePath + " " + status + "]";
    }
}
