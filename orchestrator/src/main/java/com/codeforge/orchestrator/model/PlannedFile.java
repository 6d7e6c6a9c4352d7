package com.codeforge.orchestrator.model;

/** One {@code (file_path, purpose)} entry of a Plan. */
public record PlannedFile(String path, String purpose) {}
