package com.codeforge.orchestrator.model;

/**
 * Why a Project stopped: the stage that was running, the error kind and the
 * last validation or tool error message.
 */
public record FailureRecord(Stage stage, ErrorKind kind, String message) {}
