package com.codeforge.orchestrator.skill;

/**
 * What a tool touches when it runs.
 *
 * SANDBOX_FILESYSTEM: file operations routed through the project's
 *                     SandboxedFileGateway; no other side effects.
 * SUBPROCESS:         launches an external command (git, pip, npm) with the
 *                     sandbox root as working directory; timeout-bounded.
 * NETWORK:            outbound HTTP; timeout-bounded and rate-bounded.
 */
public enum ExecutionTarget {
    SANDBOX_FILESYSTEM,
    SUBPROCESS,
    NETWORK
}
