package com.codeforge.orchestrator.skill;

/**
 * Outcome of an external command run by a SUBPROCESS skill.
 */
public record ProcessResult(
        int    exitCode,
        String stdout,
        String stderr,
        double elapsedSec) {

    /** True if the command exited with status 0. */
    public boolean success() {
        return exitCode == 0;
    }

    /** Format as the observation string the collaborator reads on its next turn. */
    public String toObservation() {
        StringBuilder sb = new StringBuilder();
        if (stdout != null && !stdout.isBlank()) {
            sb.append("stdout:\n").append(stdout.stripTrailing());
        }
        if (stderr != null && !stderr.isBlank()) {
            if (!sb.isEmpty()) sb.append("\n\n");
            sb.append("stderr:\n").append(stderr.stripTrailing());
        }
        if (sb.isEmpty()) sb.append("(no output)");
        sb.append("\n\nexit_code: ").append(exitCode);
        return sb.toString();
    }
}
