package com.codeforge.orchestrator.skill;

/**
 * Execution constraints for a skill.
 *
 * @param networkAllowed    true only for skills that make outbound requests.
 * @param filesystemWrite   true for skills that mutate the sandbox.
 * @param commandTimeoutSec Wall-clock limit for the underlying operation.
 * @param maxCallsPerTask   How many times one task may call the skill; 0 = unbounded.
 */
public record SkillPolicy(
        boolean networkAllowed,
        boolean filesystemWrite,
        int     commandTimeoutSec,
        int     maxCallsPerTask) {

    /** Read-only sandbox file operation. */
    public static SkillPolicy readOnly() {
        return new SkillPolicy(false, false, 10, 0);
    }

    /** Sandbox file operation that may create or overwrite files. */
    public static SkillPolicy writeAllowed() {
        return new SkillPolicy(false, true, 10, 0);
    }

    /** External command run inside the sandbox root. */
    public static SkillPolicy subprocess(int timeoutSec, int maxCallsPerTask) {
        return new SkillPolicy(false, true, timeoutSec, maxCallsPerTask);
    }

    /** Outbound HTTP. */
    public static SkillPolicy network(int timeoutSec, int maxCallsPerTask) {
        return new SkillPolicy(true, false, timeoutSec, maxCallsPerTask);
    }
}
