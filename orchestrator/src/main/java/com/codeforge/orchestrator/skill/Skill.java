package com.codeforge.orchestrator.skill;

/**
 * Every tool the coding loop may call is registered as a Skill.
 *
 * A Skill is a versioned, policy-bounded, observable execution unit. The
 * registry wraps every call with the same error mapping and metrics, so a
 * failing git command and a rejected path surface to the loop the same way.
 *
 * @param <I> Input type ({@link ToolArguments} for all coding-loop tools)
 * @param <O> Output type (the observation payload)
 */
public interface Skill<I, O> {

    /** Identity, documentation, and routing metadata. */
    SkillManifest manifest();

    /** Execution constraints enforced around execute(). */
    SkillPolicy policy();

    /**
     * Execute the skill.
     *
     * @throws SkillException on policy violation, timeout, or execution error
     */
    O execute(I input, SkillExecutionContext ctx) throws SkillException;
}
