package com.codeforge.orchestrator.skill;

/**
 * Identity and documentation contract for a skill.
 *
 * @param name        Unique identifier used in the registry and in tool-call requests
 *                    (e.g. "write_file").
 * @param version     Semantic version; lets the registry detect incompatible changes.
 * @param signature   Signature shown to the collaborator in the tool documentation,
 *                    e.g. "write_file(path: str, content: str) -> int".
 * @param description One-sentence docstring injected verbatim into the tool documentation.
 * @param target      What the skill touches when it runs.
 */
public record SkillManifest(
        String          name,
        String          version,
        String          signature,
        String          description,
        ExecutionTarget target) {}
