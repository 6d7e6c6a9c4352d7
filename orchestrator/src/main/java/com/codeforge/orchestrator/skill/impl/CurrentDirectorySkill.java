package com.codeforge.orchestrator.skill.impl;

import com.codeforge.orchestrator.skill.*;
import org.springframework.stereotype.Component;

@Component
public class CurrentDirectorySkill implements Skill<ToolArguments, String> {

    private static final SkillManifest MANIFEST = new SkillManifest(
            "get_current_directory", "1.0.0",
            "get_current_directory() -> str",
            "Return the working directory, relative to the project root.",
            ExecutionTarget.SANDBOX_FILESYSTEM);

    private static final SkillPolicy POLICY = SkillPolicy.readOnly();

    @Override public SkillManifest manifest() { return MANIFEST; }
    @Override public SkillPolicy   policy()   { return POLICY; }

    @Override
    public String execute(ToolArguments args, SkillExecutionContext ctx) {
        return ctx.gateway().currentDirectory();
    }
}
