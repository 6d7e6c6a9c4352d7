package com.codeforge.orchestrator.skill.impl;

import com.codeforge.orchestrator.skill.*;
import org.springframework.stereotype.Component;

@Component
public class ReadFileSkill implements Skill<ToolArguments, String> {

    private static final SkillManifest MANIFEST = new SkillManifest(
            "read_file", "1.0.0",
            "read_file(path: str) -> str",
            "Read a file relative to the project root.",
            ExecutionTarget.SANDBOX_FILESYSTEM);

    private static final SkillPolicy POLICY = SkillPolicy.readOnly();

    @Override public SkillManifest manifest() { return MANIFEST; }
    @Override public SkillPolicy   policy()   { return POLICY; }

    @Override
    public String execute(ToolArguments args, SkillExecutionContext ctx) {
        String path = args.requireString("path");
        return ctx.gateway().readFile(path)
                .orElseThrow(() -> new SkillException(SkillException.Kind.NOT_FOUND,
                        "File not found: " + path));
    }
}
