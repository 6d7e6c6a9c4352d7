package com.codeforge.orchestrator.skill.impl;

import com.codeforge.orchestrator.skill.*;
import org.springframework.stereotype.Component;

/**
 * Creates or overwrites a file inside the project root.
 * Parent directories are created as needed.
 */
@Component
public class WriteFileSkill implements Skill<ToolArguments, String> {

    private static final SkillManifest MANIFEST = new SkillManifest(
            "write_file", "1.0.0",
            "write_file(path: str, content: str) -> str",
            "Create or overwrite a file relative to the project root. Parent directories are created.",
            ExecutionTarget.SANDBOX_FILESYSTEM);

    private static final SkillPolicy POLICY = SkillPolicy.writeAllowed();

    @Override public SkillManifest manifest() { return MANIFEST; }
    @Override public SkillPolicy   policy()   { return POLICY; }

    @Override
    public String execute(ToolArguments args, SkillExecutionContext ctx) {
        String path    = args.requireString("path");
        String content = args.requireString("content");
        int bytes = ctx.gateway().writeFile(path, content);
        return "Wrote " + bytes + " bytes to " + path;
    }
}
