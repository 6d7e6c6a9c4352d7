package com.codeforge.orchestrator.skill.impl;

import com.codeforge.orchestrator.skill.*;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ListFilesSkill implements Skill<ToolArguments, String> {

    private static final SkillManifest MANIFEST = new SkillManifest(
            "list_files", "1.0.0",
            "list_files(directory: str = \".\") -> list[str]",
            "List every file below a directory, recursively, one project-relative path per line.",
            ExecutionTarget.SANDBOX_FILESYSTEM);

    private static final SkillPolicy POLICY = SkillPolicy.readOnly();

    @Override public SkillManifest manifest() { return MANIFEST; }
    @Override public SkillPolicy   policy()   { return POLICY; }

    @Override
    public String execute(ToolArguments args, SkillExecutionContext ctx) {
        String directory = args.optionalString("directory", ".");
        List<String> files = ctx.gateway().listFiles(directory);
        return files.isEmpty() ? "(no files)" : String.join("\n", files);
    }
}
