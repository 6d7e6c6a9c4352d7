package com.codeforge.orchestrator.skill;

public class SkillNotFoundException extends SkillException {
    public SkillNotFoundException(String name) {
        super(Kind.UNKNOWN_TOOL, "No tool registered with name: '" + name + "'");
    }
}
