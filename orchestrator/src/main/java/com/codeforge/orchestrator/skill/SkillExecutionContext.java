package com.codeforge.orchestrator.skill;

import com.codeforge.orchestrator.sandbox.SandboxedFileGateway;

import java.util.List;

/**
 * Runtime context passed to every skill invocation.
 *
 * Skills reach the filesystem only through {@code gateway}, and tag metrics
 * and logs with the owning project and task.
 *
 * @param declaredPackages the Plan's required packages; the only ones
 *                         install_dependency may install
 */
public record SkillExecutionContext(
        SandboxedFileGateway gateway,
        String               projectId,
        String               taskId,
        List<String>         declaredPackages) {

    public SkillExecutionContext {
        declaredPackages = declaredPackages == null ? List.of() : List.copyOf(declaredPackages);
    }
}
