package com.codeforge.orchestrator.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle: parses the arguments,
 * runs the selected command and exposes its exit code.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final CodeforgeCommand codeforgeCommand;
    private final IFactory         factory;
    private int exitCode;

    public CliRunner(CodeforgeCommand codeforgeCommand, IFactory factory) {
        this.codeforgeCommand = codeforgeCommand;
        this.factory          = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(codeforgeCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
