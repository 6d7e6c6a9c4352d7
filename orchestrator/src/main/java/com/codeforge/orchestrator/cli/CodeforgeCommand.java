package com.codeforge.orchestrator.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command. Routes to subcommands: generate, status.
 */
@Command(
        name = "codeforge",
        mixinStandardHelpOptions = true,
        version = "codeforge 1.0.0",
        description = "Generates a project from a natural-language description",
        subcommands = {
                GenerateCommand.class,
                StatusCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CodeforgeCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
