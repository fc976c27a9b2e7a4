package com.repolens.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for RepoLens.
 * Routes to subcommands: context, health, serve.
 */
@Command(
        name = "repolens",
        mixinStandardHelpOptions = true,
        version = "RepoLens 0.1.0",
        description = "Selects the files of a repository that matter for a task prompt",
        subcommands = {
                ContextCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class RepoLensCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
