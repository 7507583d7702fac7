package com.orbit.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Orbit.
 * Routes to subcommands: run, plan.
 */
@Command(
        name = "orbit",
        mixinStandardHelpOptions = true,
        version = "Orbit 0.1.0",
        description = "Autonomous agent with deadline-aware hierarchical planning",
        subcommands = {
                RunCommand.class,
                PlanCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class OrbitCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
