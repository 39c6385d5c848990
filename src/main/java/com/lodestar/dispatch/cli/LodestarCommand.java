package com.lodestar.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Lodestar.
 */
@Command(
        name = "lodestar",
        mixinStandardHelpOptions = true,
        version = "Lodestar 0.1.0",
        description = "Turns a product idea into a verified, drift-checked implementation plan",
        subcommands = {
                PlanCommand.class,
                StatusCommand.class,
                DecideCommand.class,
                ResumeCommand.class,
                CancelCommand.class,
                ReviseCommand.class,
                SpecCommand.class,
                ExportCommand.class,
                TimelineCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class LodestarCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
