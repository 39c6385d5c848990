package com.lodestar.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final LodestarCommand lodestarCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(LodestarCommand lodestarCommand, IFactory factory) {
        this.lodestarCommand = lodestarCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // Serve mode: picocli would return at once and let the main thread finish before Tomcat is up.
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return;
            }
        }
        exitCode = new CommandLine(lodestarCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
