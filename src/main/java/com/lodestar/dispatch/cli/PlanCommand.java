package com.lodestar.dispatch.cli;

import com.lodestar.core.engine.PipelineEngine;
import com.lodestar.core.model.PipelineStatus;
import com.lodestar.core.state.PipelineState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CLI command: lodestar plan "&lt;idea&gt;"
 * <p>
 * Starts a planning run and runs it to the first gate.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Start a planning run for an idea")
@Component
public class PlanCommand implements Runnable {

    @Parameters(index = "0", description = "The product idea, in plain language")
    private String idea;

    @Option(names = {"--legacy", "-l"},
            description = "Free-text output of an earlier run, as stage=file (repeatable)")
    private Map<String, Path> legacy = new LinkedHashMap<>();

    @Option(names = "--design-integration", negatable = true,
            description = "Include the design hand-off stage (default: from configuration)")
    private Boolean designIntegration;

    private final PipelineEngine engine;

    public PlanCommand(PipelineEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        Map<String, String> legacyOutputs = new LinkedHashMap<>();
        for (var entry : legacy.entrySet()) {
            try {
                legacyOutputs.put(entry.getKey(), Files.readString(entry.getValue(), StandardCharsets.UTF_8));
            } catch (IOException e) {
                ConsoleOutput.error("Cannot read legacy output " + entry.getValue() + ": " + e.getMessage());
                return;
            }
        }

        ConsoleOutput.info("Extracting the concept anchor...");
        PipelineState state;
        try {
            state = designIntegration == null
                    ? engine.start(idea, legacyOutputs)
                    : engine.start(engine.generateRunId(), idea, legacyOutputs, designIntegration);
        } catch (Exception e) {
            ConsoleOutput.error("Run failed: " + ConsoleOutput.rootCauseMessage(e));
            return;
        }

        System.out.println();
        ConsoleOutput.status(state);
        if (state.status() == PipelineStatus.AWAITING_GATE) {
            ConsoleOutput.gate(engine.gateView(state.runId()));
            System.out.println();
            ConsoleOutput.info("Decide with: lodestar decide " + state.runId() + " --approve");
        }
    }
}
