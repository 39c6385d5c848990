package com.lodestar.dispatch.cli;

import com.lodestar.core.engine.PipelineEngine;
import com.lodestar.core.model.PipelineStatus;
import com.lodestar.core.state.PipelineState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: lodestar resume &lt;run-id&gt;
 * <p>
 * Continues a cancelled or interrupted run from its first pending stage.
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Continue a cancelled or interrupted run")
@Component
public class ResumeCommand implements Runnable {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    private final PipelineEngine engine;

    public ResumeCommand(PipelineEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        PipelineState state;
        try {
            state = engine.continueRun(runId);
        } catch (Exception e) {
            ConsoleOutput.error("Resume failed: " + ConsoleOutput.rootCauseMessage(e));
            return;
        }
        ConsoleOutput.status(state);
        if (state.status() == PipelineStatus.AWAITING_GATE) {
            ConsoleOutput.gate(engine.gateView(runId));
        }
    }
}
