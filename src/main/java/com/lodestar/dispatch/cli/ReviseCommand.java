package com.lodestar.dispatch.cli;

import com.lodestar.core.engine.PipelineEngine;
import com.lodestar.core.model.PhaseId;
import com.lodestar.core.model.PipelineStatus;
import com.lodestar.core.state.PipelineState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: lodestar revise &lt;run-id&gt; &lt;phase&gt; --feedback "..."
 * <p>
 * Re-opens a completed phase. Artifacts are kept, so only what the revision
 * supersedes is regenerated downstream.
 */
@Command(name = "revise", mixinStandardHelpOptions = true, description = "Re-open a completed phase")
@Component
public class ReviseCommand implements Runnable {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    @Parameters(index = "1", description = "Phase: discovery, scope, design or planning")
    private String phase;

    @Option(names = {"--feedback", "-f"}, description = "What should change")
    private String feedback;

    private final PipelineEngine engine;

    public ReviseCommand(PipelineEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        PhaseId phaseId;
        try {
            phaseId = PhaseId.fromKey(phase);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Unknown phase: " + phase + ". Valid phases: discovery, scope, design, planning");
            return;
        }

        PipelineState state;
        try {
            state = engine.revise(runId, phaseId, feedback);
        } catch (Exception e) {
            ConsoleOutput.error("Revision failed: " + ConsoleOutput.rootCauseMessage(e));
            return;
        }
        ConsoleOutput.status(state);
        if (state.status() == PipelineStatus.AWAITING_GATE) {
            ConsoleOutput.gate(engine.gateView(runId));
        }
    }
}
