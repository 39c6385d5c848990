package com.lodestar.dispatch.cli;

import com.lodestar.core.engine.PipelineEngine;
import com.lodestar.core.model.GateDecision;
import com.lodestar.core.model.PipelineStatus;
import com.lodestar.core.state.PipelineState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * CLI command: lodestar decide &lt;run-id&gt; --approve | --request-changes | --resolve | --override
 * <p>
 * Delivers a decision to the gate a run is waiting at and resumes the run.
 */
@Command(name = "decide", mixinStandardHelpOptions = true, description = "Decide the gate a run is waiting at")
@Component
public class DecideCommand implements Runnable {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Decision decision;

    @Option(names = {"--stage", "-s"}, description = "Stage to re-run with --request-changes")
    private String stage;

    @Option(names = {"--invariant", "-i"}, split = ",",
            description = "Invariants acknowledged with --override (default: every open finding)")
    private List<String> invariants = new ArrayList<>();

    static class Decision {
        @Option(names = "--approve", required = true, description = "Approve the phase")
        boolean approve;

        @Option(names = "--request-changes", required = true, paramLabel = "FEEDBACK",
                description = "Re-run the phase with feedback")
        String feedback;

        @Option(names = "--resolve", required = true, paramLabel = "PROPERTY=VALUE",
                description = "Pick a value for an ambiguous invariant (repeatable)")
        Map<String, String> selections;

        @Option(names = "--override", required = true, paramLabel = "ACKNOWLEDGEMENT",
                description = "Accept blocking violations with a recorded justification")
        String acknowledgement;
    }

    private final PipelineEngine engine;

    public DecideCommand(PipelineEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        GateDecision gateDecision = toGateDecision();
        ConsoleOutput.info("Delivering " + gateDecision.type() + " to run " + runId + "...");

        PipelineState state;
        try {
            state = engine.decide(runId, gateDecision);
        } catch (Exception e) {
            ConsoleOutput.error("Decision failed: " + ConsoleOutput.rootCauseMessage(e));
            return;
        }

        System.out.println();
        ConsoleOutput.status(state);
        if (state.status() == PipelineStatus.AWAITING_GATE) {
            ConsoleOutput.gate(engine.gateView(runId));
        } else if (state.status() == PipelineStatus.COMPLETED) {
            ConsoleOutput.success("Specification ready: lodestar spec " + runId);
        }
    }

    GateDecision toGateDecision() {
        if (decision.approve) {
            return GateDecision.approve();
        }
        if (decision.feedback != null) {
            return GateDecision.requestChanges(decision.feedback, stage);
        }
        if (decision.selections != null) {
            return GateDecision.resolveAmbiguity(decision.selections);
        }
        return GateDecision.overrideViolation(decision.acknowledgement, invariants);
    }
}
