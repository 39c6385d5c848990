package com.lodestar.dispatch.cli;

import com.lodestar.core.engine.PipelineEngine;
import com.lodestar.core.engine.RunNotFoundException;
import com.lodestar.core.engine.TimelineEntry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: lodestar timeline &lt;run-id&gt;
 * <p>
 * Lists every persisted checkpoint of a run in state-version order.
 */
@Command(name = "timeline", mixinStandardHelpOptions = true, description = "Show run execution timeline")
@Component
public class TimelineCommand implements Runnable {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    private final PipelineEngine engine;

    public TimelineCommand(PipelineEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<TimelineEntry> entries;
        try {
            entries = engine.timeline(runId);
        } catch (RunNotFoundException e) {
            ConsoleOutput.error("No checkpoints found for run: " + runId);
            return;
        }

        ConsoleOutput.info("Timeline for run " + runId);
        System.out.println();
        System.out.printf("  %-5s %-22s %-22s %-14s %-10s %s%n", "VER", "NODE", "NEXT NODE", "STATUS", "PHASE", "CHECKPOINT ID");
        System.out.println("  " + "-".repeat(100));

        for (TimelineEntry e : entries) {
            System.out.printf("  %-5d %-22s %-22s %-14s %-10s %s%n", e.stateVersion(),
                    e.nodeId() != null ? e.nodeId() : "-",
                    e.nextNodeId() != null ? e.nextNodeId() : "-",
                    e.status(), e.phase(),
                    ConsoleOutput.truncate(e.checkpointId(), 24));
        }

        System.out.println();
        ConsoleOutput.info(entries.size() + " checkpoint" + (entries.size() != 1 ? "s" : "") + " recorded.");
    }
}
