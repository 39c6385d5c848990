package com.lodestar.dispatch.cli;

import com.lodestar.core.engine.PipelineEngine;
import com.lodestar.core.tracker.ExportedWorkItem;
import com.lodestar.core.tracker.TrackerExportService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: lodestar export &lt;run-id&gt;
 * <p>
 * Drafts the work items of a completed run in the tracker.
 */
@Command(name = "export", mixinStandardHelpOptions = true, description = "Draft work items in the tracker")
@Component
public class ExportCommand implements Runnable {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    private final PipelineEngine engine;
    private final TrackerExportService exportService;

    public ExportCommand(PipelineEngine engine, TrackerExportService exportService) {
        this.engine = engine;
        this.exportService = exportService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        List<ExportedWorkItem> exported;
        try {
            var spec = engine.state(runId).specification()
                    .orElseThrow(() -> new IllegalStateException("Run " + runId + " has no specification yet"));
            exported = exportService.export(runId, spec);
        } catch (Exception e) {
            ConsoleOutput.error("Export failed: " + ConsoleOutput.rootCauseMessage(e));
            return;
        }
        for (ExportedWorkItem item : exported) {
            System.out.printf("  %-10s %-8s %s%n", item.workItemId(), item.status(), item.reference());
        }
        ConsoleOutput.success(exported.size() + " work item" + (exported.size() != 1 ? "s" : "") + " drafted.");
    }
}
