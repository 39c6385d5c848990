package com.lodestar.dispatch.cli;

import com.lodestar.core.engine.PipelineEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: lodestar cancel &lt;run-id&gt;
 */
@Command(name = "cancel", mixinStandardHelpOptions = true, description = "Cancel a run, keeping its artifacts")
@Component
public class CancelCommand implements Runnable {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    private final PipelineEngine engine;

    public CancelCommand(PipelineEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        try {
            ConsoleOutput.status(engine.cancel(runId));
        } catch (Exception e) {
            ConsoleOutput.error("Cancel failed: " + ConsoleOutput.rootCauseMessage(e));
        }
    }
}
