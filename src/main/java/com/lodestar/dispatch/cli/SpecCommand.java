package com.lodestar.dispatch.cli;

import com.lodestar.core.assembly.SpecificationAssembler;
import com.lodestar.core.engine.PipelineEngine;
import com.lodestar.core.model.ResolvedSpecification;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * CLI command: lodestar spec &lt;run-id&gt;
 * <p>
 * Prints the resolved specification of a completed run as JSON.
 */
@Command(name = "spec", mixinStandardHelpOptions = true, description = "Print the resolved specification")
@Component
public class SpecCommand implements Runnable {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    @Option(names = {"--output", "-o"}, description = "Write to a file instead of standard output")
    private Path output;

    private final PipelineEngine engine;
    private final SpecificationAssembler assembler;

    public SpecCommand(PipelineEngine engine, SpecificationAssembler assembler) {
        this.engine = engine;
        this.assembler = assembler;
    }

    @Override
    public void run() {
        ResolvedSpecification spec;
        try {
            var state = engine.state(runId);
            spec = state.specification().orElse(null);
            if (spec == null) {
                ConsoleOutput.error("Run " + runId + " has no specification yet (" + state.status() + ")");
                return;
            }
        } catch (Exception e) {
            ConsoleOutput.error(ConsoleOutput.rootCauseMessage(e));
            return;
        }

        String json = assembler.toJson(spec);
        if (output == null) {
            System.out.println(json);
            return;
        }
        try {
            Files.writeString(output, json, StandardCharsets.UTF_8);
            ConsoleOutput.success("Wrote " + spec.workItems().size() + " work items to " + output);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot write " + output + ": " + e.getMessage());
        }
    }
}
