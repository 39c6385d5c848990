package com.lodestar.dispatch.cli;

import com.lodestar.core.engine.PipelineEngine;
import com.lodestar.core.engine.RunNotFoundException;
import com.lodestar.core.model.PhaseId;
import com.lodestar.core.model.PipelineStatus;
import com.lodestar.core.state.PipelineState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * CLI command: lodestar status &lt;run-id&gt;
 * <p>
 * Shows phase and stage progress of a run, and the gate view when it waits for a decision.
 * Without a run ID, lists every known run.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Check run status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Run ID (omit to list runs)")
    private String runId;

    @Option(names = {"--watch", "-w"}, description = "Watch for live updates via SSE")
    private boolean watch;

    @Option(names = {"--port"}, description = "Server port for watch mode (default: ${DEFAULT-VALUE})",
            defaultValue = "8080")
    private int port;

    private final PipelineEngine engine;

    public StatusCommand(PipelineEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        if (runId == null) {
            listRuns();
            return;
        }
        if (watch) {
            runWatchMode();
            return;
        }

        ConsoleOutput.printBanner();

        PipelineState state;
        try {
            state = engine.state(runId);
        } catch (RunNotFoundException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }

        System.out.println();
        System.out.println("RUN " + state.runId());
        System.out.println("Idea: " + state.idea());
        ConsoleOutput.status(state);

        System.out.println();
        System.out.printf("  %-10s %-14s %s%n", "PHASE", "STATUS", "CORRECTIONS");
        System.out.println("  " + "-".repeat(40));
        for (PhaseId phase : PhaseId.values()) {
            System.out.printf("  %-10s %-14s %d%n", phase, state.phaseStatus(phase), state.correctiveAttempts(phase));
        }

        if (!state.stageStatuses().isEmpty()) {
            System.out.println();
            System.out.printf("  %-22s %-20s %s%n", "STAGE", "STATUS", "ATTEMPTS");
            System.out.println("  " + "-".repeat(52));
            state.stageStatuses().forEach((stage, status) ->
                    System.out.printf("  %-22s %-20s %d%n", stage, status, state.stageAttempts(stage)));
        }

        if (state.status() == PipelineStatus.AWAITING_GATE) {
            ConsoleOutput.gate(engine.gateView(runId));
        } else if (!state.openEscalations().isEmpty()) {
            System.out.println();
            state.openEscalations().forEach(ConsoleOutput::escalation);
        }
    }

    private void listRuns() {
        ConsoleOutput.printBanner();
        var runs = engine.listRuns();
        if (runs.isEmpty()) {
            ConsoleOutput.info("No runs recorded.");
            return;
        }
        System.out.printf("  %-16s %-14s %-10s %s%n", "RUN", "STATUS", "PHASE", "IDEA");
        System.out.println("  " + "-".repeat(72));
        for (PipelineState state : runs) {
            System.out.printf("  %-16s %-14s %-10s %s%n", state.runId(), state.status(), state.currentPhase(),
                    ConsoleOutput.truncate(state.idea(), 40));
        }
    }

    private void runWatchMode() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Watching run " + runId + " (connecting to localhost:" + port + ")...");
        System.out.println();

        URI uri = URI.create("http://localhost:" + port + "/api/v1/runs/" + runId + "/events");

        try {
            HttpClient client = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofSeconds(5))
                    .build();

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(uri)
                    .header("Accept", "text/event-stream")
                    .GET()
                    .build();

            HttpResponse<java.util.stream.Stream<String>> response = client.send(request,
                    HttpResponse.BodyHandlers.ofLines());

            if (response.statusCode() == 404) {
                ConsoleOutput.error("Run not found: " + runId);
                return;
            }
            if (response.statusCode() != 200) {
                ConsoleOutput.error("Server returned HTTP " + response.statusCode());
                return;
            }

            final String[] currentEventType = {""};
            response.body().forEach(line -> {
                if (line.startsWith("event:")) {
                    currentEventType[0] = line.substring(6).trim();
                } else if (line.startsWith("data:")) {
                    String data = line.substring(5).trim();
                    String eventType = currentEventType[0].isEmpty() ? "message" : currentEventType[0];
                    ConsoleOutput.watchEvent(eventType, data);
                    currentEventType[0] = "";
                }
            });

            System.out.println();
            ConsoleOutput.info("Stream ended.");

        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Lodestar server at localhost:" + port);
            ConsoleOutput.info("Start the server first: lodestar serve");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Watch interrupted.");
        } catch (Exception e) {
            ConsoleOutput.error("Watch failed: " + e.getMessage());
        }
    }
}
