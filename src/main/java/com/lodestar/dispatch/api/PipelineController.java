package com.lodestar.dispatch.api;

import com.lodestar.core.assembly.SpecificationAssembler;
import com.lodestar.core.engine.GateView;
import com.lodestar.core.engine.PipelineEngine;
import com.lodestar.core.engine.TimelineEntry;
import com.lodestar.core.model.GateDecision;
import com.lodestar.core.model.PhaseId;
import com.lodestar.core.model.PipelineStatus;
import com.lodestar.core.model.ResolvedSpecification;
import com.lodestar.core.state.PipelineState;
import com.lodestar.core.tracker.ExportedWorkItem;
import com.lodestar.core.tracker.TrackerExportService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * REST controller for the run lifecycle.
 * <p>
 * Anything that executes stages (start, decision, continue, revise) is validated up
 * front and then runs asynchronously; callers follow progress through the events
 * stream or by polling the run.
 */
@RestController
@RequestMapping("/api/v1/runs")
public class PipelineController {

    private static final Logger log = LoggerFactory.getLogger(PipelineController.class);

    private final PipelineEngine engine;
    private final SpecificationAssembler assembler;
    private final TrackerExportService exportService;
    private final SseStreamingService sseStreamingService;

    /** Runs with an execution in flight, keyed by run ID. */
    private final ConcurrentHashMap<String, CompletableFuture<PipelineState>> inFlight = new ConcurrentHashMap<>();

    public PipelineController(PipelineEngine engine,
                              SpecificationAssembler assembler,
                              TrackerExportService exportService,
                              SseStreamingService sseStreamingService) {
        this.engine = engine;
        this.assembler = assembler;
        this.exportService = exportService;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/runs: Start a run. Executes asynchronously up to the first gate.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> startRun(@RequestBody RunRequest request) {
        if (request.idea() == null || request.idea().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Idea text is required"));
        }
        String runId = engine.generateRunId();
        log.info("Accepted run {}, launching async execution", runId);
        launchAsync(runId, () -> engine.start(runId, request.idea(),
                request.legacyOutputs() == null ? Map.of() : request.legacyOutputs(),
                request.designIntegration() != null ? request.designIntegration() : engine.designIntegrationDefault()));
        return ResponseEntity.accepted().body(Map.of(
                "run_id", runId,
                "status", PipelineStatus.RUNNING.name()
        ));
    }

    /**
     * GET /api/v1/runs: List every known run.
     */
    @GetMapping
    public ResponseEntity<List<RunResponse>> listRuns() {
        return ResponseEntity.ok(engine.listRuns().stream().map(RunResponse::from).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<RunResponse> getRun(@PathVariable String id) {
        return ResponseEntity.ok(RunResponse.from(engine.state(id)));
    }

    /**
     * GET /api/v1/runs/{id}/gate: What the human sees at the current gate.
     */
    @GetMapping("/{id}/gate")
    public ResponseEntity<GateView> getGate(@PathVariable String id) {
        return ResponseEntity.ok(engine.gateView(id));
    }

    /**
     * POST /api/v1/runs/{id}/decision: Deliver a gate decision and resume the run.
     */
    @PostMapping("/{id}/decision")
    public ResponseEntity<Map<String, String>> decide(@PathVariable String id, @RequestBody DecisionRequest request) {
        GateDecision decision = request.toDecision();
        PipelineState state = requireIdle(id);
        if (state.status() != PipelineStatus.AWAITING_GATE) {
            throw new IllegalStateException("Run " + id + " is " + state.status() + ", not waiting at a gate");
        }
        log.info("Decision {} accepted for run {}", decision.type(), id);
        launchAsync(id, () -> engine.decide(id, decision));
        return accepted(id);
    }

    /**
     * POST /api/v1/runs/{id}/continue: Resume a cancelled or interrupted run.
     */
    @PostMapping("/{id}/continue")
    public ResponseEntity<Map<String, String>> continueRun(@PathVariable String id) {
        PipelineState state = requireIdle(id);
        if (state.status() != PipelineStatus.CANCELLED && state.status() != PipelineStatus.RUNNING) {
            throw new IllegalStateException("Run " + id + " is " + state.status() + " and cannot be continued");
        }
        launchAsync(id, () -> engine.continueRun(id));
        return accepted(id);
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<RunResponse> cancel(@PathVariable String id) {
        return ResponseEntity.ok(RunResponse.from(engine.cancel(id)));
    }

    /**
     * POST /api/v1/runs/{id}/revise: Re-open a completed phase with feedback.
     */
    @PostMapping("/{id}/revise")
    public ResponseEntity<Map<String, String>> revise(@PathVariable String id, @RequestBody ReviseRequest request) {
        if (request.phase() == null || request.phase().isBlank()) {
            throw new IllegalArgumentException("Phase is required");
        }
        PhaseId phase = PhaseId.fromKey(request.phase());
        PipelineState state = requireIdle(id);
        if (state.status() != PipelineStatus.COMPLETED && state.status() != PipelineStatus.AWAITING_GATE) {
            throw new IllegalStateException("Run " + id + " is " + state.status() + " and cannot be revised");
        }
        launchAsync(id, () -> engine.revise(id, phase, request.feedback()));
        return accepted(id);
    }

    /**
     * GET /api/v1/runs/{id}/specification: The resolved specification, byte-for-byte as assembled.
     */
    @GetMapping(value = "/{id}/specification", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> getSpecification(@PathVariable String id) {
        return ResponseEntity.ok(assembler.toJson(requireSpecification(id)));
    }

    /**
     * POST /api/v1/runs/{id}/export: Draft the specification's work items in the tracker.
     */
    @PostMapping("/{id}/export")
    public ResponseEntity<List<ExportedWorkItem>> export(@PathVariable String id) {
        return ResponseEntity.ok(exportService.export(id, requireSpecification(id)));
    }

    @GetMapping("/{id}/work-items/{workItemId}/status")
    public ResponseEntity<Map<String, String>> workItemStatus(@PathVariable String id, @PathVariable String workItemId) {
        return exportService.queryStatus(id, workItemId)
                .map(status -> ResponseEntity.ok(Map.of("work_item_id", workItemId, "status", status)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/runs/{id}/timeline: Checkpointed state history.
     */
    @GetMapping("/{id}/timeline")
    public ResponseEntity<List<TimelineEntry>> getTimeline(@PathVariable String id) {
        return ResponseEntity.ok(engine.timeline(id));
    }

    /**
     * GET /api/v1/runs/{id}/events: SSE stream of run events.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String id) {
        if (!inFlight.containsKey(id)) {
            engine.state(id);
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }

    private PipelineState requireIdle(String id) {
        PipelineState state = engine.state(id);
        if (inFlight.containsKey(id)) {
            throw new IllegalStateException("Run " + id + " is executing");
        }
        return state;
    }

    private ResolvedSpecification requireSpecification(String id) {
        PipelineState state = engine.state(id);
        return state.specification().orElseThrow(() ->
                new IllegalStateException("Run " + id + " has no specification yet (" + state.status() + ")"));
    }

    private void launchAsync(String runId, Supplier<PipelineState> execution) {
        CompletableFuture<PipelineState> future = CompletableFuture.supplyAsync(execution);
        inFlight.put(runId, future);
        future.whenComplete((state, error) -> {
            inFlight.remove(runId, future);
            if (error != null) {
                log.error("Execution of run {} failed", runId, error);
            }
        });
    }

    private static ResponseEntity<Map<String, String>> accepted(String runId) {
        return ResponseEntity.accepted().body(Map.of(
                "run_id", runId,
                "status", PipelineStatus.RUNNING.name()
        ));
    }
}
