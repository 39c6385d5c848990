package com.lodestar.core.engine;

import com.lodestar.core.diff.DiffEngine;
import com.lodestar.core.events.EventBus;
import com.lodestar.core.events.PipelineEvent;
import com.lodestar.core.graph.PipelineGraph;
import com.lodestar.core.logging.MdcContext;
import com.lodestar.core.metrics.PipelineMetrics;
import com.lodestar.core.model.*;
import com.lodestar.core.persistence.CheckpointQueryService;
import com.lodestar.core.state.PipelineState;
import com.lodestar.core.state.StateUpdates;
import com.lodestar.core.workflow.*;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Orchestrates planning runs by bridging the CLI and REST API to the LangGraph4j graph.
 * <p>
 * Every entry point loads the latest persisted state, applies the caller's change and
 * re-enters the graph, which runs until the next gate, the end of the run or a
 * cancellation. Nothing is held in memory across a gate.
 */
@Service
public class PipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(PipelineEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final PipelineGraph pipelineGraph;
    private final PipelineDefinition definition;
    private final CheckpointQueryService checkpoints;
    private final CancellationRegistry cancellations;
    private final GateEvaluator gateEvaluator;
    private final DiffEngine diffEngine;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;
    private final WorkflowProperties properties;
    private final Set<String> executing = ConcurrentHashMap.newKeySet();

    public PipelineEngine(PipelineGraph pipelineGraph, PipelineDefinition definition,
                          CheckpointQueryService checkpoints, CancellationRegistry cancellations,
                          GateEvaluator gateEvaluator, DiffEngine diffEngine, EventBus eventBus,
                          PipelineMetrics metrics, WorkflowProperties properties) {
        this.pipelineGraph = pipelineGraph;
        this.definition = definition;
        this.checkpoints = checkpoints;
        this.cancellations = cancellations;
        this.gateEvaluator = gateEvaluator;
        this.diffEngine = diffEngine;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
    }

    /**
     * Starts a new run for an idea, generating a new run ID.
     */
    public PipelineState start(String idea) {
        return start(generateRunId(), idea, Map.of(), properties.isDesignIntegrationEnabled());
    }

    public PipelineState start(String idea, Map<String, String> legacyOutputs) {
        return start(generateRunId(), idea, legacyOutputs, properties.isDesignIntegrationEnabled());
    }

    /**
     * Starts a new run with a pre-generated run ID.
     *
     * @param legacyOutputs free-text outputs of stages from an older run, keyed by stage
     *                      name; used as read-only context where no structured output exists
     * @return the state at the first suspension point
     */
    public PipelineState start(String runId, String idea, Map<String, String> legacyOutputs, boolean designIntegration) {
        MdcContext.setRun(runId);
        try {
            log.info("Starting run {}: {}", runId, idea);
            checkpoints.register(runId);
            eventBus.publish(PipelineEvent.of(PipelineEvent.RUN_STARTED, runId, null,
                    Map.of("idea", idea == null ? "" : idea)));

            var stateMap = new HashMap<String, Object>();
            stateMap.put("runId", runId);
            stateMap.put("idea", idea == null ? "" : idea.strip());
            stateMap.put("status", PipelineStatus.RUNNING.name());
            stateMap.put("designIntegrationEnabled", designIntegration);
            if (legacyOutputs != null && !legacyOutputs.isEmpty()) {
                stateMap.put("legacyOutputs", new LinkedHashMap<>(legacyOutputs));
                log.info("Run {} carries legacy output for {}", runId, legacyOutputs.keySet());
            }
            return invoke(runId, stateMap);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Delivers a human decision to the gate the run is suspended at and resumes it.
     *
     * @throws IllegalStateException when the run is not waiting at a gate
     */
    public PipelineState decide(String runId, GateDecision decision) {
        MdcContext.setRun(runId);
        try {
            PipelineState state = requireIdle(runId);
            if (state.status() != PipelineStatus.AWAITING_GATE) {
                throw new IllegalStateException("Run " + runId + " is " + state.status() + ", not waiting at a gate");
            }
            log.info("Decision {} for run {} at the {} gate", decision.type(), runId, state.currentPhase());
            Map<String, Object> input = state.snapshot();
            input.putAll(StateUpdates.from(state).addDecision(decision).build());
            return invoke(runId, input);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Resumes a cancelled or interrupted run from its first pending stage.
     */
    public PipelineState continueRun(String runId) {
        MdcContext.setRun(runId);
        try {
            PipelineState state = requireIdle(runId);
            PipelineStatus status = state.status();
            if (status != PipelineStatus.CANCELLED && status != PipelineStatus.RUNNING) {
                throw new IllegalStateException("Run " + runId + " is " + status + " and cannot be continued"
                        + (status == PipelineStatus.AWAITING_GATE ? "; deliver a gate decision instead" : ""));
            }
            log.info("Continuing run {} at phase {}", runId, state.currentPhase());
            cancellations.clear(runId);
            Map<String, Object> input = state.snapshot();
            input.putAll(StateUpdates.from(state).status(PipelineStatus.RUNNING).build());
            return invoke(runId, input);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Cancels a run. An executing run stops before its next stage; a suspended run is
     * marked cancelled straight away. Artifacts produced so far are kept.
     */
    public PipelineState cancel(String runId) {
        MdcContext.setRun(runId);
        try {
            PipelineState state = checkpoints.getLatestState(runId).orElseThrow(() -> new RunNotFoundException(runId));
            if (state.status() == PipelineStatus.COMPLETED || state.status() == PipelineStatus.CANCELLED) {
                throw new IllegalStateException("Run " + runId + " is already " + state.status());
            }
            cancellations.cancel(runId);
            if (executing.contains(runId)) {
                log.info("Cancellation requested for executing run {}", runId);
                return state;
            }
            log.info("Cancelling suspended run {}", runId);
            var config = RunnableConfig.builder().threadId(runId).build();
            try {
                pipelineGraph.getCompiledGraph().updateState(config,
                        StateUpdates.from(state).status(PipelineStatus.CANCELLED).build());
            } catch (Exception e) {
                throw new IllegalStateException("Failed to persist cancellation of run " + runId, e);
            }
            eventBus.publish(PipelineEvent.of(PipelineEvent.RUN_CANCELLED, runId, null, Map.of()));
            metrics.recordRunResult(PipelineStatus.CANCELLED.name());
            return state(runId);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Re-opens a finished phase with feedback. Later phases are reset but every artifact
     * is kept, so only what the revision actually changes is regenerated.
     */
    public PipelineState revise(String runId, PhaseId phase, String feedback) {
        MdcContext.setPhase(runId, phase.name());
        try {
            PipelineState state = requireIdle(runId);
            if (state.status() != PipelineStatus.COMPLETED && state.status() != PipelineStatus.AWAITING_GATE) {
                throw new IllegalStateException("Run " + runId + " is " + state.status() + " and cannot be revised");
            }
            if (!state.phaseStatus(phase).isDone()) {
                throw new IllegalStateException("Phase " + phase + " is " + state.phaseStatus(phase)
                        + "; only a completed phase can be revised");
            }
            log.info("Revising phase {} of run {}", phase, runId);

            StateUpdates updates = StateUpdates.from(state);
            boolean reopened = false;
            for (PhaseDefinition p : definition.phases()) {
                if (p.id() == phase) {
                    reopened = true;
                    updates.phaseStatus(p.id(), PhaseStatus.IN_PROGRESS);
                } else if (reopened) {
                    updates.phaseStatus(p.id(), PhaseStatus.NOT_STARTED);
                } else {
                    continue;
                }
                updates.correctiveAttempts(p.id(), 0);
                p.stages().forEach(s -> updates.stageStatus(s.name(), StageStatus.PENDING));
            }
            if (feedback != null && !feedback.isBlank()) {
                updates.addFeedback(revisionTarget(definition.phase(phase), state), feedback.strip());
            }
            updates.reopen(phase).currentPhase(phase).status(PipelineStatus.RUNNING).gateNotice("");

            Map<String, Object> input = state.snapshot();
            input.putAll(updates.build());
            return invoke(runId, input);
        } finally {
            MdcContext.clear();
        }
    }

    public boolean designIntegrationDefault() {
        return properties.isDesignIntegrationEnabled();
    }

    public PipelineState state(String runId) {
        return checkpoints.getLatestState(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    public List<PipelineState> listRuns() {
        List<PipelineState> runs = new ArrayList<>();
        for (String runId : checkpoints.listAllThreadIds()) {
            checkpoints.getLatestState(runId).ifPresent(runs::add);
        }
        return runs;
    }

    public GateView gateView(String runId) {
        PipelineState state = state(runId);
        PhaseId phase = state.currentPhase();
        PhaseDefinition phaseDefinition = definition.phase(phase);

        Map<String, String> summaries = new LinkedHashMap<>();
        Map<String, StageOutput> outputs = state.stageOutputs();
        for (StageDefinition stage : phaseDefinition.stages()) {
            StageOutput output = outputs.get(stage.name());
            String summary = output != null ? output.summary() : state.legacyOutputs().getOrDefault(stage.name(), "");
            summaries.put(stage.name(), state.stageStatus(stage.name()) + (summary.isBlank() ? "" : ": " + summary));
        }
        PhaseVerificationReport report = state.latestReport(phase).orElse(null);
        List<InvariantViolation> unacknowledged = report == null
                ? List.of()
                : report.invariantsViolated().stream()
                        .filter(v -> state.violationOverrides().stream().noneMatch(o -> o.covers(phase, v)))
                        .toList();
        return new GateView(runId, phase, state.phaseStatus(phase), summaries, diffEngine.diff(state.store()),
                report, unacknowledged, gateEvaluator.ambiguousInvariants(state), state.openEscalations(),
                state.gateNotice(), gateEvaluator.approvalBlockers(phaseDefinition, state));
    }

    public List<TimelineEntry> timeline(String runId) {
        var entries = checkpoints.listCheckpoints(runId).stream()
                .map(cp -> {
                    PipelineState s = new PipelineState(cp.getState());
                    return new TimelineEntry(cp.getId(), cp.getNodeId(), cp.getNextNodeId(), s.stateVersion(),
                            s.status().name(), s.currentPhase().name());
                })
                .toList();
        if (entries.isEmpty()) {
            throw new RunNotFoundException(runId);
        }
        return entries;
    }

    /**
     * Generates a unique run ID in the format LDST-YYYY-NNNN.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("LDST-%d-%04d", year, count);
    }

    private PipelineState invoke(String runId, Map<String, Object> input) {
        if (!executing.add(runId)) {
            throw new IllegalStateException("Run " + runId + " is already executing");
        }
        try {
            var config = RunnableConfig.builder()
                    .threadId(runId)
                    .build();

            var result = pipelineGraph.getCompiledGraph().invoke(input, config);

            var state = result.orElseThrow(() ->
                    new IllegalStateException("Graph execution returned empty state for run " + runId));

            log.info("Run {} is {} at phase {} (state version {})", runId, state.status(), state.currentPhase(),
                    state.stateVersion());
            metrics.recordRunResult(state.status().name());
            return state;
        } finally {
            executing.remove(runId);
            cancellations.clear(runId);
        }
    }

    private PipelineState requireIdle(String runId) {
        PipelineState state = state(runId);
        if (executing.contains(runId)) {
            throw new IllegalStateException("Run " + runId + " is executing");
        }
        return state;
    }

    /** The anchor is never re-extracted once frozen, so feedback goes to the next generation stage. */
    private static String revisionTarget(PhaseDefinition phase, PipelineState state) {
        boolean frozen = state.anchor().map(ConceptAnchor::frozen).orElse(false);
        return phase.generationStages().stream()
                .map(StageDefinition::name)
                .filter(name -> !(frozen && Stages.EXTRACT_ANCHOR.equals(name)))
                .findFirst()
                .orElse(phase.stages().get(0).name());
    }
}
