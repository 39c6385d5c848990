package com.lodestar.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a run executes, used for SSE streaming and CLI output.
 *
 * @param eventType event type, e.g. "run.started", "stage.completed", "gate.awaiting"
 * @param runId     the run this event belongs to
 * @param stage     the stage this event relates to (null for run- and phase-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record PipelineEvent(
    String eventType,
    String runId,
    String stage,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String RUN_STARTED = "run.started";
    public static final String STAGE_COMPLETED = "stage.completed";
    public static final String STAGE_SKIPPED = "stage.skipped";
    public static final String STAGE_FAILED = "stage.failed";
    public static final String PHASE_VERIFIED = "phase.verified";
    public static final String GATE_AWAITING = "gate.awaiting";
    public static final String GATE_DECIDED = "gate.decided";
    public static final String RUN_COMPLETED = "run.completed";
    public static final String RUN_CANCELLED = "run.cancelled";

    public static PipelineEvent of(String eventType, String runId, String stage, Map<String, Object> payload) {
        return new PipelineEvent(eventType, runId, stage, payload, Instant.now());
    }
}
