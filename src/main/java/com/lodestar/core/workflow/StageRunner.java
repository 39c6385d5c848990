package com.lodestar.core.workflow;

import com.lodestar.core.context.ContextAssembler;
import com.lodestar.core.diff.DiffEngine;
import com.lodestar.core.error.GenerationFailureException;
import com.lodestar.core.error.PipelineException;
import com.lodestar.core.error.SchemaValidationException;
import com.lodestar.core.events.EventBus;
import com.lodestar.core.events.PipelineEvent;
import com.lodestar.core.logging.MdcContext;
import com.lodestar.core.metrics.PipelineMetrics;
import com.lodestar.core.model.ArtifactDiff;
import com.lodestar.core.model.ErrorKind;
import com.lodestar.core.model.Escalation;
import com.lodestar.core.model.PipelineStatus;
import com.lodestar.core.model.StageStatus;
import com.lodestar.core.state.PipelineState;
import com.lodestar.core.state.StateUpdates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Executes one stage inside a graph node: skip check, predicate, context assembly,
 * bounded retries for transient failures, and conversion of every failure into an
 * escalation for the phase gate. A stage with pending feedback always runs.
 */
@Component
public class StageRunner {

    private static final Logger log = LoggerFactory.getLogger(StageRunner.class);

    private final DiffEngine diffEngine;
    private final ContextAssembler contextAssembler;
    private final CancellationRegistry cancellations;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;
    private final WorkflowProperties properties;

    public StageRunner(DiffEngine diffEngine, ContextAssembler contextAssembler, CancellationRegistry cancellations,
                       EventBus eventBus, PipelineMetrics metrics, WorkflowProperties properties) {
        this.diffEngine = diffEngine;
        this.contextAssembler = contextAssembler;
        this.cancellations = cancellations;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
    }

    public Map<String, Object> run(StageDefinition stage, StageHandler handler, PipelineState state) {
        String runId = state.runId();
        MdcContext.setStage(runId, stage.phase().name(), stage.name());
        try {
            StageStatus current = state.stageStatus(stage.name());
            if (current.isSettled() || current == StageStatus.BLOCKED_ON_APPROVAL) {
                log.debug("Stage {} is {}, not re-running", stage.name(), current);
                return Map.of();
            }

            StateUpdates updates = StateUpdates.from(state);
            if (cancellations.isCancelled(runId)) {
                log.info("Run {} cancelled before stage {}", runId, stage.name());
                eventBus.publish(PipelineEvent.of(PipelineEvent.RUN_CANCELLED, runId, stage.name(), Map.of()));
                return updates.status(PipelineStatus.CANCELLED).build();
            }

            ArtifactDiff diff = diffEngine.diff(state.store());
            boolean hasFeedback = !state.feedback(stage.name()).isEmpty();
            if (!hasFeedback && !stage.predicate().test(state, diff)) {
                log.info("Skipping stage {}: not required ({})", stage.name(), diff.summary());
                eventBus.publish(PipelineEvent.of(PipelineEvent.STAGE_SKIPPED, runId, stage.name(),
                        Map.of("diff", diff.summary())));
                return updates.stageStatus(stage.name(), StageStatus.SKIPPED).build();
            }

            String context = stage.isGeneration() ? contextAssembler.forStage(stage, state, diff) : "";
            int attempt = updates.incrementStageAttempts(stage.name());
            StageRequest request = new StageRequest(runId, stage, state, diff, context, attempt);
            log.info("Running stage {} (run attempt {})", stage.name(), attempt);

            long startMs = System.currentTimeMillis();
            try {
                StageResult result = execute(stage, handler, request);
                apply(updates, stage, runId, result);
                metrics.recordStageDuration(stage.name(), result.status().name(), System.currentTimeMillis() - startMs);
            } catch (PipelineException e) {
                fail(updates, stage, runId, e);
                metrics.recordStageDuration(stage.name(), StageStatus.FAILED.name(), System.currentTimeMillis() - startMs);
            }
            return updates.build();
        } finally {
            MdcContext.clearStage();
        }
    }

    private StageResult execute(StageDefinition stage, StageHandler handler, StageRequest request) {
        int maxAttempts = stage.isGeneration() ? Math.max(1, properties.getMaxGenerationAttempts()) : 1;
        for (int attempt = 1; ; attempt++) {
            try {
                return handler.execute(request);
            } catch (GenerationFailureException e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }
                Duration backoff = properties.backoffFor(attempt);
                log.warn("Stage {} generation attempt {}/{} failed: {}; retrying in {} ms",
                        stage.name(), attempt, maxAttempts, e.getMessage(), backoff.toMillis());
                metrics.incrementGenerationRetries(stage.name());
                sleep(backoff);
            }
        }
    }

    private void apply(StateUpdates updates, StageDefinition stage, String runId, StageResult result) {
        if (result.output() != null) {
            updates.stageOutput(stage.name(), result.output());
        }
        if (result.anchor() != null) {
            updates.anchor(result.anchor());
        }
        if (result.store() != null) {
            updates.store(result.store());
        }
        if (result.resolvedContext() != null) {
            updates.resolvedContext(result.resolvedContext());
        }
        if (result.workItemOrder() != null) {
            updates.workItemOrder(result.workItemOrder());
        }

        if (result.status() == StageStatus.BLOCKED_ON_APPROVAL) {
            log.info("Stage {} needs a human decision: {}", stage.name(), result.note());
            updates.stageStatus(stage.name(), StageStatus.BLOCKED_ON_APPROVAL);
            updates.escalate(new Escalation(stage.phase(), stage.name(), ErrorKind.EXTRACTION_AMBIGUITY,
                    result.note(), null, Instant.now()));
            metrics.incrementEscalations(ErrorKind.EXTRACTION_AMBIGUITY.name());
        } else {
            updates.stageStatus(stage.name(), StageStatus.COMPLETED);
        }
        String summary = result.output() != null ? result.output().summary() : "";
        eventBus.publish(PipelineEvent.of(PipelineEvent.STAGE_COMPLETED, runId, stage.name(),
                Map.of("status", result.status().name(), "summary", summary)));
    }

    private void fail(StateUpdates updates, StageDefinition stage, String runId, PipelineException e) {
        String message = e.getMessage() == null ? e.kind().name() : e.getMessage();
        String raw = null;
        if (e instanceof SchemaValidationException schema) {
            message = message + ": " + String.join("; ", schema.problems());
            raw = schema.rawOutput();
        }
        log.error("Stage {} failed ({}): {}", stage.name(), e.kind(), message);
        updates.stageStatus(stage.name(), StageStatus.FAILED);
        updates.escalate(new Escalation(stage.phase(), stage.name(), e.kind(), message, raw, Instant.now()));
        metrics.incrementEscalations(e.kind().name());
        eventBus.publish(PipelineEvent.of(PipelineEvent.STAGE_FAILED, runId, stage.name(),
                Map.of("kind", e.kind().name(), "message", message)));
    }

    private static void sleep(Duration backoff) {
        if (backoff.isZero() || backoff.isNegative()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new GenerationFailureException("Interrupted while backing off", ie);
        }
    }
}
