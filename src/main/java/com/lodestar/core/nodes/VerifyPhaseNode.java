package com.lodestar.core.nodes;

import com.lodestar.core.events.EventBus;
import com.lodestar.core.events.PipelineEvent;
import com.lodestar.core.logging.MdcContext;
import com.lodestar.core.metrics.PipelineMetrics;
import com.lodestar.core.model.ConceptAnchor;
import com.lodestar.core.model.PhaseId;
import com.lodestar.core.model.PhaseStatus;
import com.lodestar.core.model.PhaseVerificationReport;
import com.lodestar.core.model.PipelineStatus;
import com.lodestar.core.model.StageOutput;
import com.lodestar.core.model.StageStatus;
import com.lodestar.core.state.PipelineState;
import com.lodestar.core.state.StateUpdates;
import com.lodestar.core.verify.PhaseVerifier;
import com.lodestar.core.workflow.CancellationRegistry;
import com.lodestar.core.workflow.PhaseDefinition;
import com.lodestar.core.workflow.PipelineDefinition;
import com.lodestar.core.workflow.StageDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs the phase-boundary check over what the phase produced. A phase in which no
 * generation stage ran has nothing to check and is marked skipped, which also
 * skips its gate, unless a human re-opened it.
 */
@Component
public class VerifyPhaseNode {

    private static final Logger log = LoggerFactory.getLogger(VerifyPhaseNode.class);

    private final PipelineDefinition definition;
    private final PhaseVerifier verifier;
    private final CancellationRegistry cancellations;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;

    public VerifyPhaseNode(PipelineDefinition definition, PhaseVerifier verifier, CancellationRegistry cancellations,
                           EventBus eventBus, PipelineMetrics metrics) {
        this.definition = definition;
        this.verifier = verifier;
        this.cancellations = cancellations;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(PhaseId phase, PipelineState state) {
        MdcContext.setPhase(state.runId(), phase.name());
        StateUpdates updates = StateUpdates.from(state);
        if (cancellations.isCancelled(state.runId())) {
            log.info("Run {} cancelled before verifying {}", state.runId(), phase);
            eventBus.publish(PipelineEvent.of(PipelineEvent.RUN_CANCELLED, state.runId(), null, Map.of("phase", phase.name())));
            return updates.status(PipelineStatus.CANCELLED).build();
        }

        PhaseDefinition phaseDefinition = definition.phase(phase);
        if (!phaseDefinition.producedOutput(state)) {
            if (state.reopened(phase)) {
                log.info("Phase {} was re-opened but produced no new output; returning to its gate", phase);
                return updates.build();
            }
            log.info("Phase {} produced no new output; skipping verification and its gate", phase);
            return updates.phaseStatus(phase, PhaseStatus.SKIPPED).build();
        }

        ConceptAnchor anchor = state.anchor()
                .orElseThrow(() -> new IllegalStateException("No concept anchor to verify " + phase + " against"));
        Map<String, StageOutput> all = state.stageOutputs();
        Map<String, StageOutput> phaseOutputs = new LinkedHashMap<>();
        for (StageDefinition stage : phaseDefinition.stages()) {
            if (state.stageStatus(stage.name()) == StageStatus.COMPLETED && all.containsKey(stage.name())) {
                phaseOutputs.put(stage.name(), all.get(stage.name()));
            }
        }

        PhaseVerificationReport report = verifier.verify(phase, phaseDefinition.verification(), anchor,
                phaseOutputs, state.store().currentFromPhase(phase));
        metrics.recordVerification(phase.name(), report.passed(), report.completed(), report.blockingViolations().size());
        eventBus.publish(PipelineEvent.of(PipelineEvent.PHASE_VERIFIED, state.runId(), null,
                Map.of("phase", phase.name(), "passed", report.passed(), "summary", report.summary())));
        return updates.addReport(report).build();
    }
}
