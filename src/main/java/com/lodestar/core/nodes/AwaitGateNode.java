package com.lodestar.core.nodes;

import com.lodestar.core.events.EventBus;
import com.lodestar.core.events.PipelineEvent;
import com.lodestar.core.logging.MdcContext;
import com.lodestar.core.metrics.PipelineMetrics;
import com.lodestar.core.model.ErrorKind;
import com.lodestar.core.model.Escalation;
import com.lodestar.core.model.InvariantViolation;
import com.lodestar.core.model.PhaseId;
import com.lodestar.core.model.PhaseStatus;
import com.lodestar.core.model.PipelineStatus;
import com.lodestar.core.state.PipelineState;
import com.lodestar.core.state.StateUpdates;
import com.lodestar.core.workflow.GateEvaluator;
import com.lodestar.core.workflow.PhaseDefinition;
import com.lodestar.core.workflow.PipelineDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Suspends the run at a phase gate. The graph ends here; a later decision resumes it
 * from the persisted state.
 */
@Component
public class AwaitGateNode {

    private static final Logger log = LoggerFactory.getLogger(AwaitGateNode.class);

    private final PipelineDefinition definition;
    private final GateEvaluator gateEvaluator;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;

    public AwaitGateNode(PipelineDefinition definition, GateEvaluator gateEvaluator,
                         EventBus eventBus, PipelineMetrics metrics) {
        this.definition = definition;
        this.gateEvaluator = gateEvaluator;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(PhaseId phase, PipelineState state) {
        MdcContext.setPhase(state.runId(), phase.name());
        PhaseDefinition phaseDefinition = definition.phase(phase);
        StateUpdates updates = StateUpdates.from(state)
                .currentPhase(phase)
                .phaseStatus(phase, PhaseStatus.AWAITING_GATE)
                .status(PipelineStatus.AWAITING_GATE);

        boolean settled = phaseDefinition.stages().stream().allMatch(s -> state.stageStatus(s.name()).isSettled());
        boolean alreadyEscalated = state.openEscalations().stream()
                .anyMatch(e -> e.phase() == phase && e.kind() == ErrorKind.VERIFICATION_VIOLATION);
        if (settled && !alreadyEscalated) {
            state.latestReport(phase).ifPresent(report -> {
                List<InvariantViolation> blocking = report.unacknowledgedBlocking(state.violationOverrides());
                if (!blocking.isEmpty()) {
                    String invariants = blocking.stream().map(InvariantViolation::invariant).distinct()
                            .collect(Collectors.joining(", "));
                    updates.escalate(new Escalation(phase, null, ErrorKind.VERIFICATION_VIOLATION,
                            "Blocking violations remain after " + state.correctiveAttempts(phase)
                                    + " corrective re-run(s): " + invariants,
                            null, Instant.now()));
                    metrics.incrementEscalations(ErrorKind.VERIFICATION_VIOLATION.name());
                }
            });
        }

        List<String> blockers = gateEvaluator.approvalBlockers(phaseDefinition, state);
        log.info("Awaiting decision at the {} gate ({} open issue(s))", phase, blockers.size());
        eventBus.publish(PipelineEvent.of(PipelineEvent.GATE_AWAITING, state.runId(), null,
                Map.of("phase", phase.name(), "blockers", blockers)));
        return updates.build();
    }
}
