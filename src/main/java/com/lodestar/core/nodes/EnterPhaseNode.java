package com.lodestar.core.nodes;

import com.lodestar.core.error.EntryConditionException;
import com.lodestar.core.events.EventBus;
import com.lodestar.core.events.PipelineEvent;
import com.lodestar.core.logging.MdcContext;
import com.lodestar.core.metrics.PipelineMetrics;
import com.lodestar.core.model.Escalation;
import com.lodestar.core.model.PhaseId;
import com.lodestar.core.model.PhaseStatus;
import com.lodestar.core.model.PipelineStatus;
import com.lodestar.core.state.PipelineState;
import com.lodestar.core.state.StateUpdates;
import com.lodestar.core.workflow.EntryConditions;
import com.lodestar.core.workflow.PipelineDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Checks a phase's entry conditions. A phase whose prerequisites are missing never
 * starts: the run goes back to the previous phase's gate with the failure attached,
 * or is blocked outright when there is no previous phase.
 */
@Component
public class EnterPhaseNode {

    private static final Logger log = LoggerFactory.getLogger(EnterPhaseNode.class);

    private final PipelineDefinition definition;
    private final EntryConditions entryConditions;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;

    public EnterPhaseNode(PipelineDefinition definition, EntryConditions entryConditions,
                          EventBus eventBus, PipelineMetrics metrics) {
        this.definition = definition;
        this.entryConditions = entryConditions;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(PhaseId phase, PipelineState state) {
        MdcContext.setPhase(state.runId(), phase.name());
        StateUpdates updates = StateUpdates.from(state);
        try {
            entryConditions.check(phase, state);
        } catch (EntryConditionException e) {
            log.warn(e.getMessage());
            updates.escalate(new Escalation(phase, null, e.kind(), e.getMessage(), null, Instant.now()));
            metrics.incrementEscalations(e.kind().name());
            Optional<PhaseId> previous = definition.previous(phase);
            if (previous.isPresent()) {
                updates.currentPhase(previous.get())
                        .phaseStatus(previous.get(), PhaseStatus.AWAITING_GATE)
                        .status(PipelineStatus.AWAITING_GATE);
                eventBus.publish(PipelineEvent.of(PipelineEvent.GATE_AWAITING, state.runId(), null,
                        Map.of("phase", previous.get().name(), "reason", e.getMessage())));
            } else {
                updates.currentPhase(phase).status(PipelineStatus.BLOCKED);
            }
            return updates.build();
        }

        log.info("Entering phase {} ({})", phase, phase.title());
        updates.currentPhase(phase).status(PipelineStatus.RUNNING);
        if (state.phaseStatus(phase) != PhaseStatus.IN_PROGRESS) {
            updates.phaseStatus(phase, PhaseStatus.IN_PROGRESS);
        }
        return updates.build();
    }
}
