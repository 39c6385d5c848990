package com.lodestar.core.nodes;

import com.lodestar.core.assembly.SpecificationAssembler;
import com.lodestar.core.error.SchemaValidationException;
import com.lodestar.core.events.EventBus;
import com.lodestar.core.events.PipelineEvent;
import com.lodestar.core.logging.MdcContext;
import com.lodestar.core.metrics.PipelineMetrics;
import com.lodestar.core.model.*;
import com.lodestar.core.state.PipelineState;
import com.lodestar.core.state.StateUpdates;
import com.lodestar.core.workflow.Stages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Produces the resolved specification after the last gate. When work items were not
 * regenerated in this pass the existing specification is kept unchanged.
 */
@Component
public class FinalizeNode {

    private static final Logger log = LoggerFactory.getLogger(FinalizeNode.class);

    private final SpecificationAssembler assembler;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;

    public FinalizeNode(SpecificationAssembler assembler, EventBus eventBus, PipelineMetrics metrics) {
        this.assembler = assembler;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(PipelineState state) {
        MdcContext.setPhase(state.runId(), PhaseId.PLANNING.name());
        StateUpdates updates = StateUpdates.from(state);
        Optional<ResolvedSpecification> prior = state.specification();
        ResolvedSpecification specification;

        if (prior.isPresent() && state.stageStatus(Stages.GENERATE_WORK_ITEMS) != StageStatus.COMPLETED) {
            log.info("Work items were not regenerated; keeping the existing specification");
            specification = prior.get();
        } else {
            try {
                ResolvedProjectContext context = state.resolvedContext().orElseGet(() -> assembler.assembleContext(
                        state.store(),
                        state.anchor().orElseThrow(() -> new IllegalStateException("No concept anchor")),
                        state.stageOutputs(), state.legacyOutputs()));
                specification = assembler.attachWorkItems(context, state.store(), state.workItemOrder());
            } catch (SchemaValidationException e) {
                String message = e.getMessage() + ": " + String.join("; ", e.problems());
                log.error("Could not assemble the specification: {}", message);
                metrics.incrementEscalations(e.kind().name());
                eventBus.publish(PipelineEvent.of(PipelineEvent.GATE_AWAITING, state.runId(), null,
                        Map.of("phase", PhaseId.PLANNING.name(), "reason", message)));
                return updates.escalate(new Escalation(PhaseId.PLANNING, null, e.kind(), message, e.rawOutput(), Instant.now()))
                        .currentPhase(PhaseId.PLANNING)
                        .phaseStatus(PhaseId.PLANNING, PhaseStatus.AWAITING_GATE)
                        .status(PipelineStatus.AWAITING_GATE)
                        .gateNotice("The specification could not be assembled; request changes to regenerate work items")
                        .build();
            }
            updates.specification(specification);
        }

        log.info("Run complete: {} work item(s), {} uncovered capability(ies)",
                specification.workItems().size(), specification.uncoveredIds().size());
        eventBus.publish(PipelineEvent.of(PipelineEvent.RUN_COMPLETED, state.runId(), null,
                Map.of("workItems", specification.workItems().size())));
        return updates.status(PipelineStatus.COMPLETED).build();
    }
}
