package com.lodestar.core.workflow;

import com.lodestar.core.model.AnchorInvariant;
import com.lodestar.core.model.InvariantViolation;
import com.lodestar.core.model.PhaseVerificationReport;
import com.lodestar.core.model.StageStatus;
import com.lodestar.core.state.PipelineState;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a phase waiting at its gate may be approved.
 */
@Component
public class GateEvaluator {

    private final double anchorConfidenceThreshold;

    public GateEvaluator(WorkflowProperties properties) {
        this.anchorConfidenceThreshold = properties.getAnchorConfidenceThreshold();
    }

    /**
     * Reasons approval must be refused. A phase can be approved only when every stage has
     * settled, verification ran to completion (or its failure was acknowledged), every
     * blocking violation was acknowledged and no anchor invariant is still ambiguous.
     */
    public List<String> approvalBlockers(PhaseDefinition phase, PipelineState state) {
        List<String> blockers = new ArrayList<>();
        for (StageDefinition stage : phase.stages()) {
            StageStatus status = state.stageStatus(stage.name());
            if (!status.isSettled()) {
                blockers.add("stage " + stage.name() + " is " + status);
            }
        }

        Optional<PhaseVerificationReport> report = state.latestReport(phase.id());
        if (phase.producedOutput(state) && report.isEmpty()) {
            blockers.add("phase " + phase.id() + " has not been verified");
        }
        report.ifPresent(r -> {
            for (InvariantViolation v : r.unacknowledgedBlocking(state.violationOverrides())) {
                blockers.add("blocking violation of '" + v.invariant() + "' in " + v.stage() + " is not acknowledged");
            }
            if (!r.incompleteAcknowledged(state.violationOverrides())) {
                blockers.add("verification did not complete; acknowledge it with override-violation");
            }
        });

        state.anchor().filter(a -> !a.frozen()).ifPresent(anchor -> {
            for (AnchorInvariant inv : anchor.ambiguousInvariants(anchorConfidenceThreshold)) {
                blockers.add("invariant '" + inv.property() + "' is ambiguous: " + inv.ambiguity());
            }
        });
        return blockers;
    }

    public List<AnchorInvariant> ambiguousInvariants(PipelineState state) {
        return state.anchor()
                .filter(a -> !a.frozen())
                .map(a -> a.ambiguousInvariants(anchorConfidenceThreshold))
                .orElse(List.of());
    }
}
