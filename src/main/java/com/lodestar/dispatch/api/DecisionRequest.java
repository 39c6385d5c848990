package com.lodestar.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lodestar.core.model.GateDecision;
import com.lodestar.core.model.GateDecisionType;

import java.util.List;
import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/runs/{id}/decision.
 *
 * @param type            APPROVE, REQUEST_CHANGES, RESOLVE_AMBIGUITY or OVERRIDE_VIOLATION
 * @param feedback        request-changes text
 * @param targetStage     request-changes: stage to re-run; nullable
 * @param selections      resolve-ambiguity: invariant property to chosen value
 * @param acknowledgement override-violation justification
 * @param invariants      override-violation: invariants to acknowledge; empty means all
 */
public record DecisionRequest(
    GateDecisionType type,
    String feedback,
    @JsonProperty("target_stage") String targetStage,
    Map<String, String> selections,
    String acknowledgement,
    List<String> invariants
) {

    public GateDecision toDecision() {
        if (type == null) {
            throw new IllegalArgumentException("Decision type is required");
        }
        return new GateDecision(type, feedback, targetStage, selections, acknowledgement, invariants, null);
    }
}
