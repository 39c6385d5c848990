package com.lodestar.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A human decision delivered to a suspended gate.
 *
 * @param feedback       request-changes text, appended to the re-run stage's context
 * @param targetStage    request-changes: stage to re-run (defaults to the phase's first stage)
 * @param selections     resolve-ambiguity: invariant property to chosen value
 * @param acknowledgement override-violation: justification recorded with the override
 * @param invariants     override-violation: invariants to acknowledge (empty = every open finding)
 */
public record GateDecision(
        GateDecisionType type,
        String feedback,
        String targetStage,
        Map<String, String> selections,
        String acknowledgement,
        List<String> invariants,
        Instant decidedAt
) implements Serializable {

    public GateDecision {
        selections = selections == null ? Map.of() : Map.copyOf(selections);
        invariants = invariants == null ? List.of() : List.copyOf(invariants);
        decidedAt = decidedAt == null ? Instant.now() : decidedAt;
    }

    public static GateDecision approve() {
        return new GateDecision(GateDecisionType.APPROVE, null, null, Map.of(), null, List.of(), null);
    }

    public static GateDecision requestChanges(String feedback, String targetStage) {
        return new GateDecision(GateDecisionType.REQUEST_CHANGES, feedback, targetStage, Map.of(), null, List.of(), null);
    }

    public static GateDecision resolveAmbiguity(Map<String, String> selections) {
        return new GateDecision(GateDecisionType.RESOLVE_AMBIGUITY, null, null, selections, null, List.of(), null);
    }

    public static GateDecision overrideViolation(String acknowledgement, List<String> invariants) {
        return new GateDecision(GateDecisionType.OVERRIDE_VIOLATION, null, null, Map.of(), acknowledgement, invariants, null);
    }
}
