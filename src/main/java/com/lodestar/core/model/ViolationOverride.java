package com.lodestar.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A human acknowledgement of a verifier finding, recorded at a gate.
 * An override whose invariant is {@link #INCOMPLETE_VERIFICATION} acknowledges that
 * the verifier could not finish.
 */
public record ViolationOverride(
        PhaseId phase,
        String invariant,
        String stage,
        Severity severity,
        String acknowledgement,
        Instant recordedAt
) implements Serializable {

    public static final String INCOMPLETE_VERIFICATION = "(verification incomplete)";

    public boolean covers(PhaseId reportPhase, InvariantViolation violation) {
        return phase == reportPhase
                && invariant.equals(violation.invariant())
                && (stage == null || stage.equals(violation.stage()));
    }
}
