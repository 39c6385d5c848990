package com.lodestar.core.model;

import java.io.Serializable;

public record InvariantViolation(
        String invariant,
        String violation,
        String stage,
        Severity severity,
        String suggestedFix
) implements Serializable {

    public InvariantViolation {
        severity = severity == null ? Severity.WARNING : severity;
    }

    public boolean isBlocking() {
        return severity == Severity.BLOCKING;
    }

    public InvariantViolation withSeverity(Severity raised) {
        return new InvariantViolation(invariant, violation, stage, raised, suggestedFix);
    }
}
