package com.lodestar.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum GateDecisionType {
    APPROVE,
    REQUEST_CHANGES,
    RESOLVE_AMBIGUITY,
    OVERRIDE_VIOLATION;

    @JsonCreator
    public static GateDecisionType from(String raw) {
        GateDecisionType parsed = Lenient.parse(GateDecisionType.class, raw, null);
        if (parsed == null) {
            throw new IllegalArgumentException("Unknown gate decision: " + raw);
        }
        return parsed;
    }
}
