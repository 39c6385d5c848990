package com.lodestar.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    @JsonCreator
    public static RiskLevel from(String raw) {
        return Lenient.parse(RiskLevel.class, raw, MEDIUM);
    }
}
