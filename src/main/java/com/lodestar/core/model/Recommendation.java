package com.lodestar.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum Recommendation {
    GO,
    PIVOT,
    NO_GO;

    @JsonCreator
    public static Recommendation from(String raw) {
        return Lenient.parse(Recommendation.class, raw, GO);
    }
}
