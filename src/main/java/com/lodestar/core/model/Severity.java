package com.lodestar.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum Severity {
    BLOCKING,
    WARNING;

    @JsonCreator
    public static Severity from(String raw) {
        return Lenient.parse(Severity.class, raw, WARNING);
    }
}
