package com.lodestar.core.model;

public enum PhaseStatus {
    NOT_STARTED,
    IN_PROGRESS,
    AWAITING_GATE,
    COMPLETE,
    SKIPPED;

    public boolean isDone() {
        return this == COMPLETE || this == SKIPPED;
    }
}
