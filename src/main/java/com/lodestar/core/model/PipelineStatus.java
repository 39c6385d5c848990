package com.lodestar.core.model;

/**
 * Run-level status shown to callers.
 */
public enum PipelineStatus {
    RUNNING,
    AWAITING_GATE,
    BLOCKED,
    CANCELLED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
