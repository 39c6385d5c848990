package com.lodestar.core.model;

/**
 * Lifecycle of one stage. {@code SKIPPED} means the stage's predicate was false;
 * downstream predicates treat it as not required rather than failed.
 */
public enum StageStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    BLOCKED_ON_APPROVAL,
    FAILED,
    SKIPPED;

    public boolean isSettled() {
        return this == COMPLETED || this == SKIPPED;
    }
}
