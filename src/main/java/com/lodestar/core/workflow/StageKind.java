package com.lodestar.core.workflow;

public enum StageKind {
    /** Calls the generation capability; retried with backoff and covered by phase verification. */
    GENERATION,
    /** Pure computation over state; never retried, never verified. */
    DETERMINISTIC
}
