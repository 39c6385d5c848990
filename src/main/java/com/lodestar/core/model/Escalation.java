package com.lodestar.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A problem handed to the human at the nearest gate instead of failing the run.
 *
 * @param rawOutput the generator's unvalidated output, when there is one, for manual correction
 */
public record Escalation(
        PhaseId phase,
        String stage,
        ErrorKind kind,
        String message,
        String rawOutput,
        Instant raisedAt
) implements Serializable {}
