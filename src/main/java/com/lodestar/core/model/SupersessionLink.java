package com.lodestar.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Records that {@code supersedingId} replaced {@code supersededId}. Links are only ever added.
 */
public record SupersessionLink(
        String supersededId,
        String supersedingId,
        PhaseId phase,
        Instant recordedAt
) implements Serializable {}
