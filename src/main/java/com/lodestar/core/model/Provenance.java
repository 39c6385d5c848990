package com.lodestar.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Where an artifact came from. Artifacts whose phase never completed are provisional.
 */
public record Provenance(String runId, String stage, int attempt, Instant createdAt) implements Serializable {}
