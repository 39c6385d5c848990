package com.lodestar.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/runs/{id}/revise.
 *
 * @param phase    discovery, scope, design or planning
 * @param feedback what should change; nullable
 */
public record ReviseRequest(
    String phase,
    String feedback
) {}
