package com.lodestar.core.engine;

/**
 * One persisted checkpoint of a run.
 */
public record TimelineEntry(
        String checkpointId,
        String nodeId,
        String nextNodeId,
        int stateVersion,
        String status,
        String phase
) {}
