package com.lodestar.core.workflow;

import com.lodestar.core.model.ArtifactDiff;
import com.lodestar.core.model.Provenance;
import com.lodestar.core.state.PipelineState;

import java.time.Instant;

/**
 * Everything a stage handler gets: the state as of stage start, the current diff and the
 * context assembled for this stage.
 *
 * @param attempt 1-based count of times this stage has run in the run, this one included
 */
public record StageRequest(
        String runId,
        StageDefinition stage,
        PipelineState state,
        ArtifactDiff diff,
        String context,
        int attempt
) {

    public Provenance provenance() {
        return new Provenance(runId, stage.name(), attempt, Instant.now());
    }
}
