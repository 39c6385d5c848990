package com.lodestar.core.workflow;

import com.lodestar.core.model.ArtifactDiff;
import com.lodestar.core.state.PipelineState;

/**
 * Decides whether an optional stage runs. Evaluated over accumulated state just before
 * the stage would start; a {@code false} result skips the stage.
 */
@FunctionalInterface
public interface StagePredicate {

    StagePredicate ALWAYS = (state, diff) -> true;

    boolean test(PipelineState state, ArtifactDiff diff);
}
