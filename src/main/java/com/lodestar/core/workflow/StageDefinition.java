package com.lodestar.core.workflow;

import com.lodestar.core.model.PhaseId;

import java.util.List;

/**
 * One node of the declarative stage graph.
 *
 * @param inputs names of upstream stages whose summaries go into this stage's context
 */
public record StageDefinition(
        String name,
        PhaseId phase,
        StageKind kind,
        List<String> inputs,
        ContextScope scope,
        StagePredicate predicate
) {

    public StageDefinition {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        scope = scope == null ? ContextScope.NONE : scope;
        predicate = predicate == null ? StagePredicate.ALWAYS : predicate;
    }

    public boolean isGeneration() {
        return kind == StageKind.GENERATION;
    }
}
