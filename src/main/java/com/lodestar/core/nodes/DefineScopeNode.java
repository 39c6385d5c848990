package com.lodestar.core.nodes;

import com.lodestar.core.llm.GenerationService;
import com.lodestar.core.model.ScopeDefinition;
import com.lodestar.core.workflow.StageHandler;
import com.lodestar.core.workflow.StageRequest;
import com.lodestar.core.workflow.StageResult;
import com.lodestar.core.workflow.Stages;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class DefineScopeNode implements StageHandler {

    private static final String INSTRUCTIONS = """
            Define the MVP boundaries for the idea in the concept anchor.
            - inScope: what the first release must do
            - outOfScope: what it deliberately leaves out (include the anchor's non-goals)
            - successCriteria: measurable outcomes
            - summary: a short paragraph later steps can rely on
            Keep every invariant. Declare any deliberate deviation in overrides.
            """;

    private final GenerationService generation;

    public DefineScopeNode(GenerationService generation) {
        this.generation = generation;
    }

    @Override
    public String stage() {
        return Stages.DEFINE_SCOPE;
    }

    @Override
    public StageResult execute(StageRequest request) {
        ScopeDefinition scope = generation.generate(INSTRUCTIONS, request.context(), ScopeDefinition.class);
        return StageResult.of(Outputs.require(scope, stage(),
                s -> s.inScope().isEmpty() ? List.of("inScope is empty") : List.of()));
    }
}
