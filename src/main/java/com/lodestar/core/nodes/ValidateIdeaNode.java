package com.lodestar.core.nodes;

import com.lodestar.core.llm.GenerationService;
import com.lodestar.core.model.ValidationVerdict;
import com.lodestar.core.workflow.StageHandler;
import com.lodestar.core.workflow.StageRequest;
import com.lodestar.core.workflow.StageResult;
import com.lodestar.core.workflow.Stages;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ValidateIdeaNode implements StageHandler {

    private static final String INSTRUCTIONS = """
            You assess whether the product idea described by the concept anchor is worth building
            as stated. Do not redesign it.
            - recommendation: GO, PIVOT or NO_GO
            - riskLevel: LOW, MEDIUM or HIGH
            - strengths and risks: short bullet phrases tied to this specific idea
            - summary: two or three sentences a later step can rely on without reading anything else
            If you deliberately recommend against an anchor invariant, declare it in overrides
            with the invariant, the reason and the user impact.
            """;

    private final GenerationService generation;

    public ValidateIdeaNode(GenerationService generation) {
        this.generation = generation;
    }

    @Override
    public String stage() {
        return Stages.VALIDATE_IDEA;
    }

    @Override
    public StageResult execute(StageRequest request) {
        ValidationVerdict verdict = generation.generate(INSTRUCTIONS, request.context(), ValidationVerdict.class);
        return StageResult.of(Outputs.require(verdict, stage(),
                v -> v.recommendation() == null ? List.of("recommendation is missing") : List.of()));
    }
}
