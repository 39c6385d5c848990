package com.lodestar.core.nodes;

import com.lodestar.core.llm.GenerationService;
import com.lodestar.core.model.SystemTraits;
import com.lodestar.core.workflow.StageHandler;
import com.lodestar.core.workflow.StageRequest;
import com.lodestar.core.workflow.StageResult;
import com.lodestar.core.workflow.Stages;
import org.springframework.stereotype.Component;

@Component
public class ClassifyTraitsNode implements StageHandler {

    private static final String INSTRUCTIONS = """
            Classify the system described by the anchor, scope and capabilities:
            - userInterface: does it have a user-facing interface
            - realtime: does it need realtime interaction
            - dataSensitivity: LOW, MODERATE or HIGH with a few words on why
            - integrations: external systems it must talk to
            - summary: one or two sentences
            """;

    private final GenerationService generation;

    public ClassifyTraitsNode(GenerationService generation) {
        this.generation = generation;
    }

    @Override
    public String stage() {
        return Stages.CLASSIFY_TRAITS;
    }

    @Override
    public StageResult execute(StageRequest request) {
        SystemTraits traits = generation.generate(INSTRUCTIONS, request.context(), SystemTraits.class);
        return StageResult.of(Outputs.require(traits, stage()));
    }
}
