package com.lodestar.core.nodes;

import com.lodestar.core.llm.GenerationService;
import com.lodestar.core.model.CapabilityModel;
import com.lodestar.core.store.ArtifactStore;
import com.lodestar.core.workflow.StageHandler;
import com.lodestar.core.workflow.StageRequest;
import com.lodestar.core.workflow.StageResult;
import com.lodestar.core.workflow.Stages;
import org.springframework.stereotype.Component;

/**
 * Proposes capabilities and writes them to the store as {@code CAP-F-nnn},
 * {@code CAP-NF-nnn} or {@code CAP-OP-nnn}.
 */
@Component
public class ModelCapabilitiesNode implements StageHandler {

    private static final String INSTRUCTIONS = """
            List the capabilities the in-scope MVP needs. For each: category FUNCTIONAL,
            NON_FUNCTIONAL or OPERATIONAL, a short name, a description and a one-line summary.
            If current capabilities are listed, only propose what is missing or must change;
            to change one, set supersedes to its ID. Do not repeat unchanged capabilities.
            Keep every invariant and identity feature; declare deliberate deviations in overrides.
            End with a summary of the capability model.
            """;

    private final GenerationService generation;

    public ModelCapabilitiesNode(GenerationService generation) {
        this.generation = generation;
    }

    @Override
    public String stage() {
        return Stages.MODEL_CAPABILITIES;
    }

    @Override
    public StageResult execute(StageRequest request) {
        CapabilityModel model = Outputs.require(
                generation.generate(INSTRUCTIONS, request.context(), CapabilityModel.class), stage());
        ArtifactStore store = ArtifactDrafts.writeCapabilities(request.state().store(), model, request.provenance());
        return StageResult.of(model, store);
    }
}
