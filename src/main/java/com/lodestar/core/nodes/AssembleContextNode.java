package com.lodestar.core.nodes;

import com.lodestar.core.assembly.SpecificationAssembler;
import com.lodestar.core.model.ConceptAnchor;
import com.lodestar.core.state.PipelineState;
import com.lodestar.core.workflow.StageHandler;
import com.lodestar.core.workflow.StageRequest;
import com.lodestar.core.workflow.StageResult;
import com.lodestar.core.workflow.Stages;
import org.springframework.stereotype.Component;

/**
 * Deterministic: resolves the anchor and every active scope and architecture artifact
 * into the project context that work-item generation reads.
 */
@Component
public class AssembleContextNode implements StageHandler {

    private final SpecificationAssembler assembler;

    public AssembleContextNode(SpecificationAssembler assembler) {
        this.assembler = assembler;
    }

    @Override
    public String stage() {
        return Stages.ASSEMBLE_CONTEXT;
    }

    @Override
    public StageResult execute(StageRequest request) {
        PipelineState state = request.state();
        ConceptAnchor anchor = state.anchor()
                .orElseThrow(() -> new IllegalStateException("No concept anchor for run " + request.runId()));
        return StageResult.context(assembler.assembleContext(state.store(), anchor,
                state.stageOutputs(), state.legacyOutputs()));
    }
}
