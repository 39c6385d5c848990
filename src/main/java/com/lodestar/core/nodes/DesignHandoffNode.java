package com.lodestar.core.nodes;

import com.lodestar.core.error.GenerationFailureException;
import com.lodestar.core.model.DesignHandoff;
import com.lodestar.core.workflow.StageHandler;
import com.lodestar.core.workflow.StageRequest;
import com.lodestar.core.workflow.StageResult;
import com.lodestar.core.workflow.Stages;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Hands the scope and traits to the external mock-up generator and records the
 * references it returns.
 */
@Component
public class DesignHandoffNode implements StageHandler {

    private final ObjectProvider<DesignMockupGenerator> generator;

    public DesignHandoffNode(ObjectProvider<DesignMockupGenerator> generator) {
        this.generator = generator;
    }

    @Override
    public String stage() {
        return Stages.DESIGN_HANDOFF;
    }

    @Override
    public StageResult execute(StageRequest request) {
        DesignMockupGenerator mockups = generator.getIfAvailable();
        if (mockups == null) {
            throw new GenerationFailureException("No design mock-up generator is configured");
        }
        DesignHandoff handoff = mockups.requestMockups(request.context());
        return StageResult.of(Outputs.require(handoff, stage()));
    }
}
