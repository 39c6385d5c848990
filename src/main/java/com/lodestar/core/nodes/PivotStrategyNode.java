package com.lodestar.core.nodes;

import com.lodestar.core.llm.GenerationService;
import com.lodestar.core.model.PivotStrategy;
import com.lodestar.core.workflow.StageHandler;
import com.lodestar.core.workflow.StageRequest;
import com.lodestar.core.workflow.StageResult;
import com.lodestar.core.workflow.Stages;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs only when the verdict recommends a pivot or rates the risk high.
 */
@Component
public class PivotStrategyNode implements StageHandler {

    private static final String INSTRUCTIONS = """
            The idea was judged risky. Propose two or three pivots that keep the concept anchor's
            invariants and identity features intact, and name the one you recommend. A pivot that
            drops an invariant must be declared in overrides with reason and user impact.
            End with a short summary.
            """;

    private final GenerationService generation;

    public PivotStrategyNode(GenerationService generation) {
        this.generation = generation;
    }

    @Override
    public String stage() {
        return Stages.PIVOT_STRATEGY;
    }

    @Override
    public StageResult execute(StageRequest request) {
        PivotStrategy pivot = generation.generate(INSTRUCTIONS, request.context(), PivotStrategy.class);
        return StageResult.of(Outputs.require(pivot, stage(),
                p -> p.pivotOptions().isEmpty() ? List.of("no pivot options") : List.of()));
    }
}
