package com.lodestar.core.nodes;

import com.lodestar.core.llm.GenerationService;
import com.lodestar.core.model.ArchitecturePlan;
import com.lodestar.core.store.ArtifactStore;
import com.lodestar.core.workflow.StageHandler;
import com.lodestar.core.workflow.StageRequest;
import com.lodestar.core.workflow.StageResult;
import com.lodestar.core.workflow.Stages;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Proposes decisions for the capabilities the diff reports as needing one, plus the
 * domain entities those decisions reference.
 */
@Component
public class ArchitectNode implements StageHandler {

    private static final String INSTRUCTIONS = """
            Make architecture decisions for the capabilities listed as needing decisions.
            For each decision: a local key, a title, the choice, the rationale, a one-line summary
            and serves, the capability IDs it satisfies (use the IDs exactly as listed).
            To revise an existing decision set supersedes to its ID.
            For each domain entity: name, description, one-line summary and referencedBy, the keys
            of your decisions or existing decision IDs that use it.
            Decisions must keep every invariant of the concept anchor; declare deliberate
            deviations in overrides. End with a short summary of the architecture.
            """;

    private final GenerationService generation;

    public ArchitectNode(GenerationService generation) {
        this.generation = generation;
    }

    @Override
    public String stage() {
        return Stages.ARCHITECT;
    }

    @Override
    public StageResult execute(StageRequest request) {
        ArchitecturePlan plan = Outputs.require(
                generation.generate(INSTRUCTIONS, request.context(), ArchitecturePlan.class), stage(),
                p -> p.decisions().isEmpty() && p.entities().isEmpty() ? List.of("no decisions proposed") : List.of());
        ArtifactStore store = ArtifactDrafts.writeArchitecture(request.state().store(), plan, request.provenance());
        return StageResult.of(plan, store);
    }
}
