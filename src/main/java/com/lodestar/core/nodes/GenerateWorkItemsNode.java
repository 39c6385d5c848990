package com.lodestar.core.nodes;

import com.lodestar.core.llm.GenerationService;
import com.lodestar.core.model.WorkItemPlan;
import com.lodestar.core.store.ArtifactStore;
import com.lodestar.core.workflow.StageHandler;
import com.lodestar.core.workflow.StageRequest;
import com.lodestar.core.workflow.StageResult;
import com.lodestar.core.workflow.Stages;
import org.springframework.stereotype.Component;

@Component
public class GenerateWorkItemsNode implements StageHandler {

    private static final String INSTRUCTIONS = """
            Break the resolved project context into implementable work items. For each:
            a local key, title, description, one-line summary, layer (for example data, api, ui,
            infra), implementsIds with capability or decision IDs exactly as listed, dependsOn with
            keys of your other work items or existing work item IDs, and acceptanceCriteria.
            Never implement an uncovered capability. To revise an existing work item set supersedes
            to its ID; do not repeat unchanged work items.
            Keep every invariant; declare deliberate deviations in overrides. End with a summary.
            """;

    private final GenerationService generation;

    public GenerateWorkItemsNode(GenerationService generation) {
        this.generation = generation;
    }

    @Override
    public String stage() {
        return Stages.GENERATE_WORK_ITEMS;
    }

    @Override
    public StageResult execute(StageRequest request) {
        WorkItemPlan plan = Outputs.require(
                generation.generate(INSTRUCTIONS, request.context(), WorkItemPlan.class), stage());
        ArtifactStore store = ArtifactDrafts.writeWorkItems(request.state().store(), plan, request.provenance());
        return StageResult.of(plan, store);
    }
}
