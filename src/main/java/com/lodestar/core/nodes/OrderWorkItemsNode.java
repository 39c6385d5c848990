package com.lodestar.core.nodes;

import com.lodestar.core.assembly.WorkItemOrdering;
import com.lodestar.core.model.ArtifactType;
import com.lodestar.core.workflow.StageHandler;
import com.lodestar.core.workflow.StageRequest;
import com.lodestar.core.workflow.StageResult;
import com.lodestar.core.workflow.Stages;
import org.springframework.stereotype.Component;

@Component
public class OrderWorkItemsNode implements StageHandler {

    @Override
    public String stage() {
        return Stages.ORDER_WORK_ITEMS;
    }

    @Override
    public StageResult execute(StageRequest request) {
        return StageResult.order(WorkItemOrdering.order(request.state().store().current(ArtifactType.WORK_ITEM)));
    }
}
