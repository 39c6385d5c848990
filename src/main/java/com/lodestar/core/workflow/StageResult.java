package com.lodestar.core.workflow;

import com.lodestar.core.model.ConceptAnchor;
import com.lodestar.core.model.ResolvedProjectContext;
import com.lodestar.core.model.StageOutput;
import com.lodestar.core.model.StageStatus;
import com.lodestar.core.store.ArtifactStore;

import java.util.List;

/**
 * What a stage produced. Fields a stage does not touch are {@code null}.
 *
 * @param status {@link StageStatus#COMPLETED}, or {@link StageStatus#BLOCKED_ON_APPROVAL}
 *               when a human must act before the phase can go on
 * @param note   explanation shown at the gate when blocked
 */
public record StageResult(
        StageOutput output,
        ConceptAnchor anchor,
        ArtifactStore store,
        ResolvedProjectContext resolvedContext,
        List<String> workItemOrder,
        StageStatus status,
        String note
) {

    public static StageResult of(StageOutput output) {
        return new StageResult(output, null, null, null, null, StageStatus.COMPLETED, null);
    }

    public static StageResult of(StageOutput output, ArtifactStore store) {
        return new StageResult(output, null, store, null, null, StageStatus.COMPLETED, null);
    }

    public static StageResult anchor(ConceptAnchor anchor) {
        return new StageResult(null, anchor, null, null, null, StageStatus.COMPLETED, null);
    }

    public static StageResult anchorNeedsClarification(ConceptAnchor anchor, String note) {
        return new StageResult(null, anchor, null, null, null, StageStatus.BLOCKED_ON_APPROVAL, note);
    }

    public static StageResult context(ResolvedProjectContext context) {
        return new StageResult(null, null, null, context, null, StageStatus.COMPLETED, null);
    }

    public static StageResult order(List<String> workItemOrder) {
        return new StageResult(null, null, null, null, List.copyOf(workItemOrder), StageStatus.COMPLETED, null);
    }
}
