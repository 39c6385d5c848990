package com.lodestar.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Terminal output of a run: the resolved context plus ordered, resolved work items.
 * Always carries at least one work item.
 */
public record ResolvedSpecification(
        ResolvedProjectContext context,
        List<ResolvedWorkItem> workItems
) implements Serializable {

    public ResolvedSpecification {
        if (context == null) {
            throw new IllegalArgumentException("A specification requires a resolved context");
        }
        if (workItems == null || workItems.isEmpty()) {
            throw new IllegalArgumentException("A specification requires at least one work item");
        }
        workItems = List.copyOf(workItems);
    }

    public List<String> uncoveredIds() {
        return context.uncovered().stream().map(StructuredArtifact::id).toList();
    }
}
