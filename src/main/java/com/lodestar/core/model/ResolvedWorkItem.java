package com.lodestar.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A work item with every referenced artifact inlined.
 *
 * @param position zero-based place in dependency order
 */
public record ResolvedWorkItem(
        StructuredArtifact workItem,
        List<StructuredArtifact> implementsArtifacts,
        List<StructuredArtifact> dependsOn,
        int position
) implements Serializable {

    public ResolvedWorkItem {
        implementsArtifacts = List.copyOf(implementsArtifacts);
        dependsOn = List.copyOf(dependsOn);
    }
}
