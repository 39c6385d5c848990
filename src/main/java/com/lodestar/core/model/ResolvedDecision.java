package com.lodestar.core.model;

import java.io.Serializable;
import java.util.List;

public record ResolvedDecision(
        StructuredArtifact decision,
        List<StructuredArtifact> serves,
        List<StructuredArtifact> entities
) implements Serializable {

    public ResolvedDecision {
        serves = List.copyOf(serves);
        entities = List.copyOf(entities);
    }
}
