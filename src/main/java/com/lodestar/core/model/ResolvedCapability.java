package com.lodestar.core.model;

import java.io.Serializable;
import java.util.List;

public record ResolvedCapability(
        StructuredArtifact capability,
        List<StructuredArtifact> coveredBy
) implements Serializable {

    public ResolvedCapability {
        coveredBy = List.copyOf(coveredBy);
    }
}
