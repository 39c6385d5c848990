package com.lodestar.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * References returned by the external mock-up generator.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DesignHandoff(
        String summary,
        List<String> mockupReferences,
        List<InvariantOverride> overrides
) implements StageOutput {

    public DesignHandoff {
        mockupReferences = mockupReferences == null ? List.of() : List.copyOf(mockupReferences);
        overrides = overrides == null ? List.of() : List.copyOf(overrides);
    }

    @Override
    @JsonProperty(value = "kind", access = JsonProperty.Access.READ_ONLY)
    public OutputKind kind() {
        return OutputKind.DESIGN_HANDOFF;
    }
}
