package com.lodestar.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SystemTraits(
        String summary,
        boolean userInterface,
        boolean realtime,
        String dataSensitivity,
        List<String> integrations,
        List<InvariantOverride> overrides
) implements StageOutput {

    public SystemTraits {
        integrations = integrations == null ? List.of() : List.copyOf(integrations);
        overrides = overrides == null ? List.of() : List.copyOf(overrides);
    }

    @Override
    @JsonProperty(value = "kind", access = JsonProperty.Access.READ_ONLY)
    public OutputKind kind() {
        return OutputKind.TRAITS;
    }
}
