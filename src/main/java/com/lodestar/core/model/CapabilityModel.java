package com.lodestar.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Capabilities proposed by the generator. IDs are assigned by the engine; a draft that
 * revises an existing capability names it in {@code supersedes}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CapabilityModel(
        String summary,
        List<CapabilityDraft> capabilities,
        List<InvariantOverride> overrides
) implements StageOutput {

    public CapabilityModel {
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        overrides = overrides == null ? List.of() : List.copyOf(overrides);
    }

    @Override
    @JsonProperty(value = "kind", access = JsonProperty.Access.READ_ONLY)
    public OutputKind kind() {
        return OutputKind.CAPABILITIES;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CapabilityDraft(
            CapabilityCategory category,
            String name,
            String description,
            String summary,
            String supersedes
    ) implements Serializable {}
}
