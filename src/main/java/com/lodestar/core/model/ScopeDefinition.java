package com.lodestar.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * MVP boundaries: what is in, what is explicitly out, and how success is measured.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScopeDefinition(
        String summary,
        List<String> inScope,
        List<String> outOfScope,
        List<String> successCriteria,
        List<InvariantOverride> overrides
) implements StageOutput {

    public ScopeDefinition {
        inScope = inScope == null ? List.of() : List.copyOf(inScope);
        outOfScope = outOfScope == null ? List.of() : List.copyOf(outOfScope);
        successCriteria = successCriteria == null ? List.of() : List.copyOf(successCriteria);
        overrides = overrides == null ? List.of() : List.copyOf(overrides);
    }

    @Override
    @JsonProperty(value = "kind", access = JsonProperty.Access.READ_ONLY)
    public OutputKind kind() {
        return OutputKind.SCOPE;
    }
}
