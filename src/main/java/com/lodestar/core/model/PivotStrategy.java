package com.lodestar.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PivotStrategy(
        String summary,
        List<String> pivotOptions,
        String recommendedPivot,
        List<InvariantOverride> overrides
) implements StageOutput {

    public PivotStrategy {
        pivotOptions = pivotOptions == null ? List.of() : List.copyOf(pivotOptions);
        overrides = overrides == null ? List.of() : List.copyOf(overrides);
    }

    @Override
    @JsonProperty(value = "kind", access = JsonProperty.Access.READ_ONLY)
    public OutputKind kind() {
        return OutputKind.PIVOT;
    }
}
