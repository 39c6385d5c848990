package com.lodestar.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ValidationVerdict(
        String summary,
        Recommendation recommendation,
        RiskLevel riskLevel,
        List<String> strengths,
        List<String> risks,
        List<InvariantOverride> overrides
) implements StageOutput {

    public ValidationVerdict {
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        risks = risks == null ? List.of() : List.copyOf(risks);
        overrides = overrides == null ? List.of() : List.copyOf(overrides);
    }

    @Override
    @JsonProperty(value = "kind", access = JsonProperty.Access.READ_ONLY)
    public OutputKind kind() {
        return OutputKind.VERDICT;
    }

    public boolean warrantsPivot() {
        return recommendation == Recommendation.PIVOT || riskLevel == RiskLevel.HIGH;
    }
}
