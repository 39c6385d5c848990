package com.lodestar.core.verify;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.lodestar.core.model.GenericizationFlag;
import com.lodestar.core.model.InvariantViolation;

import java.util.List;

/**
 * Raw findings of one verification check, as returned by the generator.
 * Severities here are the generator's opinion; {@link ReportSynthesizer} has the last word.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CheckFindings(
        List<String> invariantsHonored,
        List<InvariantViolation> invariantsViolated,
        List<String> identityPreserved,
        List<GenericizationFlag> identityGenericized,
        List<String> warnings,
        Integer confidenceScore,
        String rationale
) {

    public CheckFindings {
        invariantsHonored = invariantsHonored == null ? List.of() : List.copyOf(invariantsHonored);
        invariantsViolated = invariantsViolated == null ? List.of() : List.copyOf(invariantsViolated);
        identityPreserved = identityPreserved == null ? List.of() : List.copyOf(identityPreserved);
        identityGenericized = identityGenericized == null ? List.of() : List.copyOf(identityGenericized);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
