package com.lodestar.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of the independent check run at the end of a phase. Never changed after
 * creation; human acknowledgements live in {@link ViolationOverride} records.
 *
 * @param completed false when the verifier itself failed and the findings are partial
 * @param checks    names of the checks that contributed to this report
 */
public record PhaseVerificationReport(
        PhaseId phase,
        boolean passed,
        boolean completed,
        int confidenceScore,
        List<String> invariantsHonored,
        List<InvariantViolation> invariantsViolated,
        List<String> identityPreserved,
        List<GenericizationFlag> identityGenericized,
        List<String> warnings,
        List<String> checks,
        Instant createdAt
) implements Serializable {

    public PhaseVerificationReport {
        invariantsHonored = invariantsHonored == null ? List.of() : List.copyOf(invariantsHonored);
        invariantsViolated = invariantsViolated == null ? List.of() : List.copyOf(invariantsViolated);
        identityPreserved = identityPreserved == null ? List.of() : List.copyOf(identityPreserved);
        identityGenericized = identityGenericized == null ? List.of() : List.copyOf(identityGenericized);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        checks = checks == null ? List.of() : List.copyOf(checks);
    }

    public List<InvariantViolation> blockingViolations() {
        return invariantsViolated.stream().filter(InvariantViolation::isBlocking).toList();
    }

    public boolean hasBlockingViolations() {
        return invariantsViolated.stream().anyMatch(InvariantViolation::isBlocking);
    }

    /** Blocking violations no override in {@code overrides} acknowledges. */
    public List<InvariantViolation> unacknowledgedBlocking(List<ViolationOverride> overrides) {
        return blockingViolations().stream()
                .filter(v -> overrides.stream().noneMatch(o -> o.covers(phase, v)))
                .toList();
    }

    public boolean incompleteAcknowledged(List<ViolationOverride> overrides) {
        return completed || overrides.stream().anyMatch(o -> o.phase() == phase
                && ViolationOverride.INCOMPLETE_VERIFICATION.equals(o.invariant()));
    }

    public String summary() {
        var sb = new StringBuilder();
        sb.append(passed ? "PASSED" : "FAILED").append(" (confidence ").append(confidenceScore).append("/100)");
        if (!completed) {
            sb.append(", verification incomplete");
        }
        if (!invariantsViolated.isEmpty()) {
            sb.append(", ").append(blockingViolations().size()).append(" blocking / ")
                    .append(invariantsViolated.size()).append(" violations");
        }
        if (!identityGenericized.isEmpty()) {
            sb.append(", ").append(identityGenericized.size()).append(" genericized");
        }
        if (!warnings.isEmpty()) {
            sb.append(", ").append(warnings.size()).append(" warnings");
        }
        return sb.toString();
    }
}
