package com.lodestar.core.verify;

import com.lodestar.core.model.AnchorInvariant;
import com.lodestar.core.model.ConceptAnchor;
import com.lodestar.core.model.GenericizationFlag;
import com.lodestar.core.model.InvariantViolation;
import com.lodestar.core.model.PhaseId;
import com.lodestar.core.model.PhaseVerificationReport;
import com.lodestar.core.model.Severity;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Merges the outcomes of one or more checks into a single report. Deterministic: no
 * generation call is made here.
 * <p>
 * Severity is normalized against the anchor. A violation of an invariant the human
 * confirmed, or one extracted at or above the blocking confidence, is always blocking.
 * A violation naming no known invariant is downgraded to a warning. {@code passed} is
 * recomputed as "no blocking violation".
 */
public class ReportSynthesizer {

    private final double blockingConfidenceThreshold;
    private final Clock clock;

    public ReportSynthesizer(double blockingConfidenceThreshold, Clock clock) {
        this.blockingConfidenceThreshold = blockingConfidenceThreshold;
        this.clock = clock;
    }

    public PhaseVerificationReport synthesize(PhaseId phase, ConceptAnchor anchor, List<CheckOutcome> outcomes) {
        Map<String, InvariantViolation> violations = new LinkedHashMap<>();
        Map<String, GenericizationFlag> genericized = new LinkedHashMap<>();
        Set<String> honored = new LinkedHashSet<>();
        Set<String> preserved = new LinkedHashSet<>();
        List<String> warnings = new ArrayList<>();
        List<String> checks = new ArrayList<>();
        Integer confidence = null;
        boolean completed = !outcomes.isEmpty();

        for (CheckOutcome outcome : outcomes) {
            checks.add(outcome.check().name());
            if (!outcome.isCompleted()) {
                completed = false;
                warnings.add("Verification check " + outcome.check().name() + " did not complete: " + outcome.failure());
                continue;
            }
            CheckFindings findings = outcome.findings();
            for (InvariantViolation v : findings.invariantsViolated()) {
                InvariantViolation normalized = normalize(anchor, v);
                String key = normalized.invariant() + "|" + normalized.stage() + "|" + normalized.violation();
                violations.merge(key, normalized, (a, b) -> a.isBlocking() ? a : b);
            }
            for (GenericizationFlag flag : findings.identityGenericized()) {
                genericized.putIfAbsent(flag.originalFeature() + "|" + flag.stage(), flag);
            }
            honored.addAll(findings.invariantsHonored());
            preserved.addAll(findings.identityPreserved());
            warnings.addAll(findings.warnings());
            int score = clamp(findings.confidenceScore() == null ? 0 : findings.confidenceScore());
            confidence = confidence == null ? score : Math.min(confidence, score);
        }

        violations.values().forEach(v -> honored.remove(v.invariant()));
        genericized.values().forEach(g -> preserved.remove(g.originalFeature()));
        for (InvariantViolation v : violations.values()) {
            if (anchor.invariant(v.invariant()).isEmpty()) {
                warnings.add("Violation reported against unknown invariant '" + v.invariant() + "'");
            }
        }

        List<InvariantViolation> violated = List.copyOf(violations.values());
        boolean passed = violated.stream().noneMatch(InvariantViolation::isBlocking);
        return new PhaseVerificationReport(phase, passed, completed, confidence == null ? 0 : confidence,
                List.copyOf(honored), violated, List.copyOf(preserved), List.copyOf(genericized.values()),
                warnings, checks, clock.instant());
    }

    InvariantViolation normalize(ConceptAnchor anchor, InvariantViolation violation) {
        Optional<AnchorInvariant> invariant = anchor.invariant(violation.invariant());
        if (invariant.isEmpty()) {
            return violation.withSeverity(Severity.WARNING);
        }
        AnchorInvariant inv = invariant.get();
        if (inv.userConfirmed() || (inv.confidence() != null && inv.confidence() >= blockingConfidenceThreshold)) {
            return violation.withSeverity(Severity.BLOCKING);
        }
        return violation;
    }

    private static int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }
}
