package com.lodestar.core.anchor;

import com.lodestar.core.model.AnchorInvariant;
import com.lodestar.core.model.ConceptAnchor;
import com.lodestar.core.model.IdentityFeature;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Programmatic checks on an extracted anchor. Every invariant below the confidence
 * threshold must explain its ambiguity and offer two or three options.
 */
public class AnchorValidator {

    private final double confidenceThreshold;

    public AnchorValidator(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    /** Returns the list of problems; empty when the anchor is well formed. */
    public List<String> validate(ConceptAnchor anchor) {
        List<String> problems = new ArrayList<>();
        if (anchor == null) {
            return List.of("anchor is missing");
        }
        if (isBlank(anchor.goal())) {
            problems.add("goal is missing");
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < anchor.invariants().size(); i++) {
            AnchorInvariant inv = anchor.invariants().get(i);
            String label = isBlank(inv.property()) ? "invariant #" + (i + 1) : "invariant '" + inv.property() + "'";
            if (isBlank(inv.property())) {
                problems.add(label + " has no property name");
            } else if (!seen.add(inv.property())) {
                problems.add(label + " is declared more than once");
            }
            if (isBlank(inv.value())) {
                problems.add(label + " has no required value");
            }
            if (isBlank(inv.source())) {
                problems.add(label + " has no source quote");
            }
            if (inv.confidence() == null) {
                problems.add(label + " has no confidence");
            } else if (inv.confidence() < 0.0 || inv.confidence() > 1.0) {
                problems.add(label + " has confidence " + inv.confidence() + " outside 0..1");
            } else if (inv.isAmbiguous(confidenceThreshold)) {
                if (isBlank(inv.ambiguity())) {
                    problems.add(label + " has confidence " + inv.confidence() + " but no ambiguity text");
                }
                int options = (int) inv.clarificationOptions().stream().filter(o -> !isBlank(o)).count();
                if (options < 2 || options > 3) {
                    problems.add(label + " needs 2-3 clarification options, has " + options);
                }
            }
        }
        for (IdentityFeature feature : anchor.identityFeatures()) {
            if (isBlank(feature.feature())) {
                problems.add("identity feature without a name");
            }
        }
        return problems;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
