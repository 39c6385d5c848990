package com.lodestar.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Immutable distillation of the original idea. Rendered verbatim into every stage's
 * context and into every verification. Once {@link #frozen()} no stage may replace it.
 */
public record ConceptAnchor(
        String goal,
        List<String> explicitConstraints,
        List<String> nonGoals,
        List<AnchorInvariant> invariants,
        List<IdentityFeature> identityFeatures,
        ProductArchetype archetype,
        boolean frozen
) implements Serializable {

    public ConceptAnchor {
        explicitConstraints = explicitConstraints == null ? List.of() : List.copyOf(explicitConstraints);
        nonGoals = nonGoals == null ? List.of() : List.copyOf(nonGoals);
        invariants = invariants == null ? List.of() : List.copyOf(invariants);
        identityFeatures = identityFeatures == null ? List.of() : List.copyOf(identityFeatures);
    }

    public Optional<AnchorInvariant> invariant(String property) {
        return invariants.stream().filter(i -> i.property().equals(property)).findFirst();
    }

    public List<AnchorInvariant> ambiguousInvariants(double threshold) {
        return invariants.stream().filter(i -> i.isAmbiguous(threshold)).toList();
    }

    public ConceptAnchor withInvariants(List<AnchorInvariant> replacement) {
        return new ConceptAnchor(goal, explicitConstraints, nonGoals, replacement, identityFeatures, archetype, frozen);
    }

    public ConceptAnchor freeze() {
        return new ConceptAnchor(goal, explicitConstraints, nonGoals, invariants, identityFeatures, archetype, true);
    }

    /**
     * Strips anything a generator may have claimed about confirmation: a fresh anchor is
     * never frozen and no invariant in it is user-confirmed.
     */
    public ConceptAnchor asExtracted() {
        return new ConceptAnchor(goal, explicitConstraints, nonGoals,
                invariants.stream().map(AnchorInvariant::unconfirmed).toList(),
                identityFeatures, archetype, false);
    }

    /**
     * Plain-text block placed at the top of every generation and verification context.
     */
    public String render() {
        var sb = new StringBuilder();
        sb.append("## Concept Anchor (must be honored)\n\n");
        sb.append("Goal: ").append(goal).append('\n');
        if (archetype != null) {
            sb.append("Archetype: ").append(archetype.name()).append('\n');
        }
        if (!explicitConstraints.isEmpty()) {
            sb.append("\nExplicit constraints:\n");
            explicitConstraints.forEach(c -> sb.append("- ").append(c).append('\n'));
        }
        if (!nonGoals.isEmpty()) {
            sb.append("\nNon-goals:\n");
            nonGoals.forEach(n -> sb.append("- ").append(n).append('\n'));
        }
        if (!invariants.isEmpty()) {
            sb.append("\nInvariants:\n");
            for (AnchorInvariant inv : invariants) {
                sb.append("- ").append(inv.property()).append(": ").append(inv.value());
                sb.append(" (source: \"").append(inv.source()).append("\"");
                if (inv.userConfirmed()) {
                    sb.append(", confirmed by user");
                }
                sb.append(")\n");
            }
        }
        if (!identityFeatures.isEmpty()) {
            sb.append("\nIdentity features (do not replace with generic equivalents):\n");
            for (IdentityFeature f : identityFeatures) {
                sb.append("- ").append(f.feature()).append(": ").append(f.whyDistinctive()).append('\n');
            }
        }
        return sb.toString();
    }
}
