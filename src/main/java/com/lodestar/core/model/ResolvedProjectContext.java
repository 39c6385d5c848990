package com.lodestar.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Anchor plus every active scope and architecture artifact, with references resolved.
 * Input to work-item generation; it never carries work items.
 *
 * @param uncovered    active capabilities no decision serves
 * @param placeholders raw-text stand-ins for upstream output that was never structured
 */
public record ResolvedProjectContext(
        ConceptAnchor anchor,
        String verdictSummary,
        ScopeDefinition scope,
        SystemTraits traits,
        List<ResolvedCapability> capabilities,
        List<ResolvedDecision> decisions,
        List<StructuredArtifact> entities,
        List<StructuredArtifact> uncovered,
        List<StructuredArtifact> placeholders
) implements Serializable {

    public ResolvedProjectContext {
        if (anchor == null) {
            throw new IllegalArgumentException("A resolved context requires an anchor");
        }
        capabilities = List.copyOf(capabilities);
        decisions = List.copyOf(decisions);
        entities = List.copyOf(entities);
        uncovered = List.copyOf(uncovered);
        placeholders = List.copyOf(placeholders);
    }

    public String render() {
        var sb = new StringBuilder(anchor.render());
        if (verdictSummary != null && !verdictSummary.isBlank()) {
            sb.append("\n## Validation\n").append(verdictSummary).append('\n');
        }
        if (scope != null) {
            sb.append("\n## Scope\n").append(scope.summary()).append('\n');
            scope.inScope().forEach(s -> sb.append("- in: ").append(s).append('\n'));
            scope.outOfScope().forEach(s -> sb.append("- out: ").append(s).append('\n'));
        }
        if (traits != null) {
            sb.append("\n## System traits\n").append(traits.summary()).append('\n');
        }
        sb.append("\n## Capabilities\n");
        for (ResolvedCapability c : capabilities) {
            sb.append("- ").append(c.capability().shortForm()).append('\n');
        }
        sb.append("\n## Decisions\n");
        for (ResolvedDecision d : decisions) {
            sb.append("- ").append(d.decision().shortForm()).append('\n');
        }
        if (!entities.isEmpty()) {
            sb.append("\n## Entities\n");
            entities.forEach(e -> sb.append("- ").append(e.shortForm()).append('\n'));
        }
        if (!uncovered.isEmpty()) {
            sb.append("\n## Uncovered capabilities (no decision yet; do not plan work for them)\n");
            uncovered.forEach(u -> sb.append("- ").append(u.id()).append('\n'));
        }
        for (StructuredArtifact p : placeholders) {
            sb.append("\n## ").append(p.title()).append(" (unstructured)\n").append(p.field("raw")).append('\n');
        }
        return sb.toString();
    }
}
