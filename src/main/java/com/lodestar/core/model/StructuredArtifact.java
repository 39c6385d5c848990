package com.lodestar.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Generic envelope for capabilities, decisions, entities and work items.
 * <p>
 * {@code serves} holds the IDs this artifact satisfies: capability IDs for a decision,
 * decision IDs that reference an entity, capability or decision IDs a work item
 * implements. {@code supersededBy} is only ever populated on views handed out by the
 * artifact store; stored instances are never changed.
 */
public record StructuredArtifact(
        String id,
        ArtifactType type,
        String title,
        String summary,
        Map<String, String> fields,
        List<String> serves,
        List<String> dependsOn,
        String supersededBy,
        PhaseId sourcePhase,
        Provenance provenance,
        List<InvariantOverride> overrides,
        boolean placeholder
) implements Serializable {

    public StructuredArtifact {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(fields));
        serves = serves == null ? List.of() : List.copyOf(serves);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        overrides = overrides == null ? List.of() : List.copyOf(overrides);
    }

    public static StructuredArtifact create(String id, ArtifactType type, String title, String summary,
                                            Map<String, String> fields, List<String> serves,
                                            PhaseId sourcePhase, Provenance provenance) {
        return new StructuredArtifact(id, type, title, summary, fields, serves, List.of(),
                null, sourcePhase, provenance, List.of(), false);
    }

    public boolean isSuperseded() {
        return supersededBy != null;
    }

    /** Work-item view of {@link #serves()}. */
    public List<String> implementsIds() {
        return serves;
    }

    public String field(String name) {
        return fields.getOrDefault(name, "");
    }

    public StructuredArtifact withSupersededBy(String successorId) {
        return new StructuredArtifact(id, type, title, summary, fields, serves, dependsOn,
                successorId, sourcePhase, provenance, overrides, placeholder);
    }

    public StructuredArtifact withDependsOn(List<String> dependencies) {
        return new StructuredArtifact(id, type, title, summary, fields, serves, dependencies,
                supersededBy, sourcePhase, provenance, overrides, placeholder);
    }

    public StructuredArtifact withOverrides(List<InvariantOverride> declared) {
        return new StructuredArtifact(id, type, title, summary, fields, serves, dependsOn,
                supersededBy, sourcePhase, provenance, declared, placeholder);
    }

    /** One-line form used in context blocks and gate summaries. */
    public String shortForm() {
        var sb = new StringBuilder(id).append(": ").append(title);
        if (summary != null && !summary.isBlank()) {
            sb.append(" | ").append(summary);
        }
        if (!serves.isEmpty()) {
            sb.append(type == ArtifactType.WORK_ITEM ? " [implements " : " [serves ")
                    .append(String.join(", ", serves)).append(']');
        }
        return sb.toString();
    }
}
