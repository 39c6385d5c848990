package com.lodestar.core.assembly;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.lodestar.core.error.SchemaValidationException;
import com.lodestar.core.model.*;
import com.lodestar.core.state.StateJson;
import com.lodestar.core.store.ArtifactStore;
import com.lodestar.core.workflow.Stages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Resolves cross-artifact references into the two consumer shapes: the project context
 * (input to work-item generation) and the full specification (terminal output).
 * <p>
 * Deterministic and free of generation calls: the same store always yields an equal
 * result, and {@link #toJson} renders equal results to identical bytes. Consumers never
 * receive a bare ID; every reference is replaced by the artifact it names.
 */
@Component
public class SpecificationAssembler {

    private static final Logger log = LoggerFactory.getLogger(SpecificationAssembler.class);

    public ResolvedProjectContext assembleContext(ArtifactStore store, ConceptAnchor anchor,
                                                  Map<String, StageOutput> outputs,
                                                  Map<String, String> legacyOutputs) {
        if (anchor == null) {
            throw new IllegalArgumentException("Cannot assemble a project context without a concept anchor");
        }
        String verdictSummary = outputs.get(Stages.VALIDATE_IDEA) instanceof ValidationVerdict v
                ? v.summary()
                : legacyOutputs.get(Stages.VALIDATE_IDEA);
        ScopeDefinition scope = outputs.get(Stages.DEFINE_SCOPE) instanceof ScopeDefinition s ? s : null;
        SystemTraits traits = outputs.get(Stages.CLASSIFY_TRAITS) instanceof SystemTraits t ? t : null;

        List<ResolvedCapability> capabilities = new ArrayList<>();
        List<StructuredArtifact> uncovered = new ArrayList<>();
        for (StructuredArtifact cap : store.current(ArtifactType.CAPABILITY)) {
            List<StructuredArtifact> covering = store.coveringDecisions(cap.id());
            capabilities.add(new ResolvedCapability(cap, covering));
            if (covering.isEmpty()) {
                uncovered.add(cap);
            }
        }

        List<ResolvedDecision> decisions = new ArrayList<>();
        for (StructuredArtifact decision : store.current(ArtifactType.DECISION)) {
            List<StructuredArtifact> served = decision.serves().stream().map(store::require).toList();
            decisions.add(new ResolvedDecision(decision, served, store.entitiesReferencedBy(decision.id())));
        }

        List<StructuredArtifact> placeholders = new ArrayList<>();
        addLegacyPlaceholder(placeholders, store, legacyOutputs, Stages.MODEL_CAPABILITIES, ArtifactType.CAPABILITY);
        addLegacyPlaceholder(placeholders, store, legacyOutputs, Stages.ARCHITECT, ArtifactType.DECISION);

        return new ResolvedProjectContext(anchor, verdictSummary, scope, traits, capabilities, decisions,
                store.current(ArtifactType.ENTITY), uncovered, placeholders);
    }

    /**
     * Adds ordered work items to a context.
     *
     * @param order work item IDs in dependency order; when empty the store's active work
     *              items are ordered here
     * @throws SchemaValidationException when a work item implements something that is not
     *                                   an active, covered capability or an active decision
     */
    public ResolvedSpecification attachWorkItems(ResolvedProjectContext context, ArtifactStore store, List<String> order) {
        List<String> ids = order.isEmpty() ? WorkItemOrdering.order(store.current(ArtifactType.WORK_ITEM)) : order;
        if (ids.isEmpty()) {
            throw new SchemaValidationException("A specification needs at least one work item",
                    List.of("no active work items"), null);
        }

        List<String> problems = new ArrayList<>();
        List<ResolvedWorkItem> resolved = new ArrayList<>();
        for (int position = 0; position < ids.size(); position++) {
            StructuredArtifact item = store.require(ids.get(position));
            if (store.isSuperseded(item.id())) {
                problems.add(item.id() + " is superseded and cannot be part of the specification");
                continue;
            }
            List<StructuredArtifact> implemented = new ArrayList<>();
            for (String ref : item.implementsIds()) {
                problems.addAll(implementationProblems(store, item.id(), ref));
                store.find(ref).ifPresent(implemented::add);
            }
            List<StructuredArtifact> dependencies = new ArrayList<>();
            for (String dep : item.dependsOn()) {
                if (!store.contains(dep) || store.isSuperseded(dep)) {
                    problems.add(item.id() + " depends on " + dep + ", which is not an active work item");
                } else {
                    dependencies.add(store.require(dep));
                }
            }
            resolved.add(new ResolvedWorkItem(item, implemented, dependencies, position));
        }
        if (!problems.isEmpty()) {
            throw new SchemaValidationException("Work items do not resolve against the artifact store", problems, null);
        }
        return new ResolvedSpecification(context, resolved);
    }

    /** Checks one {@code implements} reference of a work item. */
    public static List<String> implementationProblems(ArtifactStore store, String workItemId, String ref) {
        if (!store.contains(ref)) {
            return List.of(workItemId + " implements unknown artifact " + ref);
        }
        if (store.isSuperseded(ref)) {
            return List.of(workItemId + " implements superseded artifact " + ref);
        }
        StructuredArtifact target = store.require(ref);
        if (target.type() == ArtifactType.CAPABILITY) {
            if (store.coveringDecisions(ref).isEmpty()) {
                return List.of(workItemId + " implements uncovered capability " + ref);
            }
            return List.of();
        }
        if (target.type() == ArtifactType.DECISION) {
            return List.of();
        }
        return List.of(workItemId + " implements " + target.type() + " " + ref + "; only capabilities and decisions can be implemented");
    }

    /** Canonical JSON rendering; equal specifications always produce identical bytes. */
    public String toJson(ResolvedSpecification specification) {
        try {
            return StateJson.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(specification);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render specification", e);
        }
    }

    /**
     * Wraps raw text from a run that predates structured stage output in a minimal
     * placeholder artifact, so assembly does not fail on it.
     *
     * @deprecated runs without structured stage output are no longer produced; remove
     *             once no stored run carries {@code legacyOutputs}
     */
    @Deprecated(forRemoval = true)
    static StructuredArtifact legacyPlaceholder(String stage, ArtifactType type, String raw) {
        return new StructuredArtifact("LEGACY-" + type.idPrefix(), type, "Legacy " + stage + " output",
                "Unstructured output carried over from an earlier run", Map.of("raw", raw), List.of(), List.of(),
                null, null, null, List.of(), true);
    }

    @SuppressWarnings("removal")
    private void addLegacyPlaceholder(List<StructuredArtifact> placeholders, ArtifactStore store,
                                      Map<String, String> legacyOutputs, String stage, ArtifactType type) {
        String raw = legacyOutputs.get(stage);
        if (raw == null || raw.isBlank() || !store.current(type).isEmpty()) {
            return;
        }
        log.warn("Using a placeholder for unstructured {} output", stage);
        placeholders.add(legacyPlaceholder(stage, type, raw));
    }
}
