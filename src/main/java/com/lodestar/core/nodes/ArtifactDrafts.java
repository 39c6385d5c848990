package com.lodestar.core.nodes;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.lodestar.core.assembly.SpecificationAssembler;
import com.lodestar.core.error.SchemaValidationException;
import com.lodestar.core.model.*;
import com.lodestar.core.model.ArchitecturePlan.DecisionDraft;
import com.lodestar.core.model.ArchitecturePlan.EntityDraft;
import com.lodestar.core.model.CapabilityModel.CapabilityDraft;
import com.lodestar.core.model.WorkItemPlan.WorkItemDraft;
import com.lodestar.core.state.StateJson;
import com.lodestar.core.store.ArtifactStore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns generator drafts into store artifacts.
 * <p>
 * IDs are always assigned here, never by the generator. A draft naming an existing
 * artifact in {@code supersedes} becomes its replacement; everything else is appended.
 * Any unresolvable reference rejects the whole output, leaving the store untouched.
 */
final class ArtifactDrafts {

    private ArtifactDrafts() {}

    static ArtifactStore writeCapabilities(ArtifactStore store, CapabilityModel model, Provenance provenance) {
        List<String> problems = new ArrayList<>();
        if (model.capabilities().isEmpty() && store.current(ArtifactType.CAPABILITY).isEmpty()) {
            problems.add("no capabilities proposed");
        }
        ArtifactStore result = store;
        for (int i = 0; i < model.capabilities().size(); i++) {
            CapabilityDraft draft = model.capabilities().get(i);
            String label = "capability #" + (i + 1);
            if (isBlank(draft.name())) {
                problems.add(label + " has no name");
                continue;
            }
            if (isBlank(draft.summary())) {
                problems.add(label + " '" + draft.name() + "' has no summary");
                continue;
            }
            CapabilityCategory category = draft.category() == null ? CapabilityCategory.FUNCTIONAL : draft.category();
            var fields = new LinkedHashMap<String, String>();
            fields.put("category", category.name());
            fields.put("description", nullToEmpty(draft.description()));
            StructuredArtifact artifact = StructuredArtifact.create(
                    result.nextId(ArtifactType.CAPABILITY, category.idInfix()), ArtifactType.CAPABILITY,
                    draft.name(), draft.summary(), fields, List.of(), PhaseId.SCOPE, provenance)
                    .withOverrides(model.overrides());
            result = place(result, artifact, draft.supersedes(), PhaseId.SCOPE, problems, label);
        }
        return finish(result, problems, model);
    }

    static ArtifactStore writeArchitecture(ArtifactStore store, ArchitecturePlan plan, Provenance provenance) {
        List<String> problems = new ArrayList<>();
        ArtifactStore result = store;
        Map<String, String> decisionKeys = new HashMap<>();
        for (int i = 0; i < plan.decisions().size(); i++) {
            DecisionDraft draft = plan.decisions().get(i);
            String label = "decision " + (isBlank(draft.key()) ? "#" + (i + 1) : "'" + draft.key() + "'");
            if (isBlank(draft.title()) || isBlank(draft.summary())) {
                problems.add(label + " needs a title and a summary");
                continue;
            }
            if (draft.serves().isEmpty()) {
                problems.add(label + " serves no capability");
            }
            for (String ref : draft.serves()) {
                if (!isActive(store, ref, ArtifactType.CAPABILITY)) {
                    problems.add(label + " serves " + ref + ", which is not an active capability");
                }
            }
            var fields = new LinkedHashMap<String, String>();
            fields.put("choice", nullToEmpty(draft.choice()));
            fields.put("rationale", nullToEmpty(draft.rationale()));
            String id = result.nextId(ArtifactType.DECISION, null);
            StructuredArtifact artifact = StructuredArtifact.create(id, ArtifactType.DECISION, draft.title(),
                    draft.summary(), fields, draft.serves(), PhaseId.DESIGN, provenance)
                    .withOverrides(plan.overrides());
            result = place(result, artifact, draft.supersedes(), PhaseId.DESIGN, problems, label);
            if (!isBlank(draft.key())) {
                decisionKeys.put(draft.key(), id);
            }
        }
        for (int i = 0; i < plan.entities().size(); i++) {
            EntityDraft draft = plan.entities().get(i);
            String label = "entity " + (isBlank(draft.name()) ? "#" + (i + 1) : "'" + draft.name() + "'");
            if (isBlank(draft.name()) || isBlank(draft.summary())) {
                problems.add(label + " needs a name and a summary");
                continue;
            }
            List<String> referencedBy = new ArrayList<>();
            for (String ref : draft.referencedBy()) {
                if (decisionKeys.containsKey(ref)) {
                    referencedBy.add(decisionKeys.get(ref));
                } else if (isActive(result, ref, ArtifactType.DECISION)) {
                    referencedBy.add(ref);
                } else {
                    problems.add(label + " is referenced by unknown decision " + ref);
                }
            }
            StructuredArtifact artifact = StructuredArtifact.create(result.nextId(ArtifactType.ENTITY, null),
                    ArtifactType.ENTITY, draft.name(), draft.summary(),
                    Map.of("description", nullToEmpty(draft.description())), referencedBy, PhaseId.DESIGN, provenance)
                    .withOverrides(plan.overrides());
            result = place(result, artifact, draft.supersedes(), PhaseId.DESIGN, problems, label);
        }
        return finish(result, problems, plan);
    }

    static ArtifactStore writeWorkItems(ArtifactStore store, WorkItemPlan plan, Provenance provenance) {
        List<String> problems = new ArrayList<>();
        if (plan.workItems().isEmpty() && store.current(ArtifactType.WORK_ITEM).isEmpty()) {
            problems.add("no work items proposed");
        }
        String prefix = ArtifactType.WORK_ITEM.idPrefix() + "-";
        int next = Integer.parseInt(store.nextId(ArtifactType.WORK_ITEM, null).substring(prefix.length()));
        Map<String, String> keys = new HashMap<>();
        for (int i = 0; i < plan.workItems().size(); i++) {
            String key = plan.workItems().get(i).key();
            if (!isBlank(key)) {
                keys.put(key, prefix + String.format("%03d", next + i));
            }
        }

        ArtifactStore result = store;
        for (int i = 0; i < plan.workItems().size(); i++) {
            WorkItemDraft draft = plan.workItems().get(i);
            String id = prefix + String.format("%03d", next + i);
            String label = "work item " + (isBlank(draft.key()) ? "#" + (i + 1) : "'" + draft.key() + "'");
            if (isBlank(draft.title()) || isBlank(draft.summary())) {
                problems.add(label + " needs a title and a summary");
                continue;
            }
            if (draft.implementsIds().isEmpty()) {
                problems.add(label + " implements nothing");
            }
            for (String ref : draft.implementsIds()) {
                problems.addAll(SpecificationAssembler.implementationProblems(store, label, ref));
            }
            List<String> dependsOn = new ArrayList<>();
            for (String dep : draft.dependsOn()) {
                if (keys.containsKey(dep)) {
                    dependsOn.add(keys.get(dep));
                } else if (isActive(store, dep, ArtifactType.WORK_ITEM)) {
                    dependsOn.add(dep);
                } else {
                    problems.add(label + " depends on unknown work item " + dep);
                }
            }
            var fields = new LinkedHashMap<String, String>();
            fields.put("description", nullToEmpty(draft.description()));
            fields.put("layer", isBlank(draft.layer()) ? "unspecified" : draft.layer().trim());
            fields.put("acceptanceCriteria", String.join("\n", draft.acceptanceCriteria()));
            StructuredArtifact artifact = StructuredArtifact.create(id, ArtifactType.WORK_ITEM, draft.title(),
                    draft.summary(), fields, draft.implementsIds(), PhaseId.PLANNING, provenance)
                    .withDependsOn(dependsOn)
                    .withOverrides(plan.overrides());
            result = place(result, artifact, draft.supersedes(), PhaseId.PLANNING, problems, label);
        }
        return finish(result, problems, plan);
    }

    private static ArtifactStore place(ArtifactStore store, StructuredArtifact artifact, String supersedes,
                                       PhaseId phase, List<String> problems, String label) {
        if (isBlank(supersedes)) {
            return store.append(artifact);
        }
        if (!isActive(store, supersedes, artifact.type())) {
            problems.add(label + " supersedes " + supersedes + ", which is not an active " + artifact.type());
            return store;
        }
        return store.supersede(supersedes, artifact, phase);
    }

    private static boolean isActive(ArtifactStore store, String id, ArtifactType type) {
        return store.find(id).map(a -> a.type() == type && !a.isSuperseded()).orElse(false);
    }

    private static ArtifactStore finish(ArtifactStore written, List<String> problems, StageOutput output) {
        if (!problems.isEmpty()) {
            throw new SchemaValidationException(output.kind() + " output does not resolve", problems, toJson(output));
        }
        return written;
    }

    static String toJson(Object output) {
        try {
            return StateJson.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(output);
        } catch (JsonProcessingException e) {
            return String.valueOf(output);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
