package com.lodestar.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Set arithmetic over the artifact store: what lacks coverage and what a supersession
 * has invalidated. Recomputed on demand; all lists are sorted by ID.
 *
 * @param uncovered                    active capabilities no active decision serves
 * @param affectedDecisions            active decisions serving a superseded capability
 * @param affectedEntities             active entities referenced by an affected decision
 * @param affectedWorkItems            active work items implementing a superseded capability or decision
 * @param capabilitiesWithoutWorkItems served, active capabilities no active work item implements
 * @param supersededCapabilities       capabilities that have been replaced
 * @param greenfield                   no active decision exists yet
 */
public record ArtifactDiff(
        List<String> uncovered,
        List<String> affectedDecisions,
        List<String> affectedEntities,
        List<String> affectedWorkItems,
        List<String> capabilitiesWithoutWorkItems,
        List<String> supersededCapabilities,
        boolean greenfield
) implements Serializable {

    public ArtifactDiff {
        uncovered = List.copyOf(uncovered);
        affectedDecisions = List.copyOf(affectedDecisions);
        affectedEntities = List.copyOf(affectedEntities);
        affectedWorkItems = List.copyOf(affectedWorkItems);
        capabilitiesWithoutWorkItems = List.copyOf(capabilitiesWithoutWorkItems);
        supersededCapabilities = List.copyOf(supersededCapabilities);
    }

    /** Everything is covered and nothing downstream references a superseded capability. */
    public boolean isEmpty() {
        return uncovered.isEmpty() && affectedDecisions.isEmpty()
                && affectedEntities.isEmpty() && affectedWorkItems.isEmpty();
    }

    public boolean needsArchitecture() {
        return greenfield || !uncovered.isEmpty() || !affectedDecisions.isEmpty();
    }

    public boolean needsWorkItems() {
        return !affectedWorkItems.isEmpty() || !capabilitiesWithoutWorkItems.isEmpty();
    }

    public String summary() {
        if (isEmpty() && capabilitiesWithoutWorkItems.isEmpty()) {
            return greenfield ? "No decisions yet" : "No changes";
        }
        return "%d uncovered, %d affected decisions, %d affected entities, %d affected work items, %d capabilities without work items"
                .formatted(uncovered.size(), affectedDecisions.size(), affectedEntities.size(),
                        affectedWorkItems.size(), capabilitiesWithoutWorkItems.size());
    }
}
