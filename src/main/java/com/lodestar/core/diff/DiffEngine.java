package com.lodestar.core.diff;

import com.lodestar.core.model.ArtifactDiff;
import com.lodestar.core.model.ArtifactType;
import com.lodestar.core.model.StructuredArtifact;
import com.lodestar.core.store.ArtifactStore;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Computes which capabilities lack a covering decision and which downstream artifacts
 * reference a superseded artifact.
 * <p>
 * Pure set arithmetic over artifact lists that include superseded artifacts (with
 * {@code supersededBy} set). No I/O, no generation calls.
 */
@Component
public class DiffEngine {

    public ArtifactDiff diff(ArtifactStore store) {
        return diff(store.history(ArtifactType.CAPABILITY),
                store.history(ArtifactType.DECISION),
                store.history(ArtifactType.ENTITY),
                store.history(ArtifactType.WORK_ITEM));
    }

    public ArtifactDiff diff(List<StructuredArtifact> capabilities,
                             List<StructuredArtifact> decisions,
                             List<StructuredArtifact> entities,
                             List<StructuredArtifact> workItems) {
        Set<String> supersededCaps = ids(capabilities.stream().filter(StructuredArtifact::isSuperseded).toList());
        Set<String> activeCaps = ids(active(capabilities));
        List<StructuredArtifact> activeDecisions = active(decisions);

        Set<String> served = activeDecisions.stream()
                .flatMap(d -> d.serves().stream())
                .collect(Collectors.toCollection(TreeSet::new));

        Set<String> uncovered = new TreeSet<>(activeCaps);
        uncovered.removeAll(served);

        Set<String> affectedDecisions = activeDecisions.stream()
                .filter(d -> intersects(d.serves(), supersededCaps))
                .map(StructuredArtifact::id)
                .collect(Collectors.toCollection(TreeSet::new));

        Set<String> affectedEntities = active(entities).stream()
                .filter(e -> intersects(e.serves(), affectedDecisions))
                .map(StructuredArtifact::id)
                .collect(Collectors.toCollection(TreeSet::new));

        Set<String> supersededRefs = new TreeSet<>(supersededCaps);
        decisions.stream().filter(StructuredArtifact::isSuperseded).map(StructuredArtifact::id).forEach(supersededRefs::add);

        List<StructuredArtifact> activeWorkItems = active(workItems);
        Set<String> affectedWorkItems = activeWorkItems.stream()
                .filter(w -> intersects(w.implementsIds(), supersededRefs))
                .map(StructuredArtifact::id)
                .collect(Collectors.toCollection(TreeSet::new));

        Set<String> implemented = activeWorkItems.stream()
                .flatMap(w -> w.implementsIds().stream())
                .collect(Collectors.toSet());
        Set<String> withoutWorkItems = new TreeSet<>(served);
        withoutWorkItems.retainAll(activeCaps);
        withoutWorkItems.removeAll(implemented);

        return new ArtifactDiff(
                List.copyOf(uncovered),
                List.copyOf(affectedDecisions),
                List.copyOf(affectedEntities),
                List.copyOf(affectedWorkItems),
                List.copyOf(withoutWorkItems),
                List.copyOf(new TreeSet<>(supersededCaps)),
                activeDecisions.isEmpty());
    }

    private static List<StructuredArtifact> active(List<StructuredArtifact> artifacts) {
        return artifacts.stream().filter(a -> !a.isSuperseded()).toList();
    }

    private static Set<String> ids(Collection<StructuredArtifact> artifacts) {
        return artifacts.stream().map(StructuredArtifact::id).collect(Collectors.toCollection(TreeSet::new));
    }

    private static boolean intersects(Collection<String> refs, Set<String> targets) {
        for (String ref : refs) {
            if (targets.contains(ref)) {
                return true;
            }
        }
        return false;
    }
}
