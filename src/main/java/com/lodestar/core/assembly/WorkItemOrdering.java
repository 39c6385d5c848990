package com.lodestar.core.assembly;

import com.lodestar.core.error.SchemaValidationException;
import com.lodestar.core.model.StructuredArtifact;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.TreeSet;

/**
 * Stable topological order of work items: a work item comes after everything it depends
 * on, and among items whose dependencies are all placed the lowest ID goes first.
 */
public final class WorkItemOrdering {

    private WorkItemOrdering() {}

    /**
     * @throws SchemaValidationException on a dependency outside the given set or a cycle
     */
    public static List<String> order(List<StructuredArtifact> workItems) {
        Map<String, StructuredArtifact> byId = new HashMap<>();
        workItems.forEach(w -> byId.put(w.id(), w));

        List<String> problems = new ArrayList<>();
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (StructuredArtifact w : workItems) {
            inDegree.putIfAbsent(w.id(), 0);
            for (String dep : new TreeSet<>(w.dependsOn())) {
                if (!byId.containsKey(dep)) {
                    problems.add(w.id() + " depends on unknown work item " + dep);
                    continue;
                }
                inDegree.merge(w.id(), 1, Integer::sum);
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(w.id());
            }
        }
        if (!problems.isEmpty()) {
            throw new SchemaValidationException("Work item dependencies do not resolve", problems, null);
        }

        PriorityQueue<String> ready = new PriorityQueue<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(id);
            }
        });
        List<String> ordered = new ArrayList<>();
        while (!ready.isEmpty()) {
            String next = ready.poll();
            ordered.add(next);
            for (String dependent : dependents.getOrDefault(next, List.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (ordered.size() < workItems.size()) {
            TreeSet<String> cyclic = new TreeSet<>(byId.keySet());
            ordered.forEach(cyclic::remove);
            throw new SchemaValidationException("Work item dependencies contain a cycle",
                    List.of("cycle among " + String.join(", ", cyclic)), null);
        }
        return List.copyOf(ordered);
    }
}
