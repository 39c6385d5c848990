package com.lodestar.core.anchor;

import com.lodestar.core.error.ExtractionAmbiguityException;
import com.lodestar.core.model.AnchorInvariant;
import com.lodestar.core.model.ConceptAnchor;
import com.lodestar.core.workflow.WorkflowProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Applies human clarifications to an anchor and freezes it.
 */
@Service
public class AnchorClarifier {

    private static final Logger log = LoggerFactory.getLogger(AnchorClarifier.class);

    private final double confidenceThreshold;

    public AnchorClarifier(WorkflowProperties properties) {
        this.confidenceThreshold = properties.getAnchorConfidenceThreshold();
    }

    /**
     * Returns a new anchor in which each selected invariant carries the chosen value at
     * confidence 1.0, with ambiguity cleared and the user-confirmed flag set.
     *
     * @param selections invariant property to chosen value
     * @throws IllegalStateException    if the anchor is already frozen
     * @throws IllegalArgumentException for unknown properties or blank selections
     */
    public ConceptAnchor resolve(ConceptAnchor anchor, Map<String, String> selections) {
        if (anchor.frozen()) {
            throw new IllegalStateException("The concept anchor is frozen and cannot be changed");
        }
        for (var entry : selections.entrySet()) {
            if (anchor.invariant(entry.getKey()).isEmpty()) {
                throw new IllegalArgumentException("Unknown invariant '" + entry.getKey() + "'");
            }
            if (entry.getValue() == null || entry.getValue().isBlank()) {
                throw new IllegalArgumentException("Blank selection for invariant '" + entry.getKey() + "'");
            }
        }
        List<AnchorInvariant> updated = new ArrayList<>();
        for (AnchorInvariant inv : anchor.invariants()) {
            String choice = selections.get(inv.property());
            if (choice == null) {
                updated.add(inv);
                continue;
            }
            if (!inv.clarificationOptions().isEmpty() && !inv.clarificationOptions().contains(choice)) {
                log.info("Invariant '{}' resolved with a custom value outside the offered options", inv.property());
            }
            updated.add(inv.resolve(choice));
        }
        return anchor.withInvariants(updated);
    }

    /**
     * Describes each selection that replaces the offered options with a value of the
     * human's own, e.g. {@code monetization = "sponsor funded" (offered: earned only, earned or purchased)}.
     */
    public List<String> customSelections(ConceptAnchor anchor, Map<String, String> selections) {
        List<String> custom = new ArrayList<>();
        for (AnchorInvariant inv : anchor.invariants()) {
            String choice = selections.get(inv.property());
            if (choice != null && !inv.clarificationOptions().isEmpty()
                    && !inv.clarificationOptions().contains(choice)) {
                custom.add(inv.property() + " = \"" + choice.strip() + "\" (offered: "
                        + String.join(", ", inv.clarificationOptions()) + ")");
            }
        }
        return custom;
    }

    public List<AnchorInvariant> unresolved(ConceptAnchor anchor) {
        return anchor.ambiguousInvariants(confidenceThreshold);
    }

    /**
     * @throws ExtractionAmbiguityException while any invariant is still ambiguous
     */
    public ConceptAnchor freeze(ConceptAnchor anchor) {
        List<AnchorInvariant> open = unresolved(anchor);
        if (!open.isEmpty()) {
            throw new ExtractionAmbiguityException(open.stream().map(AnchorInvariant::property).toList());
        }
        return anchor.frozen() ? anchor : anchor.freeze();
    }
}
