package com.lodestar.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A property of the original idea that every later stage must keep.
 *
 * @param property             short name, e.g. "community_model"
 * @param value                the required value, e.g. "closed, invite-only"
 * @param source               verbatim quote from the idea the invariant was taken from
 * @param confidence           0..1; values below the anchor threshold need ambiguity text and options.
 *                             Null when the extraction omitted it, which validation rejects
 * @param ambiguity            what is unclear, when confidence is low
 * @param clarificationOptions two or three candidate values offered to the human
 * @param userConfirmed        set once a human picked a value
 */
public record AnchorInvariant(
        String property,
        String value,
        String source,
        Double confidence,
        String ambiguity,
        List<String> clarificationOptions,
        boolean userConfirmed
) implements Serializable {

    public AnchorInvariant {
        clarificationOptions = clarificationOptions == null ? List.of() : List.copyOf(clarificationOptions);
    }

    public boolean isAmbiguous(double threshold) {
        return confidence == null || confidence < threshold;
    }

    /** Returns a copy fixed to the chosen value, at full confidence, with the ambiguity cleared. */
    public AnchorInvariant resolve(String selection) {
        return new AnchorInvariant(property, selection, source, 1.0, null, List.of(), true);
    }

    AnchorInvariant unconfirmed() {
        return new AnchorInvariant(property, value, source, confidence, ambiguity, clarificationOptions, false);
    }
}
