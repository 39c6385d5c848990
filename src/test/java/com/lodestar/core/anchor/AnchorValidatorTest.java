package com.lodestar.core.anchor;

import com.lodestar.core.Fixtures;
import com.lodestar.core.model.AnchorInvariant;
import com.lodestar.core.model.ConceptAnchor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnchorValidatorTest {

    private final AnchorValidator validator = new AnchorValidator(0.7);

    @Test
    @DisplayName("accepts confident and properly clarified invariants")
    void acceptsWellFormedAnchor() {
        ConceptAnchor anchor = Fixtures.anchor(Fixtures.closedCommunity(), Fixtures.ambiguousMonetization());

        assertEquals(List.of(), validator.validate(anchor));
    }

    @Test
    @DisplayName("rejects a missing anchor")
    void rejectsNull() {
        assertEquals(List.of("anchor is missing"), validator.validate(null));
    }

    @Test
    @DisplayName("low-confidence invariants need ambiguity text and two or three options")
    void lowConfidenceNeedsClarification() {
        var bare = new AnchorInvariant("audience", "designers", "indie board game designers", 0.5,
                null, List.of("a", "b", "c", "d"), false);

        List<String> problems = validator.validate(Fixtures.anchor(bare));

        assertEquals(2, problems.size());
        assertTrue(problems.get(0).contains("no ambiguity text"));
        assertTrue(problems.get(1).contains("needs 2-3 clarification options, has 4"));
    }

    @Test
    @DisplayName("flags duplicate properties, missing values and out-of-range confidence")
    void flagsMalformedInvariants() {
        var first = new AnchorInvariant("scope", "x", "src", 1.0, null, List.of(), false);
        var duplicate = new AnchorInvariant("scope", "", "src", 1.4, null, List.of(), false);

        List<String> problems = validator.validate(Fixtures.anchor(first, duplicate));

        assertTrue(problems.contains("invariant 'scope' is declared more than once"));
        assertTrue(problems.contains("invariant 'scope' has no required value"));
        assertTrue(problems.stream().anyMatch(p -> p.contains("outside 0..1")));
    }

    @Test
    @DisplayName("an invariant without a confidence is a problem")
    void flagsMissingConfidence() {
        var unscored = new AnchorInvariant("community_model", "open to anyone", "designers", null,
                null, List.of(), false);

        List<String> problems = validator.validate(Fixtures.anchor(unscored));

        assertEquals(List.of("invariant 'community_model' has no confidence"), problems);
    }
}
