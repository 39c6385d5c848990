package com.lodestar.core.model;

import com.lodestar.core.Fixtures;
import com.lodestar.core.state.StateJson;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    // -- Lenient enum parsing ---------------------------------------------------------

    @Nested
    @DisplayName("Enum parsing")
    class EnumParsing {

        @Test
        @DisplayName("generator spellings are normalized")
        void normalizes() {
            assertEquals(Severity.BLOCKING, Severity.from(" blocking "));
            assertEquals(Recommendation.NO_GO, Recommendation.from("no go"));
            assertEquals(Recommendation.NO_GO, Recommendation.from("No-Go"));
            assertEquals(CapabilityCategory.NON_FUNCTIONAL, CapabilityCategory.from("Non-Functional"));
        }

        @Test
        @DisplayName("capability categories accept their ID infix")
        void categoryInfix() {
            assertEquals(CapabilityCategory.NON_FUNCTIONAL, CapabilityCategory.from("nf"));
            assertEquals(CapabilityCategory.OPERATIONAL, CapabilityCategory.from("OP"));
        }

        @Test
        @DisplayName("unknown values fall back")
        void fallback() {
            assertEquals(Severity.WARNING, Severity.from("catastrophic"));
            assertEquals(CapabilityCategory.FUNCTIONAL, CapabilityCategory.from(null));
        }

        @Test
        @DisplayName("an unknown gate decision is rejected")
        void unknownDecision() {
            var e = assertThrows(IllegalArgumentException.class, () -> GateDecisionType.from("merge"));
            assertEquals("Unknown gate decision: merge", e.getMessage());
            assertEquals(GateDecisionType.OVERRIDE_VIOLATION, GateDecisionType.from("override-violation"));
        }

        @Test
        @DisplayName("phase keys are case-insensitive")
        void phaseKeys() {
            assertEquals(PhaseId.PLANNING, PhaseId.fromKey(" Planning "));
            assertEquals("design", PhaseId.DESIGN.key());
            assertThrows(IllegalArgumentException.class, () -> PhaseId.fromKey("deployment"));
        }
    }

    // -- Concept anchor ---------------------------------------------------------------

    @Nested
    @DisplayName("ConceptAnchor")
    class AnchorTests {

        @Test
        @DisplayName("render lists goal, constraints, non-goals, invariants and identity features")
        void render() {
            AnchorInvariant confirmed = Fixtures.closedCommunity().resolve("closed, invite-only");
            String rendered = Fixtures.anchor(confirmed).render();

            assertTrue(rendered.startsWith("## Concept Anchor (must be honored)\n\nGoal: "));
            assertTrue(rendered.contains("Archetype: CONSUMER_APP"));
            assertTrue(rendered.contains("Explicit constraints:\n- invite-only membership"));
            assertTrue(rendered.contains("Non-goals:\n- public marketplace"));
            assertTrue(rendered.contains("- community_model: closed, invite-only (source: \"A private, invite-only community\", confirmed by user)"));
            assertTrue(rendered.contains("- playtest credits: reciprocity gate before requesting tests"));
        }

        @Test
        @DisplayName("asExtracted drops any claimed confirmation")
        void asExtracted() {
            ConceptAnchor claimed = Fixtures.anchor(Fixtures.closedCommunity().resolve("closed")).freeze();

            ConceptAnchor extracted = claimed.asExtracted();

            assertFalse(extracted.frozen());
            assertFalse(extracted.invariants().get(0).userConfirmed());
            assertEquals("closed", extracted.invariants().get(0).value());
        }

        @Test
        @DisplayName("ambiguity is judged against the threshold")
        void ambiguity() {
            ConceptAnchor anchor = Fixtures.anchor(Fixtures.closedCommunity(), Fixtures.ambiguousMonetization());

            assertEquals(List.of("monetization"),
                    anchor.ambiguousInvariants(0.7).stream().map(AnchorInvariant::property).toList());
            assertEquals(2, anchor.ambiguousInvariants(0.99).size());
        }

        @Test
        @DisplayName("resolving an invariant fixes its value at full confidence")
        void resolve() {
            AnchorInvariant resolved = Fixtures.ambiguousMonetization().resolve("earned only");

            assertEquals("earned only", resolved.value());
            assertEquals(1.0, (double) resolved.confidence());
            assertNull(resolved.ambiguity());
            assertTrue(resolved.clarificationOptions().isEmpty());
            assertTrue(resolved.userConfirmed());
        }

        @Test
        @DisplayName("a missing confidence stays missing and never counts as certain")
        void missingConfidence() {
            var invariant = new AnchorInvariant("p", "v", "s", null, null, null, false);
            assertNull(invariant.confidence());
            assertTrue(invariant.isAmbiguous(0.7));
        }
    }

    // -- Records ----------------------------------------------------------------------

    @Test
    @DisplayName("artifacts copy their collections and sort their fields")
    void artifactIsImmutable() {
        var fields = new java.util.HashMap<String, String>();
        fields.put("b", "2");
        fields.put("a", "1");
        StructuredArtifact artifact = StructuredArtifact.create("CAP-F-001", ArtifactType.CAPABILITY, "t", "s",
                fields, null, PhaseId.SCOPE, Fixtures.PROVENANCE);
        fields.put("c", "3");

        assertEquals(List.of("a", "b"), List.copyOf(artifact.fields().keySet()));
        assertTrue(artifact.serves().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> artifact.fields().put("d", "4"));
    }

    @Test
    @DisplayName("short form shows serves for decisions and implements for work items")
    void shortForm() {
        assertEquals("DEC-001: Invite tokens | Invite tokens [serves CAP-F-001]",
                Fixtures.decision("DEC-001", "Invite tokens", "CAP-F-001").shortForm());
        assertEquals("WI-001: Endpoint | Endpoint [implements DEC-001]",
                Fixtures.workItem("WI-001", "Endpoint", List.of("DEC-001"), List.of()).shortForm());
    }

    @Test
    @DisplayName("a gate decision restored from its JSON-map form keeps its payload")
    void decisionFromJsonMap() {
        GateDecision decision = StateJson.convert(Map.of(
                "type", "resolve_ambiguity",
                "selections", Map.of("monetization", "earned only")), GateDecision.class);

        assertEquals(GateDecisionType.RESOLVE_AMBIGUITY, decision.type());
        assertEquals(Map.of("monetization", "earned only"), decision.selections());
        assertTrue(decision.invariants().isEmpty());
        assertNotNull(decision.decidedAt());
    }

    @Test
    @DisplayName("violations default to warnings")
    void violationDefaults() {
        var violation = new InvariantViolation("community_model", "public profiles", "define_scope", null, null);
        assertFalse(violation.isBlocking());
        assertTrue(violation.withSeverity(Severity.BLOCKING).isBlocking());
    }
}
