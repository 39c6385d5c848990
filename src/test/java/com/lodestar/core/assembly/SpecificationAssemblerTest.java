package com.lodestar.core.assembly;

import com.lodestar.core.Fixtures;
import com.lodestar.core.error.SchemaValidationException;
import com.lodestar.core.model.ArtifactType;
import com.lodestar.core.model.PhaseId;
import com.lodestar.core.model.Recommendation;
import com.lodestar.core.model.ResolvedProjectContext;
import com.lodestar.core.model.ResolvedSpecification;
import com.lodestar.core.model.RiskLevel;
import com.lodestar.core.model.StageOutput;
import com.lodestar.core.model.StructuredArtifact;
import com.lodestar.core.model.ValidationVerdict;
import com.lodestar.core.store.ArtifactStore;
import com.lodestar.core.workflow.Stages;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SpecificationAssemblerTest {

    private final SpecificationAssembler assembler = new SpecificationAssembler();

    private static ArtifactStore designedStore() {
        return ArtifactStore.empty()
                .append(Fixtures.capability("CAP-F-001", "Invite members"))
                .append(Fixtures.capability("CAP-F-002", "Request playtest"))
                .append(Fixtures.capability("CAP-F-003", "Leaderboard"))
                .append(Fixtures.decision("DEC-001", "Invite codes", "CAP-F-001"))
                .append(Fixtures.decision("DEC-002", "Credit ledger", "CAP-F-002"))
                .append(Fixtures.entity("ENT-001", "Invitation", "DEC-001"))
                .append(Fixtures.entity("ENT-002", "CreditEntry", "DEC-002"));
    }

    private static ArtifactStore plannedStore() {
        return designedStore()
                .append(Fixtures.workItem("WI-001", "Invitation schema", List.of("DEC-001"), List.of()))
                .append(Fixtures.workItem("WI-002", "Redeem invitation", List.of("CAP-F-001"), List.of("WI-001")))
                .append(Fixtures.workItem("WI-003", "Request a playtest", List.of("CAP-F-002"), List.of("WI-002")));
    }

    private ResolvedProjectContext context(ArtifactStore store) {
        Map<String, StageOutput> outputs = Map.of(Stages.VALIDATE_IDEA,
                new ValidationVerdict("Niche but eager audience", Recommendation.GO, RiskLevel.MEDIUM,
                        List.of(), List.of(), List.of()));
        return assembler.assembleContext(store, Fixtures.frozenAnchor(), outputs, Map.of());
    }

    // -- Project context ------------------------------------------------------

    @Nested
    @DisplayName("assembleContext")
    class ContextTests {

        @Test
        @DisplayName("resolves decisions to the capabilities they serve and their entities")
        void resolvesReferences() {
            ResolvedProjectContext ctx = context(designedStore());

            assertEquals("Niche but eager audience", ctx.verdictSummary());
            assertEquals(3, ctx.capabilities().size());
            var invite = ctx.decisions().get(0);
            assertEquals("DEC-001", invite.decision().id());
            assertEquals("CAP-F-001", invite.serves().get(0).id());
            assertEquals("ENT-001", invite.entities().get(0).id());
            assertEquals(List.of("CAP-F-003"), ctx.uncovered().stream().map(StructuredArtifact::id).toList());
            assertTrue(ctx.render().contains("## Uncovered capabilities"));
        }

        @Test
        @DisplayName("only active artifacts are included")
        void excludesSuperseded() {
            ArtifactStore store = designedStore()
                    .supersede("DEC-002", Fixtures.decision("DEC-003", "Credit ledger v2", "CAP-F-002"), PhaseId.DESIGN);

            ResolvedProjectContext ctx = context(store);

            assertEquals(List.of("DEC-001", "DEC-003"), ctx.decisions().stream().map(d -> d.decision().id()).toList());
        }

        @Test
        @DisplayName("legacy text stands in for missing capability output")
        @SuppressWarnings("removal")
        void legacyPlaceholder() {
            ResolvedProjectContext ctx = assembler.assembleContext(ArtifactStore.empty(), Fixtures.frozenAnchor(),
                    Map.of(), Map.of(Stages.MODEL_CAPABILITIES, "Members can invite friends",
                            Stages.VALIDATE_IDEA, "Looks viable"));

            assertEquals("Looks viable", ctx.verdictSummary());
            assertEquals(1, ctx.placeholders().size());
            StructuredArtifact placeholder = ctx.placeholders().get(0);
            assertTrue(placeholder.placeholder());
            assertEquals(ArtifactType.CAPABILITY, placeholder.type());
            assertEquals("Members can invite friends", placeholder.field("raw"));
        }

        @Test
        @DisplayName("a context needs an anchor")
        void requiresAnchor() {
            assertThrows(IllegalArgumentException.class,
                    () -> assembler.assembleContext(designedStore(), null, Map.of(), Map.of()));
        }
    }

    // -- Specification --------------------------------------------------------

    @Nested
    @DisplayName("attachWorkItems")
    class SpecificationTests {

        @Test
        @DisplayName("work items are resolved in dependency order")
        void resolvesWorkItems() {
            ArtifactStore store = plannedStore();

            ResolvedSpecification spec = assembler.attachWorkItems(context(store), store, List.of());

            assertEquals(List.of("WI-001", "WI-002", "WI-003"),
                    spec.workItems().stream().map(w -> w.workItem().id()).toList());
            assertEquals("DEC-001", spec.workItems().get(0).implementsArtifacts().get(0).id());
            assertEquals("WI-001", spec.workItems().get(1).dependsOn().get(0).id());
            assertEquals(2, spec.workItems().get(2).position());
        }

        @Test
        @DisplayName("a capability no decision serves is listed as uncovered and no work item implements it")
        void reportsUncoveredCapability() {
            ArtifactStore store = plannedStore();

            ResolvedSpecification spec = assembler.attachWorkItems(context(store), store, List.of());

            assertEquals(List.of("CAP-F-003"), spec.uncoveredIds());
            assertTrue(spec.workItems().stream()
                    .flatMap(w -> w.implementsArtifacts().stream())
                    .noneMatch(a -> "CAP-F-003".equals(a.id())));
            assertEquals(3, spec.workItems().size());
        }

        @Test
        @DisplayName("the same store renders to identical bytes")
        void deterministicRendering() {
            ArtifactStore store = plannedStore();

            String first = assembler.toJson(assembler.attachWorkItems(context(store), store, List.of()));
            String second = assembler.toJson(assembler.attachWorkItems(context(store), store, List.of()));

            assertEquals(first, second);
            assertTrue(first.contains("\"WI-003\""));
        }

        @Test
        @DisplayName("a work item implementing an uncovered capability is rejected")
        void rejectsUncoveredImplementation() {
            ArtifactStore store = plannedStore()
                    .append(Fixtures.workItem("WI-004", "Leaderboard page", List.of("CAP-F-003"), List.of()));

            var ex = assertThrows(SchemaValidationException.class,
                    () -> assembler.attachWorkItems(context(store), store, List.of()));
            assertTrue(ex.problems().contains("WI-004 implements uncovered capability CAP-F-003"));
        }

        @Test
        @DisplayName("implementing an entity or an unknown ID is rejected")
        void rejectsBadTargets() {
            ArtifactStore store = designedStore();

            assertEquals(List.of("WI-009 implements unknown artifact CAP-F-099"),
                    SpecificationAssembler.implementationProblems(store, "WI-009", "CAP-F-099"));
            assertTrue(SpecificationAssembler.implementationProblems(store, "WI-009", "ENT-001").get(0)
                    .contains("only capabilities and decisions"));
            assertEquals(List.of(), SpecificationAssembler.implementationProblems(store, "WI-009", "DEC-002"));
        }

        @Test
        @DisplayName("a store without work items cannot become a specification")
        void requiresWorkItems() {
            ArtifactStore store = designedStore();

            assertThrows(SchemaValidationException.class,
                    () -> assembler.attachWorkItems(context(store), store, List.of()));
        }
    }
}
