package com.lodestar.core.nodes;

import com.lodestar.core.Fixtures;
import com.lodestar.core.anchor.AnchorClarifier;
import com.lodestar.core.anchor.ConceptAnchorExtractor;
import com.lodestar.core.diff.DiffEngine;
import com.lodestar.core.error.SchemaValidationException;
import com.lodestar.core.llm.GenerationService;
import com.lodestar.core.model.ArchitecturePlan;
import com.lodestar.core.model.ArchitecturePlan.DecisionDraft;
import com.lodestar.core.model.ArchitecturePlan.EntityDraft;
import com.lodestar.core.model.ArtifactType;
import com.lodestar.core.model.CapabilityCategory;
import com.lodestar.core.model.CapabilityModel;
import com.lodestar.core.model.CapabilityModel.CapabilityDraft;
import com.lodestar.core.model.ConceptAnchor;
import com.lodestar.core.model.Recommendation;
import com.lodestar.core.model.RiskLevel;
import com.lodestar.core.model.StageStatus;
import com.lodestar.core.model.StructuredArtifact;
import com.lodestar.core.model.ValidationVerdict;
import com.lodestar.core.model.WorkItemPlan;
import com.lodestar.core.model.WorkItemPlan.WorkItemDraft;
import com.lodestar.core.state.PipelineState;
import com.lodestar.core.store.ArtifactStore;
import com.lodestar.core.workflow.PipelineDefinition;
import com.lodestar.core.workflow.StageHandler;
import com.lodestar.core.workflow.StageRequest;
import com.lodestar.core.workflow.StageResult;
import com.lodestar.core.workflow.WorkflowProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class GenerationNodesTest {

    private WorkflowProperties properties;
    private PipelineDefinition definition;
    private GenerationService generation;

    @BeforeEach
    void setUp() {
        properties = new WorkflowProperties();
        definition = new PipelineDefinition(properties, false);
        generation = mock(GenerationService.class);
    }

    private StageRequest request(StageHandler handler, PipelineState state) {
        return new StageRequest("LDST-1", definition.stage(handler.stage()), state,
                new DiffEngine().diff(state.store()), "## Concept Anchor (must be honored)", 1);
    }

    private static ArtifactStore coveredCapability() {
        return ArtifactStore.empty()
                .append(Fixtures.capability("CAP-F-001", "Invite members"))
                .append(Fixtures.decision("DEC-001", "Invite tokens", "CAP-F-001"));
    }

    // -- Anchor extraction ---------------------------------------------------------

    @Nested
    @DisplayName("extract_anchor")
    class ExtractAnchor {

        private ExtractAnchorNode node;

        @BeforeEach
        void setUp() {
            node = new ExtractAnchorNode(new ConceptAnchorExtractor(generation, properties), new AnchorClarifier(properties));
        }

        @Test
        @DisplayName("a clear anchor completes the stage unfrozen")
        void clearAnchor() {
            when(generation.generate(anyString(), anyString(), eq(ConceptAnchor.class)))
                    .thenReturn(Fixtures.anchor(Fixtures.closedCommunity()));

            StageResult result = node.execute(request(node, Fixtures.state(null, ArtifactStore.empty())));

            assertEquals(StageStatus.COMPLETED, result.status());
            assertFalse(result.anchor().frozen());
            assertEquals("closed, invite-only", result.anchor().invariant("community_model").orElseThrow().value());
        }

        @Test
        @DisplayName("an ambiguous invariant blocks the stage with its options")
        void ambiguousAnchorBlocks() {
            when(generation.generate(anyString(), anyString(), eq(ConceptAnchor.class)))
                    .thenReturn(Fixtures.anchor(Fixtures.closedCommunity(), Fixtures.ambiguousMonetization()));

            StageResult result = node.execute(request(node, Fixtures.state(null, ArtifactStore.empty())));

            assertEquals(StageStatus.BLOCKED_ON_APPROVAL, result.status());
            assertNotNull(result.anchor());
            assertTrue(result.note().contains("monetization"));
            assertTrue(result.note().contains("earned only | earned or purchased"));
        }
    }

    // -- Validation ------------------------------------------------------------------

    @Nested
    @DisplayName("validate_idea")
    class ValidateIdea {

        @Test
        @DisplayName("a verdict without a recommendation is rejected")
        void requiresRecommendation() {
            ValidateIdeaNode node = new ValidateIdeaNode(generation);
            when(generation.generate(anyString(), anyString(), eq(ValidationVerdict.class)))
                    .thenReturn(new ValidationVerdict("Looks viable", null, RiskLevel.LOW, List.of(), List.of(), List.of()));

            var ex = assertThrows(SchemaValidationException.class,
                    () -> node.execute(request(node, Fixtures.state(Fixtures.frozenAnchor(), ArtifactStore.empty()))));
            assertTrue(ex.problems().contains("recommendation is missing"));
        }

        @Test
        @DisplayName("a verdict without a summary is rejected")
        void requiresSummary() {
            ValidateIdeaNode node = new ValidateIdeaNode(generation);
            when(generation.generate(anyString(), anyString(), eq(ValidationVerdict.class)))
                    .thenReturn(new ValidationVerdict(" ", Recommendation.GO, RiskLevel.LOW, List.of(), List.of(), List.of()));

            var ex = assertThrows(SchemaValidationException.class,
                    () -> node.execute(request(node, Fixtures.state(Fixtures.frozenAnchor(), ArtifactStore.empty()))));
            assertTrue(ex.problems().contains("summary is missing"));
            assertNotNull(ex.rawOutput());
        }
    }

    // -- Capabilities ----------------------------------------------------------------

    @Nested
    @DisplayName("model_capabilities")
    class ModelCapabilities {

        private ModelCapabilitiesNode node;

        @BeforeEach
        void setUp() {
            node = new ModelCapabilitiesNode(generation);
        }

        @Test
        @DisplayName("IDs are assigned per category by the engine")
        void assignsIds() {
            when(generation.generate(anyString(), anyString(), eq(CapabilityModel.class))).thenReturn(new CapabilityModel(
                    "Two capabilities",
                    List.of(new CapabilityDraft(CapabilityCategory.FUNCTIONAL, "Invite members", "Send invites", "Invites", null),
                            new CapabilityDraft(CapabilityCategory.NON_FUNCTIONAL, "Private data", "No public pages", "Privacy", null)),
                    List.of()));

            StageResult result = node.execute(request(node, Fixtures.state(Fixtures.frozenAnchor(), ArtifactStore.empty())));

            assertTrue(result.store().contains("CAP-F-001"));
            assertTrue(result.store().contains("CAP-NF-001"));
            assertEquals("NON_FUNCTIONAL", result.store().require("CAP-NF-001").field("category"));
        }

        @Test
        @DisplayName("a revision supersedes the named capability and keeps the original")
        void supersedes() {
            ArtifactStore store = ArtifactStore.empty().append(Fixtures.capability("CAP-F-001", "Invite members"));
            when(generation.generate(anyString(), anyString(), eq(CapabilityModel.class))).thenReturn(new CapabilityModel(
                    "Revised invites",
                    List.of(new CapabilityDraft(CapabilityCategory.FUNCTIONAL, "Invite by referral", "Members refer", "Referrals", "CAP-F-001")),
                    List.of()));

            StageResult result = node.execute(request(node, Fixtures.state(Fixtures.frozenAnchor(), store)));

            assertTrue(result.store().isSuperseded("CAP-F-001"));
            assertEquals("Invite by referral", result.store().require("CAP-F-002").title());
            assertEquals(List.of("CAP-F-002"),
                    result.store().current(ArtifactType.CAPABILITY).stream().map(StructuredArtifact::id).toList());
        }

        @Test
        @DisplayName("superseding an unknown capability rejects the whole output")
        void rejectsUnknownSupersession() {
            when(generation.generate(anyString(), anyString(), eq(CapabilityModel.class))).thenReturn(new CapabilityModel(
                    "Revision",
                    List.of(new CapabilityDraft(CapabilityCategory.FUNCTIONAL, "Invite", "Invite", "Invite", "CAP-F-009")),
                    List.of()));

            var ex = assertThrows(SchemaValidationException.class,
                    () -> node.execute(request(node, Fixtures.state(Fixtures.frozenAnchor(), ArtifactStore.empty()))));
            assertTrue(ex.problems().contains("capability #1 supersedes CAP-F-009, which is not an active CAPABILITY"));
        }
    }

    // -- Architecture ----------------------------------------------------------------

    @Nested
    @DisplayName("architect")
    class Architect {

        private ArchitectNode node;

        @BeforeEach
        void setUp() {
            node = new ArchitectNode(generation);
        }

        @Test
        @DisplayName("entities referring to a decision key get the decision's assigned ID")
        void resolvesDecisionKeys() {
            ArtifactStore store = ArtifactStore.empty().append(Fixtures.capability("CAP-F-001", "Invite members"));
            when(generation.generate(anyString(), anyString(), eq(ArchitecturePlan.class))).thenReturn(new ArchitecturePlan(
                    "Token invites",
                    List.of(new DecisionDraft("invites", "Invite tokens", "Signed tokens", "No open signup",
                            "Single-use tokens", List.of("CAP-F-001"), null)),
                    List.of(new EntityDraft("Invitation", "A pending invite", "Invite record", List.of("invites"), null)),
                    List.of()));

            StageResult result = node.execute(request(node, Fixtures.state(Fixtures.frozenAnchor(), store)));

            assertEquals(List.of("CAP-F-001"), result.store().require("DEC-001").serves());
            assertEquals(List.of("DEC-001"), result.store().require("ENT-001").serves());
            assertEquals(1, result.store().coveringDecisions("CAP-F-001").size());
        }

        @Test
        @DisplayName("a decision serving an unknown capability is rejected")
        void rejectsUnknownCapability() {
            when(generation.generate(anyString(), anyString(), eq(ArchitecturePlan.class))).thenReturn(new ArchitecturePlan(
                    "Token invites",
                    List.of(new DecisionDraft("invites", "Invite tokens", "Signed tokens", "No open signup",
                            "Single-use tokens", List.of("CAP-F-042"), null)),
                    List.of(),
                    List.of()));

            var ex = assertThrows(SchemaValidationException.class,
                    () -> node.execute(request(node, Fixtures.state(Fixtures.frozenAnchor(), ArtifactStore.empty()))));
            assertTrue(ex.problems().contains("decision 'invites' serves CAP-F-042, which is not an active capability"));
        }

        @Test
        @DisplayName("a plan with neither decisions nor entities is incomplete")
        void rejectsEmptyPlan() {
            when(generation.generate(anyString(), anyString(), eq(ArchitecturePlan.class)))
                    .thenReturn(new ArchitecturePlan("Nothing", List.of(), List.of(), List.of()));

            var ex = assertThrows(SchemaValidationException.class,
                    () -> node.execute(request(node, Fixtures.state(Fixtures.frozenAnchor(), ArtifactStore.empty()))));
            assertTrue(ex.problems().contains("no decisions proposed"));
        }
    }

    // -- Work items ------------------------------------------------------------------

    @Nested
    @DisplayName("generate_work_items")
    class GenerateWorkItems {

        private GenerateWorkItemsNode node;

        @BeforeEach
        void setUp() {
            node = new GenerateWorkItemsNode(generation);
        }

        @Test
        @DisplayName("draft keys in dependsOn become work item IDs")
        void mapsKeys() {
            when(generation.generate(anyString(), anyString(), eq(WorkItemPlan.class))).thenReturn(new WorkItemPlan(
                    "Invites",
                    List.of(new WorkItemDraft("schema", "Invitation table", "Create table", "Table", "data",
                                    List.of("DEC-001"), List.of(), List.of("migration applies"), null),
                            new WorkItemDraft("api", "Invite endpoint", "POST /invites", "Endpoint", null,
                                    List.of("CAP-F-001"), List.of("schema"), List.of(), null)),
                    List.of()));

            StageResult result = node.execute(request(node, Fixtures.state(Fixtures.frozenAnchor(), coveredCapability())));

            StructuredArtifact api = result.store().require("WI-002");
            assertEquals(List.of("WI-001"), api.dependsOn());
            assertEquals("unspecified", api.field("layer"));
            assertEquals("migration applies", result.store().require("WI-001").field("acceptanceCriteria"));
        }

        @Test
        @DisplayName("implementing an uncovered capability rejects the plan")
        void rejectsUncoveredCapability() {
            ArtifactStore store = coveredCapability().append(Fixtures.capability("CAP-F-002", "Credits"));
            when(generation.generate(anyString(), anyString(), eq(WorkItemPlan.class))).thenReturn(new WorkItemPlan(
                    "Credits",
                    List.of(new WorkItemDraft("credits", "Credit ledger", "Ledger", "Ledger", "data",
                            List.of("CAP-F-002"), List.of("missing"), List.of(), null)),
                    List.of()));

            var ex = assertThrows(SchemaValidationException.class,
                    () -> node.execute(request(node, Fixtures.state(Fixtures.frozenAnchor(), store))));
            assertTrue(ex.problems().contains("work item 'credits' implements uncovered capability CAP-F-002"));
            assertTrue(ex.problems().contains("work item 'credits' depends on unknown work item missing"));
        }
    }

    // -- Deterministic stages --------------------------------------------------------

    @Test
    @DisplayName("order_work_items puts dependencies first")
    void ordersWorkItems() {
        ArtifactStore store = coveredCapability()
                .append(Fixtures.workItem("WI-001", "Endpoint", List.of("DEC-001"), List.of("WI-002")))
                .append(Fixtures.workItem("WI-002", "Table", List.of("DEC-001"), List.of()));
        OrderWorkItemsNode node = new OrderWorkItemsNode();

        StageResult result = node.execute(request(node, Fixtures.state(Fixtures.frozenAnchor(), store)));

        assertEquals(List.of("WI-002", "WI-001"), result.workItemOrder());
        verifyNoInteractions(generation);
    }
}
