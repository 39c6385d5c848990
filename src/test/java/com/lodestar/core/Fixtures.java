package com.lodestar.core;

import com.lodestar.core.model.AnchorInvariant;
import com.lodestar.core.model.ArtifactType;
import com.lodestar.core.model.ConceptAnchor;
import com.lodestar.core.model.IdentityFeature;
import com.lodestar.core.model.PhaseId;
import com.lodestar.core.model.ProductArchetype;
import com.lodestar.core.model.Provenance;
import com.lodestar.core.model.StructuredArtifact;
import com.lodestar.core.state.PipelineState;
import com.lodestar.core.store.ArtifactStore;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared sample data: an invite-only community for board game designers.
 */
public final class Fixtures {

    public static final String IDEA =
            "A private, invite-only community where indie board game designers playtest each other's prototypes. "
                    + "Members earn playtest credits by testing before they can request tests.";

    public static final Provenance PROVENANCE = new Provenance("LDST-1", "test", 1, Instant.EPOCH);

    private Fixtures() {}

    public static AnchorInvariant closedCommunity() {
        return new AnchorInvariant("community_model", "closed, invite-only", "A private, invite-only community",
                0.95, null, List.of(), false);
    }

    public static AnchorInvariant ambiguousMonetization() {
        return new AnchorInvariant("monetization", "free", "playtest credits", 0.4,
                "Credits could be an internal currency or purchasable",
                List.of("earned only", "earned or purchased"), false);
    }

    public static ConceptAnchor anchor(AnchorInvariant... invariants) {
        return new ConceptAnchor(
                "Let indie board game designers playtest each other's prototypes in a closed community",
                List.of("invite-only membership"),
                List.of("public marketplace"),
                List.of(invariants),
                List.of(new IdentityFeature("playtest credits", "reciprocity gate before requesting tests")),
                ProductArchetype.CONSUMER_APP,
                false);
    }

    public static ConceptAnchor frozenAnchor() {
        return anchor(closedCommunity()).freeze();
    }

    public static StructuredArtifact capability(String id, String title) {
        return StructuredArtifact.create(id, ArtifactType.CAPABILITY, title, title, Map.of("category", "F"),
                List.of(), PhaseId.SCOPE, PROVENANCE);
    }

    public static StructuredArtifact decision(String id, String title, String... serves) {
        return StructuredArtifact.create(id, ArtifactType.DECISION, title, title, Map.of("choice", title),
                List.of(serves), PhaseId.DESIGN, PROVENANCE);
    }

    public static StructuredArtifact entity(String id, String title, String... referencedBy) {
        return StructuredArtifact.create(id, ArtifactType.ENTITY, title, title, Map.of(),
                List.of(referencedBy), PhaseId.DESIGN, PROVENANCE);
    }

    public static StructuredArtifact workItem(String id, String title, List<String> implementsIds, List<String> dependsOn) {
        return StructuredArtifact.create(id, ArtifactType.WORK_ITEM, title, title, Map.of("layer", "backend"),
                implementsIds, PhaseId.PLANNING, PROVENANCE).withDependsOn(dependsOn);
    }

    /** A state holding the idea, the given anchor (may be null) and the store's artifacts. */
    public static PipelineState state(ConceptAnchor anchor, ArtifactStore store) {
        Map<String, Object> data = new HashMap<>();
        data.put("runId", "LDST-1");
        data.put("idea", IDEA);
        if (anchor != null) {
            data.put("anchor", anchor);
        }
        data.put("artifacts", store.artifacts());
        data.put("supersessions", store.supersessions());
        return new PipelineState(data);
    }

    /** Applies node updates the way replace-on-write channels do. */
    public static PipelineState apply(PipelineState state, Map<String, Object> updates) {
        Map<String, Object> data = state.snapshot();
        data.putAll(updates);
        return new PipelineState(data);
    }
}
