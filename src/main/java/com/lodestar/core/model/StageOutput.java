package com.lodestar.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Structured result of one generation stage. Every variant carries a short
 * {@link #summary()} written by the generator itself; downstream context is built
 * from these summaries, never from truncated prose.
 * <p>
 * The {@link #kind()} discriminator is written to JSON so checkpointed outputs can be
 * read back into the right variant.
 */
public sealed interface StageOutput extends Serializable
        permits ValidationVerdict, PivotStrategy, ScopeDefinition, CapabilityModel,
                SystemTraits, DesignHandoff, ArchitecturePlan, WorkItemPlan {

    @JsonProperty(value = "kind", access = JsonProperty.Access.READ_ONLY)
    OutputKind kind();

    String summary();

    /** Deliberate deviations from anchor invariants declared by the stage. */
    List<InvariantOverride> overrides();
}
