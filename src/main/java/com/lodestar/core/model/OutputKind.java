package com.lodestar.core.model;

/**
 * Discriminator for {@link StageOutput} variants.
 */
public enum OutputKind {
    VERDICT(ValidationVerdict.class),
    PIVOT(PivotStrategy.class),
    SCOPE(ScopeDefinition.class),
    CAPABILITIES(CapabilityModel.class),
    TRAITS(SystemTraits.class),
    DESIGN_HANDOFF(DesignHandoff.class),
    ARCHITECTURE(ArchitecturePlan.class),
    WORK_ITEMS(WorkItemPlan.class);

    private final Class<? extends StageOutput> outputType;

    OutputKind(Class<? extends StageOutput> outputType) {
        this.outputType = outputType;
    }

    public Class<? extends StageOutput> outputType() {
        return outputType;
    }
}
