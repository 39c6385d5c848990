package com.lodestar.core.workflow;

/**
 * Stage names. Used as graph node names, state keys and CLI arguments.
 */
public final class Stages {

    public static final String EXTRACT_ANCHOR = "extract_anchor";
    public static final String VALIDATE_IDEA = "validate_idea";
    public static final String PIVOT_STRATEGY = "pivot_strategy";
    public static final String DEFINE_SCOPE = "define_scope";
    public static final String MODEL_CAPABILITIES = "model_capabilities";
    public static final String CLASSIFY_TRAITS = "classify_traits";
    public static final String DESIGN_HANDOFF = "design_handoff";
    public static final String ARCHITECT = "architect";
    public static final String ASSEMBLE_CONTEXT = "assemble_context";
    public static final String GENERATE_WORK_ITEMS = "generate_work_items";
    public static final String ORDER_WORK_ITEMS = "order_work_items";

    private Stages() {}
}
