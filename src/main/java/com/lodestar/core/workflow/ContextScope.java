package com.lodestar.core.workflow;

/**
 * Which store artifacts a stage sees in its context, beyond the anchor and the
 * summaries of its declared input stages.
 */
public enum ContextScope {
    NONE,
    /** Every active capability, with IDs. */
    CAPABILITIES,
    /** Capabilities the diff says need a decision, plus affected decisions and their entities. */
    ARCHITECTURE,
    /** The resolved project context, affected work items and capabilities still without work. */
    WORK_ITEMS
}
