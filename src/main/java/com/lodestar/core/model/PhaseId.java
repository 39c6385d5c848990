package com.lodestar.core.model;

import java.util.Locale;

/**
 * Phases of a planning run, in execution order. Each phase ends in a decision gate.
 */
public enum PhaseId {
    DISCOVERY("Idea validation"),
    SCOPE("Scope and capabilities"),
    DESIGN("Architecture"),
    PLANNING("Work items");

    private final String title;

    PhaseId(String title) {
        this.title = title;
    }

    public String title() {
        return title;
    }

    /** Lower-case form used in graph node names and CLI arguments. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PhaseId fromKey(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
