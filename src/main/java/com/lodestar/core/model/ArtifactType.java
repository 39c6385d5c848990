package com.lodestar.core.model;

/**
 * Kinds of structured artifact kept in the store, with their ID prefixes.
 */
public enum ArtifactType {
    CAPABILITY("CAP"),
    DECISION("DEC"),
    ENTITY("ENT"),
    WORK_ITEM("WI");

    private final String idPrefix;

    ArtifactType(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    public String idPrefix() {
        return idPrefix;
    }
}
