package com.lodestar.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum ProductArchetype {
    CONSUMER_APP,
    B2B_SAAS,
    MARKETPLACE,
    DEVELOPER_TOOL,
    INTERNAL_TOOL,
    OTHER;

    @JsonCreator
    public static ProductArchetype from(String raw) {
        return Lenient.parse(ProductArchetype.class, raw, OTHER);
    }
}
