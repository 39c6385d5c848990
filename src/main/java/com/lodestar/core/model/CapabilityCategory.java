package com.lodestar.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum CapabilityCategory {
    FUNCTIONAL("F"),
    NON_FUNCTIONAL("NF"),
    OPERATIONAL("OP");

    private final String idInfix;

    CapabilityCategory(String idInfix) {
        this.idInfix = idInfix;
    }

    public String idInfix() {
        return idInfix;
    }

    @JsonCreator
    public static CapabilityCategory from(String raw) {
        if (raw != null) {
            for (CapabilityCategory c : values()) {
                if (c.idInfix.equalsIgnoreCase(raw.trim())) {
                    return c;
                }
            }
        }
        return Lenient.parse(CapabilityCategory.class, raw, FUNCTIONAL);
    }
}
