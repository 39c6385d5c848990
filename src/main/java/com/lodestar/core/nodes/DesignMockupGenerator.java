package com.lodestar.core.nodes;

import com.lodestar.core.model.DesignHandoff;

/**
 * External mock-up generator. The design handoff stage only runs when a bean of this
 * type exists and design integration is enabled.
 */
public interface DesignMockupGenerator {

    /**
     * @param context the assembled stage context, anchor block first
     */
    DesignHandoff requestMockups(String context);
}
