package com.lodestar.core.graph;

import com.lodestar.core.model.PhaseId;

/**
 * Names of the phase-control nodes. Stage nodes are named after their stage.
 */
public final class NodeNames {

    public static final String DECIDE = "apply_decision";
    public static final String FINALIZE = "finalize";

    private NodeNames() {}

    public static String enter(PhaseId phase) {
        return "enter_" + phase.key();
    }

    public static String verify(PhaseId phase) {
        return "verify_" + phase.key();
    }

    public static String correct(PhaseId phase) {
        return "correct_" + phase.key();
    }

    public static String gate(PhaseId phase) {
        return "gate_" + phase.key();
    }
}
