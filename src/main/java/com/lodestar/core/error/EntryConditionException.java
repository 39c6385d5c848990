package com.lodestar.core.error;

import com.lodestar.core.model.ErrorKind;
import com.lodestar.core.model.PhaseId;

import java.util.List;

/**
 * A phase's prerequisites are not met. Not retryable; the phase does not start.
 */
public class EntryConditionException extends PipelineException {

    private final PhaseId phase;
    private final List<String> unmet;

    public EntryConditionException(PhaseId phase, List<String> unmet) {
        super("Cannot start " + phase + ": " + String.join("; ", unmet));
        this.phase = phase;
        this.unmet = List.copyOf(unmet);
    }

    public PhaseId phase() {
        return phase;
    }

    public List<String> unmet() {
        return unmet;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.ENTRY_CONDITION_FAILURE;
    }
}
