package com.lodestar.core.error;

import com.lodestar.core.model.ErrorKind;

import java.util.List;

/**
 * Raised when an anchor with unresolved low-confidence invariants would be frozen.
 */
public class ExtractionAmbiguityException extends PipelineException {

    private final List<String> properties;

    public ExtractionAmbiguityException(List<String> properties) {
        super("Anchor invariants need clarification before proceeding: " + String.join(", ", properties));
        this.properties = List.copyOf(properties);
    }

    public List<String> properties() {
        return properties;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.EXTRACTION_AMBIGUITY;
    }
}
