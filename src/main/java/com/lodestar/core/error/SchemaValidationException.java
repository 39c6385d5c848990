package com.lodestar.core.error;

import com.lodestar.core.model.ErrorKind;

import java.util.List;

/**
 * Generated output that does not conform to the required structure.
 * Carries the raw output so a human can correct it.
 */
public class SchemaValidationException extends PipelineException {

    private final List<String> problems;
    private final String rawOutput;

    public SchemaValidationException(String message, List<String> problems, String rawOutput) {
        super(message);
        this.problems = List.copyOf(problems);
        this.rawOutput = rawOutput;
    }

    public SchemaValidationException(String message, String rawOutput, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
        this.rawOutput = rawOutput;
    }

    public List<String> problems() {
        return problems;
    }

    public String rawOutput() {
        return rawOutput;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SCHEMA_VALIDATION_FAILURE;
    }
}
