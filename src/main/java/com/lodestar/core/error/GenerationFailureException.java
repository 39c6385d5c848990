package com.lodestar.core.error;

import com.lodestar.core.model.ErrorKind;

/**
 * Transient failure of a generation call (timeout, empty response, backend error).
 */
public class GenerationFailureException extends PipelineException {

    public GenerationFailureException(String message) {
        super(message);
    }

    public GenerationFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.GENERATION_FAILURE;
    }
}
