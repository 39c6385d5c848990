package com.lodestar.core.error;

import com.lodestar.core.model.ErrorKind;

/**
 * Root of the pipeline's failure taxonomy. Unchecked, as every failure is converted into
 * an escalation at the nearest gate by the stage runner.
 */
public abstract class PipelineException extends RuntimeException {

    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
