package com.lodestar.core.workflow;

/**
 * Work performed by one stage. Implementations compute a result from the request and
 * never write state themselves; the stage runner applies the result.
 */
public interface StageHandler {

    /** Name of the stage this handler implements, as in {@link Stages}. */
    String stage();

    /**
     * @throws com.lodestar.core.error.GenerationFailureException transient, retried with backoff
     * @throws com.lodestar.core.error.SchemaValidationException  fails the stage immediately
     */
    StageResult execute(StageRequest request);
}
