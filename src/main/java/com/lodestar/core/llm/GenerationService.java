package com.lodestar.core.llm;

/**
 * The opaque generation capability. Implementations return data conforming to the
 * requested schema or throw a typed failure; they never return a silently malformed result.
 */
public interface GenerationService {

    /**
     * @param instructions role and task instructions for the generator
     * @param context      assembled stage context (anchor block first)
     * @param schema       record type the output must deserialize into
     * @throws com.lodestar.core.error.GenerationFailureException transient failure, safe to retry
     * @throws com.lodestar.core.error.SchemaValidationException  output does not fit {@code schema}
     */
    <T> T generate(String instructions, String context, Class<T> schema);
}
