package com.lodestar.core.model;

/**
 * Failure taxonomy. Every escalation shown at a gate carries one of these.
 */
public enum ErrorKind {
    /** An anchor invariant is below the confidence threshold and needs a human choice. */
    EXTRACTION_AMBIGUITY,
    VERIFICATION_VIOLATION,
    /** Transient; retried with backoff before it escalates. */
    GENERATION_FAILURE,
    /** Output does not conform to the requested structure. Never retried with backoff. */
    SCHEMA_VALIDATION_FAILURE,
    ENTRY_CONDITION_FAILURE
}
