package com.lodestar.core.model;

/**
 * Status derived from the links between artifacts. Never stored on the artifact itself.
 */
public enum ArtifactStatus {
    ACTIVE,
    /** Capability served by at least one active decision. */
    COVERED,
    /** Capability no active decision serves. */
    UNCOVERED,
    /** An active work item implements it. */
    IMPLEMENTED,
    SUPERSEDED
}
