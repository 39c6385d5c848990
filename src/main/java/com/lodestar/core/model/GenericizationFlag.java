package com.lodestar.core.model;

import java.io.Serializable;

/**
 * An identity feature that was replaced by a generic equivalent.
 */
public record GenericizationFlag(
        String originalFeature,
        String genericReplacement,
        String stage,
        String evidence
) implements Serializable {}
