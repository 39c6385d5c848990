package com.lodestar.core.model;

import java.io.Serializable;

/**
 * A distinctive element of the idea that generic defaults tend to replace.
 */
public record IdentityFeature(String feature, String whyDistinctive) implements Serializable {}
