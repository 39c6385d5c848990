package com.lodestar.core.model;

import java.io.Serializable;

/**
 * A deliberate, justified deviation from an anchor invariant, declared by the stage that
 * made it and attached to every artifact that stage produced.
 */
public record InvariantOverride(String invariant, String reason, String userImpact) implements Serializable {}
