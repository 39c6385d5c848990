package com.lodestar.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/runs.
 *
 * @param idea              the product idea in plain language
 * @param legacyOutputs     free-text output of an earlier run keyed by stage name; nullable
 * @param designIntegration include the design hand-off stage; nullable, defaults to configuration
 */
public record RunRequest(
    String idea,
    @JsonProperty("legacy_outputs") Map<String, String> legacyOutputs,
    @JsonProperty("design_integration") Boolean designIntegration
) {}
