package com.lodestar.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lodestar.core.model.Escalation;
import com.lodestar.core.state.PipelineState;

import java.util.List;
import java.util.Map;

/**
 * JSON response for run endpoints.
 */
public record RunResponse(
    @JsonProperty("run_id") String runId,
    String idea,
    String status,
    @JsonProperty("current_phase") String currentPhase,
    @JsonProperty("state_version") int stateVersion,
    @JsonProperty("phase_statuses") Map<String, String> phaseStatuses,
    @JsonProperty("stage_statuses") Map<String, String> stageStatuses,
    @JsonProperty("open_escalations") List<Escalation> openEscalations,
    @JsonProperty("gate_notice") String gateNotice,
    @JsonProperty("has_specification") boolean hasSpecification
) {

    public static RunResponse from(PipelineState state) {
        return new RunResponse(
                state.runId(),
                state.idea(),
                state.status().name(),
                state.currentPhase().name(),
                state.stateVersion(),
                state.phaseStatuses(),
                state.stageStatuses(),
                state.openEscalations(),
                state.gateNotice(),
                state.specification().isPresent()
        );
    }
}
