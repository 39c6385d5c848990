package com.lodestar.core.state;

import com.lodestar.core.model.*;
import com.lodestar.core.store.ArtifactStore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Collects the channel values a node changes. Every changed channel is written whole,
 * and {@link #build()} always bumps {@code stateVersion}.
 */
public final class StateUpdates {

    private final PipelineState state;
    private final Map<String, Object> updates = new HashMap<>();

    private Map<String, String> phaseStatuses;
    private Map<String, String> stageStatuses;
    private Map<String, Integer> stageAttempts;
    private Map<String, Integer> correctiveAttempts;
    private Map<String, List<String>> stageFeedback;
    private Map<String, StageOutput> stageOutputs;
    private List<Escalation> openEscalations;
    private List<String> reopenedPhases;
    private List<Escalation> escalationLog;

    private StateUpdates(PipelineState state) {
        this.state = state;
    }

    public static StateUpdates from(PipelineState state) {
        return new StateUpdates(state);
    }

    public StateUpdates status(PipelineStatus status) {
        updates.put("status", status.name());
        return this;
    }

    public StateUpdates currentPhase(PhaseId phase) {
        updates.put("currentPhase", phase.name());
        return this;
    }

    public StateUpdates phaseStatus(PhaseId phase, PhaseStatus status) {
        if (phaseStatuses == null) {
            phaseStatuses = state.phaseStatuses();
            updates.put("phaseStatuses", phaseStatuses);
        }
        phaseStatuses.put(phase.name(), status.name());
        return this;
    }

    public StateUpdates stageStatus(String stage, StageStatus status) {
        if (stageStatuses == null) {
            stageStatuses = state.stageStatuses();
            updates.put("stageStatuses", stageStatuses);
        }
        stageStatuses.put(stage, status.name());
        return this;
    }

    /** @return the new attempt count for the stage */
    public int incrementStageAttempts(String stage) {
        if (stageAttempts == null) {
            stageAttempts = state.stageAttempts();
            updates.put("stageAttempts", stageAttempts);
        }
        return stageAttempts.merge(stage, 1, Integer::sum);
    }

    public StateUpdates correctiveAttempts(PhaseId phase, int attempts) {
        if (correctiveAttempts == null) {
            correctiveAttempts = state.correctiveAttempts();
            updates.put("correctiveAttempts", correctiveAttempts);
        }
        correctiveAttempts.put(phase.name(), attempts);
        return this;
    }

    public StateUpdates addFeedback(String stage, String feedback) {
        feedbackMap().computeIfAbsent(stage, k -> new ArrayList<>()).add(feedback);
        return this;
    }

    public StateUpdates clearFeedback(String stage) {
        feedbackMap().remove(stage);
        return this;
    }

    public StateUpdates reopen(PhaseId phase) {
        List<String> phases = reopenedPhases();
        if (!phases.contains(phase.name())) {
            phases.add(phase.name());
        }
        return this;
    }

    public StateUpdates closeReopened(PhaseId phase) {
        reopenedPhases().remove(phase.name());
        return this;
    }

    public StateUpdates anchor(ConceptAnchor anchor) {
        updates.put("anchor", anchor);
        return this;
    }

    public StateUpdates stageOutput(String stage, StageOutput output) {
        if (stageOutputs == null) {
            stageOutputs = state.stageOutputs();
            updates.put("stageOutputs", stageOutputs);
        }
        stageOutputs.put(stage, output);
        return this;
    }

    public StateUpdates store(ArtifactStore store) {
        updates.put("artifacts", new ArrayList<>(store.artifacts()));
        updates.put("supersessions", new ArrayList<>(store.supersessions()));
        return this;
    }

    public StateUpdates addReport(PhaseVerificationReport report) {
        List<PhaseVerificationReport> reports = new ArrayList<>(state.verificationReports());
        reports.add(report);
        updates.put("verificationReports", reports);
        return this;
    }

    public StateUpdates addOverrides(List<ViolationOverride> overrides) {
        List<ViolationOverride> all = new ArrayList<>(state.violationOverrides());
        all.addAll(overrides);
        updates.put("violationOverrides", all);
        return this;
    }

    public StateUpdates addDecision(GateDecision decision) {
        List<GateDecision> decisions = new ArrayList<>(state.gateDecisions());
        decisions.add(decision);
        updates.put("gateDecisions", decisions);
        return this;
    }

    public StateUpdates decisionApplied() {
        updates.put("decisionsApplied", state.decisionsApplied() + 1);
        return this;
    }

    public StateUpdates decisionRoute(String route) {
        updates.put("decisionRoute", route);
        return this;
    }

    public StateUpdates gateNotice(String notice) {
        updates.put("gateNotice", notice == null ? "" : notice);
        return this;
    }

    /** Adds an escalation to the open list shown at the next gate and to the permanent log. */
    public StateUpdates escalate(Escalation escalation) {
        openEscalations().add(escalation);
        if (escalationLog == null) {
            escalationLog = new ArrayList<>(state.escalationLog());
            updates.put("escalationLog", escalationLog);
        }
        escalationLog.add(escalation);
        return this;
    }

    public StateUpdates resolveEscalations(Predicate<Escalation> resolved) {
        openEscalations().removeIf(resolved);
        return this;
    }

    public StateUpdates resolvedContext(ResolvedProjectContext context) {
        updates.put("resolvedContext", context);
        return this;
    }

    public StateUpdates specification(ResolvedSpecification specification) {
        updates.put("specification", specification);
        return this;
    }

    public StateUpdates workItemOrder(List<String> order) {
        updates.put("workItemOrder", new ArrayList<>(order));
        return this;
    }

    public Map<String, Object> build() {
        updates.put("stateVersion", state.stateVersion() + 1);
        return updates;
    }

    private Map<String, List<String>> feedbackMap() {
        if (stageFeedback == null) {
            stageFeedback = new LinkedHashMap<>();
            state.stageFeedback().forEach((k, v) -> stageFeedback.put(k, new ArrayList<>(v)));
            updates.put("stageFeedback", stageFeedback);
        }
        return stageFeedback;
    }

    private List<String> reopenedPhases() {
        if (reopenedPhases == null) {
            reopenedPhases = new ArrayList<>(state.reopenedPhases());
            updates.put("reopenedPhases", reopenedPhases);
        }
        return reopenedPhases;
    }

    private List<Escalation> openEscalations() {
        if (openEscalations == null) {
            openEscalations = new ArrayList<>(state.openEscalations());
            updates.put("openEscalations", openEscalations);
        }
        return openEscalations;
    }
}
