package com.lodestar.core.nodes;

import com.lodestar.core.anchor.AnchorClarifier;
import com.lodestar.core.error.ExtractionAmbiguityException;
import com.lodestar.core.events.EventBus;
import com.lodestar.core.events.PipelineEvent;
import com.lodestar.core.graph.NodeNames;
import com.lodestar.core.logging.MdcContext;
import com.lodestar.core.metrics.PipelineMetrics;
import com.lodestar.core.model.*;
import com.lodestar.core.state.PipelineState;
import com.lodestar.core.state.StateUpdates;
import com.lodestar.core.workflow.GateEvaluator;
import com.lodestar.core.workflow.PhaseDefinition;
import com.lodestar.core.workflow.PipelineDefinition;
import com.lodestar.core.workflow.StageDefinition;
import com.lodestar.core.workflow.Stages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies the pending human decision at the current phase gate and records where the
 * run goes next in {@code decisionRoute}. A decision that cannot be applied leaves the
 * phase at its gate with an explanation in {@code gateNotice}.
 */
@Component
public class ApplyDecisionNode {

    private static final Logger log = LoggerFactory.getLogger(ApplyDecisionNode.class);

    private final PipelineDefinition definition;
    private final GateEvaluator gateEvaluator;
    private final AnchorClarifier clarifier;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;

    public ApplyDecisionNode(PipelineDefinition definition, GateEvaluator gateEvaluator, AnchorClarifier clarifier,
                             EventBus eventBus, PipelineMetrics metrics) {
        this.definition = definition;
        this.gateEvaluator = gateEvaluator;
        this.clarifier = clarifier;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(PipelineState state) {
        PhaseId phase = state.currentPhase();
        MdcContext.setPhase(state.runId(), phase.name());
        GateDecision decision = state.pendingDecision()
                .orElseThrow(() -> new IllegalStateException("No pending decision for run " + state.runId()));
        PhaseDefinition phaseDefinition = definition.phase(phase);
        StateUpdates updates = StateUpdates.from(state).decisionApplied().gateNotice("");

        log.info("Applying {} at the {} gate", decision.type(), phase);
        metrics.recordGateDecision(phase.name(), decision.type().name());
        eventBus.publish(PipelineEvent.of(PipelineEvent.GATE_DECIDED, state.runId(), null,
                Map.of("phase", phase.name(), "decision", decision.type().name())));

        switch (decision.type()) {
            case APPROVE -> approve(phaseDefinition, state, updates);
            case REQUEST_CHANGES -> requestChanges(phaseDefinition, state, decision, updates);
            case RESOLVE_AMBIGUITY -> resolveAmbiguity(phaseDefinition, state, decision, updates);
            case OVERRIDE_VIOLATION -> overrideViolation(phaseDefinition, state, decision, updates);
        }
        return updates.build();
    }

    private void approve(PhaseDefinition phase, PipelineState state, StateUpdates updates) {
        List<String> blockers = gateEvaluator.approvalBlockers(phase, state);
        if (!blockers.isEmpty()) {
            refuse(phase, updates, "Approval refused: " + String.join("; ", blockers));
            return;
        }
        if (phase.id() == definition.first()) {
            ConceptAnchor anchor = state.anchor()
                    .orElseThrow(() -> new IllegalStateException("No concept anchor to freeze"));
            try {
                updates.anchor(clarifier.freeze(anchor));
            } catch (ExtractionAmbiguityException e) {
                refuse(phase, updates, e.getMessage());
                return;
            }
        }
        updates.phaseStatus(phase.id(), PhaseStatus.COMPLETE)
                .correctiveAttempts(phase.id(), 0)
                .closeReopened(phase.id())
                .resolveEscalations(e -> e.phase() == phase.id() || e.kind() == ErrorKind.ENTRY_CONDITION_FAILURE)
                .status(PipelineStatus.RUNNING);
        phase.stages().forEach(s -> updates.clearFeedback(s.name()));
        String route = definition.next(phase.id()).map(NodeNames::enter).orElse(NodeNames.FINALIZE);
        log.info("Phase {} approved; continuing at {}", phase.id(), route);
        updates.decisionRoute(route);
    }

    private void requestChanges(PhaseDefinition phase, PipelineState state, GateDecision decision, StateUpdates updates) {
        String target = decision.targetStage() == null || decision.targetStage().isBlank()
                ? phase.stages().get(0).name()
                : decision.targetStage().trim();
        if (phase.stage(target).isEmpty()) {
            refuse(phase, updates, "Stage '" + target + "' is not part of " + phase.id());
            return;
        }
        for (StageDefinition stage : phase.from(target)) {
            updates.stageStatus(stage.name(), StageStatus.PENDING);
        }
        if (decision.feedback() != null && !decision.feedback().isBlank()) {
            updates.addFeedback(target, decision.feedback().strip());
        }
        updates.correctiveAttempts(phase.id(), 0)
                .reopen(phase.id())
                .resolveEscalations(e -> e.phase() == phase.id() || e.kind() == ErrorKind.ENTRY_CONDITION_FAILURE)
                .phaseStatus(phase.id(), PhaseStatus.IN_PROGRESS)
                .status(PipelineStatus.RUNNING)
                .decisionRoute(target);
    }

    private void resolveAmbiguity(PhaseDefinition phase, PipelineState state, GateDecision decision, StateUpdates updates) {
        ConceptAnchor anchor = state.anchor().orElse(null);
        if (anchor == null) {
            refuse(phase, updates, "There is no concept anchor to clarify");
            return;
        }
        ConceptAnchor resolved;
        try {
            resolved = clarifier.resolve(anchor, decision.selections());
        } catch (IllegalStateException | IllegalArgumentException e) {
            refuse(phase, updates, e.getMessage());
            return;
        }
        updates.anchor(resolved);
        List<String> custom = clarifier.customSelections(anchor, decision.selections());
        if (!custom.isEmpty()) {
            updates.gateNotice("Custom value replaced the offered options: " + String.join("; ", custom));
        }

        List<AnchorInvariant> open = clarifier.unresolved(resolved);
        if (!open.isEmpty()) {
            refuse(phase, updates, "Still ambiguous: "
                    + String.join(", ", open.stream().map(AnchorInvariant::property).toList()));
            return;
        }
        updates.resolveEscalations(e -> e.kind() == ErrorKind.EXTRACTION_AMBIGUITY);
        if (state.stageStatus(Stages.EXTRACT_ANCHOR) != StageStatus.BLOCKED_ON_APPROVAL) {
            updates.decisionRoute(NodeNames.gate(phase.id()));
            return;
        }
        updates.stageStatus(Stages.EXTRACT_ANCHOR, StageStatus.COMPLETED)
                .phaseStatus(phase.id(), PhaseStatus.IN_PROGRESS)
                .status(PipelineStatus.RUNNING);
        String route = phase.stages().stream()
                .filter(s -> !Stages.EXTRACT_ANCHOR.equals(s.name()))
                .filter(s -> !state.stageStatus(s.name()).isSettled())
                .map(StageDefinition::name)
                .findFirst()
                .orElse(NodeNames.verify(phase.id()));
        log.info("All invariants clarified; continuing at {}", route);
        updates.decisionRoute(route);
    }

    private void overrideViolation(PhaseDefinition phase, PipelineState state, GateDecision decision,
                                   StateUpdates updates) {
        String acknowledgement = decision.acknowledgement();
        if (acknowledgement == null || acknowledgement.isBlank()) {
            refuse(phase, updates, "An override needs an acknowledgement");
            return;
        }
        PhaseVerificationReport report = state.latestReport(phase.id()).orElse(null);
        if (report == null) {
            refuse(phase, updates, "Phase " + phase.id() + " has no verification findings to override");
            return;
        }

        Set<String> requested = new LinkedHashSet<>(decision.invariants());
        Set<String> known = new LinkedHashSet<>();
        report.invariantsViolated().forEach(v -> known.add(v.invariant()));
        known.add(ViolationOverride.INCOMPLETE_VERIFICATION);
        List<String> unknown = requested.stream().filter(i -> !known.contains(i)).toList();
        if (!unknown.isEmpty()) {
            refuse(phase, updates, "No finding to override for: " + String.join(", ", unknown));
            return;
        }

        boolean all = requested.isEmpty();
        List<ViolationOverride> overrides = state.violationOverrides();
        List<ViolationOverride> created = new ArrayList<>();
        Instant now = Instant.now();
        for (InvariantViolation v : report.invariantsViolated()) {
            boolean covered = overrides.stream().anyMatch(o -> o.covers(phase.id(), v));
            if (!covered && (all || requested.contains(v.invariant()))) {
                created.add(new ViolationOverride(phase.id(), v.invariant(), v.stage(), v.severity(),
                        acknowledgement.strip(), now));
            }
        }
        if (!report.incompleteAcknowledged(overrides)
                && (all || requested.contains(ViolationOverride.INCOMPLETE_VERIFICATION))) {
            created.add(new ViolationOverride(phase.id(), ViolationOverride.INCOMPLETE_VERIFICATION, null,
                    Severity.BLOCKING, acknowledgement.strip(), now));
        }
        if (created.isEmpty()) {
            refuse(phase, updates, "Every finding of " + phase.id() + " is already acknowledged");
            return;
        }
        log.info("Recorded {} violation override(s) at the {} gate", created.size(), phase.id());
        updates.addOverrides(created)
                .resolveEscalations(e -> e.phase() == phase.id() && e.kind() == ErrorKind.VERIFICATION_VIOLATION)
                .decisionRoute(NodeNames.gate(phase.id()));
    }

    private static void refuse(PhaseDefinition phase, StateUpdates updates, String notice) {
        log.info("Decision not applied: {}", notice);
        updates.gateNotice(notice).decisionRoute(NodeNames.gate(phase.id()));
    }
}
