package com.lodestar.core.nodes;

import com.lodestar.core.logging.MdcContext;
import com.lodestar.core.metrics.PipelineMetrics;
import com.lodestar.core.model.InvariantViolation;
import com.lodestar.core.model.PhaseId;
import com.lodestar.core.model.PhaseVerificationReport;
import com.lodestar.core.model.StageStatus;
import com.lodestar.core.state.PipelineState;
import com.lodestar.core.state.StateUpdates;
import com.lodestar.core.workflow.PhaseDefinition;
import com.lodestar.core.workflow.PipelineDefinition;
import com.lodestar.core.workflow.StageDefinition;
import com.lodestar.core.workflow.Stages;
import com.lodestar.core.workflow.WorkflowProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sends blocking verification findings back to the stage that produced them. The
 * stage and everything after it in the phase re-run with the findings as feedback,
 * up to a bounded number of times per phase.
 */
@Component
public class CorrectPhaseNode {

    private static final Logger log = LoggerFactory.getLogger(CorrectPhaseNode.class);

    private final PipelineDefinition definition;
    private final PipelineMetrics metrics;
    private final int maxCorrectiveRetries;

    public CorrectPhaseNode(PipelineDefinition definition, PipelineMetrics metrics, WorkflowProperties properties) {
        this.definition = definition;
        this.metrics = metrics;
        this.maxCorrectiveRetries = properties.getMaxCorrectiveRetries();
    }

    public Map<String, Object> apply(PhaseId phase, PipelineState state) {
        MdcContext.setPhase(state.runId(), phase.name());
        PhaseDefinition phaseDefinition = definition.phase(phase);
        PhaseVerificationReport report = state.latestReport(phase)
                .orElseThrow(() -> new IllegalStateException("No verification report for " + phase));
        String target = correctionTarget(phaseDefinition, state, report)
                .orElseThrow(() -> new IllegalStateException("No stage of " + phase + " can be corrected"));

        int attempt = state.correctiveAttempts(phase) + 1;
        List<InvariantViolation> blocking = report.unacknowledgedBlocking(state.violationOverrides());
        log.info("Re-running {} onward to address {} blocking violation(s) (corrective attempt {}/{})",
                target, blocking.size(), attempt, maxCorrectiveRetries);

        StateUpdates updates = StateUpdates.from(state).correctiveAttempts(phase, attempt);
        for (InvariantViolation v : blocking) {
            updates.addFeedback(target, feedbackFor(v));
        }
        for (StageDefinition stage : phaseDefinition.from(target)) {
            updates.stageStatus(stage.name(), StageStatus.PENDING);
        }
        metrics.incrementCorrectiveRetries(phase.name());
        return updates.build();
    }

    /**
     * The stage a corrective re-run starts from, or empty when the findings must go to
     * the human: nothing is blocking, the retry budget is spent, or no generation stage
     * of the phase ran. The earliest stage any finding names wins; findings naming no
     * stage of this phase go to the last generation stage that ran. The anchor itself
     * is never regenerated to satisfy the verifier.
     */
    public Optional<String> correctionTarget(PhaseDefinition phase, PipelineState state, PhaseVerificationReport report) {
        List<InvariantViolation> blocking = report.unacknowledgedBlocking(state.violationOverrides());
        if (blocking.isEmpty() || state.correctiveAttempts(phase.id()) >= maxCorrectiveRetries) {
            return Optional.empty();
        }
        List<StageDefinition> candidates = phase.generationStages().stream()
                .filter(s -> !Stages.EXTRACT_ANCHOR.equals(s.name()))
                .filter(s -> state.stageStatus(s.name()) == StageStatus.COMPLETED)
                .toList();
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        Optional<StageDefinition> named = candidates.stream()
                .filter(s -> blocking.stream().anyMatch(v -> s.name().equals(v.stage())))
                .findFirst();
        return Optional.of(named.orElse(candidates.get(candidates.size() - 1)).name());
    }

    private static String feedbackFor(InvariantViolation v) {
        var sb = new StringBuilder("Verification found a blocking violation of '")
                .append(v.invariant()).append("': ").append(v.violation());
        if (v.suggestedFix() != null && !v.suggestedFix().isBlank()) {
            sb.append(" Suggested fix: ").append(v.suggestedFix());
        }
        return sb.toString();
    }
}
