package com.lodestar.core.engine;

import com.lodestar.core.model.AnchorInvariant;
import com.lodestar.core.model.ArtifactDiff;
import com.lodestar.core.model.Escalation;
import com.lodestar.core.model.InvariantViolation;
import com.lodestar.core.model.PhaseId;
import com.lodestar.core.model.PhaseStatus;
import com.lodestar.core.model.PhaseVerificationReport;

import java.util.List;
import java.util.Map;

/**
 * What the human sees at a phase gate.
 *
 * @param stageSummaries    stage name to "STATUS: summary"
 * @param report            latest verification report of the phase, or null when none ran
 * @param ambiguous         invariants still waiting for a clarification, with their options
 * @param notice            why the previous decision was not applied; empty otherwise
 * @param approvalBlockers  reasons an approve decision would be refused right now
 */
public record GateView(
        String runId,
        PhaseId phase,
        PhaseStatus phaseStatus,
        Map<String, String> stageSummaries,
        ArtifactDiff diff,
        PhaseVerificationReport report,
        List<InvariantViolation> unacknowledgedViolations,
        List<AnchorInvariant> ambiguous,
        List<Escalation> openEscalations,
        String notice,
        List<String> approvalBlockers
) {}
