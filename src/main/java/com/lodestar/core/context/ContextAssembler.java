package com.lodestar.core.context;

import com.lodestar.core.model.ArtifactDiff;
import com.lodestar.core.model.ArtifactType;
import com.lodestar.core.model.ConceptAnchor;
import com.lodestar.core.model.PhaseId;
import com.lodestar.core.model.StageOutput;
import com.lodestar.core.model.StructuredArtifact;
import com.lodestar.core.state.PipelineState;
import com.lodestar.core.store.ArtifactStore;
import com.lodestar.core.workflow.StageDefinition;
import com.lodestar.core.workflow.WorkflowProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the input text for each stage and for phase verification.
 * <p>
 * The anchor block always comes first and is never shortened. Upstream stages are
 * represented by the summaries they wrote themselves, and store artifacts by their
 * one-line short form, selected through the diff rather than the full history.
 */
@Component
public class ContextAssembler {

    private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

    private final int anchorTokenBudget;

    public ContextAssembler(WorkflowProperties properties) {
        this.anchorTokenBudget = properties.getAnchorTokenBudget();
    }

    public String forStage(StageDefinition stage, PipelineState state, ArtifactDiff diff) {
        var sb = new StringBuilder();
        state.anchor().ifPresentOrElse(
                anchor -> sb.append(anchorBlock(anchor)),
                () -> sb.append("## Idea\n").append(state.idea()).append('\n'));

        Map<String, StageOutput> outputs = state.stageOutputs();
        Map<String, String> legacy = state.legacyOutputs();
        boolean upstreamHeader = false;
        for (String input : stage.inputs()) {
            String summary = outputs.containsKey(input) ? outputs.get(input).summary() : legacy.get(input);
            if (summary == null || summary.isBlank()) {
                continue;
            }
            if (!upstreamHeader) {
                sb.append("\n## Upstream summaries\n");
                upstreamHeader = true;
            }
            sb.append("- ").append(input).append(": ").append(summary.strip()).append('\n');
        }

        ArtifactStore store = state.store();
        switch (stage.scope()) {
            case NONE -> { }
            case CAPABILITIES -> appendArtifacts(sb, "Current capabilities", store.current(ArtifactType.CAPABILITY));
            case ARCHITECTURE -> appendArchitectureScope(sb, store, diff);
            case WORK_ITEMS -> appendWorkItemScope(sb, state, store, diff);
        }

        List<String> feedback = state.feedback(stage.name());
        if (!feedback.isEmpty()) {
            sb.append("\n## Feedback to address\n");
            feedback.forEach(f -> sb.append("- ").append(f).append('\n'));
        }
        return sb.toString();
    }

    /**
     * Verification sees the anchor plus only the given phase's outputs and artifacts.
     */
    public String forVerification(PhaseId phase, ConceptAnchor anchor, Map<String, StageOutput> phaseOutputs,
                                  List<StructuredArtifact> phaseArtifacts) {
        var sb = new StringBuilder(anchorBlock(anchor));
        sb.append("\n## Phase under review: ").append(phase.title()).append('\n');
        phaseOutputs.forEach((stage, output) -> {
            sb.append("\n### ").append(stage).append('\n').append(output.summary()).append('\n');
            output.overrides().forEach(o -> sb.append("- declared override of ").append(o.invariant())
                    .append(": ").append(o.reason()).append('\n'));
        });
        appendArtifacts(sb, "Artifacts produced in this phase", phaseArtifacts);
        return sb.toString();
    }

    String anchorBlock(ConceptAnchor anchor) {
        String block = anchor.render();
        int estimatedTokens = estimateTokens(block);
        if (estimatedTokens > anchorTokenBudget) {
            log.warn("Concept anchor is ~{} tokens, above the budget of {}; it is passed in full regardless",
                    estimatedTokens, anchorTokenBudget);
        }
        return block;
    }

    static int estimateTokens(String text) {
        return (text.length() + 3) / 4;
    }

    private void appendArchitectureScope(StringBuilder sb, ArtifactStore store, ArtifactDiff diff) {
        if (diff.greenfield()) {
            appendArtifacts(sb, "Capabilities needing decisions", store.current(ArtifactType.CAPABILITY));
            return;
        }
        Set<String> capabilityIds = new TreeSet<>(diff.uncovered());
        List<StructuredArtifact> affected = diff.affectedDecisions().stream().map(store::require).toList();
        for (StructuredArtifact decision : affected) {
            decision.serves().forEach(id -> capabilityIds.add(successorOf(store, id)));
        }
        appendArtifacts(sb, "Capabilities needing decisions", capabilityIds.stream().map(store::require).toList());
        appendArtifacts(sb, "Decisions serving a superseded capability (revise with supersedes)", affected);
        appendArtifacts(sb, "Entities of those decisions", diff.affectedEntities().stream().map(store::require).toList());
        appendArtifacts(sb, "Existing decisions (reference by ID, do not repeat)", store.current(ArtifactType.DECISION));
    }

    private void appendWorkItemScope(StringBuilder sb, PipelineState state, ArtifactStore store, ArtifactDiff diff) {
        state.resolvedContext().ifPresent(ctx -> {
            String rendered = ctx.render();
            // the anchor block is already at the top
            String anchor = ctx.anchor().render();
            sb.append('\n').append(rendered.startsWith(anchor) ? rendered.substring(anchor.length()) : rendered);
        });
        appendArtifacts(sb, "Work items implementing a superseded artifact (revise with supersedes)",
                diff.affectedWorkItems().stream().map(store::require).toList());
        if (!diff.capabilitiesWithoutWorkItems().isEmpty()) {
            sb.append("\n## Capabilities still without work items\n");
            diff.capabilitiesWithoutWorkItems().forEach(id -> sb.append("- ").append(id).append('\n'));
        }
        appendArtifacts(sb, "Existing work items (reference by ID in dependsOn)", store.current(ArtifactType.WORK_ITEM));
    }

    private static String successorOf(ArtifactStore store, String id) {
        String current = id;
        while (store.isSuperseded(current)) {
            current = store.require(current).supersededBy();
        }
        return current;
    }

    private static void appendArtifacts(StringBuilder sb, String heading, List<StructuredArtifact> artifacts) {
        if (artifacts.isEmpty()) {
            return;
        }
        sb.append("\n## ").append(heading).append('\n');
        for (StructuredArtifact a : artifacts) {
            sb.append("- ").append(a.shortForm()).append('\n');
        }
    }
}
