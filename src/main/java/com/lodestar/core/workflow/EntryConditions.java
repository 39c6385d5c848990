package com.lodestar.core.workflow;

import com.lodestar.core.error.EntryConditionException;
import com.lodestar.core.model.AnchorInvariant;
import com.lodestar.core.model.ArtifactType;
import com.lodestar.core.model.ConceptAnchor;
import com.lodestar.core.model.PhaseId;
import com.lodestar.core.model.ValidationVerdict;
import com.lodestar.core.state.PipelineState;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Prerequisites a phase checks before its first stage runs.
 */
@Component
public class EntryConditions {

    private final double anchorConfidenceThreshold;

    public EntryConditions(WorkflowProperties properties) {
        this.anchorConfidenceThreshold = properties.getAnchorConfidenceThreshold();
    }

    /**
     * @throws EntryConditionException listing every unmet condition
     */
    public void check(PhaseId phase, PipelineState state) {
        List<String> problems = unmet(phase, state);
        if (!problems.isEmpty()) {
            throw new EntryConditionException(phase, problems);
        }
    }

    /** @return human-readable descriptions of every unmet condition; empty when the phase may start */
    public List<String> unmet(PhaseId phase, PipelineState state) {
        List<String> problems = new ArrayList<>();
        switch (phase) {
            case DISCOVERY -> {
                if (state.idea().isBlank()) {
                    problems.add("the idea is empty");
                }
            }
            case SCOPE -> {
                Optional<ConceptAnchor> anchor = state.anchor();
                if (anchor.isEmpty()) {
                    problems.add("no concept anchor has been extracted");
                } else {
                    if (!anchor.get().frozen()) {
                        problems.add("the concept anchor is not frozen");
                    }
                    List<String> ambiguous = anchor.get().ambiguousInvariants(anchorConfidenceThreshold).stream()
                            .map(AnchorInvariant::property)
                            .toList();
                    if (!ambiguous.isEmpty()) {
                        problems.add("ambiguous invariants remain: " + String.join(", ", ambiguous));
                    }
                }
                boolean verdict = state.stageOutput(Stages.VALIDATE_IDEA, ValidationVerdict.class).isPresent()
                        || state.legacyOutputs().containsKey(Stages.VALIDATE_IDEA);
                if (!verdict) {
                    problems.add("no validation verdict exists");
                }
            }
            case DESIGN -> {
                if (state.store().current(ArtifactType.CAPABILITY).isEmpty()) {
                    problems.add("no active capabilities exist");
                }
            }
            case PLANNING -> {
                if (state.store().current(ArtifactType.DECISION).isEmpty()) {
                    problems.add("no active architecture decisions exist");
                }
            }
        }
        return problems;
    }
}
