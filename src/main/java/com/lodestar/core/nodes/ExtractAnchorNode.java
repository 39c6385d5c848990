package com.lodestar.core.nodes;

import com.lodestar.core.anchor.AnchorClarifier;
import com.lodestar.core.anchor.ConceptAnchorExtractor;
import com.lodestar.core.model.AnchorInvariant;
import com.lodestar.core.model.ConceptAnchor;
import com.lodestar.core.workflow.StageHandler;
import com.lodestar.core.workflow.StageRequest;
import com.lodestar.core.workflow.StageResult;
import com.lodestar.core.workflow.Stages;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Distills the idea into the concept anchor. When an invariant is ambiguous the stage
 * blocks for a human choice instead of letting later stages guess.
 */
@Component
public class ExtractAnchorNode implements StageHandler {

    private final ConceptAnchorExtractor extractor;
    private final AnchorClarifier clarifier;

    public ExtractAnchorNode(ConceptAnchorExtractor extractor, AnchorClarifier clarifier) {
        this.extractor = extractor;
        this.clarifier = clarifier;
    }

    @Override
    public String stage() {
        return Stages.EXTRACT_ANCHOR;
    }

    @Override
    public StageResult execute(StageRequest request) {
        List<String> feedback = request.state().feedback(stage());
        ConceptAnchor anchor = extractor.extract(request.state().idea(),
                feedback.isEmpty() ? null : String.join("\n", feedback));
        List<AnchorInvariant> ambiguous = clarifier.unresolved(anchor);
        if (ambiguous.isEmpty()) {
            return StageResult.anchor(anchor);
        }
        String note = ambiguous.stream()
                .map(i -> i.property() + " (" + i.ambiguity() + "): " + String.join(" | ", i.clarificationOptions()))
                .collect(Collectors.joining("; ", "Clarify before continuing: ", ""));
        return StageResult.anchorNeedsClarification(anchor, note);
    }
}
