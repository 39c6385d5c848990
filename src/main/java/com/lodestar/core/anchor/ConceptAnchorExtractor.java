package com.lodestar.core.anchor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.lodestar.core.error.SchemaValidationException;
import com.lodestar.core.llm.GenerationService;
import com.lodestar.core.model.ConceptAnchor;
import com.lodestar.core.state.StateJson;
import com.lodestar.core.workflow.WorkflowProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Distills the raw idea into a {@link ConceptAnchor} with a single generation call.
 * <p>
 * The output is validated programmatically. A malformed anchor is retried once with
 * the validation problems appended as feedback; a second failure raises
 * {@link SchemaValidationException} carrying the raw output for manual correction.
 */
@Service
public class ConceptAnchorExtractor {

    private static final Logger log = LoggerFactory.getLogger(ConceptAnchorExtractor.class);

    static final String INSTRUCTIONS = """
            You distill a product idea into a concept anchor. Do not elaborate, improve or
            generalize the idea: only extract what it says.

            - goal: one sentence.
            - explicitConstraints: constraints the idea states outright.
            - nonGoals: things the idea clearly excludes.
            - invariants: properties every later planning step must keep. Each needs a
              property name, the required value, a verbatim source quote from the idea and a
              confidence between 0 and 1. When confidence is below %.2f, explain the ambiguity
              and give 2 or 3 clarificationOptions.
            - identityFeatures: the distinctive elements most likely to be replaced by a generic
              equivalent, with the reason they matter.
            - archetype: CONSUMER_APP, B2B_SAAS, MARKETPLACE, DEVELOPER_TOOL, INTERNAL_TOOL or OTHER.
            """;

    private final GenerationService generation;
    private final AnchorValidator validator;
    private final double confidenceThreshold;

    public ConceptAnchorExtractor(GenerationService generation, WorkflowProperties properties) {
        this.generation = generation;
        this.confidenceThreshold = properties.getAnchorConfidenceThreshold();
        this.validator = new AnchorValidator(confidenceThreshold);
    }

    /**
     * @param idea     the original request, verbatim
     * @param feedback human feedback from a request-changes decision, or {@code null}
     */
    public ConceptAnchor extract(String idea, String feedback) {
        String instructions = INSTRUCTIONS.formatted(confidenceThreshold);
        String context = "## Idea\n" + idea + (feedback == null || feedback.isBlank() ? "" : "\n\n## Reviewer feedback\n" + feedback);

        Attempt first = attempt(instructions, context);
        if (first.problems().isEmpty()) {
            return first.anchor();
        }
        log.warn("Anchor extraction failed validation ({} problems), retrying once with feedback", first.problems().size());
        String retryContext = context + "\n\n## Your previous answer was rejected\n"
                + String.join("\n", first.problems().stream().map(p -> "- " + p).toList())
                + "\nReturn a corrected anchor.";
        Attempt second = attempt(instructions, retryContext);
        if (second.problems().isEmpty()) {
            return second.anchor();
        }
        log.error("Anchor extraction failed validation twice: {}", second.problems());
        throw new SchemaValidationException("Concept anchor failed validation", second.problems(), second.raw());
    }

    private Attempt attempt(String instructions, String context) {
        ConceptAnchor anchor;
        try {
            anchor = generation.generate(instructions, context, ConceptAnchor.class);
        } catch (SchemaValidationException e) {
            return new Attempt(null, e.problems(), e.rawOutput());
        }
        if (anchor == null) {
            return new Attempt(null, List.of("no anchor returned"), "");
        }
        ConceptAnchor normalized = anchor.asExtracted();
        return new Attempt(normalized, validator.validate(normalized), toJson(normalized));
    }

    private static String toJson(ConceptAnchor anchor) {
        try {
            return StateJson.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(anchor);
        } catch (JsonProcessingException e) {
            return String.valueOf(anchor);
        }
    }

    private record Attempt(ConceptAnchor anchor, List<String> problems, String raw) {}
}
