package com.lodestar.core.anchor;

import com.lodestar.core.Fixtures;
import com.lodestar.core.error.SchemaValidationException;
import com.lodestar.core.llm.GenerationService;
import com.lodestar.core.model.AnchorInvariant;
import com.lodestar.core.model.ConceptAnchor;
import com.lodestar.core.state.StateJson;
import com.lodestar.core.workflow.WorkflowProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ConceptAnchorExtractorTest {

    private GenerationService generation;
    private ConceptAnchorExtractor extractor;

    @BeforeEach
    void setUp() {
        generation = mock(GenerationService.class);
        extractor = new ConceptAnchorExtractor(generation, new WorkflowProperties());
    }

    @Test
    @DisplayName("returns a well-formed anchor after one call")
    void extractsOnFirstAttempt() {
        when(generation.generate(anyString(), anyString(), eq(ConceptAnchor.class)))
                .thenReturn(Fixtures.anchor(Fixtures.closedCommunity()));

        ConceptAnchor anchor = extractor.extract(Fixtures.IDEA, null);

        assertEquals("closed, invite-only", anchor.invariant("community_model").orElseThrow().value());
        assertFalse(anchor.frozen());
        verify(generation, times(1)).generate(anyString(), anyString(), eq(ConceptAnchor.class));
    }

    @Test
    @DisplayName("clears frozen and confirmed flags a generator claimed")
    void normalizesClaimedConfirmation() {
        var claimed = new AnchorInvariant("community_model", "closed", "invite-only", 0.95, null, List.of(), true);
        when(generation.generate(anyString(), anyString(), eq(ConceptAnchor.class)))
                .thenReturn(Fixtures.anchor(claimed).freeze());

        ConceptAnchor anchor = extractor.extract(Fixtures.IDEA, null);

        assertFalse(anchor.frozen());
        assertFalse(anchor.invariants().get(0).userConfirmed());
    }

    @Test
    @DisplayName("retries once with the validation problems as feedback")
    void retriesOnceWithFeedback() {
        var noOptions = new AnchorInvariant("monetization", "free", "credits", 0.4, "unclear", List.of(), false);
        when(generation.generate(anyString(), anyString(), eq(ConceptAnchor.class)))
                .thenReturn(Fixtures.anchor(noOptions))
                .thenReturn(Fixtures.anchor(Fixtures.ambiguousMonetization()));

        ConceptAnchor anchor = extractor.extract(Fixtures.IDEA, "keep it closed");

        assertEquals(2, anchor.invariant("monetization").orElseThrow().clarificationOptions().size());
        var contexts = ArgumentCaptor.forClass(String.class);
        verify(generation, times(2)).generate(anyString(), contexts.capture(), eq(ConceptAnchor.class));
        assertTrue(contexts.getAllValues().get(0).contains("keep it closed"));
        assertTrue(contexts.getAllValues().get(1).contains("previous answer was rejected"));
        assertTrue(contexts.getAllValues().get(1).contains("clarification options"));
    }

    @Test
    @DisplayName("a second malformed anchor raises a schema failure with the raw output")
    void failsAfterSecondMalformedAnchor() {
        var broken = new ConceptAnchor(" ", List.of(), List.of(), List.of(), List.of(), null, false);
        when(generation.generate(anyString(), anyString(), eq(ConceptAnchor.class))).thenReturn(broken);

        var ex = assertThrows(SchemaValidationException.class, () -> extractor.extract(Fixtures.IDEA, null));

        assertTrue(ex.problems().contains("goal is missing"));
        assertNotNull(ex.rawOutput());
        verify(generation, times(2)).generate(anyString(), anyString(), eq(ConceptAnchor.class));
    }

    @Test
    @DisplayName("an invariant without a confidence is rejected instead of trusted")
    void rejectsMissingConfidence() throws Exception {
        AnchorInvariant unscored = StateJson.mapper().readValue(
                "{\"property\":\"community_model\",\"value\":\"open to anyone\",\"source\":\"designers\"}",
                AnchorInvariant.class);
        assertNull(unscored.confidence());
        when(generation.generate(anyString(), anyString(), eq(ConceptAnchor.class)))
                .thenReturn(Fixtures.anchor(unscored));

        var ex = assertThrows(SchemaValidationException.class, () -> extractor.extract(Fixtures.IDEA, null));

        assertTrue(ex.problems().contains("invariant 'community_model' has no confidence"));
        verify(generation, times(2)).generate(anyString(), anyString(), eq(ConceptAnchor.class));
    }

    @Test
    @DisplayName("a schema failure from the generator counts as a failed attempt")
    void generatorSchemaFailureIsRetried() {
        when(generation.generate(anyString(), anyString(), eq(ConceptAnchor.class)))
                .thenThrow(new SchemaValidationException("bad json", List.of("unparseable"), "{oops"))
                .thenReturn(Fixtures.anchor(Fixtures.closedCommunity()));

        ConceptAnchor anchor = extractor.extract(Fixtures.IDEA, null);

        assertNotNull(anchor.goal());
    }
}
