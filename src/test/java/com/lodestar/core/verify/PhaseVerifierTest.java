package com.lodestar.core.verify;

import com.lodestar.core.Fixtures;
import com.lodestar.core.context.ContextAssembler;
import com.lodestar.core.error.GenerationFailureException;
import com.lodestar.core.llm.GenerationService;
import com.lodestar.core.model.InvariantOverride;
import com.lodestar.core.model.PhaseId;
import com.lodestar.core.model.PhaseVerificationReport;
import com.lodestar.core.model.ScopeDefinition;
import com.lodestar.core.model.StageOutput;
import com.lodestar.core.workflow.VerificationMode;
import com.lodestar.core.workflow.WorkflowProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class PhaseVerifierTest {

    private GenerationService generation;
    private PhaseVerifier verifier;

    private final Map<String, StageOutput> outputs = Map.of("define_scope",
            new ScopeDefinition("Members-only playtest exchange", List.of("matching"), List.of("marketplace"),
                    List.of(), List.of(new InvariantOverride("community_model", "guest judges", "guests can view"))));

    @BeforeEach
    void setUp() {
        generation = mock(GenerationService.class);
        WorkflowProperties properties = new WorkflowProperties();
        verifier = new PhaseVerifier(generation, new ContextAssembler(properties), properties);
    }

    @AfterEach
    void tearDown() {
        verifier.shutdown();
    }

    private static CheckFindings clean(int confidence) {
        return new CheckFindings(List.of("community_model"), List.of(), List.of(), List.of(), List.of(), confidence, "ok");
    }

    @Test
    @DisplayName("single pass runs one focused check over the anchor and phase outputs only")
    void singlePass() {
        when(generation.generate(anyString(), anyString(), eq(CheckFindings.class))).thenReturn(clean(92));

        PhaseVerificationReport report = verifier.verify(PhaseId.SCOPE, VerificationMode.SINGLE_PASS,
                Fixtures.frozenAnchor(), outputs, List.of(Fixtures.capability("CAP-F-001", "Invite members")));

        assertTrue(report.passed());
        assertEquals(List.of("FOCUSED"), report.checks());
        var instructions = ArgumentCaptor.forClass(String.class);
        var context = ArgumentCaptor.forClass(String.class);
        verify(generation).generate(instructions.capture(), context.capture(), eq(CheckFindings.class));
        assertEquals(VerificationCheck.FOCUSED.instructions(), instructions.getValue());
        assertTrue(context.getValue().startsWith(Fixtures.frozenAnchor().render()));
        assertTrue(context.getValue().contains("declared override of community_model: guest judges"));
        assertTrue(context.getValue().contains("CAP-F-001: Invite members"));
    }

    @Test
    @DisplayName("multi pass runs three checks and reports the lowest confidence")
    void multiPass() {
        when(generation.generate(eq(VerificationCheck.INVARIANT_COMPLIANCE.instructions()), anyString(), eq(CheckFindings.class)))
                .thenReturn(clean(95));
        when(generation.generate(eq(VerificationCheck.GENERICIZATION.instructions()), anyString(), eq(CheckFindings.class)))
                .thenReturn(clean(70));
        when(generation.generate(eq(VerificationCheck.INTERNAL_CONSISTENCY.instructions()), anyString(), eq(CheckFindings.class)))
                .thenReturn(clean(88));

        PhaseVerificationReport report = verifier.verify(PhaseId.SCOPE, VerificationMode.MULTI_PASS,
                Fixtures.frozenAnchor(), outputs, List.of());

        assertEquals(70, report.confidenceScore());
        assertEquals(List.of("INVARIANT_COMPLIANCE", "GENERICIZATION", "INTERNAL_CONSISTENCY"), report.checks());
        assertTrue(report.completed());
    }

    @Test
    @DisplayName("a failing check yields an incomplete report instead of an exception")
    void failingCheckIsReported() {
        when(generation.generate(anyString(), anyString(), eq(CheckFindings.class)))
                .thenThrow(new GenerationFailureException("model unavailable"));

        PhaseVerificationReport report = verifier.verify(PhaseId.DESIGN, VerificationMode.SINGLE_PASS,
                Fixtures.frozenAnchor(), outputs, List.of());

        assertFalse(report.completed());
        assertTrue(report.passed());
        assertTrue(report.warnings().get(0).contains("model unavailable"));
    }
}
