package com.lodestar.core.verify;

import com.lodestar.core.context.ContextAssembler;
import com.lodestar.core.llm.GenerationService;
import com.lodestar.core.model.ConceptAnchor;
import com.lodestar.core.model.PhaseId;
import com.lodestar.core.model.PhaseVerificationReport;
import com.lodestar.core.model.StageOutput;
import com.lodestar.core.model.StructuredArtifact;
import com.lodestar.core.error.PipelineException;
import com.lodestar.core.workflow.VerificationMode;
import com.lodestar.core.workflow.WorkflowProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Independent check run once at the end of a phase, before its gate.
 * <p>
 * Sees only the frozen anchor and the phase's own outputs and artifacts. In multi-pass
 * mode the specialised checks run concurrently and their findings are merged. A check
 * that fails does not fail the phase: the report is marked incomplete and says why.
 */
@Service
public class PhaseVerifier {

    private static final Logger log = LoggerFactory.getLogger(PhaseVerifier.class);

    private static final List<VerificationCheck> MULTI_PASS_CHECKS = List.of(
            VerificationCheck.INVARIANT_COMPLIANCE,
            VerificationCheck.GENERICIZATION,
            VerificationCheck.INTERNAL_CONSISTENCY);

    private final GenerationService generation;
    private final ContextAssembler contextAssembler;
    private final ReportSynthesizer synthesizer;
    private final ExecutorService executor;

    public PhaseVerifier(GenerationService generation, ContextAssembler contextAssembler, WorkflowProperties properties) {
        this.generation = generation;
        this.contextAssembler = contextAssembler;
        this.synthesizer = new ReportSynthesizer(properties.getBlockingConfidenceThreshold(), Clock.systemUTC());
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(MULTI_PASS_CHECKS.size(), r -> {
            Thread t = new Thread(r, "verify-check-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public PhaseVerificationReport verify(PhaseId phase, VerificationMode mode, ConceptAnchor anchor,
                                          Map<String, StageOutput> phaseOutputs,
                                          List<StructuredArtifact> phaseArtifacts) {
        String context = contextAssembler.forVerification(phase, anchor, phaseOutputs, phaseArtifacts);
        List<VerificationCheck> checks = mode == VerificationMode.MULTI_PASS
                ? MULTI_PASS_CHECKS
                : List.of(VerificationCheck.FOCUSED);
        log.info("Verifying phase {} with {} check(s)", phase, checks.size());

        List<CheckOutcome> outcomes;
        if (checks.size() == 1) {
            outcomes = List.of(run(checks.get(0), context));
        } else {
            List<CompletableFuture<CheckOutcome>> futures = checks.stream()
                    .map(check -> CompletableFuture.supplyAsync(() -> run(check, context), executor))
                    .toList();
            outcomes = futures.stream().map(PhaseVerifier::join).toList();
        }

        PhaseVerificationReport report = synthesizer.synthesize(phase, anchor, outcomes);
        log.info("Phase {} verification: {}", phase, report.summary());
        return report;
    }

    private CheckOutcome run(VerificationCheck check, String context) {
        try {
            CheckFindings findings = generation.generate(check.instructions(), context, CheckFindings.class);
            if (findings == null) {
                return CheckOutcome.failed(check, "no findings returned");
            }
            return CheckOutcome.completed(check, findings);
        } catch (PipelineException e) {
            log.warn("Verification check {} failed: {}", check, e.getMessage());
            return CheckOutcome.failed(check, e.getMessage());
        }
    }

    private static CheckOutcome join(CompletableFuture<CheckOutcome> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw new IllegalStateException("Verification check crashed", e.getCause());
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
