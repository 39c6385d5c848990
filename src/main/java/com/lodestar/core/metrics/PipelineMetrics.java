package com.lodestar.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for planning runs.
 */
@Service
public class PipelineMetrics {

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStageDuration(String stage, String outcome, long ms) {
        Timer.builder("lodestar.stage.duration")
                .tag("stage", stage)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /** A transient generation failure that was retried. */
    public void incrementGenerationRetries(String stage) {
        Counter.builder("lodestar.generation.retries")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordVerification(String phase, boolean passed, boolean completed, int blockingViolations) {
        Counter.builder("lodestar.verifications")
                .tag("phase", phase)
                .tag("result", !completed ? "incomplete" : passed ? "passed" : "blocked")
                .register(registry)
                .increment();
        DistributionSummary.builder("lodestar.verification.blocking_violations")
                .tag("phase", phase)
                .register(registry)
                .record(blockingViolations);
    }

    public void incrementCorrectiveRetries(String phase) {
        Counter.builder("lodestar.corrective.retries")
                .description("Stage re-runs triggered by blocking verification findings")
                .tag("phase", phase)
                .register(registry)
                .increment();
    }

    public void incrementEscalations(String kind) {
        Counter.builder("lodestar.escalations.total")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordGateDecision(String phase, String decision) {
        Counter.builder("lodestar.gate.decisions")
                .tag("phase", phase)
                .tag("decision", decision)
                .register(registry)
                .increment();
    }

    public void recordRunResult(String status) {
        Counter.builder("lodestar.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
