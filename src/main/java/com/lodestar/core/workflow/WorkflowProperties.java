package com.lodestar.core.workflow;

import com.lodestar.core.model.PhaseId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Policy constants for the workflow engine, bound from {@code lodestar.workflow.*}.
 */
@Component
@ConfigurationProperties(prefix = "lodestar.workflow")
public class WorkflowProperties {

    /** Attempts per generation call, first try included. */
    private int maxGenerationAttempts = 3;
    private Duration initialBackoff = Duration.ofMillis(500);
    private double backoffMultiplier = 2.0;
    /** Verifier-triggered re-runs of a producing stage before escalating. */
    private int maxCorrectiveRetries = 2;
    private double anchorConfidenceThreshold = 0.7;
    /** Violations of invariants at or above this confidence are always blocking. */
    private double blockingConfidenceThreshold = 0.9;
    private int anchorTokenBudget = 500;
    private Set<PhaseId> multiPassPhases = EnumSet.of(PhaseId.SCOPE);
    private boolean designIntegrationEnabled = false;

    public int getMaxGenerationAttempts() {
        return maxGenerationAttempts;
    }

    public void setMaxGenerationAttempts(int maxGenerationAttempts) {
        this.maxGenerationAttempts = maxGenerationAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
        this.initialBackoff = initialBackoff;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public int getMaxCorrectiveRetries() {
        return maxCorrectiveRetries;
    }

    public void setMaxCorrectiveRetries(int maxCorrectiveRetries) {
        this.maxCorrectiveRetries = maxCorrectiveRetries;
    }

    public double getAnchorConfidenceThreshold() {
        return anchorConfidenceThreshold;
    }

    public void setAnchorConfidenceThreshold(double anchorConfidenceThreshold) {
        this.anchorConfidenceThreshold = anchorConfidenceThreshold;
    }

    public double getBlockingConfidenceThreshold() {
        return blockingConfidenceThreshold;
    }

    public void setBlockingConfidenceThreshold(double blockingConfidenceThreshold) {
        this.blockingConfidenceThreshold = blockingConfidenceThreshold;
    }

    public int getAnchorTokenBudget() {
        return anchorTokenBudget;
    }

    public void setAnchorTokenBudget(int anchorTokenBudget) {
        this.anchorTokenBudget = anchorTokenBudget;
    }

    public Set<PhaseId> getMultiPassPhases() {
        return multiPassPhases;
    }

    public void setMultiPassPhases(Set<PhaseId> multiPassPhases) {
        this.multiPassPhases = multiPassPhases;
    }

    public boolean isDesignIntegrationEnabled() {
        return designIntegrationEnabled;
    }

    public void setDesignIntegrationEnabled(boolean designIntegrationEnabled) {
        this.designIntegrationEnabled = designIntegrationEnabled;
    }

    /** Backoff before retry number {@code attempt} (1-based). */
    public Duration backoffFor(int attempt) {
        double factor = Math.pow(backoffMultiplier, Math.max(0, attempt - 1));
        return Duration.ofMillis((long) (initialBackoff.toMillis() * factor));
    }
}
