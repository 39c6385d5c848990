package com.lodestar.core.verify;

/**
 * Result of running one check: findings, or the reason the check could not finish.
 */
record CheckOutcome(VerificationCheck check, CheckFindings findings, String failure) {

    static CheckOutcome completed(VerificationCheck check, CheckFindings findings) {
        return new CheckOutcome(check, findings, null);
    }

    static CheckOutcome failed(VerificationCheck check, String failure) {
        return new CheckOutcome(check, null, failure);
    }

    boolean isCompleted() {
        return findings != null;
    }
}
