package com.lihtcmate.backend.modules.verification.domain;

/**
 * Workflow state of an income verification. A lease with no verification row has not started one.
 */
public enum VerificationStatus {
    IN_PROGRESS,
    FINALIZED;

    public boolean isFinalized() {
        return this == FINALIZED;
    }
}
