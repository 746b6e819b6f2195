package com.lihtcmate.backend.modules.verification.domain;

public enum DocumentStatus {
    UPLOADED,
    PROCESSING,
    COMPLETED,
    NEEDS_REVIEW;

    public boolean isUsable() {
        return this == COMPLETED;
    }
}
