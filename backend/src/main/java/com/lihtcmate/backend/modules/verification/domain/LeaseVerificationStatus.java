package com.lihtcmate.backend.modules.verification.domain;

public enum LeaseVerificationStatus {
    VACANT("Vacant"),
    VERIFIED("Verified"),
    NEEDS_INVESTIGATION("Needs Investigation"),
    OUT_OF_DATE_INCOME_DOCUMENTS("Out of Date Income Documents"),
    IN_PROGRESS("In Progress - Finalize to Process"),
    WAITING_FOR_ADMIN_REVIEW("Waiting for Admin Review"),
    NEEDS_INCOME_DOCUMENTATION("Needs Income Documentation");

    private final String label;

    LeaseVerificationStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
