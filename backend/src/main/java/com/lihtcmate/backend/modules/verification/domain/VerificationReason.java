package com.lihtcmate.backend.modules.verification.domain;

public enum VerificationReason {
    INITIAL_LEASE,
    ANNUAL_RECERTIFICATION,
    LEASE_RENEWAL,
    INCOME_CHANGE,
    COMPLIANCE_AUDIT
}
