package com.lihtcmate.backend.modules.income.domain;

/**
 * Raised when a resident's paystubs cannot be annualized yet. Callers treat it as "pending more
 * documents" for that resident only.
 */
public class IncomeAnalysisException extends RuntimeException {

    public enum Reason {
        INSUFFICIENT_DATA,
        UNKNOWN_FREQUENCY,
        INSUFFICIENT_PERIOD
    }

    private final Reason reason;

    public IncomeAnalysisException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
