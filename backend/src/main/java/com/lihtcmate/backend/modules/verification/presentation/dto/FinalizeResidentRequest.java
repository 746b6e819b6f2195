package com.lihtcmate.backend.modules.verification.presentation.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.PositiveOrZero;

/**
 * {@code verifiedIncome} overrides the figure computed from the resident's completed documents.
 */
public record FinalizeResidentRequest(
        @PositiveOrZero BigDecimal verifiedIncome
) {
}
