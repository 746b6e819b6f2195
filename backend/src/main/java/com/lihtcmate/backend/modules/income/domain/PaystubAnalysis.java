package com.lihtcmate.backend.modules.income.domain;

import java.math.BigDecimal;

public record PaystubAnalysis(
        PayFrequency frequency,
        long gapDays,
        int stubsUsed,
        BigDecimal averageGrossPay,
        BigDecimal annualizedIncome
) {
}
