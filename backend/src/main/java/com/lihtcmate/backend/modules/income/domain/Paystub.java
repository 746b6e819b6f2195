package com.lihtcmate.backend.modules.income.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

public record Paystub(
        LocalDate payPeriodStartDate,
        LocalDate payPeriodEndDate,
        BigDecimal grossPayAmount
) {

    public boolean isComplete() {
        return payPeriodStartDate != null && payPeriodEndDate != null && grossPayAmount != null;
    }
}
