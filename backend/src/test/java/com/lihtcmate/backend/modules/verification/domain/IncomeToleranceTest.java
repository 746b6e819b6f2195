package com.lihtcmate.backend.modules.verification.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

class IncomeToleranceTest {

    @Test
    void differencesUpToOneDollarAreEqual() {
        assertThat(IncomeTolerance.exceeds(new BigDecimal("50000.00"), new BigDecimal("50001.00"))).isFalse();
        assertThat(IncomeTolerance.exceeds(new BigDecimal("50001.00"), new BigDecimal("50000.00"))).isFalse();
        assertThat(IncomeTolerance.exceeds(new BigDecimal("50000.00"), new BigDecimal("50001.01"))).isTrue();
    }

    @Test
    void missingValuesCountAsZero() {
        assertThat(IncomeTolerance.exceeds(null, new BigDecimal("0.99"))).isFalse();
        assertThat(IncomeTolerance.exceeds(new BigDecimal("1.50"), null)).isTrue();
    }
}
