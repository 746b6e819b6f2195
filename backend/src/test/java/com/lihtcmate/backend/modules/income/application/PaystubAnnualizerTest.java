package com.lihtcmate.backend.modules.income.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import com.lihtcmate.backend.modules.income.domain.IncomeAnalysisException;
import com.lihtcmate.backend.modules.income.domain.IncomeAnalysisException.Reason;
import com.lihtcmate.backend.modules.income.domain.PayFrequency;
import com.lihtcmate.backend.modules.income.domain.Paystub;
import com.lihtcmate.backend.modules.income.domain.PaystubAnalysis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PaystubAnnualizerTest {

    private final PaystubAnnualizer annualizer = new PaystubAnnualizer();

    @Test
    @DisplayName("bi-weekly paystubs of $1000 annualize to $26,000")
    void biWeeklyAnnualization() {
        PaystubAnalysis analysis = annualizer.analyzePaystubs(stubs(LocalDate.of(2025, 3, 28), 14, 3, "1000.00"));

        assertThat(analysis.frequency()).isEqualTo(PayFrequency.BI_WEEKLY);
        assertThat(analysis.stubsUsed()).isEqualTo(3);
        assertThat(analysis.annualizedIncome()).isEqualByComparingTo("26000");
    }

    @Test
    @DisplayName("only the most recent month of stubs is averaged")
    void averagesMostRecentStubs() {
        List<Paystub> paystubs = new ArrayList<>(stubs(LocalDate.of(2025, 3, 28), 7, 5, "500.00"));
        paystubs.add(new Paystub(LocalDate.of(2024, 12, 1), LocalDate.of(2024, 12, 7), new BigDecimal("9999.00")));

        PaystubAnalysis analysis = annualizer.analyzePaystubs(paystubs);

        assertThat(analysis.frequency()).isEqualTo(PayFrequency.WEEKLY);
        assertThat(analysis.stubsUsed()).isEqualTo(5);
        assertThat(analysis.averageGrossPay()).isEqualByComparingTo("500.00");
        assertThat(analysis.annualizedIncome()).isEqualByComparingTo("26000.00");
    }

    @Test
    @DisplayName("a gap within two days of a frequency still classifies")
    void toleranceWindow() {
        PaystubAnalysis analysis = annualizer.analyzePaystubs(List.of(
                new Paystub(LocalDate.of(2025, 2, 1), LocalDate.of(2025, 2, 28), new BigDecimal("3000.00")),
                new Paystub(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31), new BigDecimal("3000.00"))));

        assertThat(analysis.gapDays()).isEqualTo(28);
        assertThat(analysis.frequency()).isEqualTo(PayFrequency.MONTHLY);
        assertThat(analysis.annualizedIncome()).isEqualByComparingTo("36000.00");
    }

    @Test
    @DisplayName("incomplete stubs are discarded before counting")
    void insufficientData() {
        List<Paystub> paystubs = List.of(
                new Paystub(LocalDate.of(2025, 3, 15), LocalDate.of(2025, 3, 28), new BigDecimal("1000.00")),
                new Paystub(null, LocalDate.of(2025, 3, 14), new BigDecimal("1000.00")),
                new Paystub(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 14), null));

        assertThatThrownBy(() -> annualizer.analyzePaystubs(paystubs))
                .isInstanceOf(IncomeAnalysisException.class)
                .extracting(ex -> ((IncomeAnalysisException) ex).getReason())
                .isEqualTo(Reason.INSUFFICIENT_DATA);
    }

    @Test
    @DisplayName("a gap matching no frequency fails")
    void unknownFrequency() {
        assertThatThrownBy(() -> annualizer.analyzePaystubs(stubs(LocalDate.of(2025, 3, 28), 21, 3, "1000.00")))
                .isInstanceOf(IncomeAnalysisException.class)
                .extracting(ex -> ((IncomeAnalysisException) ex).getReason())
                .isEqualTo(Reason.UNKNOWN_FREQUENCY);
    }

    @Test
    @DisplayName("two weekly stubs do not cover a month")
    void insufficientPeriod() {
        assertThatThrownBy(() -> annualizer.analyzePaystubs(stubs(LocalDate.of(2025, 3, 28), 7, 2, "400.00")))
                .isInstanceOf(IncomeAnalysisException.class)
                .extracting(ex -> ((IncomeAnalysisException) ex).getReason())
                .isEqualTo(Reason.INSUFFICIENT_PERIOD);
    }

    private static List<Paystub> stubs(LocalDate latestEnd, int periodDays, int count, String gross) {
        List<Paystub> paystubs = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            LocalDate end = latestEnd.minusDays((long) periodDays * i);
            paystubs.add(new Paystub(end.minusDays(periodDays - 1L), end, new BigDecimal(gross)));
        }
        return paystubs;
    }
}
