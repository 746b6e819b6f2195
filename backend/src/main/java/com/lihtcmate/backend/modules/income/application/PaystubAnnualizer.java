package com.lihtcmate.backend.modules.income.application;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;

import com.lihtcmate.backend.modules.income.domain.IncomeAnalysisException;
import com.lihtcmate.backend.modules.income.domain.IncomeAnalysisException.Reason;
import com.lihtcmate.backend.modules.income.domain.PayFrequency;
import com.lihtcmate.backend.modules.income.domain.Paystub;
import com.lihtcmate.backend.modules.income.domain.PaystubAnalysis;

import org.springframework.stereotype.Component;

/**
 * Converts a resident's paystubs into an annual income figure.
 * <p>
 * The frequency is detected from the gap between the two most recent period-end dates, then the
 * gross pay of the stubs covering one month is averaged and multiplied by the periods per year.
 * Stateless and free of I/O.
 */
@Component
public class PaystubAnnualizer {

    private static final int MONEY_SCALE = 2;
    private static final int AVERAGE_SCALE = 6;

    public PaystubAnalysis analyzePaystubs(List<Paystub> paystubs) {
        List<Paystub> usable = paystubs == null ? List.of() : paystubs.stream()
                .filter(paystub -> paystub != null && paystub.isComplete())
                .sorted(Comparator.comparing(Paystub::payPeriodEndDate).reversed())
                .toList();

        if (usable.size() < 2) {
            throw new IncomeAnalysisException(Reason.INSUFFICIENT_DATA,
                    "At least 2 complete paystubs are required but %d were provided".formatted(usable.size()));
        }

        long gapDays = ChronoUnit.DAYS.between(usable.get(1).payPeriodEndDate(), usable.get(0).payPeriodEndDate());
        PayFrequency frequency = PayFrequency.fromGapDays(gapDays)
                .orElseThrow(() -> new IncomeAnalysisException(Reason.UNKNOWN_FREQUENCY,
                        "Cannot determine pay frequency from a %d day gap between pay periods".formatted(gapDays)));

        int required = frequency.requiredStubs();
        if (usable.size() < required) {
            throw new IncomeAnalysisException(Reason.INSUFFICIENT_PERIOD,
                    "%s pay requires %d paystubs to cover a month but %d were provided"
                            .formatted(frequency, required, usable.size()));
        }

        BigDecimal total = usable.stream()
                .limit(required)
                .map(Paystub::grossPayAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal average = total.divide(BigDecimal.valueOf(required), AVERAGE_SCALE, RoundingMode.HALF_UP);
        BigDecimal annualized = average.multiply(BigDecimal.valueOf(frequency.getPeriodsPerYear()))
                .setScale(MONEY_SCALE, RoundingMode.HALF_UP);

        return new PaystubAnalysis(
                frequency,
                gapDays,
                required,
                average.setScale(MONEY_SCALE, RoundingMode.HALF_UP),
                annualized
        );
    }
}
