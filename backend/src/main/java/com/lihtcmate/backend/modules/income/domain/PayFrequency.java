package com.lihtcmate.backend.modules.income.domain;

import java.util.Optional;

/**
 * Pay cadences recognised on paystubs, with the nominal gap between period-end dates and the number of
 * pay periods per year.
 */
public enum PayFrequency {
    WEEKLY(7, 52),
    BI_WEEKLY(14, 26),
    SEMI_MONTHLY(15, 24),
    MONTHLY(30, 12);

    public static final int TOLERANCE_DAYS = 2;
    private static final int DAYS_IN_MONTH = 30;

    private final int periodDays;
    private final int periodsPerYear;

    PayFrequency(int periodDays, int periodsPerYear) {
        this.periodDays = periodDays;
        this.periodsPerYear = periodsPerYear;
    }

    public int getPeriodDays() {
        return periodDays;
    }

    public int getPeriodsPerYear() {
        return periodsPerYear;
    }

    /**
     * Minimum number of paystubs that together cover a month of pay.
     */
    public int requiredStubs() {
        return (DAYS_IN_MONTH + periodDays - 1) / periodDays;
    }

    /**
     * Nearest frequency within {@link #TOLERANCE_DAYS}; on equal distance the earlier constant wins.
     */
    public static Optional<PayFrequency> fromGapDays(long gapDays) {
        PayFrequency best = null;
        long bestDistance = Long.MAX_VALUE;
        for (PayFrequency candidate : values()) {
            long distance = Math.abs(gapDays - candidate.periodDays);
            if (distance <= TOLERANCE_DAYS && distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best);
    }
}
