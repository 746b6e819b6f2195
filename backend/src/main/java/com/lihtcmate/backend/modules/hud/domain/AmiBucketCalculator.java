package com.lihtcmate.backend.modules.hud.domain;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Assigns a household to the lowest AMI threshold whose limit covers its verified income.
 */
public final class AmiBucketCalculator {

    public static final String VACANT = "Vacant";
    public static final String NO_INCOME_INFORMATION = "No Income Information";
    public static final String HUD_UNAVAILABLE = "HUD API Unavailable";
    public static final String ERROR_LOADING = "Error loading AMI data";
    public static final String MARKET = "Market";

    public static final int MAX_HOUSEHOLD_SIZE = 8;

    private AmiBucketCalculator() {
    }

    /**
     * Bucket label such as {@code "50% AMI"}, {@link #MARKET} above every threshold, or a sentinel.
     * Household size is the literal resident count, capped at eight.
     */
    public static String getActualAmiBucket(
            BigDecimal totalIncome,
            int householdSize,
            HudIncomeLimits limits,
            String complianceOption
    ) {
        if (householdSize <= 0) {
            return VACANT;
        }
        if (totalIncome == null || totalIncome.signum() <= 0) {
            return NO_INCOME_INFORMATION;
        }
        if (limits == null) {
            return HUD_UNAVAILABLE;
        }

        int familySize = Math.min(householdSize, MAX_HOUSEHOLD_SIZE);
        boolean anyLimit = false;
        List<Integer> thresholds = ComplianceOptionParser.thresholds(complianceOption);
        for (Integer threshold : thresholds) {
            Optional<BigDecimal> limit = limits.incomeLimit(threshold, familySize);
            if (limit.isEmpty()) {
                continue;
            }
            anyLimit = true;
            if (totalIncome.compareTo(limit.get()) <= 0) {
                return threshold + "% AMI";
            }
        }
        return anyLimit ? MARKET : HUD_UNAVAILABLE;
    }
}
