package com.lihtcmate.backend.modules.hud.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * LIHTC maximum gross rents: 30% of the income limit for the unit's imputed household size, monthly.
 */
public final class MaxRentCalculator {

    private static final BigDecimal RENT_SHARE = new BigDecimal("0.30");
    private static final BigDecimal MONTHS = BigDecimal.valueOf(12);

    public enum BedroomSize {
        STUDIO("studio", new BigDecimal("1.0")),
        ONE_BEDROOM("1br", new BigDecimal("1.5")),
        TWO_BEDROOM("2br", new BigDecimal("3.0")),
        THREE_BEDROOM("3br", new BigDecimal("4.5")),
        FOUR_BEDROOM("4br", new BigDecimal("6.0")),
        FIVE_BEDROOM("5br", new BigDecimal("8.0"));

        private final String label;
        private final BigDecimal householdSize;

        BedroomSize(String label, BigDecimal householdSize) {
            this.label = label;
            this.householdSize = householdSize;
        }

        public String label() {
            return label;
        }

        public BigDecimal householdSize() {
            return householdSize;
        }
    }

    private MaxRentCalculator() {
    }

    /**
     * Rents keyed by {@code "{T}percent"} then bedroom label. Sizes whose limits are missing are left out.
     */
    public static Map<String, Map<String, BigDecimal>> maxRents(HudIncomeLimits limits, List<Integer> thresholds) {
        Map<String, Map<String, BigDecimal>> rents = new LinkedHashMap<>();
        for (Integer threshold : thresholds) {
            Map<String, BigDecimal> byBedroom = new LinkedHashMap<>();
            for (BedroomSize size : BedroomSize.values()) {
                incomeLimit(limits, threshold, size.householdSize())
                        .ifPresent(limit -> byBedroom.put(size.label(), maxRent(limit)));
            }
            if (!byBedroom.isEmpty()) {
                rents.put(HudIncomeLimits.tableKey(threshold), byBedroom);
            }
        }
        return rents;
    }

    public static BigDecimal maxRent(BigDecimal incomeLimit) {
        return incomeLimit.multiply(RENT_SHARE).divide(MONTHS, 0, RoundingMode.HALF_UP);
    }

    /**
     * Limit at a possibly fractional household size, interpolated between the adjacent whole sizes.
     */
    public static Optional<BigDecimal> incomeLimit(HudIncomeLimits limits, int amiPercent, BigDecimal householdSize) {
        int lower = householdSize.setScale(0, RoundingMode.FLOOR).intValueExact();
        int upper = householdSize.setScale(0, RoundingMode.CEILING).intValueExact();
        Optional<BigDecimal> lowerLimit = limits.incomeLimit(amiPercent, lower);
        if (lower == upper || lowerLimit.isEmpty()) {
            return lower == upper ? lowerLimit : Optional.empty();
        }
        BigDecimal fraction = householdSize.subtract(BigDecimal.valueOf(lower));
        return limits.incomeLimit(amiPercent, upper)
                .map(upperLimit -> lowerLimit.get().add(upperLimit.subtract(lowerLimit.get()).multiply(fraction)));
    }
}
