package com.lihtcmate.backend.modules.hud.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * MTSP income-limit payload for one county and year.
 * <p>
 * Tables are keyed {@code "{T}percent"} and hold per-household-size limits {@code il{T}_p{n}}.
 * A threshold without its own table is derived from the 50% table.
 */
public final class HudIncomeLimits {

    public static final String HERA_SPECIAL_KEY = "hera_special";
    public static final List<Integer> HERA_THRESHOLDS = List.of(50, 60, 80);

    private final Map<String, Object> data;

    private HudIncomeLimits(Map<String, Object> data) {
        this.data = data;
    }

    public static HudIncomeLimits of(Map<String, Object> data) {
        if (data == null || data.isEmpty()) {
            throw new HudServiceException("HUD income limits payload is empty");
        }
        return new HudIncomeLimits(Collections.unmodifiableMap(new LinkedHashMap<>(data)));
    }

    public Map<String, Object> asMap() {
        return data;
    }

    public boolean hasHeraSpecial() {
        return data.get(HERA_SPECIAL_KEY) instanceof Map<?, ?> hera && !hera.isEmpty();
    }

    /**
     * Copy with the HERA special 50/60/80% tables in place of the standard ones. Tables HERA does not
     * publish stay standard.
     */
    @SuppressWarnings("unchecked")
    public HudIncomeLimits withHeraSpecial() {
        if (!hasHeraSpecial()) {
            return this;
        }
        Map<String, Object> hera = (Map<String, Object>) data.get(HERA_SPECIAL_KEY);
        Map<String, Object> merged = new LinkedHashMap<>(data);
        for (Integer threshold : HERA_THRESHOLDS) {
            Object table = hera.get(tableKey(threshold));
            if (table instanceof Map<?, ?>) {
                merged.put(tableKey(threshold), table);
            }
        }
        return new HudIncomeLimits(Collections.unmodifiableMap(merged));
    }

    /**
     * Limit for a whole household size at an AMI threshold.
     */
    public Optional<BigDecimal> incomeLimit(int amiPercent, int householdSize) {
        Optional<BigDecimal> direct = lookup(amiPercent, householdSize);
        if (direct.isPresent() || amiPercent == 50) {
            return direct;
        }
        return lookup(50, householdSize)
                .map(base -> base.multiply(BigDecimal.valueOf(amiPercent)).divide(BigDecimal.valueOf(50), 2, RoundingMode.HALF_UP));
    }

    private Optional<BigDecimal> lookup(int amiPercent, int householdSize) {
        if (!(data.get(tableKey(amiPercent)) instanceof Map<?, ?> table)) {
            return Optional.empty();
        }
        Object value = table.get("il%d_p%d".formatted(amiPercent, householdSize));
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(value.toString().trim()));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    public static String tableKey(int amiPercent) {
        return amiPercent + "percent";
    }
}
