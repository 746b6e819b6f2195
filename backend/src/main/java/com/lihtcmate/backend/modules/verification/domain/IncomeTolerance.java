package com.lihtcmate.backend.modules.verification.domain;

import java.math.BigDecimal;

/**
 * Declared and verified income are treated as equal when they differ by at most one dollar.
 */
public final class IncomeTolerance {

    public static final BigDecimal DISCREPANCY_THRESHOLD = new BigDecimal("1.00");

    private IncomeTolerance() {
    }

    public static boolean exceeds(BigDecimal left, BigDecimal right) {
        BigDecimal a = left == null ? BigDecimal.ZERO : left;
        BigDecimal b = right == null ? BigDecimal.ZERO : right;
        return a.subtract(b).abs().compareTo(DISCREPANCY_THRESHOLD) > 0;
    }
}
