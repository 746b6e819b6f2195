package com.lihtcmate.backend.modules.lease.domain;

import java.time.LocalDate;

/**
 * Current or future, derived from the rent roll rather than stored on the lease.
 */
public enum LeaseTiming {
    CURRENT,
    FUTURE;

    /**
     * A lease is current when the active rent roll lists it and it has started by the rent-roll date.
     */
    public static LeaseTiming of(boolean onActiveRentRoll, LocalDate leaseStartDate, LocalDate rentRollDate) {
        return onActiveRentRoll && startsBy(leaseStartDate, rentRollDate) ? CURRENT : FUTURE;
    }

    /**
     * Undated leases count as started.
     */
    public static boolean startsBy(LocalDate leaseStartDate, LocalDate rentRollDate) {
        return leaseStartDate == null || !leaseStartDate.isAfter(rentRollDate);
    }
}
