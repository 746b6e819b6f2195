package com.lihtcmate.backend.modules.rentroll.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record FinalizeComplianceResponse(
        UUID snapshotId,
        int leasesCreated,
        int tenanciesCreated,
        int residentsCreated,
        int futureLeasesPreserved,
        List<FutureLeaseMatch> futureLeaseMatches,
        List<IncomeDiscrepancy> incomeDiscrepancies
) {

    /**
     * A preserved, verified future lease whose unit received a lease with different terms. The caller
     * decides whether the new lease inherits its verified income.
     */
    public record FutureLeaseMatch(
            String unitNumber,
            UUID newLeaseId,
            LocalDate newLeaseStartDate,
            LocalDate newLeaseEndDate,
            ExistingFutureLease existingFutureLease
    ) {
    }

    public record ExistingFutureLease(
            UUID id,
            String name,
            List<MatchedResident> residents
    ) {
    }

    public record MatchedResident(
            UUID id,
            String name,
            BigDecimal verifiedIncome
    ) {
    }

    public record IncomeDiscrepancy(
            String unitNumber,
            String residentName,
            BigDecimal verifiedIncome,
            BigDecimal newRentRollIncome,
            BigDecimal discrepancy,
            UUID existingLeaseId,
            UUID newLeaseId,
            UUID existingResidentId,
            UUID newResidentId
    ) {
    }
}
