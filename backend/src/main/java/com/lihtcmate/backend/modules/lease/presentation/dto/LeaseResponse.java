package com.lihtcmate.backend.modules.lease.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record LeaseResponse(
        UUID id,
        UUID unitId,
        UUID snapshotId,
        String name,
        LocalDate leaseStartDate,
        LocalDate leaseEndDate,
        BigDecimal leaseRent,
        List<ResidentSummary> residents
) {

    public record ResidentSummary(
            UUID id,
            String name,
            BigDecimal annualizedIncome,
            boolean incomeFinalized
    ) {
    }
}
