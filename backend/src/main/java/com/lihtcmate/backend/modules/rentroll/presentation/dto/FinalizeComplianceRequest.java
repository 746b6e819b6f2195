package com.lihtcmate.backend.modules.rentroll.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * One compliance upload: lease rows grouped by unit number, as of {@code rentRollDate}.
 */
public record FinalizeComplianceRequest(
        @NotNull LocalDate rentRollDate,
        @Size(max = 255) String filename,
        @NotEmpty Map<String, @NotNull List<@NotNull @Valid LeaseRow>> unitGroups
) {

    public record LeaseRow(
            LocalDate leaseStartDate,
            LocalDate leaseEndDate,
            BigDecimal leaseRent,
            @NotNull List<@NotNull @Valid ResidentRow> residents
    ) {
    }

    public record ResidentRow(
            @Size(max = 255) String name,
            BigDecimal annualizedIncome
    ) {
    }
}
