package com.lihtcmate.backend.modules.rentroll.presentation.dto;

import java.math.BigDecimal;
import java.util.UUID;

import com.lihtcmate.backend.modules.rentroll.domain.DiscrepancyResolution;
import com.lihtcmate.backend.modules.verification.domain.LeaseVerificationStatus;

public record DiscrepancyResolutionResponse(
        DiscrepancyResolution resolution,
        UUID updatedResidentId,
        UUID leaseId,
        BigDecimal verifiedIncome,
        LeaseVerificationStatus leaseStatus
) {
}
