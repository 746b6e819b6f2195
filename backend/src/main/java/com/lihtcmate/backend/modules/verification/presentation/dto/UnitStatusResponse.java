package com.lihtcmate.backend.modules.verification.presentation.dto;

import java.util.UUID;

import com.lihtcmate.backend.modules.verification.domain.LeaseVerificationStatus;

public record UnitStatusResponse(
        UUID unitId,
        String unitNumber,
        UUID leaseId,
        LeaseVerificationStatus status,
        String statusLabel
) {
}
