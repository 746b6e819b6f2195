package com.lihtcmate.backend.modules.verification.presentation.dto;

import java.math.BigDecimal;
import java.util.UUID;

import com.lihtcmate.backend.modules.verification.domain.LeaseVerificationStatus;

public record ResidentFinalizationResponse(
        UUID residentId,
        BigDecimal verifiedIncome,
        boolean residentFinalized,
        boolean verificationFinalized,
        BigDecimal totalVerifiedIncome,
        LeaseVerificationStatus leaseStatus
) {
}
