package com.lihtcmate.backend.modules.verification.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.lihtcmate.backend.modules.verification.domain.IncomeVerification;
import com.lihtcmate.backend.modules.verification.domain.VerificationReason;
import com.lihtcmate.backend.modules.verification.domain.VerificationStatus;

public record VerificationResponse(
        UUID id,
        UUID leaseId,
        VerificationStatus status,
        VerificationReason reason,
        BigDecimal calculatedVerifiedIncome,
        OffsetDateTime finalizedAt,
        OffsetDateTime createdAt
) {

    public static VerificationResponse from(IncomeVerification verification) {
        return new VerificationResponse(
                verification.getId(),
                verification.getLease().getId(),
                verification.getStatus(),
                verification.getReason(),
                verification.getCalculatedVerifiedIncome(),
                verification.getFinalizedAt(),
                verification.getCreatedAt()
        );
    }
}
