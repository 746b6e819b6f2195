package com.lihtcmate.backend.modules.verification.presentation.dto;

import java.math.BigDecimal;
import java.util.UUID;

import com.lihtcmate.backend.modules.lease.domain.LeaseTiming;
import com.lihtcmate.backend.modules.verification.domain.LeaseVerificationStatus;

public record LeaseStatusResponse(
        UUID leaseId,
        UUID unitId,
        String unitNumber,
        String leaseName,
        LeaseTiming timing,
        LeaseVerificationStatus status,
        String statusLabel,
        int residentCount,
        BigDecimal declaredIncome,
        BigDecimal verifiedIncome
) {
}
