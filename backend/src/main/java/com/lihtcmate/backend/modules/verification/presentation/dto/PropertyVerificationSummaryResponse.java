package com.lihtcmate.backend.modules.verification.presentation.dto;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.lihtcmate.backend.modules.verification.domain.LeaseVerificationStatus;

public record PropertyVerificationSummaryResponse(
        UUID propertyId,
        UUID activeSnapshotId,
        int totalUnits,
        Map<LeaseVerificationStatus, Long> statusCounts,
        List<UnitStatusResponse> units
) {
}
