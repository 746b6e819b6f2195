package com.lihtcmate.backend.modules.rentroll.application;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.lihtcmate.backend.modules.lease.domain.Lease;
import com.lihtcmate.backend.modules.lease.domain.Resident;

/**
 * Result of copying a lease with its residents, verifications and document references into a new
 * snapshot. The id maps go from original row to copy.
 *
 * @param verified whether any verification of the source lease was FINALIZED
 */
public record LeaseGraphCopy(
        Lease source,
        Lease copy,
        List<Resident> residents,
        Map<UUID, UUID> residentIds,
        Map<UUID, UUID> verificationIds,
        int documentsReferenced,
        boolean verified
) {
}
