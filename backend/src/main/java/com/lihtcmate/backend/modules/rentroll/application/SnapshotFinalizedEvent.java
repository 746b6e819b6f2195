package com.lihtcmate.backend.modules.rentroll.application;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Published inside the finalize transaction and delivered to listeners once it commits.
 */
public record SnapshotFinalizedEvent(
        UUID propertyId,
        UUID snapshotId,
        LocalDate rentRollDate
) {
}
