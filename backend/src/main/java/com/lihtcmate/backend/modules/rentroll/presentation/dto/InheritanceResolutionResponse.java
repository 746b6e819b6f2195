package com.lihtcmate.backend.modules.rentroll.presentation.dto;

import java.util.List;
import java.util.UUID;

public record InheritanceResolutionResponse(
        List<UnitResolution> units
) {

    public record UnitResolution(
            String unitNumber,
            boolean inherited,
            UUID futureLeaseId,
            UUID newLeaseId,
            int residentsInherited,
            int documentsReferenced
    ) {
    }
}
