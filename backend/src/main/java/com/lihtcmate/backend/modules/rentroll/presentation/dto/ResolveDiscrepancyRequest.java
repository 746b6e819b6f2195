package com.lihtcmate.backend.modules.rentroll.presentation.dto;

import java.util.UUID;

import com.lihtcmate.backend.modules.rentroll.domain.DiscrepancyResolution;

import jakarta.validation.constraints.NotNull;

public record ResolveDiscrepancyRequest(
        @NotNull UUID newResidentId,
        @NotNull UUID existingResidentId,
        @NotNull DiscrepancyResolution resolution
) {
}
