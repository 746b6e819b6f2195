package com.lihtcmate.backend.modules.rentroll.presentation.dto;

import java.util.Map;
import java.util.UUID;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

/**
 * Answers to the inheritance prompts of the last finalize, keyed by unit number.
 */
public record ResolveInheritanceRequest(
        @NotEmpty Map<String, @NotNull @Valid Decision> decisions
) {

    /**
     * @param inherit    {@code true} to carry the future lease's verified income onto the new lease
     * @param newLeaseId the {@code newLeaseId} of the unit's finalize match; required when inheriting
     */
    public record Decision(
            @NotNull Boolean inherit,
            UUID newLeaseId
    ) {
    }
}
