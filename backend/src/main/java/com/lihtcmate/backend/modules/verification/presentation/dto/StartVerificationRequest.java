package com.lihtcmate.backend.modules.verification.presentation.dto;

import com.lihtcmate.backend.modules.verification.domain.VerificationReason;

import jakarta.validation.constraints.NotNull;

public record StartVerificationRequest(
        @NotNull VerificationReason reason
) {
}
