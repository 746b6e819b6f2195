package com.lihtcmate.backend.modules.property.presentation.dto;

import java.time.LocalDate;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreatePropertyRequest(
        @NotBlank @Size(max = 200) String name,
        @NotBlank @Size(max = 100) String county,
        @NotBlank @Size(max = 50) String state,
        @Size(max = 200) String complianceOption,
        LocalDate placedInServiceDate
) {
}
