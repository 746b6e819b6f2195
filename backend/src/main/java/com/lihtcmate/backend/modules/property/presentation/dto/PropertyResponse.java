package com.lihtcmate.backend.modules.property.presentation.dto;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record PropertyResponse(
        UUID id,
        String name,
        String county,
        String state,
        String complianceOption,
        LocalDate placedInServiceDate,
        List<UnitResponse> units
) {
}
