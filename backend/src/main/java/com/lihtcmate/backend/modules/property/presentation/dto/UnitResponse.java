package com.lihtcmate.backend.modules.property.presentation.dto;

import java.util.UUID;

public record UnitResponse(
        UUID id,
        String unitNumber,
        Integer bedroomCount,
        Integer squareFootage
) {
}
