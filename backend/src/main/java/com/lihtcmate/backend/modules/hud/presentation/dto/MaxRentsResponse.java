package com.lihtcmate.backend.modules.hud.presentation.dto;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

public record MaxRentsResponse(
        UUID propertyId,
        int requestedYear,
        int actualYear,
        boolean usedFallback,
        String regime,
        Map<String, Map<String, BigDecimal>> lihtcMaxRents
) {
}
