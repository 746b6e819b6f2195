package com.lihtcmate.backend.modules.hud.presentation.dto;

import java.math.BigDecimal;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LeaseAmiBucketResponse(
        UUID leaseId,
        String leaseName,
        int householdSize,
        BigDecimal totalVerifiedIncome,
        String amiBucket,
        Integer hudDataYear,
        String regime,
        String propertyLocation
) {
}
