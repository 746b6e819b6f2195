package com.lihtcmate.backend.modules.lease.presentation.dto;

import java.math.BigDecimal;
import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

public record CreateFutureLeaseRequest(
        @NotBlank @Size(max = 255) String name,
        @DecimalMin("0.00") BigDecimal leaseRent,
        @NotEmpty List<@Valid ResidentInput> residents
) {

    public record ResidentInput(
            @NotBlank @Size(max = 255) String name
    ) {
    }
}
