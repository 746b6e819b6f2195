package com.lihtcmate.backend.modules.property.presentation.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

public record RegisterUnitsRequest(
        @NotEmpty List<@Valid UnitInput> units
) {

    public record UnitInput(
            @NotBlank @Size(max = 50) String unitNumber,
            @Min(0) Integer bedroomCount,
            @Min(0) Integer squareFootage
    ) {
    }
}
