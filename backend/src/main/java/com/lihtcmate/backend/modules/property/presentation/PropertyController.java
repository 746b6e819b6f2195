package com.lihtcmate.backend.modules.property.presentation;

import java.util.UUID;

import com.lihtcmate.backend.modules.property.application.PropertyService;
import com.lihtcmate.backend.modules.property.presentation.dto.CreatePropertyRequest;
import com.lihtcmate.backend.modules.property.presentation.dto.PropertyResponse;
import com.lihtcmate.backend.modules.property.presentation.dto.RegisterUnitsRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/properties")
@Tag(name = "Properties")
public class PropertyController {

    private final PropertyService propertyService;

    public PropertyController(PropertyService propertyService) {
        this.propertyService = propertyService;
    }

    @PostMapping
    public ResponseEntity<PropertyResponse> createProperty(@Valid @RequestBody CreatePropertyRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(propertyService.createProperty(request));
    }

    @GetMapping("/{propertyId}")
    public ResponseEntity<PropertyResponse> getProperty(@PathVariable UUID propertyId) {
        return ResponseEntity.ok(propertyService.getProperty(propertyId));
    }

    @Operation(summary = "Register units", description = "Once a property has units, rent-roll uploads may only reference registered unit numbers.")
    @PostMapping("/{propertyId}/units")
    public ResponseEntity<PropertyResponse> registerUnits(
            @PathVariable UUID propertyId,
            @Valid @RequestBody RegisterUnitsRequest request
    ) {
        return ResponseEntity.ok(propertyService.registerUnits(propertyId, request));
    }
}
