package com.lihtcmate.backend.modules.property.application;

import static org.springframework.http.HttpStatus.CONFLICT;
import static org.springframework.http.HttpStatus.NOT_FOUND;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.lihtcmate.backend.global.error.ProblemException;
import com.lihtcmate.backend.modules.property.domain.Property;
import com.lihtcmate.backend.modules.property.domain.Unit;
import com.lihtcmate.backend.modules.property.infrastructure.persistence.PropertyRepository;
import com.lihtcmate.backend.modules.property.infrastructure.persistence.UnitRepository;
import com.lihtcmate.backend.modules.property.presentation.dto.CreatePropertyRequest;
import com.lihtcmate.backend.modules.property.presentation.dto.PropertyResponse;
import com.lihtcmate.backend.modules.property.presentation.dto.RegisterUnitsRequest;
import com.lihtcmate.backend.modules.property.presentation.dto.RegisterUnitsRequest.UnitInput;
import com.lihtcmate.backend.modules.property.presentation.dto.UnitResponse;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class PropertyService {

    private final PropertyRepository propertyRepository;
    private final UnitRepository unitRepository;

    public PropertyService(PropertyRepository propertyRepository, UnitRepository unitRepository) {
        this.propertyRepository = propertyRepository;
        this.unitRepository = unitRepository;
    }

    public PropertyResponse createProperty(CreatePropertyRequest request) {
        Property property = new Property();
        property.setName(request.name().trim());
        property.setCounty(request.county().trim());
        property.setState(request.state().trim());
        property.setComplianceOption(request.complianceOption());
        property.setPlacedInServiceDate(request.placedInServiceDate());
        propertyRepository.save(property);
        return toResponse(property, List.of());
    }

    @Transactional(readOnly = true)
    public PropertyResponse getProperty(UUID propertyId) {
        Property property = loadProperty(propertyId);
        return toResponse(property, unitRepository.findByPropertyIdOrderByUnitNumberAsc(propertyId));
    }

    public PropertyResponse registerUnits(UUID propertyId, RegisterUnitsRequest request) {
        Property property = loadProperty(propertyId);
        Set<String> existing = new HashSet<>();
        unitRepository.findByPropertyIdOrderByUnitNumberAsc(propertyId)
                .forEach(unit -> existing.add(unit.getUnitNumber()));

        for (UnitInput input : request.units()) {
            String unitNumber = input.unitNumber().trim();
            if (!existing.add(unitNumber)) {
                throw problem(CONFLICT, "UNIT_ALREADY_EXISTS", "Unit %s already exists on property %s".formatted(unitNumber, propertyId));
            }
            Unit unit = new Unit(property, unitNumber);
            unit.setBedroomCount(input.bedroomCount());
            unit.setSquareFootage(input.squareFootage());
            unitRepository.save(unit);
        }
        return toResponse(property, unitRepository.findByPropertyIdOrderByUnitNumberAsc(propertyId));
    }

    @Transactional(readOnly = true)
    public Property loadProperty(UUID propertyId) {
        return propertyRepository.findById(propertyId)
                .orElseThrow(() -> problem(NOT_FOUND, "PROPERTY_NOT_FOUND", "Property %s not found".formatted(propertyId)));
    }

    private PropertyResponse toResponse(Property property, List<Unit> units) {
        return new PropertyResponse(
                property.getId(),
                property.getName(),
                property.getCounty(),
                property.getState(),
                property.effectiveComplianceOption(),
                property.getPlacedInServiceDate(),
                units.stream()
                        .map(unit -> new UnitResponse(unit.getId(), unit.getUnitNumber(), unit.getBedroomCount(), unit.getSquareFootage()))
                        .toList()
        );
    }

    private ProblemException problem(HttpStatus status, String code, String detail) {
        return new ProblemException(status, code, detail);
    }
}
