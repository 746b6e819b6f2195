package com.lihtcmate.backend.modules.property.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.lihtcmate.backend.modules.property.domain.Unit;

import org.springframework.data.jpa.repository.JpaRepository;

public interface UnitRepository extends JpaRepository<Unit, UUID> {

    List<Unit> findByPropertyIdOrderByUnitNumberAsc(UUID propertyId);

    Optional<Unit> findByPropertyIdAndUnitNumber(UUID propertyId, String unitNumber);
}
