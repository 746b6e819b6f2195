package com.lihtcmate.backend.modules.rentroll.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.lihtcmate.backend.modules.rentroll.domain.RentRollSnapshot;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RentRollSnapshotRepository extends JpaRepository<RentRollSnapshot, UUID> {

    Optional<RentRollSnapshot> findFirstByPropertyIdAndActiveTrue(UUID propertyId);

    long countByPropertyIdAndActiveTrue(UUID propertyId);

    List<RentRollSnapshot> findByPropertyIdOrderByCreatedAtDesc(UUID propertyId);

    @Modifying(flushAutomatically = true)
    @Query("update RentRollSnapshot s set s.active = false where s.property.id = :propertyId and s.active = true")
    int deactivateAll(@Param("propertyId") UUID propertyId);

    @Query("""
            select s from RentRollSnapshot s
              join fetch s.property p
             where s.active = true
               and s.hudDataYear is null
             order by s.createdAt asc
            """)
    List<RentRollSnapshot> findActiveWithoutHudData();

    @Query("""
            select s from RentRollSnapshot s
              join fetch s.property
             where s.id = :snapshotId
            """)
    Optional<RentRollSnapshot> findWithPropertyById(@Param("snapshotId") UUID snapshotId);
}
