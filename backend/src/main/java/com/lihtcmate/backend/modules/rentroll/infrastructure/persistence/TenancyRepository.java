package com.lihtcmate.backend.modules.rentroll.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.lihtcmate.backend.modules.lease.domain.Lease;
import com.lihtcmate.backend.modules.rentroll.domain.Tenancy;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TenancyRepository extends JpaRepository<Tenancy, UUID> {

    @Query("""
            select l from Tenancy t
              join t.lease l
              join fetch l.unit u
             where t.rentRoll.id = :rentRollId
             order by u.unitNumber asc, l.createdAt asc
            """)
    List<Lease> findLeasesOnRentRoll(@Param("rentRollId") UUID rentRollId);

    boolean existsByLeaseIdAndRentRollId(UUID leaseId, UUID rentRollId);

    long countByRentRollId(UUID rentRollId);
}
