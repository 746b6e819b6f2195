package com.lihtcmate.backend.modules.lease.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.lihtcmate.backend.modules.lease.domain.Resident;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ResidentRepository extends JpaRepository<Resident, UUID> {

    List<Resident> findByLeaseIdOrderByCreatedAtAsc(UUID leaseId);

    @Query("select r from Resident r join fetch r.lease l where l.id in :leaseIds order by r.createdAt asc")
    List<Resident> findByLeaseIds(@Param("leaseIds") Collection<UUID> leaseIds);
}
