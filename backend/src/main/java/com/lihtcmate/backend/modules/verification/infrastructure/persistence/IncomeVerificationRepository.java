package com.lihtcmate.backend.modules.verification.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.lihtcmate.backend.modules.verification.domain.IncomeVerification;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface IncomeVerificationRepository extends JpaRepository<IncomeVerification, UUID> {

    List<IncomeVerification> findByLeaseIdOrderByCreatedAtAsc(UUID leaseId);

    Optional<IncomeVerification> findFirstByLeaseIdOrderByCreatedAtDesc(UUID leaseId);

    @Query("select v from IncomeVerification v join fetch v.lease l where l.id in :leaseIds order by v.createdAt asc")
    List<IncomeVerification> findByLeaseIds(@Param("leaseIds") Collection<UUID> leaseIds);
}
