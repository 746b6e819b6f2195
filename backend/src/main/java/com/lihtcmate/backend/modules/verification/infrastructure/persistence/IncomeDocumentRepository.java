package com.lihtcmate.backend.modules.verification.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.lihtcmate.backend.modules.verification.domain.DocumentStatus;
import com.lihtcmate.backend.modules.verification.domain.IncomeDocument;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface IncomeDocumentRepository extends JpaRepository<IncomeDocument, UUID> {

    @Query("select d from IncomeDocument d join fetch d.resident r where r.id in :residentIds order by d.createdAt asc")
    List<IncomeDocument> findByResidentIds(@Param("residentIds") Collection<UUID> residentIds);

    List<IncomeDocument> findByResidentIdAndStatusOrderByCreatedAtAsc(UUID residentId, DocumentStatus status);
}
