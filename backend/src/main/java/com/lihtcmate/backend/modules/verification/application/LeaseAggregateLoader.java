package com.lihtcmate.backend.modules.verification.application;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import com.lihtcmate.backend.modules.lease.domain.Lease;
import com.lihtcmate.backend.modules.lease.domain.Resident;
import com.lihtcmate.backend.modules.lease.infrastructure.persistence.ResidentRepository;
import com.lihtcmate.backend.modules.verification.domain.IncomeDocument;
import com.lihtcmate.backend.modules.verification.domain.IncomeVerification;
import com.lihtcmate.backend.modules.verification.infrastructure.persistence.IncomeDocumentRepository;
import com.lihtcmate.backend.modules.verification.infrastructure.persistence.IncomeVerificationRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Loads residents, documents and verifications for many leases with three queries.
 */
@Component
@Transactional(readOnly = true)
public class LeaseAggregateLoader {

    private final ResidentRepository residentRepository;
    private final IncomeDocumentRepository incomeDocumentRepository;
    private final IncomeVerificationRepository incomeVerificationRepository;

    public LeaseAggregateLoader(
            ResidentRepository residentRepository,
            IncomeDocumentRepository incomeDocumentRepository,
            IncomeVerificationRepository incomeVerificationRepository
    ) {
        this.residentRepository = residentRepository;
        this.incomeDocumentRepository = incomeDocumentRepository;
        this.incomeVerificationRepository = incomeVerificationRepository;
    }

    public LeaseAggregate load(Lease lease) {
        return loadAll(List.of(lease)).get(lease.getId());
    }

    public Map<UUID, LeaseAggregate> loadAll(Collection<Lease> leases) {
        Map<UUID, LeaseAggregate> result = new LinkedHashMap<>();
        if (leases == null || leases.isEmpty()) {
            return result;
        }
        List<UUID> leaseIds = leases.stream().map(Lease::getId).distinct().toList();

        Map<UUID, List<Resident>> residentsByLease = residentRepository.findByLeaseIds(leaseIds).stream()
                .collect(Collectors.groupingBy(resident -> resident.getLease().getId()));

        List<UUID> residentIds = residentsByLease.values().stream()
                .flatMap(List::stream)
                .map(Resident::getId)
                .toList();
        Map<UUID, List<IncomeDocument>> documentsByLease = residentIds.isEmpty()
                ? Map.of()
                : incomeDocumentRepository.findByResidentIds(residentIds).stream()
                        .collect(Collectors.groupingBy(document -> document.getResident().getLease().getId()));

        Map<UUID, List<IncomeVerification>> verificationsByLease = incomeVerificationRepository.findByLeaseIds(leaseIds).stream()
                .collect(Collectors.groupingBy(verification -> verification.getLease().getId()));

        for (Lease lease : leases) {
            result.put(lease.getId(), new LeaseAggregate(
                    lease,
                    new ArrayList<>(residentsByLease.getOrDefault(lease.getId(), List.of())),
                    new ArrayList<>(documentsByLease.getOrDefault(lease.getId(), List.of())),
                    new ArrayList<>(verificationsByLease.getOrDefault(lease.getId(), List.of()))
            ));
        }
        return result;
    }
}
