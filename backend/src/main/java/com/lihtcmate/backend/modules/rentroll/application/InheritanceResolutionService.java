package com.lihtcmate.backend.modules.rentroll.application;

import static org.springframework.http.HttpStatus.CONFLICT;
import static org.springframework.http.HttpStatus.NOT_FOUND;
import static org.springframework.http.HttpStatus.UNPROCESSABLE_ENTITY;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

import com.lihtcmate.backend.global.error.ProblemException;
import com.lihtcmate.backend.modules.lease.domain.Lease;
import com.lihtcmate.backend.modules.lease.domain.Resident;
import com.lihtcmate.backend.modules.lease.infrastructure.persistence.LeaseRepository;
import com.lihtcmate.backend.modules.lease.infrastructure.persistence.ResidentRepository;
import com.lihtcmate.backend.modules.property.domain.Unit;
import com.lihtcmate.backend.modules.property.infrastructure.persistence.UnitRepository;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.InheritanceResolutionResponse;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.InheritanceResolutionResponse.UnitResolution;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.ResolveInheritanceRequest;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.ResolveInheritanceRequest.Decision;
import com.lihtcmate.backend.modules.verification.domain.IncomeDocument;
import com.lihtcmate.backend.modules.verification.domain.IncomeVerification;
import com.lihtcmate.backend.modules.verification.domain.VerificationReason;
import com.lihtcmate.backend.modules.verification.infrastructure.persistence.IncomeDocumentRepository;
import com.lihtcmate.backend.modules.verification.infrastructure.persistence.IncomeVerificationRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Applies the caller's answers to the inheritance prompts of the last finalize. An accepted prompt
 * inherits onto the lease the prompt named. Either way the carried-forward future lease is marked
 * processed so it is not copied again.
 */
@Service
@Transactional
public class InheritanceResolutionService {

    private static final Logger log = LoggerFactory.getLogger(InheritanceResolutionService.class);

    private final PropertyFinalizeLock propertyFinalizeLock;
    private final ActiveRentRollLocator activeRentRollLocator;
    private final UnitRepository unitRepository;
    private final LeaseRepository leaseRepository;
    private final ResidentRepository residentRepository;
    private final IncomeVerificationRepository incomeVerificationRepository;
    private final IncomeDocumentRepository incomeDocumentRepository;
    private final Clock clock;

    public InheritanceResolutionService(
            PropertyFinalizeLock propertyFinalizeLock,
            ActiveRentRollLocator activeRentRollLocator,
            UnitRepository unitRepository,
            LeaseRepository leaseRepository,
            ResidentRepository residentRepository,
            IncomeVerificationRepository incomeVerificationRepository,
            IncomeDocumentRepository incomeDocumentRepository,
            Clock clock
    ) {
        this.propertyFinalizeLock = propertyFinalizeLock;
        this.activeRentRollLocator = activeRentRollLocator;
        this.unitRepository = unitRepository;
        this.leaseRepository = leaseRepository;
        this.residentRepository = residentRepository;
        this.incomeVerificationRepository = incomeVerificationRepository;
        this.incomeDocumentRepository = incomeDocumentRepository;
        this.clock = clock;
    }

    public InheritanceResolutionResponse resolveInheritance(UUID propertyId, ResolveInheritanceRequest request) {
        propertyFinalizeLock.acquire(propertyId);
        ActiveRentRoll active = activeRentRollLocator.find(propertyId)
                .orElseThrow(() -> problem(CONFLICT, "NO_ACTIVE_SNAPSHOT", "Property %s has no finalized rent roll".formatted(propertyId)));
        UUID snapshotId = active.snapshot().getId();
        List<Lease> pending = leaseRepository.findFutureLeases(propertyId, snapshotId);

        List<UnitResolution> results = new ArrayList<>();
        new TreeMap<>(request.decisions()).forEach((rawUnitNumber, decision) -> {
            String unitNumber = rawUnitNumber.trim();
            Unit unit = unitRepository.findByPropertyIdAndUnitNumber(propertyId, unitNumber)
                    .orElseThrow(() -> problem(NOT_FOUND, "UNIT_NOT_FOUND", "Unit %s not found on property %s".formatted(unitNumber, propertyId)));
            Lease futureLease = verifiedFutureLease(unit, pending)
                    .orElseThrow(() -> problem(CONFLICT, "NO_PENDING_INHERITANCE", "Unit %s has no verified future lease awaiting a decision".formatted(unitNumber)));

            UnitResolution resolution = Boolean.TRUE.equals(decision.inherit())
                    ? inherit(unitNumber, unit, futureLease, targetLeaseId(unitNumber, decision), snapshotId)
                    : new UnitResolution(unitNumber, false, futureLease.getId(), null, 0, 0);
            futureLease.markProcessed();
            results.add(resolution);
        });

        log.info("Inheritance resolved for property {}: {} unit(s), {} inherited",
                propertyId, results.size(), results.stream().filter(UnitResolution::inherited).count());
        return new InheritanceResolutionResponse(results);
    }

    private UUID targetLeaseId(String unitNumber, Decision decision) {
        if (decision.newLeaseId() == null) {
            throw problem(UNPROCESSABLE_ENTITY, "NEW_LEASE_REQUIRED", "Unit %s: newLeaseId is required to inherit".formatted(unitNumber));
        }
        return decision.newLeaseId();
    }

    private UnitResolution inherit(String unitNumber, Unit unit, Lease futureLease, UUID targetLeaseId, UUID snapshotId) {
        Lease target = leaseRepository.findActiveScopeLeasesForUnit(unit.getId(), snapshotId).stream()
                .filter(lease -> lease.getId().equals(targetLeaseId) && !lease.getId().equals(futureLease.getId()))
                .findFirst()
                .orElseThrow(() -> problem(CONFLICT, "INHERITANCE_TARGET_NOT_FOUND",
                        "Lease %s is not a lease of unit %s in the active rent roll".formatted(targetLeaseId, unitNumber)));
        OffsetDateTime now = OffsetDateTime.now(clock);

        List<Resident> targetResidents = residentRepository.findByLeaseIdOrderByCreatedAtAsc(target.getId());
        Map<String, Resident> targetsByName = new LinkedHashMap<>();
        targetResidents.forEach(resident -> targetsByName.putIfAbsent(resident.nameKey(), resident));

        IncomeVerification verification = incomeVerificationRepository.save(new IncomeVerification(target, VerificationReason.LEASE_RENEWAL));
        int residentsInherited = 0;
        List<IncomeDocument> references = new ArrayList<>();
        for (Resident source : residentRepository.findByLeaseIdOrderByCreatedAtAsc(futureLease.getId())) {
            Resident destination = targetsByName.get(source.nameKey());
            if (destination == null || !source.isFinalized()) {
                continue;
            }
            destination.inheritVerification(source, now);
            residentsInherited++;
            for (IncomeDocument document : incomeDocumentRepository.findByResidentIds(List.of(source.getId()))) {
                references.add(document.referenceFor(destination, verification));
            }
        }
        incomeDocumentRepository.saveAll(references);

        BigDecimal total = targetResidents.stream()
                .map(Resident::verifiedIncome)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        verification.finalizeWith(total, now);

        log.info("Unit {} lease {} inherited verified income {} from future lease {}", unitNumber, target.getId(), total, futureLease.getId());
        return new UnitResolution(unitNumber, true, futureLease.getId(), target.getId(), residentsInherited, references.size());
    }

    private Optional<Lease> verifiedFutureLease(Unit unit, List<Lease> pending) {
        return pending.stream()
                .filter(lease -> lease.getUnit().getId().equals(unit.getId()))
                .filter(lease -> incomeVerificationRepository.findByLeaseIdOrderByCreatedAtAsc(lease.getId()).stream()
                        .anyMatch(IncomeVerification::isFinalized))
                .findFirst();
    }

    private ProblemException problem(HttpStatus status, String code, String detail) {
        return new ProblemException(status, code, detail);
    }
}
