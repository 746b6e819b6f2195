package com.lihtcmate.backend.modules.rentroll.application;

import static org.springframework.http.HttpStatus.CONFLICT;
import static org.springframework.http.HttpStatus.NOT_FOUND;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.lihtcmate.backend.global.error.ProblemException;
import com.lihtcmate.backend.modules.lease.domain.Lease;
import com.lihtcmate.backend.modules.lease.domain.Resident;
import com.lihtcmate.backend.modules.lease.infrastructure.persistence.ResidentRepository;
import com.lihtcmate.backend.modules.rentroll.domain.DiscrepancyResolution;
import com.lihtcmate.backend.modules.rentroll.infrastructure.persistence.TenancyRepository;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.DiscrepancyResolutionResponse;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.ResolveDiscrepancyRequest;
import com.lihtcmate.backend.modules.verification.application.LeaseAggregateLoader;
import com.lihtcmate.backend.modules.verification.domain.IncomeVerification;
import com.lihtcmate.backend.modules.verification.infrastructure.persistence.IncomeVerificationRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Settles a reported income discrepancy. Only leases of the active snapshot are changed; earlier
 * snapshots stay as they were recorded.
 */
@Service
@Transactional
public class DiscrepancyResolutionService {

    private static final Logger log = LoggerFactory.getLogger(DiscrepancyResolutionService.class);

    private final PropertyFinalizeLock propertyFinalizeLock;
    private final ActiveRentRollLocator activeRentRollLocator;
    private final ResidentRepository residentRepository;
    private final IncomeVerificationRepository incomeVerificationRepository;
    private final TenancyRepository tenancyRepository;
    private final LeaseAggregateLoader leaseAggregateLoader;
    private final Clock clock;

    public DiscrepancyResolutionService(
            PropertyFinalizeLock propertyFinalizeLock,
            ActiveRentRollLocator activeRentRollLocator,
            ResidentRepository residentRepository,
            IncomeVerificationRepository incomeVerificationRepository,
            TenancyRepository tenancyRepository,
            LeaseAggregateLoader leaseAggregateLoader,
            Clock clock
    ) {
        this.propertyFinalizeLock = propertyFinalizeLock;
        this.activeRentRollLocator = activeRentRollLocator;
        this.residentRepository = residentRepository;
        this.incomeVerificationRepository = incomeVerificationRepository;
        this.tenancyRepository = tenancyRepository;
        this.leaseAggregateLoader = leaseAggregateLoader;
        this.clock = clock;
    }

    public DiscrepancyResolutionResponse resolveDiscrepancy(UUID propertyId, ResolveDiscrepancyRequest request) {
        propertyFinalizeLock.acquire(propertyId);
        ActiveRentRoll active = activeRentRollLocator.find(propertyId)
                .orElseThrow(() -> problem(CONFLICT, "NO_ACTIVE_SNAPSHOT", "Property %s has no finalized rent roll".formatted(propertyId)));
        Resident newResident = loadResident(propertyId, request.newResidentId());
        Resident existingResident = loadResident(propertyId, request.existingResidentId());

        Resident updated;
        if (request.resolution() == DiscrepancyResolution.ACCEPT_VERIFIED) {
            if (!existingResident.isIncomeFinalized() || existingResident.getCalculatedAnnualizedIncome() == null) {
                throw problem(CONFLICT, "RESIDENT_NOT_VERIFIED", "Resident %s has no verified income to accept".formatted(existingResident.getId()));
            }
            requireActiveScope(newResident.getLease(), active);
            newResident.finalizeIncome(existingResident.getCalculatedAnnualizedIncome(), OffsetDateTime.now(clock));
            updated = newResident;
        } else {
            Lease existingLease = existingResident.getLease();
            requireActiveScope(existingLease, active);
            existingResident.unfinalize();
            incomeVerificationRepository.findByLeaseIdOrderByCreatedAtAsc(existingLease.getId())
                    .forEach(IncomeVerification::reopen);
            updated = existingResident;
        }

        log.info("Income discrepancy resolved with {}: newResident={} existingResident={}",
                request.resolution(), newResident.getId(), existingResident.getId());
        Lease lease = updated.getLease();
        return new DiscrepancyResolutionResponse(
                request.resolution(),
                updated.getId(),
                lease.getId(),
                updated.getCalculatedAnnualizedIncome(),
                leaseAggregateLoader.load(lease).status()
        );
    }

    private void requireActiveScope(Lease lease, ActiveRentRoll active) {
        boolean createdInActive = lease.getSnapshot() != null && lease.getSnapshot().getId().equals(active.snapshot().getId());
        if (createdInActive || tenancyRepository.existsByLeaseIdAndRentRollId(lease.getId(), active.rentRoll().getId())) {
            return;
        }
        throw problem(CONFLICT, "HISTORICAL_LEASE_IMMUTABLE", "Lease %s belongs to a superseded rent roll".formatted(lease.getId()));
    }

    private Resident loadResident(UUID propertyId, UUID residentId) {
        return residentRepository.findById(residentId)
                .filter(resident -> resident.getLease().getUnit().getProperty().getId().equals(propertyId))
                .orElseThrow(() -> problem(NOT_FOUND, "RESIDENT_NOT_FOUND", "Resident %s not found on property %s".formatted(residentId, propertyId)));
    }

    private ProblemException problem(HttpStatus status, String code, String detail) {
        return new ProblemException(status, code, detail);
    }
}
