package com.lihtcmate.backend.modules.lease.application;

import static org.springframework.http.HttpStatus.NOT_FOUND;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.lihtcmate.backend.global.error.ProblemException;
import com.lihtcmate.backend.modules.lease.domain.Lease;
import com.lihtcmate.backend.modules.lease.domain.Resident;
import com.lihtcmate.backend.modules.lease.infrastructure.persistence.LeaseRepository;
import com.lihtcmate.backend.modules.lease.infrastructure.persistence.ResidentRepository;
import com.lihtcmate.backend.modules.lease.presentation.dto.CreateFutureLeaseRequest;
import com.lihtcmate.backend.modules.lease.presentation.dto.CreateFutureLeaseRequest.ResidentInput;
import com.lihtcmate.backend.modules.lease.presentation.dto.LeaseResponse;
import com.lihtcmate.backend.modules.property.domain.Unit;
import com.lihtcmate.backend.modules.property.infrastructure.persistence.UnitRepository;
import com.lihtcmate.backend.modules.rentroll.application.ActiveRentRoll;
import com.lihtcmate.backend.modules.rentroll.application.ActiveRentRollLocator;
import com.lihtcmate.backend.modules.rentroll.application.PropertyFinalizeLock;
import com.lihtcmate.backend.modules.rentroll.domain.RentRollSnapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Leases entered by hand ahead of a rent roll, such as an applicant household verified before move-in.
 * They carry no dates until an upload supplies them.
 */
@Service
@Transactional
public class FutureLeaseService {

    private static final Logger log = LoggerFactory.getLogger(FutureLeaseService.class);

    private final UnitRepository unitRepository;
    private final LeaseRepository leaseRepository;
    private final ResidentRepository residentRepository;
    private final ActiveRentRollLocator activeRentRollLocator;
    private final PropertyFinalizeLock propertyFinalizeLock;

    public FutureLeaseService(
            UnitRepository unitRepository,
            LeaseRepository leaseRepository,
            ResidentRepository residentRepository,
            ActiveRentRollLocator activeRentRollLocator,
            PropertyFinalizeLock propertyFinalizeLock
    ) {
        this.unitRepository = unitRepository;
        this.leaseRepository = leaseRepository;
        this.residentRepository = residentRepository;
        this.activeRentRollLocator = activeRentRollLocator;
        this.propertyFinalizeLock = propertyFinalizeLock;
    }

    public LeaseResponse createFutureLease(UUID unitId, CreateFutureLeaseRequest request) {
        Unit unit = unitRepository.findById(unitId)
                .orElseThrow(() -> problem(NOT_FOUND, "UNIT_NOT_FOUND", "Unit %s not found".formatted(unitId)));

        // a finalize must not swap the active snapshot between this read and the insert
        propertyFinalizeLock.acquire(unit.getProperty().getId());
        RentRollSnapshot snapshot = activeRentRollLocator.find(unit.getProperty().getId())
                .map(ActiveRentRoll::snapshot)
                .orElse(null);

        Lease lease = new Lease(unit, snapshot, request.name().trim());
        lease.setLeaseRent(request.leaseRent());
        leaseRepository.save(lease);

        List<Resident> residents = new ArrayList<>();
        for (ResidentInput input : request.residents()) {
            residents.add(residentRepository.save(new Resident(lease, input.name().trim(), null)));
        }

        log.info("Future lease {} created on unit {} ({} residents)", lease.getId(), unit.getUnitNumber(), residents.size());
        return toResponse(lease, residents);
    }

    static LeaseResponse toResponse(Lease lease, List<Resident> residents) {
        return new LeaseResponse(
                lease.getId(),
                lease.getUnit().getId(),
                lease.getSnapshot() != null ? lease.getSnapshot().getId() : null,
                lease.getName(),
                lease.getLeaseStartDate(),
                lease.getLeaseEndDate(),
                lease.getLeaseRent(),
                residents.stream()
                        .map(resident -> new LeaseResponse.ResidentSummary(
                                resident.getId(),
                                resident.getName(),
                                resident.getAnnualizedIncome(),
                                resident.isIncomeFinalized()))
                        .toList()
        );
    }

    private ProblemException problem(HttpStatus status, String code, String detail) {
        return new ProblemException(status, code, detail);
    }
}
