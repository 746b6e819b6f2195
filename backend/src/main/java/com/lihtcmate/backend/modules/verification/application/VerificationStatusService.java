package com.lihtcmate.backend.modules.verification.application;

import static org.springframework.http.HttpStatus.NOT_FOUND;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import com.lihtcmate.backend.global.error.ProblemException;
import com.lihtcmate.backend.modules.lease.domain.Lease;
import com.lihtcmate.backend.modules.lease.domain.LeaseTiming;
import com.lihtcmate.backend.modules.lease.infrastructure.persistence.LeaseRepository;
import com.lihtcmate.backend.modules.property.domain.Unit;
import com.lihtcmate.backend.modules.property.infrastructure.persistence.PropertyRepository;
import com.lihtcmate.backend.modules.property.infrastructure.persistence.UnitRepository;
import com.lihtcmate.backend.modules.rentroll.application.ActiveRentRoll;
import com.lihtcmate.backend.modules.rentroll.application.ActiveRentRollLocator;
import com.lihtcmate.backend.modules.rentroll.infrastructure.persistence.TenancyRepository;
import com.lihtcmate.backend.modules.verification.domain.LeaseVerificationStatus;
import com.lihtcmate.backend.modules.verification.presentation.dto.LeaseStatusResponse;
import com.lihtcmate.backend.modules.verification.presentation.dto.PropertyVerificationSummaryResponse;
import com.lihtcmate.backend.modules.verification.presentation.dto.UnitStatusResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-only status projections for dashboards and reports. Nothing here is persisted; every call
 * re-derives the status from stored residents, documents and tenancies.
 */
@Service
@Transactional(readOnly = true)
public class VerificationStatusService {

    private static final Comparator<Lease> NEWEST_FIRST = Comparator
            .comparing(Lease::getLeaseStartDate, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Lease::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .reversed();

    private final LeaseRepository leaseRepository;
    private final UnitRepository unitRepository;
    private final PropertyRepository propertyRepository;
    private final TenancyRepository tenancyRepository;
    private final ActiveRentRollLocator activeRentRollLocator;
    private final LeaseAggregateLoader leaseAggregateLoader;

    public VerificationStatusService(
            LeaseRepository leaseRepository,
            UnitRepository unitRepository,
            PropertyRepository propertyRepository,
            TenancyRepository tenancyRepository,
            ActiveRentRollLocator activeRentRollLocator,
            LeaseAggregateLoader leaseAggregateLoader
    ) {
        this.leaseRepository = leaseRepository;
        this.unitRepository = unitRepository;
        this.propertyRepository = propertyRepository;
        this.tenancyRepository = tenancyRepository;
        this.activeRentRollLocator = activeRentRollLocator;
        this.leaseAggregateLoader = leaseAggregateLoader;
    }

    public LeaseStatusResponse getLeaseVerificationStatus(UUID leaseId) {
        Lease lease = leaseRepository.findById(leaseId)
                .orElseThrow(() -> new ProblemException(NOT_FOUND, "LEASE_NOT_FOUND", "Lease %s not found".formatted(leaseId)));
        Optional<ActiveRentRoll> activeRoll = activeRentRollLocator.find(lease.getUnit().getProperty().getId());
        LeaseTiming timing = activeRoll
                .map(roll -> LeaseTiming.of(
                        tenancyRepository.existsByLeaseIdAndRentRollId(lease.getId(), roll.rentRoll().getId()),
                        lease.getLeaseStartDate(),
                        roll.asOfDate()))
                .orElse(LeaseTiming.FUTURE);
        return toLeaseStatus(leaseAggregateLoader.load(lease), timing);
    }

    public UnitStatusResponse getUnitVerificationStatus(UUID unitId) {
        Unit unit = unitRepository.findById(unitId)
                .orElseThrow(() -> new ProblemException(NOT_FOUND, "UNIT_NOT_FOUND", "Unit %s not found".formatted(unitId)));
        UUID propertyId = unit.getProperty().getId();
        UnitLeases unitLeases = UnitLeases.load(propertyId, activeRentRollLocator.find(propertyId), leaseRepository, tenancyRepository);
        return toUnitStatus(unit, unitLeases.representativeLease(unit.getId()));
    }

    public PropertyVerificationSummaryResponse getPropertySummary(UUID propertyId) {
        if (!propertyRepository.existsById(propertyId)) {
            throw new ProblemException(NOT_FOUND, "PROPERTY_NOT_FOUND", "Property %s not found".formatted(propertyId));
        }
        Optional<ActiveRentRoll> activeRoll = activeRentRollLocator.find(propertyId);
        UnitLeases unitLeases = UnitLeases.load(propertyId, activeRoll, leaseRepository, tenancyRepository);
        List<Unit> units = unitRepository.findByPropertyIdOrderByUnitNumberAsc(propertyId);

        List<Lease> representatives = units.stream()
                .map(unit -> unitLeases.representativeLease(unit.getId()))
                .flatMap(Optional::stream)
                .toList();
        Map<UUID, LeaseAggregate> aggregates = leaseAggregateLoader.loadAll(representatives);

        List<UnitStatusResponse> unitStatuses = units.stream()
                .map(unit -> unitLeases.representativeLease(unit.getId())
                        .map(lease -> unitStatus(unit, lease.getId(), aggregates.get(lease.getId()).status()))
                        .orElseGet(() -> unitStatus(unit, null, LeaseVerificationStatus.VACANT)))
                .toList();

        Map<LeaseVerificationStatus, Long> counts = new EnumMap<>(LeaseVerificationStatus.class);
        for (LeaseVerificationStatus status : LeaseVerificationStatus.values()) {
            counts.put(status, 0L);
        }
        unitStatuses.forEach(status -> counts.merge(status.status(), 1L, Long::sum));

        return new PropertyVerificationSummaryResponse(
                propertyId,
                activeRoll.map(roll -> roll.snapshot().getId()).orElse(null),
                units.size(),
                counts,
                unitStatuses
        );
    }

    private UnitStatusResponse toUnitStatus(Unit unit, Optional<Lease> lease) {
        return lease
                .map(value -> unitStatus(unit, value.getId(), leaseAggregateLoader.load(value).status()))
                .orElseGet(() -> unitStatus(unit, null, LeaseVerificationStatus.VACANT));
    }

    private UnitStatusResponse unitStatus(Unit unit, UUID leaseId, LeaseVerificationStatus status) {
        return new UnitStatusResponse(unit.getId(), unit.getUnitNumber(), leaseId, status, status.getLabel());
    }

    private LeaseStatusResponse toLeaseStatus(LeaseAggregate aggregate, LeaseTiming timing) {
        Lease lease = aggregate.lease();
        LeaseVerificationStatus status = aggregate.status();
        return new LeaseStatusResponse(
                lease.getId(),
                lease.getUnit().getId(),
                lease.getUnit().getUnitNumber(),
                lease.getName(),
                timing,
                status,
                status.getLabel(),
                aggregate.residents().size(),
                aggregate.declaredIncome(),
                aggregate.verifiedIncome()
        );
    }

    /**
     * Current and future leases of a property in the active snapshot's scope, grouped by unit.
     */
    private record UnitLeases(Map<UUID, List<Lease>> currentByUnit, Map<UUID, List<Lease>> futureByUnit) {

        static UnitLeases load(
                UUID propertyId,
                Optional<ActiveRentRoll> activeRoll,
                LeaseRepository leaseRepository,
                TenancyRepository tenancyRepository
        ) {
            Map<UUID, List<Lease>> current = activeRoll
                    .map(roll -> tenancyRepository.findLeasesOnRentRoll(roll.rentRoll().getId()).stream()
                            .filter(lease -> LeaseTiming.of(true, lease.getLeaseStartDate(), roll.asOfDate()) == LeaseTiming.CURRENT)
                            .collect(Collectors.groupingBy(lease -> lease.getUnit().getId())))
                    .orElse(Map.of());
            Set<UUID> currentIds = current.values().stream()
                    .flatMap(List::stream)
                    .map(Lease::getId)
                    .collect(Collectors.toSet());
            UUID snapshotId = activeRoll.map(roll -> roll.snapshot().getId()).orElse(null);
            Map<UUID, List<Lease>> future = leaseRepository.findFutureLeases(propertyId, snapshotId).stream()
                    .filter(lease -> !currentIds.contains(lease.getId()))
                    .collect(Collectors.groupingBy(lease -> lease.getUnit().getId()));
            return new UnitLeases(current, future);
        }

        Optional<Lease> representativeLease(UUID unitId) {
            Optional<Lease> current = currentByUnit.getOrDefault(unitId, List.of()).stream().sorted(NEWEST_FIRST).findFirst();
            if (current.isPresent()) {
                return current;
            }
            return futureByUnit.getOrDefault(unitId, List.of()).stream().sorted(NEWEST_FIRST).findFirst();
        }
    }
}
