package com.lihtcmate.backend.modules.rentroll.application;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

import com.lihtcmate.backend.modules.lease.domain.Lease;
import com.lihtcmate.backend.modules.lease.domain.LeaseTiming;
import com.lihtcmate.backend.modules.lease.domain.Resident;
import com.lihtcmate.backend.modules.lease.infrastructure.persistence.LeaseRepository;
import com.lihtcmate.backend.modules.lease.infrastructure.persistence.ResidentRepository;
import com.lihtcmate.backend.modules.property.domain.Property;
import com.lihtcmate.backend.modules.property.domain.Unit;
import com.lihtcmate.backend.modules.property.infrastructure.persistence.UnitRepository;
import com.lihtcmate.backend.modules.rentroll.domain.RentRoll;
import com.lihtcmate.backend.modules.rentroll.domain.RentRollSnapshot;
import com.lihtcmate.backend.modules.rentroll.domain.Tenancy;
import com.lihtcmate.backend.modules.rentroll.infrastructure.persistence.RentRollRepository;
import com.lihtcmate.backend.modules.rentroll.infrastructure.persistence.RentRollSnapshotRepository;
import com.lihtcmate.backend.modules.rentroll.infrastructure.persistence.TenancyRepository;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.FinalizeComplianceRequest;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.FinalizeComplianceRequest.LeaseRow;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.FinalizeComplianceRequest.ResidentRow;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.FinalizeComplianceResponse;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.FinalizeComplianceResponse.FutureLeaseMatch;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.FinalizeComplianceResponse.IncomeDiscrepancy;
import com.lihtcmate.backend.modules.verification.domain.IncomeDocument;
import com.lihtcmate.backend.modules.verification.domain.IncomeVerification;
import com.lihtcmate.backend.modules.verification.infrastructure.persistence.IncomeDocumentRepository;
import com.lihtcmate.backend.modules.verification.infrastructure.persistence.IncomeVerificationRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns one rent-roll upload into a new active snapshot for the property.
 * <p>
 * Within one transaction, under the property row lock:
 * <ol>
 *     <li>collect the future leases of the active snapshot and the current lease of each unit on its rent roll;</li>
 *     <li>deactivate the old snapshot and create the new snapshot with its rent roll;</li>
 *     <li>copy every future lease graph into the new snapshot;</li>
 *     <li>ingest the uploaded rows, continuing a unit's current lease when the row repeats its dates and
 *     household;</li>
 *     <li>report verified future leases that need an inheritance decision and declared incomes that
 *     disagree with verified ones.</li>
 * </ol>
 * HUD limits for the snapshot are fetched after commit by listeners of {@link SnapshotFinalizedEvent}.
 */
@Service
@Transactional
public class ComplianceFinalizeService {

    private static final Logger log = LoggerFactory.getLogger(ComplianceFinalizeService.class);

    static final int FINALIZE_TIMEOUT_SECONDS = 60;

    private final PropertyFinalizeLock propertyFinalizeLock;
    private final UnitRepository unitRepository;
    private final LeaseRepository leaseRepository;
    private final ResidentRepository residentRepository;
    private final IncomeVerificationRepository incomeVerificationRepository;
    private final IncomeDocumentRepository incomeDocumentRepository;
    private final RentRollSnapshotRepository snapshotRepository;
    private final RentRollRepository rentRollRepository;
    private final TenancyRepository tenancyRepository;
    private final ActiveRentRollLocator activeRentRollLocator;
    private final RentRollUploadValidator uploadValidator;
    private final LeaseGraphCloner leaseGraphCloner;
    private final ApplicationEventPublisher eventPublisher;

    public ComplianceFinalizeService(
            PropertyFinalizeLock propertyFinalizeLock,
            UnitRepository unitRepository,
            LeaseRepository leaseRepository,
            ResidentRepository residentRepository,
            IncomeVerificationRepository incomeVerificationRepository,
            IncomeDocumentRepository incomeDocumentRepository,
            RentRollSnapshotRepository snapshotRepository,
            RentRollRepository rentRollRepository,
            TenancyRepository tenancyRepository,
            ActiveRentRollLocator activeRentRollLocator,
            RentRollUploadValidator uploadValidator,
            LeaseGraphCloner leaseGraphCloner,
            ApplicationEventPublisher eventPublisher
    ) {
        this.propertyFinalizeLock = propertyFinalizeLock;
        this.unitRepository = unitRepository;
        this.leaseRepository = leaseRepository;
        this.residentRepository = residentRepository;
        this.incomeVerificationRepository = incomeVerificationRepository;
        this.incomeDocumentRepository = incomeDocumentRepository;
        this.snapshotRepository = snapshotRepository;
        this.rentRollRepository = rentRollRepository;
        this.tenancyRepository = tenancyRepository;
        this.activeRentRollLocator = activeRentRollLocator;
        this.uploadValidator = uploadValidator;
        this.leaseGraphCloner = leaseGraphCloner;
        this.eventPublisher = eventPublisher;
    }

    @Transactional(timeout = FINALIZE_TIMEOUT_SECONDS)
    public FinalizeComplianceResponse finalizeComplianceUpload(UUID propertyId, FinalizeComplianceRequest request) {
        Property property = propertyFinalizeLock.acquire(propertyId);
        LocalDate rentRollDate = request.rentRollDate();

        Map<String, Unit> units = new HashMap<>();
        unitRepository.findByPropertyIdOrderByUnitNumberAsc(propertyId)
                .forEach(unit -> units.put(unit.getUnitNumber(), unit));
        uploadValidator.validate(request.unitGroups(), units.keySet());

        Optional<ActiveRentRoll> prior = activeRentRollLocator.find(propertyId);
        List<Lease> futureLeases = leaseRepository.findFutureLeases(propertyId, prior.map(active -> active.snapshot().getId()).orElse(null));
        Map<UUID, Lease> priorCurrentByUnit = prior.map(this::currentLeasesByUnit).orElseGet(Map::of);

        List<Lease> graphRoots = new ArrayList<>(futureLeases);
        graphRoots.addAll(priorCurrentByUnit.values());
        LeaseGraphs graphs = loadGraphs(graphRoots);

        snapshotRepository.deactivateAll(propertyId);
        RentRollSnapshot snapshot = snapshotRepository.save(new RentRollSnapshot(property, filenameOf(request), rentRollDate));
        RentRoll rentRoll = rentRollRepository.save(new RentRoll(snapshot));

        Map<UUID, List<LeaseGraphCopy>> preservedByUnit = new HashMap<>();
        for (Lease futureLease : futureLeases) {
            LeaseGraphCopy copy = leaseGraphCloner.cloneLeaseGraph(
                    futureLease,
                    snapshot,
                    graphs.residentsOf(futureLease),
                    graphs.verificationsOf(futureLease),
                    graphs.documentsOf(futureLease));
            preservedByUnit.computeIfAbsent(futureLease.getUnit().getId(), key -> new ArrayList<>()).add(copy);
        }

        Ingestion ingestion = new Ingestion(snapshot, rentRoll, rentRollDate);
        normalizedGroups(request.unitGroups()).forEach((unitNumber, rows) -> {
            Unit unit = units.computeIfAbsent(unitNumber, number -> unitRepository.save(new Unit(property, number)));
            Lease priorCurrent = priorCurrentByUnit.get(unit.getId());
            ingestUnit(
                    ingestion,
                    unitNumber,
                    unit,
                    rows,
                    priorCurrent,
                    priorCurrent != null ? graphs.residentsOf(priorCurrent) : List.of(),
                    preservedByUnit.getOrDefault(unit.getId(), List.of()));
        });

        eventPublisher.publishEvent(new SnapshotFinalizedEvent(propertyId, snapshot.getId(), rentRollDate));
        log.info("Compliance upload finalized for property {}: snapshot={} leases={} tenancies={} residents={} preserved={} matches={} discrepancies={}",
                propertyId,
                snapshot.getId(),
                ingestion.leasesCreated,
                ingestion.tenanciesCreated,
                ingestion.residentsCreated,
                futureLeases.size(),
                ingestion.matches.size(),
                ingestion.discrepancies.size());

        return new FinalizeComplianceResponse(
                snapshot.getId(),
                ingestion.leasesCreated,
                ingestion.tenanciesCreated,
                ingestion.residentsCreated,
                futureLeases.size(),
                List.copyOf(ingestion.matches),
                List.copyOf(ingestion.discrepancies)
        );
    }

    private void ingestUnit(
            Ingestion ingestion,
            String unitNumber,
            Unit unit,
            List<LeaseRow> rows,
            Lease priorCurrent,
            List<Resident> priorCurrentResidents,
            List<LeaseGraphCopy> preserved
    ) {
        boolean continued = false;
        Lease firstNewLease = null;

        for (LeaseRow row : rows) {
            boolean current = LeaseTiming.startsBy(row.leaseStartDate(), ingestion.rentRollDate);
            if (current && !continued && InheritanceMatcher.continues(priorCurrent, priorCurrentResidents, row)) {
                tenancyRepository.save(new Tenancy(priorCurrent, ingestion.rentRoll));
                ingestion.tenanciesCreated++;
                continued = true;
                continue;
            }

            Lease lease = new Lease(unit, ingestion.snapshot, leaseName(unitNumber, row));
            lease.setLeaseStartDate(row.leaseStartDate());
            lease.setLeaseEndDate(row.leaseEndDate());
            lease.setLeaseRent(row.leaseRent());
            leaseRepository.save(lease);
            ingestion.leasesCreated++;

            List<Resident> residents = new ArrayList<>();
            for (ResidentRow residentRow : row.residents()) {
                // future leases have no rent-roll baseline
                residents.add(new Resident(lease, residentRow.name().trim(), current ? residentRow.annualizedIncome() : null));
            }
            residentRepository.saveAll(residents);
            ingestion.residentsCreated += residents.size();

            if (current) {
                tenancyRepository.save(new Tenancy(lease, ingestion.rentRoll));
                ingestion.tenanciesCreated++;

                List<Resident> baseline = new ArrayList<>(priorCurrentResidents);
                preserved.forEach(copy -> baseline.addAll(copy.residents()));
                ingestion.discrepancies.addAll(IncomeDiscrepancyDetector.detect(unitNumber, lease, residents, baseline));
            }
            if (firstNewLease == null) {
                firstNewLease = lease;
            }
        }

        if (continued || firstNewLease == null) {
            return;
        }
        for (LeaseGraphCopy copy : preserved) {
            if (copy.verified()) {
                ingestion.matches.add(InheritanceMatcher.toMatch(unitNumber, firstNewLease, copy));
            }
        }
    }

    /**
     * Newest lease per unit that was current on the active rent roll.
     */
    private Map<UUID, Lease> currentLeasesByUnit(ActiveRentRoll active) {
        Map<UUID, Lease> byUnit = new HashMap<>();
        for (Lease lease : tenancyRepository.findLeasesOnRentRoll(active.rentRoll().getId())) {
            if (LeaseTiming.startsBy(lease.getLeaseStartDate(), active.asOfDate())) {
                byUnit.put(lease.getUnit().getId(), lease);
            }
        }
        return byUnit;
    }

    private LeaseGraphs loadGraphs(Collection<Lease> leases) {
        if (leases.isEmpty()) {
            return new LeaseGraphs(Map.of(), Map.of(), Map.of());
        }
        List<UUID> leaseIds = leases.stream().map(Lease::getId).distinct().toList();

        Map<UUID, List<Resident>> residents = new HashMap<>();
        for (Resident resident : residentRepository.findByLeaseIds(leaseIds)) {
            residents.computeIfAbsent(resident.getLease().getId(), key -> new ArrayList<>()).add(resident);
        }
        Map<UUID, List<IncomeVerification>> verifications = new HashMap<>();
        for (IncomeVerification verification : incomeVerificationRepository.findByLeaseIds(leaseIds)) {
            verifications.computeIfAbsent(verification.getLease().getId(), key -> new ArrayList<>()).add(verification);
        }
        Map<UUID, List<IncomeDocument>> documents = new HashMap<>();
        List<UUID> residentIds = residents.values().stream().flatMap(List::stream).map(Resident::getId).toList();
        if (!residentIds.isEmpty()) {
            for (IncomeDocument document : incomeDocumentRepository.findByResidentIds(residentIds)) {
                documents.computeIfAbsent(document.getResident().getId(), key -> new ArrayList<>()).add(document);
            }
        }
        return new LeaseGraphs(residents, verifications, documents);
    }

    private static Map<String, List<LeaseRow>> normalizedGroups(Map<String, List<LeaseRow>> unitGroups) {
        Map<String, List<LeaseRow>> normalized = new TreeMap<>();
        unitGroups.forEach((unitNumber, rows) -> normalized.put(unitNumber.trim(), rows == null ? List.of() : rows));
        return normalized;
    }

    private static String filenameOf(FinalizeComplianceRequest request) {
        if (request.filename() != null && !request.filename().isBlank()) {
            return request.filename().trim();
        }
        return "rent-roll-%s".formatted(request.rentRollDate());
    }

    /**
     * First resident's name, with a count of the others.
     */
    static String leaseName(String unitNumber, LeaseRow row) {
        List<String> names = row.residents().stream().map(resident -> resident.name().trim()).toList();
        if (names.isEmpty()) {
            return "Unit %s lease".formatted(unitNumber);
        }
        int others = names.size() - 1;
        if (others == 0) {
            return names.get(0);
        }
        return "%s + %d other%s".formatted(names.get(0), others, others > 1 ? "s" : "");
    }

    private record LeaseGraphs(
            Map<UUID, List<Resident>> residents,
            Map<UUID, List<IncomeVerification>> verifications,
            Map<UUID, List<IncomeDocument>> documents
    ) {

        List<Resident> residentsOf(Lease lease) {
            return residents.getOrDefault(lease.getId(), List.of());
        }

        List<IncomeVerification> verificationsOf(Lease lease) {
            return verifications.getOrDefault(lease.getId(), List.of());
        }

        List<IncomeDocument> documentsOf(Lease lease) {
            List<IncomeDocument> result = new ArrayList<>();
            residentsOf(lease).forEach(resident -> result.addAll(documents.getOrDefault(resident.getId(), List.of())));
            return result;
        }
    }

    private static final class Ingestion {

        private final RentRollSnapshot snapshot;
        private final RentRoll rentRoll;
        private final LocalDate rentRollDate;
        private final List<FutureLeaseMatch> matches = new ArrayList<>();
        private final List<IncomeDiscrepancy> discrepancies = new ArrayList<>();
        private int leasesCreated;
        private int tenanciesCreated;
        private int residentsCreated;

        private Ingestion(RentRollSnapshot snapshot, RentRoll rentRoll, LocalDate rentRollDate) {
            this.snapshot = snapshot;
            this.rentRoll = rentRoll;
            this.rentRollDate = rentRollDate;
        }
    }
}
