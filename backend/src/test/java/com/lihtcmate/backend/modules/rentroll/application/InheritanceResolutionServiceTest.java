package com.lihtcmate.backend.modules.rentroll.application;

import static com.lihtcmate.backend.support.TestEntities.withRandomId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.lihtcmate.backend.global.error.ProblemException;
import com.lihtcmate.backend.modules.lease.domain.Lease;
import com.lihtcmate.backend.modules.lease.domain.Resident;
import com.lihtcmate.backend.modules.lease.infrastructure.persistence.LeaseRepository;
import com.lihtcmate.backend.modules.lease.infrastructure.persistence.ResidentRepository;
import com.lihtcmate.backend.modules.property.domain.Property;
import com.lihtcmate.backend.modules.property.domain.Unit;
import com.lihtcmate.backend.modules.property.infrastructure.persistence.UnitRepository;
import com.lihtcmate.backend.modules.rentroll.domain.RentRoll;
import com.lihtcmate.backend.modules.rentroll.domain.RentRollSnapshot;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.InheritanceResolutionResponse;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.InheritanceResolutionResponse.UnitResolution;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.ResolveInheritanceRequest;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.ResolveInheritanceRequest.Decision;
import com.lihtcmate.backend.modules.verification.domain.DocumentStatus;
import com.lihtcmate.backend.modules.verification.domain.DocumentType;
import com.lihtcmate.backend.modules.verification.domain.IncomeDocument;
import com.lihtcmate.backend.modules.verification.domain.IncomeVerification;
import com.lihtcmate.backend.modules.verification.domain.VerificationReason;
import com.lihtcmate.backend.modules.verification.infrastructure.persistence.IncomeDocumentRepository;
import com.lihtcmate.backend.modules.verification.infrastructure.persistence.IncomeVerificationRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class InheritanceResolutionServiceTest {

    @Mock
    private PropertyFinalizeLock propertyFinalizeLock;

    @Mock
    private ActiveRentRollLocator activeRentRollLocator;

    @Mock
    private UnitRepository unitRepository;

    @Mock
    private LeaseRepository leaseRepository;

    @Mock
    private ResidentRepository residentRepository;

    @Mock
    private IncomeVerificationRepository incomeVerificationRepository;

    @Mock
    private IncomeDocumentRepository incomeDocumentRepository;

    private InheritanceResolutionService service;
    private Clock clock;

    private Property property;
    private Unit unit;
    private RentRollSnapshot snapshot;
    private Lease futureLease;
    private Lease newLease;
    private Resident futureBo;
    private Resident futureCy;
    private Resident newBo;
    private Resident newCy;
    private IncomeVerification futureVerification;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant(), ZoneOffset.UTC);
        service = new InheritanceResolutionService(propertyFinalizeLock, activeRentRollLocator, unitRepository,
                leaseRepository, residentRepository, incomeVerificationRepository, incomeDocumentRepository, clock);

        property = withRandomId(new Property());
        unit = withRandomId(new Unit(property, "102"));
        snapshot = withRandomId(new RentRollSnapshot(property, "rent-roll-2025-01-31", LocalDate.of(2025, 1, 31)));
        RentRoll rentRoll = withRandomId(new RentRoll(snapshot));

        futureLease = withRandomId(new Lease(unit, snapshot, "Bo Chen + 1 other"));
        futureBo = withRandomId(new Resident(futureLease, "Bo Chen", null));
        futureBo.finalizeIncome(new BigDecimal("45000.00"), OffsetDateTime.parse("2024-11-15T10:00:00Z"));
        futureCy = withRandomId(new Resident(futureLease, "Cy Chen", null));
        futureCy.markNoIncome(OffsetDateTime.parse("2024-11-15T10:00:00Z"));
        futureVerification = withRandomId(new IncomeVerification(futureLease, VerificationReason.INITIAL_LEASE));
        futureVerification.finalizeWith(new BigDecimal("45000.00"), OffsetDateTime.parse("2024-11-15T10:00:00Z"));

        newLease = withRandomId(new Lease(unit, snapshot, "BO CHEN + 1 other"));
        newBo = withRandomId(new Resident(newLease, "BO CHEN", new BigDecimal("40000.00")));
        newCy = withRandomId(new Resident(newLease, "cy chen", new BigDecimal("0")));

        lenient().when(activeRentRollLocator.find(property.getId())).thenReturn(Optional.of(new ActiveRentRoll(snapshot, rentRoll)));
        lenient().when(leaseRepository.findFutureLeases(property.getId(), snapshot.getId())).thenReturn(List.of(futureLease));
        lenient().when(unitRepository.findByPropertyIdAndUnitNumber(property.getId(), "102")).thenReturn(Optional.of(unit));
        lenient().when(incomeVerificationRepository.findByLeaseIdOrderByCreatedAtAsc(futureLease.getId()))
                .thenReturn(List.of(futureVerification));
        lenient().when(incomeVerificationRepository.save(any(IncomeVerification.class)))
                .thenAnswer(invocation -> withRandomId(invocation.getArgument(0)));
    }

    @Test
    @DisplayName("inheriting copies each matching resident's verified outcome and document references")
    void resolveInheritance_inherit() {
        IncomeDocument paystub = withRandomId(new IncomeDocument(futureBo, futureVerification, DocumentType.PAYSTUB));
        paystub.setStatus(DocumentStatus.COMPLETED);
        when(leaseRepository.findActiveScopeLeasesForUnit(unit.getId(), snapshot.getId())).thenReturn(List.of(futureLease, newLease));
        when(residentRepository.findByLeaseIdOrderByCreatedAtAsc(newLease.getId())).thenReturn(List.of(newBo, newCy));
        when(residentRepository.findByLeaseIdOrderByCreatedAtAsc(futureLease.getId())).thenReturn(List.of(futureBo, futureCy));
        when(incomeDocumentRepository.findByResidentIds(List.of(futureBo.getId()))).thenReturn(List.of(paystub));
        when(incomeDocumentRepository.findByResidentIds(List.of(futureCy.getId()))).thenReturn(List.of());

        InheritanceResolutionResponse response = service.resolveInheritance(property.getId(),
                decide(" 102", true, newLease.getId()));

        UnitResolution resolution = response.units().get(0);
        assertThat(resolution.inherited()).isTrue();
        assertThat(resolution.newLeaseId()).isEqualTo(newLease.getId());
        assertThat(resolution.residentsInherited()).isEqualTo(2);
        assertThat(resolution.documentsReferenced()).isEqualTo(1);

        assertThat(newBo.isIncomeFinalized()).isTrue();
        assertThat(newBo.getCalculatedAnnualizedIncome()).isEqualByComparingTo("45000.00");
        assertThat(newBo.getFinalizedAt()).isEqualTo(OffsetDateTime.parse("2024-11-15T10:00:00Z"));
        assertThat(newCy.isHasNoIncome()).isTrue();
        assertThat(futureLease.isProcessed()).isTrue();

        ArgumentCaptor<IncomeVerification> verification = ArgumentCaptor.forClass(IncomeVerification.class);
        verify(incomeVerificationRepository).save(verification.capture());
        assertThat(verification.getValue().getReason()).isEqualTo(VerificationReason.LEASE_RENEWAL);
        assertThat(verification.getValue().isFinalized()).isTrue();
        assertThat(verification.getValue().getCalculatedVerifiedIncome()).isEqualByComparingTo("45000.00");
        verify(incomeDocumentRepository).saveAll(anyIterable());
    }

    @Test
    @DisplayName("income lands on the lease the finalize match named, not on a later renewal")
    void resolveInheritance_targetsMatchedLease() {
        Lease renewal = withRandomId(new Lease(unit, snapshot, "Bo Chen + 1 other"));
        renewal.setLeaseStartDate(LocalDate.of(2025, 6, 1));
        when(leaseRepository.findActiveScopeLeasesForUnit(unit.getId(), snapshot.getId())).thenReturn(List.of(renewal, newLease, futureLease));
        when(residentRepository.findByLeaseIdOrderByCreatedAtAsc(newLease.getId())).thenReturn(List.of(newBo, newCy));
        when(residentRepository.findByLeaseIdOrderByCreatedAtAsc(futureLease.getId())).thenReturn(List.of(futureBo, futureCy));

        InheritanceResolutionResponse response = service.resolveInheritance(property.getId(), decide("102", true, newLease.getId()));

        assertThat(response.units()).singleElement()
                .satisfies(resolution -> assertThat(resolution.newLeaseId()).isEqualTo(newLease.getId()));
        assertThat(newBo.getCalculatedAnnualizedIncome()).isEqualByComparingTo("45000.00");
        verify(residentRepository, never()).findByLeaseIdOrderByCreatedAtAsc(renewal.getId());
    }

    @Test
    @DisplayName("a finalized verification still counts after a newer one is opened")
    void resolveInheritance_earlierFinalizedVerification() {
        IncomeVerification recertification = withRandomId(new IncomeVerification(futureLease, VerificationReason.ANNUAL_RECERTIFICATION));
        when(incomeVerificationRepository.findByLeaseIdOrderByCreatedAtAsc(futureLease.getId()))
                .thenReturn(List.of(futureVerification, recertification));

        InheritanceResolutionResponse response = service.resolveInheritance(property.getId(), decide("102", false, null));

        assertThat(response.units()).singleElement()
                .satisfies(resolution -> assertThat(resolution.futureLeaseId()).isEqualTo(futureLease.getId()));
        assertThat(futureLease.isProcessed()).isTrue();
    }

    @Test
    @DisplayName("a lease outside the unit's active scope cannot inherit")
    void resolveInheritance_unknownTarget() {
        when(leaseRepository.findActiveScopeLeasesForUnit(unit.getId(), snapshot.getId())).thenReturn(List.of(futureLease, newLease));

        assertThatThrownBy(() -> service.resolveInheritance(property.getId(), decide("102", true, UUID.randomUUID())))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("INHERITANCE_TARGET_NOT_FOUND");
        assertThat(futureLease.isProcessed()).isFalse();
    }

    @Test
    void resolveInheritance_inheritWithoutTarget() {
        assertThatThrownBy(() -> service.resolveInheritance(property.getId(), decide("102", true, null)))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("NEW_LEASE_REQUIRED");
        verify(incomeVerificationRepository, never()).save(any());
    }

    @Test
    @DisplayName("declining only marks the future lease processed")
    void resolveInheritance_decline() {
        InheritanceResolutionResponse response = service.resolveInheritance(property.getId(),
                decide("102", false, null));

        assertThat(response.units()).singleElement().satisfies(resolution -> {
            assertThat(resolution.inherited()).isFalse();
            assertThat(resolution.futureLeaseId()).isEqualTo(futureLease.getId());
        });
        assertThat(futureLease.isProcessed()).isTrue();
        verify(incomeVerificationRepository, never()).save(any());
    }

    @Test
    @DisplayName("a unit without a verified future lease has nothing to decide")
    void resolveInheritance_noPendingLease() {
        futureVerification.reopen();

        assertThatThrownBy(() -> service.resolveInheritance(property.getId(), decide("102", true, newLease.getId())))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("NO_PENDING_INHERITANCE");
    }

    @Test
    void resolveInheritance_noActiveSnapshot() {
        when(activeRentRollLocator.find(property.getId())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.resolveInheritance(property.getId(), decide("102", true, newLease.getId())))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("NO_ACTIVE_SNAPSHOT");
    }

    private static ResolveInheritanceRequest decide(String unitNumber, boolean inherit, UUID newLeaseId) {
        return new ResolveInheritanceRequest(Map.of(unitNumber, new Decision(inherit, newLeaseId)));
    }
}
