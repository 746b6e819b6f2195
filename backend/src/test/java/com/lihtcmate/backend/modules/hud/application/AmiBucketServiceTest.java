package com.lihtcmate.backend.modules.hud.application;

import static com.lihtcmate.backend.support.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.lihtcmate.backend.modules.hud.domain.AmiBucketCalculator;
import com.lihtcmate.backend.modules.hud.domain.HudLimitFixtures;
import com.lihtcmate.backend.modules.hud.domain.HudServiceException;
import com.lihtcmate.backend.modules.hud.domain.LimitRegime;
import com.lihtcmate.backend.modules.hud.domain.ResolvedIncomeLimits;
import com.lihtcmate.backend.modules.hud.presentation.dto.LeaseAmiBucketResponse;
import com.lihtcmate.backend.modules.hud.presentation.dto.MaxRentsResponse;
import com.lihtcmate.backend.modules.lease.domain.Lease;
import com.lihtcmate.backend.modules.lease.domain.Resident;
import com.lihtcmate.backend.modules.lease.infrastructure.persistence.LeaseRepository;
import com.lihtcmate.backend.modules.lease.infrastructure.persistence.ResidentRepository;
import com.lihtcmate.backend.modules.property.domain.Property;
import com.lihtcmate.backend.modules.property.domain.Unit;
import com.lihtcmate.backend.modules.property.infrastructure.persistence.PropertyRepository;
import com.lihtcmate.backend.modules.rentroll.domain.RentRollSnapshot;
import com.lihtcmate.backend.modules.rentroll.infrastructure.persistence.RentRollSnapshotRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AmiBucketServiceTest {

    @Mock
    private LeaseRepository leaseRepository;

    @Mock
    private ResidentRepository residentRepository;

    @Mock
    private PropertyRepository propertyRepository;

    @Mock
    private RentRollSnapshotRepository snapshotRepository;

    @Mock
    private HudIncomeLimitsService hudIncomeLimitsService;

    private AmiBucketService service;
    private Clock clock;

    private Property property;
    private RentRollSnapshot snapshot;
    private Lease lease;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant(), ZoneOffset.UTC);
        service = new AmiBucketService(leaseRepository, residentRepository, propertyRepository, snapshotRepository,
                hudIncomeLimitsService, clock);

        property = withId(new Property(), UUID.fromString("00000000-0000-0000-0000-000000000101"));
        property.setName("Maple Court");
        property.setCounty("Travis");
        property.setState("TX");
        property.setPlacedInServiceDate(LocalDate.of(2015, 3, 1));
        snapshot = withId(new RentRollSnapshot(property, "rent-roll-2025-01-01", LocalDate.of(2025, 1, 1)), UUID.randomUUID());
        lease = withId(new Lease(new Unit(property, "101"), snapshot, "Jane Doe + 1 other"),
                UUID.fromString("00000000-0000-0000-0000-000000000201"));
        lenient().when(leaseRepository.findDetailedById(lease.getId())).thenReturn(Optional.of(lease));
    }

    @Test
    @DisplayName("limits stored on the lease's snapshot are used without calling HUD")
    void storedSnapshotLimits() {
        snapshot.recordHudData(HudLimitFixtures.standardPayload(), 2024, "HOLD_HARMLESS", OffsetDateTime.now(clock));
        when(residentRepository.findByLeaseIdOrderByCreatedAtAsc(lease.getId()))
                .thenReturn(List.of(verified("Jane", "30000"), verified("John", "10000")));

        LeaseAmiBucketResponse response = service.getLeaseAmiBucket(lease.getId());

        assertThat(response.amiBucket()).isEqualTo("50% AMI");
        assertThat(response.householdSize()).isEqualTo(2);
        assertThat(response.totalVerifiedIncome()).isEqualByComparingTo("40000");
        assertThat(response.hudDataYear()).isEqualTo(2024);
        assertThat(response.regime()).isEqualTo("HOLD_HARMLESS");
        verifyNoInteractions(hudIncomeLimitsService);
    }

    @Test
    @DisplayName("unverified income counts as zero")
    void noVerifiedIncome() {
        when(residentRepository.findByLeaseIdOrderByCreatedAtAsc(lease.getId()))
                .thenReturn(List.of(new Resident(lease, "Jane", new BigDecimal("30000"))));

        assertThat(service.getLeaseAmiBucket(lease.getId()).amiBucket())
                .isEqualTo(AmiBucketCalculator.NO_INCOME_INFORMATION);
    }

    @Test
    void vacantLease() {
        when(residentRepository.findByLeaseIdOrderByCreatedAtAsc(lease.getId())).thenReturn(List.of());

        assertThat(service.getLeaseAmiBucket(lease.getId()).amiBucket()).isEqualTo(AmiBucketCalculator.VACANT);
    }

    @Test
    @DisplayName("a HUD outage degrades to a sentinel instead of failing")
    void hudUnavailable() {
        when(residentRepository.findByLeaseIdOrderByCreatedAtAsc(lease.getId()))
                .thenReturn(List.of(verified("Jane", "30000")));
        when(snapshotRepository.findFirstByPropertyIdAndActiveTrue(property.getId())).thenReturn(Optional.empty());
        when(hudIncomeLimitsService.getIncomeLimitsWithFallback(anyString(), anyString(), anyInt(), any()))
                .thenThrow(new HudServiceException("down"));

        LeaseAmiBucketResponse response = service.getLeaseAmiBucket(lease.getId());

        assertThat(response.amiBucket()).isEqualTo(AmiBucketCalculator.HUD_UNAVAILABLE);
        assertThat(response.hudDataYear()).isNull();
    }

    @Test
    @DisplayName("max rents report the fallback year and cover the standard thresholds")
    void maxRents() {
        when(propertyRepository.findById(property.getId())).thenReturn(Optional.of(property));
        when(hudIncomeLimitsService.getIncomeLimitsWithFallback("Travis", "TX", 2025, property.getPlacedInServiceDate()))
                .thenReturn(new ResolvedIncomeLimits(HudLimitFixtures.standardLimits(), 2024, LimitRegime.HOLD_HARMLESS));

        MaxRentsResponse response = service.maxRents(property.getId(), null);

        assertThat(response.requestedYear()).isEqualTo(2025);
        assertThat(response.actualYear()).isEqualTo(2024);
        assertThat(response.usedFallback()).isTrue();
        assertThat(response.lihtcMaxRents()).containsOnlyKeys("30percent", "50percent", "60percent", "80percent");
        assertThat(response.lihtcMaxRents().get("80percent").get("studio")).isEqualByComparingTo("1400");
        verify(hudIncomeLimitsService).getIncomeLimitsWithFallback("Travis", "TX", 2025, property.getPlacedInServiceDate());
    }

    private Resident verified(String name, String income) {
        Resident resident = new Resident(lease, name, new BigDecimal(income));
        resident.finalizeIncome(new BigDecimal(income), OffsetDateTime.now(clock));
        return resident;
    }
}
