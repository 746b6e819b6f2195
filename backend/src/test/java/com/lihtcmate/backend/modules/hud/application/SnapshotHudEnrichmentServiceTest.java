package com.lihtcmate.backend.modules.hud.application;

import static com.lihtcmate.backend.support.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.lihtcmate.backend.modules.hud.domain.HudLimitFixtures;
import com.lihtcmate.backend.modules.hud.domain.HudServiceException;
import com.lihtcmate.backend.modules.hud.domain.LimitRegime;
import com.lihtcmate.backend.modules.hud.domain.ResolvedIncomeLimits;
import com.lihtcmate.backend.modules.property.domain.Property;
import com.lihtcmate.backend.modules.rentroll.domain.RentRollSnapshot;
import com.lihtcmate.backend.modules.rentroll.infrastructure.persistence.RentRollSnapshotRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SnapshotHudEnrichmentServiceTest {

    @Mock
    private RentRollSnapshotRepository snapshotRepository;

    @Mock
    private HudIncomeLimitsService hudIncomeLimitsService;

    private SnapshotHudEnrichmentService service;
    private Clock clock;
    private Property property;
    private RentRollSnapshot snapshot;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant(), ZoneOffset.UTC);
        service = new SnapshotHudEnrichmentService(snapshotRepository, hudIncomeLimitsService, clock);

        property = withId(new Property(), UUID.randomUUID());
        property.setCounty("Travis");
        property.setState("TX");
        snapshot = withId(new RentRollSnapshot(property, "rent-roll-2024-12-31", LocalDate.of(2024, 12, 31)), UUID.randomUUID());
        when(snapshotRepository.findWithPropertyById(snapshot.getId())).thenReturn(Optional.of(snapshot));
    }

    @Test
    void storesLimitsForTheRentRollYear() {
        when(hudIncomeLimitsService.getIncomeLimitsWithFallback("Travis", "TX", 2024, null))
                .thenReturn(new ResolvedIncomeLimits(HudLimitFixtures.standardLimits(), 2024, LimitRegime.STANDARD));

        assertThat(service.enrich(snapshot.getId())).isTrue();

        assertThat(snapshot.hasHudData()).isTrue();
        assertThat(snapshot.getHudDataYear()).isEqualTo(2024);
        assertThat(snapshot.getHudRegime()).isEqualTo("STANDARD");
        assertThat(snapshot.getHudFetchedAt()).isEqualTo(OffsetDateTime.now(clock));
        verify(snapshotRepository).save(snapshot);
    }

    @Test
    void alreadyEnrichedSnapshotIsSkipped() {
        snapshot.recordHudData(HudLimitFixtures.standardPayload(), 2024, "STANDARD", OffsetDateTime.now(clock));

        assertThat(service.enrich(snapshot.getId())).isTrue();

        verifyNoInteractions(hudIncomeLimitsService);
    }

    @Test
    void failureLeavesSnapshotForRetry() {
        when(hudIncomeLimitsService.getIncomeLimitsWithFallback("Travis", "TX", 2024, null))
                .thenThrow(new HudServiceException("down"));

        assertThat(service.enrich(snapshot.getId())).isFalse();

        assertThat(snapshot.hasHudData()).isFalse();
        verify(snapshotRepository, never()).save(snapshot);
    }
}
