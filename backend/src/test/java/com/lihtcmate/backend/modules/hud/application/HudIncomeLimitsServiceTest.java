package com.lihtcmate.backend.modules.hud.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.lihtcmate.backend.modules.hud.domain.HudLimitFixtures;
import com.lihtcmate.backend.modules.hud.domain.HudServiceException;
import com.lihtcmate.backend.modules.hud.domain.LimitRegime;
import com.lihtcmate.backend.modules.hud.domain.ResolvedIncomeLimits;
import com.lihtcmate.backend.modules.hud.infrastructure.client.HudApiClient;
import com.lihtcmate.backend.modules.hud.infrastructure.client.HudProperties;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HudIncomeLimitsServiceTest {

    private static final LocalDate PRE_HERA = LocalDate.of(2005, 6, 1);
    private static final LocalDate POST_HERA = LocalDate.of(2015, 6, 1);

    @Mock
    private HudApiClient hudApiClient;

    private final Clock clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant(), ZoneOffset.UTC);

    @Test
    @DisplayName("pre-2009 properties get HERA special limits when the county publishes them")
    void heraApplied() {
        when(hudApiClient.fetchIncomeLimits("Travis", "TX", 2025))
                .thenReturn(HudLimitFixtures.withHera(HudLimitFixtures.standardPayload()));

        ResolvedIncomeLimits resolved = service(true).getIncomeLimits("Travis", "TX", 2025, PRE_HERA);

        assertThat(resolved.regime()).isEqualTo(LimitRegime.HERA_SPECIAL);
        assertThat(resolved.limits().incomeLimit(50, 1)).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("38500"));
    }

    @Test
    @DisplayName("pre-2009 properties fall back to standard limits without HERA data")
    void heraUnavailable() {
        when(hudApiClient.fetchIncomeLimits("Travis", "TX", 2025)).thenReturn(HudLimitFixtures.standardPayload());

        ResolvedIncomeLimits resolved = service(true).getIncomeLimits("Travis", "TX", 2025, PRE_HERA);

        assertThat(resolved.regime()).isEqualTo(LimitRegime.STANDARD);
        assertThat(resolved.limits().incomeLimit(50, 1)).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("35000"));
    }

    @Test
    @DisplayName("post-2008 properties use the published hold-harmless figures")
    void holdHarmless() {
        when(hudApiClient.fetchIncomeLimits("Travis", "TX", 2025))
                .thenReturn(HudLimitFixtures.withHera(HudLimitFixtures.standardPayload()));

        ResolvedIncomeLimits resolved = service(true).getIncomeLimits("Travis", "TX", 2025, POST_HERA);

        assertThat(resolved.regime()).isEqualTo(LimitRegime.HOLD_HARMLESS);
        assertThat(resolved.limits().incomeLimit(50, 1)).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("35000"));
    }

    @Test
    @DisplayName("repeat lookups are served from the cache")
    void cached() {
        when(hudApiClient.fetchIncomeLimits("Travis", "TX", 2025)).thenReturn(HudLimitFixtures.standardPayload());
        HudIncomeLimitsService service = service(true);

        service.getIncomeLimits("Travis", "TX", 2025, POST_HERA);
        service.getIncomeLimits("TRAVIS", "tx", 2025, POST_HERA);

        verify(hudApiClient, times(1)).fetchIncomeLimits("Travis", "TX", 2025);
    }

    @Test
    @DisplayName("an unpublished year falls back to the previous one")
    void previousYearFallback() {
        when(hudApiClient.fetchIncomeLimits("Travis", "TX", 2025)).thenThrow(new HudServiceException("404"));
        when(hudApiClient.fetchIncomeLimits("Travis", "TX", 2024)).thenReturn(HudLimitFixtures.standardPayload());

        ResolvedIncomeLimits resolved = service(true).getIncomeLimitsWithFallback("Travis", "TX", 2025, POST_HERA);

        assertThat(resolved.year()).isEqualTo(2024);
    }

    @Test
    void fallbackDisabled() {
        when(hudApiClient.fetchIncomeLimits("Travis", "TX", 2025)).thenThrow(new HudServiceException("404"));

        assertThatThrownBy(() -> service(false).getIncomeLimitsWithFallback("Travis", "TX", 2025, POST_HERA))
                .isInstanceOf(HudServiceException.class);
    }

    private HudIncomeLimitsService service(boolean fallback) {
        HudProperties properties = new HudProperties("http://hud.test", "token", Duration.ofSeconds(1),
                Duration.ofSeconds(1), Duration.ofHours(24), 10, fallback);
        return new HudIncomeLimitsService(hudApiClient, new HudIncomeLimitsCache(properties, clock), properties);
    }
}
