package com.lihtcmate.backend.modules.hud.application;

import java.time.LocalDate;

import com.lihtcmate.backend.modules.hud.domain.HudIncomeLimits;
import com.lihtcmate.backend.modules.hud.domain.HudServiceException;
import com.lihtcmate.backend.modules.hud.domain.LimitRegime;
import com.lihtcmate.backend.modules.hud.domain.ResolvedIncomeLimits;
import com.lihtcmate.backend.modules.hud.infrastructure.client.HudApiClient;
import com.lihtcmate.backend.modules.hud.infrastructure.client.HudProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class HudIncomeLimitsService {

    private static final Logger log = LoggerFactory.getLogger(HudIncomeLimitsService.class);

    private final HudApiClient hudApiClient;
    private final HudIncomeLimitsCache cache;
    private final HudProperties properties;

    public HudIncomeLimitsService(HudApiClient hudApiClient, HudIncomeLimitsCache cache, HudProperties properties) {
        this.hudApiClient = hudApiClient;
        this.cache = cache;
        this.properties = properties;
    }

    /**
     * Limits for exactly {@code year} under the regime the placed-in-service date calls for.
     *
     * @throws HudServiceException when the upstream API fails
     */
    public ResolvedIncomeLimits getIncomeLimits(String county, String state, int year, LocalDate placedInServiceDate) {
        LimitRegime requested = LimitRegime.requestedFor(placedInServiceDate);
        return cache.get(HudIncomeLimitsCache.Key.of(county, state, year, requested), key -> {
            HudIncomeLimits raw = HudIncomeLimits.of(hudApiClient.fetchIncomeLimits(county, state, year));
            LimitRegime applied = requested.resolve(raw.hasHeraSpecial());
            if (requested != applied) {
                log.info("No HERA special limits for {}, {} ({}); using standard limits", county, state, year);
            }
            HudIncomeLimits limits = applied == LimitRegime.HERA_SPECIAL ? raw.withHeraSpecial() : raw;
            return new ResolvedIncomeLimits(limits, year, applied);
        });
    }

    /**
     * As {@link #getIncomeLimits}, retrying the previous year when {@code app.hud.fallback-to-previous-year}
     * is on.
     */
    public ResolvedIncomeLimits getIncomeLimitsWithFallback(String county, String state, int year, LocalDate placedInServiceDate) {
        try {
            return getIncomeLimits(county, state, year, placedInServiceDate);
        } catch (HudServiceException ex) {
            if (!properties.fallbackToPreviousYear()) {
                throw ex;
            }
            log.warn("HUD limits for {}, {} {} unavailable ({}); falling back to {}", county, state, year, ex.getDetailMessage(), year - 1);
            return getIncomeLimits(county, state, year - 1, placedInServiceDate);
        }
    }
}
