package com.lihtcmate.backend.modules.hud.domain;

import java.time.LocalDate;

/**
 * Which set of MTSP income limits applies to a property, decided by its placed-in-service date.
 */
public enum LimitRegime {
    /** Pre-2009 projects with HERA special limits published for their county. */
    HERA_SPECIAL,
    /** Post-2008 projects. HUD applies hold-harmless in the published figures. */
    HOLD_HARMLESS,
    STANDARD;

    public static final LocalDate HERA_CUTOFF = LocalDate.of(2009, 1, 1);

    /**
     * Regime to request before the county payload is known. A pre-2009 property asks for HERA and
     * may still end up {@link #STANDARD} once the payload is inspected.
     */
    public static LimitRegime requestedFor(LocalDate placedInServiceDate) {
        if (placedInServiceDate == null) {
            return STANDARD;
        }
        return placedInServiceDate.isBefore(HERA_CUTOFF) ? HERA_SPECIAL : HOLD_HARMLESS;
    }

    public LimitRegime resolve(boolean heraDataAvailable) {
        if (this == HERA_SPECIAL && !heraDataAvailable) {
            return STANDARD;
        }
        return this;
    }
}
