package com.lihtcmate.backend.modules.hud.domain;

/**
 * Income limits with the data year actually served and the regime actually applied.
 */
public record ResolvedIncomeLimits(
        HudIncomeLimits limits,
        int year,
        LimitRegime regime
) {
}
