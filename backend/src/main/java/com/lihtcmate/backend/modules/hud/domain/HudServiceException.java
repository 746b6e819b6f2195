package com.lihtcmate.backend.modules.hud.domain;

import com.lihtcmate.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * The HUD limits API could not be reached, answered non-2xx, or returned an unusable payload.
 */
public class HudServiceException extends ProblemException {

    public HudServiceException(String detail) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "HUD_UNAVAILABLE", detail);
    }

    public HudServiceException(String detail, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "HUD_UNAVAILABLE", detail, cause);
    }
}
