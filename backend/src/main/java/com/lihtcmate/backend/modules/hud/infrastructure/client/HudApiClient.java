package com.lihtcmate.backend.modules.hud.infrastructure.client;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.lihtcmate.backend.modules.hud.domain.HudServiceException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Two-step HUD lookup: county name to FIPS code through the FMR county listing, then the MTSP
 * income limits for that FIPS code.
 */
@Component
public class HudApiClient {

    private static final Logger log = LoggerFactory.getLogger(HudApiClient.class);

    private final RestClient hudRestClient;
    private final HudProperties properties;

    public HudApiClient(RestClient hudRestClient, HudProperties properties) {
        this.hudRestClient = hudRestClient;
        this.properties = properties;
    }

    public Map<String, Object> fetchIncomeLimits(String county, String state, int year) {
        if (!properties.hasApiKey()) {
            throw new HudServiceException("HUD API key is not configured");
        }
        String stateCode = StateCodes.resolve(state)
                .orElseThrow(() -> new HudServiceException("State not found: %s".formatted(state)));
        String fipsCode = findFipsCode(county, stateCode, year);
        log.debug("HUD county {} {} resolved to FIPS {}", county, stateCode, fipsCode);
        return fetchMtspLimits(fipsCode, year);
    }

    String findFipsCode(String county, String stateCode, int year) {
        Object body = get("/fmr/listCounties/{state}?year={year}", stateCode, year);
        Object list = body instanceof Map<?, ?> wrapper && wrapper.containsKey("data") ? wrapper.get("data") : body;
        if (!(list instanceof List<?> counties)) {
            throw new HudServiceException("Unexpected county listing for %s: expected an array".formatted(stateCode));
        }

        String prefix = county.trim().toLowerCase(Locale.ROOT);
        for (Object entry : counties) {
            if (!(entry instanceof Map<?, ?> candidate)) {
                continue;
            }
            Object name = candidate.get("county_name") != null ? candidate.get("county_name") : candidate.get("cntyname");
            if (name instanceof String countyName && countyName.toLowerCase(Locale.ROOT).startsWith(prefix)) {
                Object fips = candidate.get("fips_code");
                if (fips == null) {
                    throw new HudServiceException("County '%s' in %s has no FIPS code".formatted(county, stateCode));
                }
                return fips.toString();
            }
        }
        throw new HudServiceException("County '%s' not found in %s".formatted(county, stateCode));
    }

    @SuppressWarnings("unchecked")
    Map<String, Object> fetchMtspLimits(String fipsCode, int year) {
        Object body = get("/mtspil/data/{fips}?year={year}", fipsCode, year);
        if (body instanceof Map<?, ?> wrapper && wrapper.get("data") instanceof Map<?, ?> data) {
            return (Map<String, Object>) data;
        }
        throw new HudServiceException("Unexpected income limits payload for FIPS %s".formatted(fipsCode));
    }

    private Object get(String uriTemplate, Object... variables) {
        try {
            return hudRestClient.get()
                    .uri(uriTemplate, variables)
                    .retrieve()
                    .body(Object.class);
        } catch (RestClientResponseException ex) {
            throw new HudServiceException(
                    "HUD API returned %d for %s".formatted(ex.getStatusCode().value(), uriTemplate), ex);
        } catch (RestClientException ex) {
            throw new HudServiceException("HUD API call failed for %s: %s".formatted(uriTemplate, ex.getMessage()), ex);
        }
    }
}
