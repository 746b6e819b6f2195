package com.lihtcmate.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Checks required configuration once the application is ready.
 * A missing datasource is fatal; a missing HUD key only degrades AMI lookups to sentinels.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "app.hud.base-url"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> missing = new ArrayList<>();
        for (String key : REQUIRED_KEYS) {
            if (isBlank(key)) {
                missing.add(key);
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Missing required configuration: " + String.join(", ", missing));
        }

        if (isBlank("app.hud.api-key")) {
            log.warn("app.hud.api-key is not set; HUD income limits will be reported as unavailable");
        }
        log.info("Environment validation completed");
    }

    private boolean isBlank(String key) {
        return Optional.ofNullable(environment.getProperty(key))
                .map(String::trim)
                .orElse("")
                .isEmpty();
    }
}
