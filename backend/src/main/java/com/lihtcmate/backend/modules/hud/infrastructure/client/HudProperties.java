package com.lihtcmate.backend.modules.hud.infrastructure.client;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.hud")
public record HudProperties(
        String baseUrl,
        String apiKey,
        @DefaultValue("10s") Duration connectTimeout,
        @DefaultValue("10s") Duration readTimeout,
        @DefaultValue("24h") Duration cacheTtl,
        @DefaultValue("500") int cacheMaxEntries,
        @DefaultValue("true") boolean fallbackToPreviousYear
) {

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
