package com.lihtcmate.backend.modules.hud.application;

import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.lihtcmate.backend.modules.hud.domain.LimitRegime;
import com.lihtcmate.backend.modules.hud.domain.ResolvedIncomeLimits;
import com.lihtcmate.backend.modules.hud.infrastructure.client.HudProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolved income limits per county, state, year and requested regime. Entries expire after
 * {@code app.hud.cache-ttl}, measured on the application clock. Failed loads are not cached.
 */
@Component
public class HudIncomeLimitsCache {

    private static final Logger log = LoggerFactory.getLogger(HudIncomeLimitsCache.class);

    public record Key(String county, String state, int year, LimitRegime regime) {

        public static Key of(String county, String state, int year, LimitRegime regime) {
            return new Key(normalize(county), normalize(state), year, regime);
        }

        private static String normalize(String value) {
            return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        }
    }

    private final Cache<Key, ResolvedIncomeLimits> cache;

    public HudIncomeLimitsCache(HudProperties properties, Clock clock) {
        Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
        this.cache = Caffeine.newBuilder()
                .maximumSize(properties.cacheMaxEntries())
                .expireAfterWrite(properties.cacheTtl())
                .ticker(ticker)
                .build();
        log.info("HUD income limits cache configured - MaxSize: {}, TTL: {}", properties.cacheMaxEntries(), properties.cacheTtl());
    }

    public ResolvedIncomeLimits get(Key key, Function<Key, ResolvedIncomeLimits> loader) {
        ResolvedIncomeLimits cached = cache.getIfPresent(key);
        if (cached != null) {
            log.debug("HUD cache hit for {}", key);
            return cached;
        }
        log.debug("HUD cache miss for {}", key);
        return cache.get(key, loader);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    long estimatedSize() {
        return cache.estimatedSize();
    }
}
