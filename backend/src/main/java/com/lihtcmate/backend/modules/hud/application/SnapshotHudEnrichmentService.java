package com.lihtcmate.backend.modules.hud.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.lihtcmate.backend.modules.hud.domain.ResolvedIncomeLimits;
import com.lihtcmate.backend.modules.property.domain.Property;
import com.lihtcmate.backend.modules.rentroll.domain.RentRollSnapshot;
import com.lihtcmate.backend.modules.rentroll.infrastructure.persistence.RentRollSnapshotRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Stores the HUD income limits in force for a snapshot's rent-roll year on the snapshot itself.
 * Runs outside the finalize transaction; the HUD call holds no database connection.
 */
@Service
public class SnapshotHudEnrichmentService {

    private static final Logger log = LoggerFactory.getLogger(SnapshotHudEnrichmentService.class);

    private final RentRollSnapshotRepository snapshotRepository;
    private final HudIncomeLimitsService hudIncomeLimitsService;
    private final Clock clock;

    public SnapshotHudEnrichmentService(
            RentRollSnapshotRepository snapshotRepository,
            HudIncomeLimitsService hudIncomeLimitsService,
            Clock clock
    ) {
        this.snapshotRepository = snapshotRepository;
        this.hudIncomeLimitsService = hudIncomeLimitsService;
        this.clock = clock;
    }

    /**
     * @return {@code true} when limits were stored; failures are logged and reported as {@code false}
     */
    public boolean enrich(UUID snapshotId) {
        RentRollSnapshot snapshot = snapshotRepository.findWithPropertyById(snapshotId).orElse(null);
        if (snapshot == null) {
            log.warn("[ALERT][Hud][ENRICH] snapshot={} errorCode=SNAPSHOT_NOT_FOUND", snapshotId);
            return false;
        }
        if (snapshot.hasHudData()) {
            return true;
        }

        Property property = snapshot.getProperty();
        int year = snapshot.getUploadDate().getYear();
        try {
            ResolvedIncomeLimits resolved = hudIncomeLimitsService.getIncomeLimitsWithFallback(
                    property.getCounty(), property.getState(), year, property.getPlacedInServiceDate());
            snapshot.recordHudData(resolved.limits().asMap(), resolved.year(), resolved.regime().name(), OffsetDateTime.now(clock));
            snapshotRepository.save(snapshot);
            log.info("Snapshot {} enriched with HUD {} limits for {} ({})", snapshotId, resolved.regime(), resolved.year(), property.getCounty());
            return true;
        } catch (RuntimeException ex) {
            log.warn("[ALERT][Hud][ENRICH] snapshot={} property={} year={} detail={}",
                    snapshotId,
                    property.getId(),
                    year,
                    ex.getMessage(),
                    ex);
            return false;
        }
    }
}
