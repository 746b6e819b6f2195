package com.lihtcmate.backend.modules.hud.application;

import java.util.List;

import com.lihtcmate.backend.modules.rentroll.domain.RentRollSnapshot;
import com.lihtcmate.backend.modules.rentroll.infrastructure.persistence.RentRollSnapshotRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Retries active snapshots whose post-commit enrichment failed, e.g. while HUD was down.
 */
@Component
public class SnapshotHudEnrichmentScheduler {

    private static final Logger log = LoggerFactory.getLogger(SnapshotHudEnrichmentScheduler.class);

    private final RentRollSnapshotRepository snapshotRepository;
    private final SnapshotHudEnrichmentService enrichmentService;

    public SnapshotHudEnrichmentScheduler(
            RentRollSnapshotRepository snapshotRepository,
            SnapshotHudEnrichmentService enrichmentService
    ) {
        this.snapshotRepository = snapshotRepository;
        this.enrichmentService = enrichmentService;
    }

    @Scheduled(
            initialDelayString = "${app.hud.enrichment-initial-delay:PT1M}",
            fixedDelayString = "${app.hud.enrichment-interval:PT15M}"
    )
    public void retryMissingHudData() {
        List<RentRollSnapshot> pending = snapshotRepository.findActiveWithoutHudData();
        if (pending.isEmpty()) {
            return;
        }
        long enriched = pending.stream()
                .filter(snapshot -> enrichmentService.enrich(snapshot.getId()))
                .count();
        if (enriched < pending.size()) {
            log.warn("[ALERT][Hud][RETRY] pending={} enriched={}", pending.size(), enriched);
        } else {
            log.info("HUD enrichment retry completed for {} snapshots", enriched);
        }
    }
}
