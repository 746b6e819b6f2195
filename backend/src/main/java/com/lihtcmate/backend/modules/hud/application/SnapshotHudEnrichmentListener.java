package com.lihtcmate.backend.modules.hud.application;

import com.lihtcmate.backend.modules.rentroll.application.SnapshotFinalizedEvent;

import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
public class SnapshotHudEnrichmentListener {

    private final SnapshotHudEnrichmentService enrichmentService;

    public SnapshotHudEnrichmentListener(SnapshotHudEnrichmentService enrichmentService) {
        this.enrichmentService = enrichmentService;
    }

    @Async("hudEnrichmentExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onSnapshotFinalized(SnapshotFinalizedEvent event) {
        enrichmentService.enrich(event.snapshotId());
    }
}
