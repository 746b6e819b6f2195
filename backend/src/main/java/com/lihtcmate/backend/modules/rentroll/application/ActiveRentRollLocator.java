package com.lihtcmate.backend.modules.rentroll.application;

import java.util.Optional;
import java.util.UUID;

import com.lihtcmate.backend.modules.rentroll.infrastructure.persistence.RentRollRepository;
import com.lihtcmate.backend.modules.rentroll.infrastructure.persistence.RentRollSnapshotRepository;

import org.springframework.stereotype.Component;

@Component
public class ActiveRentRollLocator {

    private final RentRollSnapshotRepository snapshotRepository;
    private final RentRollRepository rentRollRepository;

    public ActiveRentRollLocator(RentRollSnapshotRepository snapshotRepository, RentRollRepository rentRollRepository) {
        this.snapshotRepository = snapshotRepository;
        this.rentRollRepository = rentRollRepository;
    }

    public Optional<ActiveRentRoll> find(UUID propertyId) {
        return snapshotRepository.findFirstByPropertyIdAndActiveTrue(propertyId)
                .flatMap(snapshot -> rentRollRepository.findBySnapshotId(snapshot.getId())
                        .map(rentRoll -> new ActiveRentRoll(snapshot, rentRoll)));
    }
}
