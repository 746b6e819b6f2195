package com.lihtcmate.backend.modules.rentroll.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.lihtcmate.backend.modules.rentroll.domain.RentRoll;

import org.springframework.data.jpa.repository.JpaRepository;

public interface RentRollRepository extends JpaRepository<RentRoll, UUID> {

    Optional<RentRoll> findBySnapshotId(UUID snapshotId);
}
