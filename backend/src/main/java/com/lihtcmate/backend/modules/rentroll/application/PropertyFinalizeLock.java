package com.lihtcmate.backend.modules.rentroll.application;

import static org.springframework.http.HttpStatus.CONFLICT;
import static org.springframework.http.HttpStatus.NOT_FOUND;

import java.time.Duration;
import java.util.UUID;

import com.lihtcmate.backend.global.error.ProblemException;
import com.lihtcmate.backend.global.error.RetryableProblemException;
import com.lihtcmate.backend.modules.property.domain.Property;
import com.lihtcmate.backend.modules.property.infrastructure.persistence.PropertyRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Row lock on the property that serializes every write to its snapshots. Held until the caller's
 * transaction ends.
 */
@Component
public class PropertyFinalizeLock {

    private static final Logger log = LoggerFactory.getLogger(PropertyFinalizeLock.class);

    static final Duration RETRY_AFTER = Duration.ofSeconds(5);

    private final PropertyRepository propertyRepository;

    public PropertyFinalizeLock(PropertyRepository propertyRepository) {
        this.propertyRepository = propertyRepository;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Property acquire(UUID propertyId) {
        try {
            return propertyRepository.findByIdForUpdate(propertyId)
                    .orElseThrow(() -> new ProblemException(NOT_FOUND, "PROPERTY_NOT_FOUND", "Property %s not found".formatted(propertyId)));
        } catch (PessimisticLockingFailureException ex) {
            log.warn("Property {} is locked by another compliance operation: {}", propertyId, ex.getMessage());
            throw new RetryableProblemException(
                    CONFLICT,
                    "FINALIZE_IN_PROGRESS",
                    "Another compliance operation is running for property %s".formatted(propertyId),
                    RETRY_AFTER
            );
        }
    }
}
