package com.lihtcmate.backend.modules.hud.application;

import static org.springframework.http.HttpStatus.NOT_FOUND;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;

import com.lihtcmate.backend.global.error.ProblemException;
import com.lihtcmate.backend.modules.hud.domain.AmiBucketCalculator;
import com.lihtcmate.backend.modules.hud.domain.ComplianceOptionParser;
import com.lihtcmate.backend.modules.hud.domain.HudIncomeLimits;
import com.lihtcmate.backend.modules.hud.domain.HudServiceException;
import com.lihtcmate.backend.modules.hud.domain.LimitRegime;
import com.lihtcmate.backend.modules.hud.domain.MaxRentCalculator;
import com.lihtcmate.backend.modules.hud.domain.ResolvedIncomeLimits;
import com.lihtcmate.backend.modules.hud.presentation.dto.LeaseAmiBucketResponse;
import com.lihtcmate.backend.modules.hud.presentation.dto.MaxRentsResponse;
import com.lihtcmate.backend.modules.lease.domain.Lease;
import com.lihtcmate.backend.modules.lease.domain.Resident;
import com.lihtcmate.backend.modules.lease.infrastructure.persistence.LeaseRepository;
import com.lihtcmate.backend.modules.lease.infrastructure.persistence.ResidentRepository;
import com.lihtcmate.backend.modules.property.domain.Property;
import com.lihtcmate.backend.modules.property.infrastructure.persistence.PropertyRepository;
import com.lihtcmate.backend.modules.rentroll.domain.RentRollSnapshot;
import com.lihtcmate.backend.modules.rentroll.infrastructure.persistence.RentRollSnapshotRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * AMI projections. Not transactional: reads go through fetch-joined queries so no connection is
 * held while the HUD API is called.
 */
@Service
public class AmiBucketService {

    private static final Logger log = LoggerFactory.getLogger(AmiBucketService.class);

    private static final List<Integer> STANDARD_RENT_THRESHOLDS = List.of(30, 50, 60, 80);

    private final LeaseRepository leaseRepository;
    private final ResidentRepository residentRepository;
    private final PropertyRepository propertyRepository;
    private final RentRollSnapshotRepository snapshotRepository;
    private final HudIncomeLimitsService hudIncomeLimitsService;
    private final Clock clock;

    public AmiBucketService(
            LeaseRepository leaseRepository,
            ResidentRepository residentRepository,
            PropertyRepository propertyRepository,
            RentRollSnapshotRepository snapshotRepository,
            HudIncomeLimitsService hudIncomeLimitsService,
            Clock clock
    ) {
        this.leaseRepository = leaseRepository;
        this.residentRepository = residentRepository;
        this.propertyRepository = propertyRepository;
        this.snapshotRepository = snapshotRepository;
        this.hudIncomeLimitsService = hudIncomeLimitsService;
        this.clock = clock;
    }

    public LeaseAmiBucketResponse getLeaseAmiBucket(UUID leaseId) {
        Lease lease = leaseRepository.findDetailedById(leaseId)
                .orElseThrow(() -> problem(NOT_FOUND, "LEASE_NOT_FOUND", "Lease %s not found".formatted(leaseId)));
        Property property = lease.getUnit().getProperty();
        List<Resident> residents = residentRepository.findByLeaseIdOrderByCreatedAtAsc(leaseId);
        BigDecimal totalIncome = residents.stream()
                .map(Resident::verifiedIncome)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        String bucket;
        ResolvedIncomeLimits resolved = null;
        if (residents.isEmpty()) {
            bucket = AmiBucketCalculator.VACANT;
        } else if (totalIncome.signum() <= 0) {
            bucket = AmiBucketCalculator.NO_INCOME_INFORMATION;
        } else {
            try {
                resolved = limitsFor(lease, property);
                bucket = AmiBucketCalculator.getActualAmiBucket(
                        totalIncome, residents.size(), resolved.limits(), property.effectiveComplianceOption());
            } catch (HudServiceException ex) {
                log.warn("AMI bucket for lease {} degraded: {}", leaseId, ex.getDetailMessage());
                bucket = AmiBucketCalculator.HUD_UNAVAILABLE;
            } catch (RuntimeException ex) {
                log.error("AMI bucket for lease {} failed", leaseId, ex);
                bucket = AmiBucketCalculator.ERROR_LOADING;
            }
        }

        return new LeaseAmiBucketResponse(
                lease.getId(),
                lease.getName(),
                residents.size(),
                totalIncome,
                bucket,
                resolved != null ? resolved.year() : null,
                resolved != null ? resolved.regime().name() : null,
                "%s, %s".formatted(property.getCounty(), property.getState())
        );
    }

    /**
     * @throws HudServiceException when neither the requested nor the fallback year is available
     */
    public MaxRentsResponse maxRents(UUID propertyId, Integer year) {
        Property property = propertyRepository.findById(propertyId)
                .orElseThrow(() -> problem(NOT_FOUND, "PROPERTY_NOT_FOUND", "Property %s not found".formatted(propertyId)));
        int requestedYear = year != null ? year : LocalDate.now(clock).getYear();

        ResolvedIncomeLimits resolved = hudIncomeLimitsService.getIncomeLimitsWithFallback(
                property.getCounty(), property.getState(), requestedYear, property.getPlacedInServiceDate());

        TreeSet<Integer> thresholds = new TreeSet<>(STANDARD_RENT_THRESHOLDS);
        thresholds.addAll(ComplianceOptionParser.thresholds(property.effectiveComplianceOption()));

        return new MaxRentsResponse(
                propertyId,
                requestedYear,
                resolved.year(),
                resolved.year() != requestedYear,
                resolved.regime().name(),
                MaxRentCalculator.maxRents(resolved.limits(), List.copyOf(thresholds))
        );
    }

    private ResolvedIncomeLimits limitsFor(Lease lease, Property property) {
        Optional<ResolvedIncomeLimits> stored = storedLimits(lease.getSnapshot())
                .or(() -> snapshotRepository.findFirstByPropertyIdAndActiveTrue(property.getId()).flatMap(this::storedLimits));
        if (stored.isPresent()) {
            return stored.get();
        }
        return hudIncomeLimitsService.getIncomeLimitsWithFallback(
                property.getCounty(), property.getState(), LocalDate.now(clock).getYear(), property.getPlacedInServiceDate());
    }

    private Optional<ResolvedIncomeLimits> storedLimits(RentRollSnapshot snapshot) {
        if (snapshot == null || !snapshot.hasHudData()) {
            return Optional.empty();
        }
        LimitRegime regime = snapshot.getHudRegime() != null ? LimitRegime.valueOf(snapshot.getHudRegime()) : LimitRegime.STANDARD;
        return Optional.of(new ResolvedIncomeLimits(HudIncomeLimits.of(snapshot.getHudIncomeLimits()), snapshot.getHudDataYear(), regime));
    }

    private ProblemException problem(HttpStatus status, String code, String detail) {
        return new ProblemException(status, code, detail);
    }
}
