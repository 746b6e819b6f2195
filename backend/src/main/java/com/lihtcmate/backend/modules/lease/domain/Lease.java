package com.lihtcmate.backend.modules.lease.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

import com.lihtcmate.backend.global.jpa.AbstractTimestampedEntity;
import com.lihtcmate.backend.modules.property.domain.Unit;
import com.lihtcmate.backend.modules.rentroll.domain.RentRollSnapshot;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * A lease on a unit. Whether it is current or future is never stored; see {@link LeaseTiming}.
 * <p>
 * {@code snapshot} is the rent-roll snapshot the row was created in. Manual future leases entered
 * before the first upload have none.
 */
@Entity
@Table(name = "lease")
public class Lease extends AbstractTimestampedEntity {

    public static final String PROCESSED_PREFIX = "[PROCESSED]";

    static final int NAME_MAX_LENGTH = 255;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "unit_id", nullable = false)
    private Unit unit;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "snapshot_id")
    private RentRollSnapshot snapshot;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "lease_start_date")
    private LocalDate leaseStartDate;

    @Column(name = "lease_end_date")
    private LocalDate leaseEndDate;

    @Column(name = "lease_rent", precision = 12, scale = 2)
    private BigDecimal leaseRent;

    protected Lease() {
    }

    public Lease(Unit unit, RentRollSnapshot snapshot, String name) {
        this.unit = unit;
        this.snapshot = snapshot;
        this.name = fitName(name);
    }

    /**
     * New row for {@code target} carrying this lease's terms and creation time.
     */
    public Lease copyInto(RentRollSnapshot target) {
        Lease copy = new Lease(unit, target, name);
        copy.leaseStartDate = leaseStartDate;
        copy.leaseEndDate = leaseEndDate;
        copy.leaseRent = leaseRent;
        copy.carryCreatedAt(getCreatedAt());
        return copy;
    }

    public boolean hasSameTerm(LocalDate startDate, LocalDate endDate) {
        return Objects.equals(leaseStartDate, startDate) && Objects.equals(leaseEndDate, endDate);
    }

    public boolean isProcessed() {
        return name != null && name.startsWith(PROCESSED_PREFIX);
    }

    public void markProcessed() {
        if (!isProcessed()) {
            this.name = fitName(PROCESSED_PREFIX + " " + name);
        }
    }

    private static String fitName(String name) {
        if (name == null || name.length() <= NAME_MAX_LENGTH) {
            return name;
        }
        return name.substring(0, NAME_MAX_LENGTH);
    }

    public UUID getId() {
        return id;
    }

    public Unit getUnit() {
        return unit;
    }

    public RentRollSnapshot getSnapshot() {
        return snapshot;
    }

    public String getName() {
        return name;
    }

    public LocalDate getLeaseStartDate() {
        return leaseStartDate;
    }

    public void setLeaseStartDate(LocalDate leaseStartDate) {
        this.leaseStartDate = leaseStartDate;
    }

    public LocalDate getLeaseEndDate() {
        return leaseEndDate;
    }

    public void setLeaseEndDate(LocalDate leaseEndDate) {
        this.leaseEndDate = leaseEndDate;
    }

    public BigDecimal getLeaseRent() {
        return leaseRent;
    }

    public void setLeaseRent(BigDecimal leaseRent) {
        this.leaseRent = leaseRent;
    }
}
