package com.lihtcmate.backend.modules.rentroll.domain;

import java.util.UUID;

import com.lihtcmate.backend.global.jpa.AbstractTimestampedEntity;
import com.lihtcmate.backend.modules.lease.domain.Lease;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

/**
 * Records that a lease was listed on a rent roll.
 */
@Entity
@Table(name = "tenancy", uniqueConstraints = @UniqueConstraint(name = "uq_tenancy_lease_rent_roll", columnNames = {"lease_id", "rent_roll_id"}))
public class Tenancy extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "lease_id", nullable = false)
    private Lease lease;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "rent_roll_id", nullable = false)
    private RentRoll rentRoll;

    protected Tenancy() {
    }

    public Tenancy(Lease lease, RentRoll rentRoll) {
        this.lease = lease;
        this.rentRoll = rentRoll;
    }

    public UUID getId() {
        return id;
    }

    public Lease getLease() {
        return lease;
    }

    public RentRoll getRentRoll() {
        return rentRoll;
    }
}
