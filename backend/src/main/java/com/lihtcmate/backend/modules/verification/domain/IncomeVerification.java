package com.lihtcmate.backend.modules.verification.domain;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.lihtcmate.backend.global.jpa.AbstractTimestampedEntity;
import com.lihtcmate.backend.modules.lease.domain.Lease;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Verification workflow for a lease. A lease may accumulate several; the newest by creation time is authoritative.
 */
@Entity
@Table(name = "income_verification")
public class IncomeVerification extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "lease_id", nullable = false)
    private Lease lease;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private VerificationStatus status = VerificationStatus.IN_PROGRESS;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", length = 30)
    private VerificationReason reason;

    @Column(name = "finalized_at")
    private OffsetDateTime finalizedAt;

    @Column(name = "calculated_verified_income", precision = 12, scale = 2)
    private BigDecimal calculatedVerifiedIncome;

    protected IncomeVerification() {
    }

    public IncomeVerification(Lease lease, VerificationReason reason) {
        this.lease = lease;
        this.reason = reason;
    }

    public IncomeVerification copyFor(Lease target) {
        IncomeVerification copy = new IncomeVerification(target, reason);
        copy.status = status;
        copy.finalizedAt = finalizedAt;
        copy.calculatedVerifiedIncome = calculatedVerifiedIncome;
        copy.carryCreatedAt(getCreatedAt());
        return copy;
    }

    public void finalizeWith(BigDecimal verifiedIncome, OffsetDateTime at) {
        this.status = VerificationStatus.FINALIZED;
        this.calculatedVerifiedIncome = verifiedIncome;
        this.finalizedAt = at;
    }

    public void reopen() {
        this.status = VerificationStatus.IN_PROGRESS;
        this.calculatedVerifiedIncome = null;
        this.finalizedAt = null;
    }

    public boolean isFinalized() {
        return status.isFinalized();
    }

    public UUID getId() {
        return id;
    }

    public Lease getLease() {
        return lease;
    }

    public VerificationStatus getStatus() {
        return status;
    }

    public VerificationReason getReason() {
        return reason;
    }

    public OffsetDateTime getFinalizedAt() {
        return finalizedAt;
    }

    public BigDecimal getCalculatedVerifiedIncome() {
        return calculatedVerifiedIncome;
    }
}
