package com.lihtcmate.backend.modules.lease.domain;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.UUID;

import com.lihtcmate.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * A person on a lease.
 * <p>
 * {@code annualizedIncome} is what the rent roll declared and is written once at ingestion.
 * {@code calculatedAnnualizedIncome} is the document-verified figure, owned by the verification workflow.
 */
@Entity
@Table(name = "resident")
public class Resident extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "lease_id", nullable = false)
    private Lease lease;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "annualized_income", precision = 12, scale = 2, updatable = false)
    private BigDecimal annualizedIncome;

    @Column(name = "calculated_annualized_income", precision = 12, scale = 2)
    private BigDecimal calculatedAnnualizedIncome;

    @Column(name = "income_finalized", nullable = false)
    private boolean incomeFinalized;

    @Column(name = "has_no_income", nullable = false)
    private boolean hasNoIncome;

    @Column(name = "finalized_at")
    private OffsetDateTime finalizedAt;

    protected Resident() {
    }

    public Resident(Lease lease, String name, BigDecimal annualizedIncome) {
        this.lease = lease;
        this.name = name;
        this.annualizedIncome = annualizedIncome;
    }

    /**
     * New row on {@code target} with this resident's declared income, verification state and creation time.
     */
    public Resident copyFor(Lease target) {
        Resident copy = new Resident(target, name, annualizedIncome);
        copy.calculatedAnnualizedIncome = calculatedAnnualizedIncome;
        copy.incomeFinalized = incomeFinalized;
        copy.hasNoIncome = hasNoIncome;
        copy.finalizedAt = finalizedAt;
        copy.carryCreatedAt(getCreatedAt());
        return copy;
    }

    public boolean isFinalized() {
        return incomeFinalized || hasNoIncome;
    }

    /**
     * Income counted as verified: the calculated figure once finalized, otherwise zero.
     */
    public BigDecimal verifiedIncome() {
        if (!incomeFinalized || calculatedAnnualizedIncome == null) {
            return BigDecimal.ZERO;
        }
        return calculatedAnnualizedIncome;
    }

    public BigDecimal declaredIncome() {
        return annualizedIncome == null ? BigDecimal.ZERO : annualizedIncome;
    }

    /**
     * Trimmed, case-insensitive key used to pair residents across leases.
     */
    public String nameKey() {
        return nameKey(name);
    }

    public static String nameKey(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    public void finalizeIncome(BigDecimal verifiedIncome, OffsetDateTime at) {
        this.calculatedAnnualizedIncome = verifiedIncome;
        this.incomeFinalized = true;
        this.hasNoIncome = false;
        this.finalizedAt = at;
    }

    public void markNoIncome(OffsetDateTime at) {
        this.calculatedAnnualizedIncome = BigDecimal.ZERO;
        this.incomeFinalized = true;
        this.hasNoIncome = true;
        this.finalizedAt = at;
    }

    public void unfinalize() {
        this.calculatedAnnualizedIncome = null;
        this.incomeFinalized = false;
        this.hasNoIncome = false;
        this.finalizedAt = null;
    }

    /**
     * Copies another resident's verified outcome onto this one.
     */
    public void inheritVerification(Resident source, OffsetDateTime fallbackFinalizedAt) {
        this.calculatedAnnualizedIncome = source.calculatedAnnualizedIncome;
        this.incomeFinalized = source.incomeFinalized;
        this.hasNoIncome = source.hasNoIncome;
        this.finalizedAt = source.finalizedAt != null ? source.finalizedAt : fallbackFinalizedAt;
    }

    public UUID getId() {
        return id;
    }

    public Lease getLease() {
        return lease;
    }

    public String getName() {
        return name;
    }

    public BigDecimal getAnnualizedIncome() {
        return annualizedIncome;
    }

    public BigDecimal getCalculatedAnnualizedIncome() {
        return calculatedAnnualizedIncome;
    }

    public boolean isIncomeFinalized() {
        return incomeFinalized;
    }

    public void setIncomeFinalized(boolean incomeFinalized) {
        this.incomeFinalized = incomeFinalized;
    }

    public boolean isHasNoIncome() {
        return hasNoIncome;
    }

    public OffsetDateTime getFinalizedAt() {
        return finalizedAt;
    }

    public void setFinalizedAt(OffsetDateTime finalizedAt) {
        this.finalizedAt = finalizedAt;
    }
}
