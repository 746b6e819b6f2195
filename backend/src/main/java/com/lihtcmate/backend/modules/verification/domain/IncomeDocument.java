package com.lihtcmate.backend.modules.verification.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import com.lihtcmate.backend.global.jpa.AbstractTimestampedEntity;
import com.lihtcmate.backend.modules.income.domain.Paystub;
import com.lihtcmate.backend.modules.lease.domain.Resident;

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
 * Extracted income evidence for a resident. The uploaded file itself lives in storage under
 * {@code filePath}; rows copied into a later snapshot point at the same file through
 * {@code sourceDocumentId} instead of duplicating it.
 */
@Entity
@Table(name = "income_document")
public class IncomeDocument extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "resident_id", nullable = false)
    private Resident resident;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "verification_id")
    private IncomeVerification verification;

    @Column(name = "source_document_id", columnDefinition = "uuid")
    private UUID sourceDocumentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "document_type", nullable = false, length = 20)
    private DocumentType documentType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private DocumentStatus status = DocumentStatus.PROCESSING;

    @Column(name = "file_path", length = 500)
    private String filePath;

    @Column(name = "document_date")
    private LocalDate documentDate;

    @Column(name = "employer_name", length = 255)
    private String employerName;

    @Column(name = "employee_name", length = 255)
    private String employeeName;

    @Column(name = "gross_pay_amount", precision = 12, scale = 2)
    private BigDecimal grossPayAmount;

    @Column(name = "pay_frequency", length = 20)
    private String payFrequency;

    @Column(name = "pay_period_start_date")
    private LocalDate payPeriodStartDate;

    @Column(name = "pay_period_end_date")
    private LocalDate payPeriodEndDate;

    @Column(name = "tax_year")
    private Integer taxYear;

    @Column(name = "box1_wages", precision = 12, scale = 2)
    private BigDecimal box1Wages;

    @Column(name = "calculated_annualized_income", precision = 12, scale = 2)
    private BigDecimal calculatedAnnualizedIncome;

    protected IncomeDocument() {
    }

    public IncomeDocument(Resident resident, IncomeVerification verification, DocumentType documentType) {
        this.resident = resident;
        this.verification = verification;
        this.documentType = documentType;
    }

    /**
     * Row on another resident that refers to the same stored file and extracted values.
     */
    public IncomeDocument referenceFor(Resident targetResident, IncomeVerification targetVerification) {
        IncomeDocument reference = new IncomeDocument(targetResident, targetVerification, documentType);
        reference.sourceDocumentId = sourceDocumentId != null ? sourceDocumentId : id;
        reference.status = status;
        reference.filePath = filePath;
        reference.documentDate = documentDate;
        reference.employerName = employerName;
        reference.employeeName = employeeName;
        reference.grossPayAmount = grossPayAmount;
        reference.payFrequency = payFrequency;
        reference.payPeriodStartDate = payPeriodStartDate;
        reference.payPeriodEndDate = payPeriodEndDate;
        reference.taxYear = taxYear;
        reference.box1Wages = box1Wages;
        reference.calculatedAnnualizedIncome = calculatedAnnualizedIncome;
        reference.carryCreatedAt(getCreatedAt());
        return reference;
    }

    public Paystub toPaystub() {
        return new Paystub(payPeriodStartDate, payPeriodEndDate, grossPayAmount);
    }

    public boolean needsReview() {
        return status == DocumentStatus.NEEDS_REVIEW;
    }

    public UUID getId() {
        return id;
    }

    public Resident getResident() {
        return resident;
    }

    public IncomeVerification getVerification() {
        return verification;
    }

    public UUID getSourceDocumentId() {
        return sourceDocumentId;
    }

    public DocumentType getDocumentType() {
        return documentType;
    }

    public DocumentStatus getStatus() {
        return status;
    }

    public void setStatus(DocumentStatus status) {
        this.status = status;
    }

    public String getFilePath() {
        return filePath;
    }

    public void setFilePath(String filePath) {
        this.filePath = filePath;
    }

    public LocalDate getDocumentDate() {
        return documentDate;
    }

    public void setDocumentDate(LocalDate documentDate) {
        this.documentDate = documentDate;
    }

    public String getEmployerName() {
        return employerName;
    }

    public void setEmployerName(String employerName) {
        this.employerName = employerName;
    }

    public String getEmployeeName() {
        return employeeName;
    }

    public void setEmployeeName(String employeeName) {
        this.employeeName = employeeName;
    }

    public BigDecimal getGrossPayAmount() {
        return grossPayAmount;
    }

    public void setGrossPayAmount(BigDecimal grossPayAmount) {
        this.grossPayAmount = grossPayAmount;
    }

    public String getPayFrequency() {
        return payFrequency;
    }

    public void setPayFrequency(String payFrequency) {
        this.payFrequency = payFrequency;
    }

    public LocalDate getPayPeriodStartDate() {
        return payPeriodStartDate;
    }

    public void setPayPeriodStartDate(LocalDate payPeriodStartDate) {
        this.payPeriodStartDate = payPeriodStartDate;
    }

    public LocalDate getPayPeriodEndDate() {
        return payPeriodEndDate;
    }

    public void setPayPeriodEndDate(LocalDate payPeriodEndDate) {
        this.payPeriodEndDate = payPeriodEndDate;
    }

    public Integer getTaxYear() {
        return taxYear;
    }

    public void setTaxYear(Integer taxYear) {
        this.taxYear = taxYear;
    }

    public BigDecimal getBox1Wages() {
        return box1Wages;
    }

    public void setBox1Wages(BigDecimal box1Wages) {
        this.box1Wages = box1Wages;
    }

    public BigDecimal getCalculatedAnnualizedIncome() {
        return calculatedAnnualizedIncome;
    }

    public void setCalculatedAnnualizedIncome(BigDecimal calculatedAnnualizedIncome) {
        this.calculatedAnnualizedIncome = calculatedAnnualizedIncome;
    }
}
