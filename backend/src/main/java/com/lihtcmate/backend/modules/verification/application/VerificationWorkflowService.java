package com.lihtcmate.backend.modules.verification.application;

import static org.springframework.http.HttpStatus.CONFLICT;
import static org.springframework.http.HttpStatus.NOT_FOUND;
import static org.springframework.http.HttpStatus.UNPROCESSABLE_ENTITY;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.lihtcmate.backend.global.error.ProblemException;
import com.lihtcmate.backend.modules.income.domain.IncomeAnalysisException;
import com.lihtcmate.backend.modules.lease.domain.Lease;
import com.lihtcmate.backend.modules.lease.domain.Resident;
import com.lihtcmate.backend.modules.lease.infrastructure.persistence.LeaseRepository;
import com.lihtcmate.backend.modules.lease.infrastructure.persistence.ResidentRepository;
import com.lihtcmate.backend.modules.verification.domain.DocumentStatus;
import com.lihtcmate.backend.modules.verification.domain.IncomeDocument;
import com.lihtcmate.backend.modules.verification.domain.IncomeVerification;
import com.lihtcmate.backend.modules.verification.domain.LeaseVerificationStatusEngine;
import com.lihtcmate.backend.modules.verification.infrastructure.persistence.IncomeDocumentRepository;
import com.lihtcmate.backend.modules.verification.infrastructure.persistence.IncomeVerificationRepository;
import com.lihtcmate.backend.modules.verification.presentation.dto.DocumentResponse;
import com.lihtcmate.backend.modules.verification.presentation.dto.FinalizeResidentRequest;
import com.lihtcmate.backend.modules.verification.presentation.dto.RegisterDocumentRequest;
import com.lihtcmate.backend.modules.verification.presentation.dto.ResidentFinalizationResponse;
import com.lihtcmate.backend.modules.verification.presentation.dto.StartVerificationRequest;
import com.lihtcmate.backend.modules.verification.presentation.dto.VerificationResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The only writer of residents' verified income: document intake, review approval and per-resident
 * finalization. A verification finalizes itself once every resident on the lease is finalized.
 */
@Service
@Transactional
public class VerificationWorkflowService {

    private static final Logger log = LoggerFactory.getLogger(VerificationWorkflowService.class);

    private final LeaseRepository leaseRepository;
    private final ResidentRepository residentRepository;
    private final IncomeVerificationRepository incomeVerificationRepository;
    private final IncomeDocumentRepository incomeDocumentRepository;
    private final ResidentIncomeCalculator residentIncomeCalculator;
    private final LeaseAggregateLoader leaseAggregateLoader;
    private final Clock clock;

    public VerificationWorkflowService(
            LeaseRepository leaseRepository,
            ResidentRepository residentRepository,
            IncomeVerificationRepository incomeVerificationRepository,
            IncomeDocumentRepository incomeDocumentRepository,
            ResidentIncomeCalculator residentIncomeCalculator,
            LeaseAggregateLoader leaseAggregateLoader,
            Clock clock
    ) {
        this.leaseRepository = leaseRepository;
        this.residentRepository = residentRepository;
        this.incomeVerificationRepository = incomeVerificationRepository;
        this.incomeDocumentRepository = incomeDocumentRepository;
        this.residentIncomeCalculator = residentIncomeCalculator;
        this.leaseAggregateLoader = leaseAggregateLoader;
        this.clock = clock;
    }

    /**
     * Opens a verification for the lease, or returns the one already in progress.
     */
    public VerificationResponse startVerification(UUID leaseId, StartVerificationRequest request) {
        Lease lease = leaseRepository.findById(leaseId)
                .orElseThrow(() -> problem(NOT_FOUND, "LEASE_NOT_FOUND", "Lease %s not found".formatted(leaseId)));
        IncomeVerification verification = incomeVerificationRepository.findFirstByLeaseIdOrderByCreatedAtDesc(leaseId)
                .filter(existing -> !existing.isFinalized())
                .orElseGet(() -> incomeVerificationRepository.save(new IncomeVerification(lease, request.reason())));
        return VerificationResponse.from(verification);
    }

    public DocumentResponse registerDocument(UUID verificationId, RegisterDocumentRequest request) {
        IncomeVerification verification = loadVerification(verificationId);
        Resident resident = loadResidentOnLease(request.residentId(), verification.getLease());

        IncomeDocument document = new IncomeDocument(resident, verification, request.documentType());
        document.setStatus(request.status());
        document.setFilePath(request.filePath());
        document.setDocumentDate(request.documentDate());
        document.setEmployerName(request.employerName());
        document.setEmployeeName(request.employeeName());
        document.setGrossPayAmount(request.grossPayAmount());
        document.setPayFrequency(request.payFrequency());
        document.setPayPeriodStartDate(request.payPeriodStartDate());
        document.setPayPeriodEndDate(request.payPeriodEndDate());
        document.setTaxYear(request.taxYear());
        document.setBox1Wages(request.box1Wages());
        document.setCalculatedAnnualizedIncome(request.calculatedAnnualizedIncome());
        incomeDocumentRepository.save(document);
        return DocumentResponse.from(document);
    }

    public DocumentResponse approveDocument(UUID documentId) {
        IncomeDocument document = incomeDocumentRepository.findById(documentId)
                .orElseThrow(() -> problem(NOT_FOUND, "DOCUMENT_NOT_FOUND", "Document %s not found".formatted(documentId)));
        if (!document.needsReview()) {
            throw problem(CONFLICT, "DOCUMENT_NOT_IN_REVIEW", "Document %s is %s, not NEEDS_REVIEW".formatted(documentId, document.getStatus()));
        }
        document.setStatus(DocumentStatus.COMPLETED);
        return DocumentResponse.from(document);
    }

    public ResidentFinalizationResponse finalizeResident(UUID verificationId, UUID residentId, FinalizeResidentRequest request) {
        IncomeVerification verification = loadOpenVerification(verificationId);
        Resident resident = loadResidentOnLease(residentId, verification.getLease());

        BigDecimal verifiedIncome = request != null && request.verifiedIncome() != null
                ? request.verifiedIncome()
                : computeFromDocuments(resident);
        resident.finalizeIncome(verifiedIncome, OffsetDateTime.now(clock));
        return completeIfAllFinalized(verification, resident);
    }

    public ResidentFinalizationResponse markNoIncome(UUID verificationId, UUID residentId) {
        IncomeVerification verification = loadOpenVerification(verificationId);
        Resident resident = loadResidentOnLease(residentId, verification.getLease());
        resident.markNoIncome(OffsetDateTime.now(clock));
        return completeIfAllFinalized(verification, resident);
    }

    /**
     * Reverts a resident to unverified and reopens the verification.
     */
    public ResidentFinalizationResponse unfinalizeResident(UUID verificationId, UUID residentId) {
        IncomeVerification verification = loadVerification(verificationId);
        Resident resident = loadResidentOnLease(residentId, verification.getLease());
        resident.unfinalize();
        if (verification.isFinalized()) {
            verification.reopen();
        }
        residentRepository.flush();
        LeaseAggregate aggregate = leaseAggregateLoader.load(verification.getLease());
        return new ResidentFinalizationResponse(
                resident.getId(),
                null,
                false,
                false,
                aggregate.verifiedIncome(),
                aggregate.status()
        );
    }

    private BigDecimal computeFromDocuments(Resident resident) {
        List<IncomeDocument> completed = incomeDocumentRepository
                .findByResidentIdAndStatusOrderByCreatedAtAsc(resident.getId(), DocumentStatus.COMPLETED);
        try {
            return residentIncomeCalculator.calculate(completed);
        } catch (IncomeAnalysisException ex) {
            log.info("Resident {} cannot be finalized yet: {} ({})", resident.getId(), ex.getMessage(), ex.getReason());
            throw problem(UNPROCESSABLE_ENTITY, ex.getReason().name(), ex.getMessage());
        }
    }

    private ResidentFinalizationResponse completeIfAllFinalized(IncomeVerification verification, Resident resident) {
        residentRepository.flush();
        LeaseAggregate aggregate = leaseAggregateLoader.load(verification.getLease());
        boolean allFinalized = aggregate.residents().stream().allMatch(Resident::isFinalized);
        BigDecimal totalVerified = LeaseVerificationStatusEngine.totalVerified(aggregate.residents());
        if (allFinalized) {
            verification.finalizeWith(totalVerified, OffsetDateTime.now(clock));
            log.info("Verification {} finalized for lease {} with verified income {}",
                    verification.getId(), verification.getLease().getId(), totalVerified);
        }
        return new ResidentFinalizationResponse(
                resident.getId(),
                resident.getCalculatedAnnualizedIncome(),
                true,
                allFinalized,
                totalVerified,
                aggregate.status()
        );
    }

    private IncomeVerification loadVerification(UUID verificationId) {
        return incomeVerificationRepository.findById(verificationId)
                .orElseThrow(() -> problem(NOT_FOUND, "VERIFICATION_NOT_FOUND", "Verification %s not found".formatted(verificationId)));
    }

    private IncomeVerification loadOpenVerification(UUID verificationId) {
        IncomeVerification verification = loadVerification(verificationId);
        if (verification.isFinalized()) {
            throw problem(CONFLICT, "VERIFICATION_ALREADY_FINALIZED", "Verification %s is already finalized".formatted(verificationId));
        }
        return verification;
    }

    private Resident loadResidentOnLease(UUID residentId, Lease lease) {
        Resident resident = residentRepository.findById(residentId)
                .orElseThrow(() -> problem(NOT_FOUND, "RESIDENT_NOT_FOUND", "Resident %s not found".formatted(residentId)));
        if (!resident.getLease().getId().equals(lease.getId())) {
            throw problem(UNPROCESSABLE_ENTITY, "RESIDENT_NOT_ON_LEASE", "Resident %s is not on lease %s".formatted(residentId, lease.getId()));
        }
        return resident;
    }

    private ProblemException problem(HttpStatus status, String code, String detail) {
        return new ProblemException(status, code, detail);
    }
}
