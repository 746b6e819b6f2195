package com.lihtcmate.backend.modules.verification.presentation;

import java.util.UUID;

import com.lihtcmate.backend.modules.verification.application.VerificationWorkflowService;
import com.lihtcmate.backend.modules.verification.presentation.dto.DocumentResponse;
import com.lihtcmate.backend.modules.verification.presentation.dto.FinalizeResidentRequest;
import com.lihtcmate.backend.modules.verification.presentation.dto.RegisterDocumentRequest;
import com.lihtcmate.backend.modules.verification.presentation.dto.ResidentFinalizationResponse;
import com.lihtcmate.backend.modules.verification.presentation.dto.StartVerificationRequest;
import com.lihtcmate.backend.modules.verification.presentation.dto.VerificationResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Tag(name = "Income verification")
public class VerificationWorkflowController {

    private final VerificationWorkflowService verificationWorkflowService;

    public VerificationWorkflowController(VerificationWorkflowService verificationWorkflowService) {
        this.verificationWorkflowService = verificationWorkflowService;
    }

    @PostMapping("/leases/{leaseId}/verifications")
    public ResponseEntity<VerificationResponse> startVerification(
            @PathVariable UUID leaseId,
            @Valid @RequestBody StartVerificationRequest request
    ) {
        return ResponseEntity.ok(verificationWorkflowService.startVerification(leaseId, request));
    }

    @Operation(summary = "Register an extracted document", description = "Called with the validated output of the OCR service.")
    @PostMapping("/verifications/{verificationId}/documents")
    public ResponseEntity<DocumentResponse> registerDocument(
            @PathVariable UUID verificationId,
            @Valid @RequestBody RegisterDocumentRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(verificationWorkflowService.registerDocument(verificationId, request));
    }

    @PostMapping("/documents/{documentId}/approve")
    public ResponseEntity<DocumentResponse> approveDocument(@PathVariable UUID documentId) {
        return ResponseEntity.ok(verificationWorkflowService.approveDocument(documentId));
    }

    @Operation(summary = "Finalize a resident's verified income", description = "Without an explicit amount the income is computed from the resident's completed documents.")
    @PostMapping("/verifications/{verificationId}/residents/{residentId}/finalize")
    public ResponseEntity<ResidentFinalizationResponse> finalizeResident(
            @PathVariable UUID verificationId,
            @PathVariable UUID residentId,
            @Valid @RequestBody(required = false) FinalizeResidentRequest request
    ) {
        return ResponseEntity.ok(verificationWorkflowService.finalizeResident(verificationId, residentId, request));
    }

    @PostMapping("/verifications/{verificationId}/residents/{residentId}/no-income")
    public ResponseEntity<ResidentFinalizationResponse> markNoIncome(
            @PathVariable UUID verificationId,
            @PathVariable UUID residentId
    ) {
        return ResponseEntity.ok(verificationWorkflowService.markNoIncome(verificationId, residentId));
    }

    @PostMapping("/verifications/{verificationId}/residents/{residentId}/unfinalize")
    public ResponseEntity<ResidentFinalizationResponse> unfinalizeResident(
            @PathVariable UUID verificationId,
            @PathVariable UUID residentId
    ) {
        return ResponseEntity.ok(verificationWorkflowService.unfinalizeResident(verificationId, residentId));
    }
}
