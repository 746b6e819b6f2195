package com.lihtcmate.backend.modules.verification.presentation;

import java.util.UUID;

import com.lihtcmate.backend.modules.verification.application.VerificationStatusService;
import com.lihtcmate.backend.modules.verification.presentation.dto.LeaseStatusResponse;
import com.lihtcmate.backend.modules.verification.presentation.dto.PropertyVerificationSummaryResponse;
import com.lihtcmate.backend.modules.verification.presentation.dto.UnitStatusResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Tag(name = "Verification status")
public class VerificationStatusController {

    private final VerificationStatusService verificationStatusService;

    public VerificationStatusController(VerificationStatusService verificationStatusService) {
        this.verificationStatusService = verificationStatusService;
    }

    @GetMapping("/leases/{leaseId}/verification-status")
    public ResponseEntity<LeaseStatusResponse> getLeaseStatus(@PathVariable UUID leaseId) {
        return ResponseEntity.ok(verificationStatusService.getLeaseVerificationStatus(leaseId));
    }

    @Operation(summary = "Unit verification status", description = "Status of the unit's current lease, or of its newest future lease when the unit is not on the active rent roll.")
    @GetMapping("/units/{unitId}/verification-status")
    public ResponseEntity<UnitStatusResponse> getUnitStatus(@PathVariable UUID unitId) {
        return ResponseEntity.ok(verificationStatusService.getUnitVerificationStatus(unitId));
    }

    @GetMapping("/properties/{propertyId}/verification-summary")
    public ResponseEntity<PropertyVerificationSummaryResponse> getPropertySummary(@PathVariable UUID propertyId) {
        return ResponseEntity.ok(verificationStatusService.getPropertySummary(propertyId));
    }
}
