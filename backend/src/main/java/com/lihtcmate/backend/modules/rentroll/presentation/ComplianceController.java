package com.lihtcmate.backend.modules.rentroll.presentation;

import java.util.UUID;

import com.lihtcmate.backend.modules.rentroll.application.ComplianceFinalizeService;
import com.lihtcmate.backend.modules.rentroll.application.DiscrepancyResolutionService;
import com.lihtcmate.backend.modules.rentroll.application.InheritanceResolutionService;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.DiscrepancyResolutionResponse;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.FinalizeComplianceRequest;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.FinalizeComplianceResponse;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.InheritanceResolutionResponse;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.ResolveDiscrepancyRequest;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.ResolveInheritanceRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/properties/{propertyId}/compliance")
@Tag(name = "Compliance uploads")
public class ComplianceController {

    private final ComplianceFinalizeService complianceFinalizeService;
    private final InheritanceResolutionService inheritanceResolutionService;
    private final DiscrepancyResolutionService discrepancyResolutionService;

    public ComplianceController(
            ComplianceFinalizeService complianceFinalizeService,
            InheritanceResolutionService inheritanceResolutionService,
            DiscrepancyResolutionService discrepancyResolutionService
    ) {
        this.complianceFinalizeService = complianceFinalizeService;
        this.inheritanceResolutionService = inheritanceResolutionService;
        this.discrepancyResolutionService = discrepancyResolutionService;
    }

    @Operation(
            summary = "Finalize a rent-roll upload into a new snapshot",
            description = "Returns the inheritance prompts and income discrepancies the caller must resolve."
    )
    @PostMapping("/finalize")
    public ResponseEntity<FinalizeComplianceResponse> finalizeUpload(
            @PathVariable UUID propertyId,
            @Valid @RequestBody FinalizeComplianceRequest request
    ) {
        return ResponseEntity.ok(complianceFinalizeService.finalizeComplianceUpload(propertyId, request));
    }

    @PostMapping("/inheritance")
    public ResponseEntity<InheritanceResolutionResponse> resolveInheritance(
            @PathVariable UUID propertyId,
            @Valid @RequestBody ResolveInheritanceRequest request
    ) {
        return ResponseEntity.ok(inheritanceResolutionService.resolveInheritance(propertyId, request));
    }

    @PostMapping("/discrepancies/resolve")
    public ResponseEntity<DiscrepancyResolutionResponse> resolveDiscrepancy(
            @PathVariable UUID propertyId,
            @Valid @RequestBody ResolveDiscrepancyRequest request
    ) {
        return ResponseEntity.ok(discrepancyResolutionService.resolveDiscrepancy(propertyId, request));
    }
}
