package com.lihtcmate.backend.modules.hud.presentation;

import java.util.UUID;

import com.lihtcmate.backend.modules.hud.application.AmiBucketService;
import com.lihtcmate.backend.modules.hud.presentation.dto.LeaseAmiBucketResponse;
import com.lihtcmate.backend.modules.hud.presentation.dto.MaxRentsResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Tag(name = "HUD income limits")
public class HudController {

    private final AmiBucketService amiBucketService;

    public HudController(AmiBucketService amiBucketService) {
        this.amiBucketService = amiBucketService;
    }

    @Operation(summary = "AMI bucket of a lease's verified income", description = "Returns a sentinel bucket instead of failing when HUD data is unavailable.")
    @GetMapping("/leases/{leaseId}/ami-bucket")
    public ResponseEntity<LeaseAmiBucketResponse> getLeaseAmiBucket(@PathVariable UUID leaseId) {
        return ResponseEntity.ok(amiBucketService.getLeaseAmiBucket(leaseId));
    }

    @Operation(summary = "LIHTC maximum rents by bedroom size")
    @GetMapping("/properties/{propertyId}/max-rents")
    public ResponseEntity<MaxRentsResponse> getMaxRents(
            @PathVariable UUID propertyId,
            @RequestParam(required = false) Integer year
    ) {
        return ResponseEntity.ok(amiBucketService.maxRents(propertyId, year));
    }
}
