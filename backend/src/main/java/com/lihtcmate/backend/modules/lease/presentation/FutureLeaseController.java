package com.lihtcmate.backend.modules.lease.presentation;

import java.util.UUID;

import com.lihtcmate.backend.modules.lease.application.FutureLeaseService;
import com.lihtcmate.backend.modules.lease.presentation.dto.CreateFutureLeaseRequest;
import com.lihtcmate.backend.modules.lease.presentation.dto.LeaseResponse;

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
@RequestMapping("/api/units/{unitId}/future-leases")
@Tag(name = "Leases")
public class FutureLeaseController {

    private final FutureLeaseService futureLeaseService;

    public FutureLeaseController(FutureLeaseService futureLeaseService) {
        this.futureLeaseService = futureLeaseService;
    }

    @Operation(summary = "Create a future lease ahead of the next rent roll")
    @PostMapping
    public ResponseEntity<LeaseResponse> createFutureLease(
            @PathVariable UUID unitId,
            @Valid @RequestBody CreateFutureLeaseRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(futureLeaseService.createFutureLease(unitId, request));
    }
}
