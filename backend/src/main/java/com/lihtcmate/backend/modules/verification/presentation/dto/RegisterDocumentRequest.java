package com.lihtcmate.backend.modules.verification.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import com.lihtcmate.backend.modules.verification.domain.DocumentStatus;
import com.lihtcmate.backend.modules.verification.domain.DocumentType;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Fields extracted by the document OCR service, already validated by it.
 */
public record RegisterDocumentRequest(
        @NotNull UUID residentId,
        @NotNull DocumentType documentType,
        @NotNull DocumentStatus status,
        @Size(max = 500) String filePath,
        LocalDate documentDate,
        @Size(max = 255) String employerName,
        @Size(max = 255) String employeeName,
        @PositiveOrZero BigDecimal grossPayAmount,
        @Size(max = 20) String payFrequency,
        LocalDate payPeriodStartDate,
        LocalDate payPeriodEndDate,
        Integer taxYear,
        @PositiveOrZero BigDecimal box1Wages,
        @PositiveOrZero BigDecimal calculatedAnnualizedIncome
) {
}
