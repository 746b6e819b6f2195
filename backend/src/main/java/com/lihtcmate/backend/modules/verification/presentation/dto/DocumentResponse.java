package com.lihtcmate.backend.modules.verification.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import com.lihtcmate.backend.modules.verification.domain.DocumentStatus;
import com.lihtcmate.backend.modules.verification.domain.DocumentType;
import com.lihtcmate.backend.modules.verification.domain.IncomeDocument;

public record DocumentResponse(
        UUID id,
        UUID residentId,
        UUID verificationId,
        DocumentType documentType,
        DocumentStatus status,
        String filePath,
        BigDecimal grossPayAmount,
        LocalDate payPeriodStartDate,
        LocalDate payPeriodEndDate,
        BigDecimal box1Wages,
        BigDecimal calculatedAnnualizedIncome
) {

    public static DocumentResponse from(IncomeDocument document) {
        return new DocumentResponse(
                document.getId(),
                document.getResident().getId(),
                document.getVerification() != null ? document.getVerification().getId() : null,
                document.getDocumentType(),
                document.getStatus(),
                document.getFilePath(),
                document.getGrossPayAmount(),
                document.getPayPeriodStartDate(),
                document.getPayPeriodEndDate(),
                document.getBox1Wages(),
                document.getCalculatedAnnualizedIncome()
        );
    }
}
