package com.lihtcmate.backend.modules.verification.application;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import com.lihtcmate.backend.modules.income.application.PaystubAnnualizer;
import com.lihtcmate.backend.modules.income.domain.IncomeAnalysisException;
import com.lihtcmate.backend.modules.income.domain.IncomeAnalysisException.Reason;
import com.lihtcmate.backend.modules.verification.domain.DocumentType;
import com.lihtcmate.backend.modules.verification.domain.IncomeDocument;

import org.springframework.stereotype.Component;

/**
 * Verified annual income for one resident from that resident's completed documents.
 * <p>
 * Paystubs are annualized when present; otherwise W-2 box 1 wages of the latest tax year are used.
 * Income from other sources (benefit letters, offer letters, statements) is added when the extraction
 * produced an annualized figure.
 */
@Component
public class ResidentIncomeCalculator {

    private final PaystubAnnualizer paystubAnnualizer;

    public ResidentIncomeCalculator(PaystubAnnualizer paystubAnnualizer) {
        this.paystubAnnualizer = paystubAnnualizer;
    }

    public BigDecimal calculate(List<IncomeDocument> completedDocuments) {
        if (completedDocuments == null || completedDocuments.isEmpty()) {
            throw new IncomeAnalysisException(Reason.INSUFFICIENT_DATA, "No completed income documents");
        }

        List<IncomeDocument> paystubs = ofType(completedDocuments, DocumentType.PAYSTUB);
        BigDecimal employment;
        if (!paystubs.isEmpty()) {
            employment = paystubAnnualizer.analyzePaystubs(paystubs.stream().map(IncomeDocument::toPaystub).toList())
                    .annualizedIncome();
        } else {
            employment = latestW2Wages(ofType(completedDocuments, DocumentType.W2));
        }

        List<BigDecimal> otherFigures = completedDocuments.stream()
                .filter(document -> document.getDocumentType() != DocumentType.PAYSTUB
                        && document.getDocumentType() != DocumentType.W2)
                .map(IncomeDocument::getCalculatedAnnualizedIncome)
                .filter(Objects::nonNull)
                .toList();

        if (employment == null && otherFigures.isEmpty()) {
            throw new IncomeAnalysisException(Reason.INSUFFICIENT_DATA, "No completed document carries an income figure");
        }
        BigDecimal total = employment == null ? BigDecimal.ZERO : employment;
        for (BigDecimal figure : otherFigures) {
            total = total.add(figure);
        }
        return total;
    }

    private BigDecimal latestW2Wages(List<IncomeDocument> w2s) {
        if (w2s.stream().allMatch(document -> document.getBox1Wages() == null)) {
            return null;
        }
        Integer latestYear = w2s.stream()
                .map(IncomeDocument::getTaxYear)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);
        return w2s.stream()
                .filter(document -> latestYear == null || latestYear.equals(document.getTaxYear()))
                .map(IncomeDocument::getBox1Wages)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private List<IncomeDocument> ofType(List<IncomeDocument> documents, DocumentType type) {
        return documents.stream()
                .filter(document -> document.getDocumentType() == type)
                .toList();
    }
}
