package com.lihtcmate.backend.modules.rentroll.application;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.lihtcmate.backend.modules.lease.domain.Lease;
import com.lihtcmate.backend.modules.lease.domain.Resident;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.FinalizeComplianceResponse.IncomeDiscrepancy;
import com.lihtcmate.backend.modules.verification.domain.IncomeTolerance;

/**
 * Compares the income a new rent roll declares for each resident with the income already verified
 * for the same person, paired by trimmed case-insensitive name.
 */
final class IncomeDiscrepancyDetector {

    private IncomeDiscrepancyDetector() {
    }

    /**
     * @param baseline residents of earlier leases on the unit; only finalized ones with a figure count,
     *                 and the first resident per name wins
     */
    static List<IncomeDiscrepancy> detect(String unitNumber, Lease newLease, List<Resident> newResidents, List<Resident> baseline) {
        Map<String, Resident> verifiedByName = new LinkedHashMap<>();
        for (Resident resident : baseline) {
            if (resident.isIncomeFinalized() && resident.getCalculatedAnnualizedIncome() != null) {
                verifiedByName.putIfAbsent(resident.nameKey(), resident);
            }
        }

        List<IncomeDiscrepancy> discrepancies = new ArrayList<>();
        for (Resident resident : newResidents) {
            Resident existing = verifiedByName.get(resident.nameKey());
            if (existing == null) {
                continue;
            }
            BigDecimal verified = existing.getCalculatedAnnualizedIncome();
            BigDecimal declared = resident.declaredIncome();
            if (IncomeTolerance.exceeds(verified, declared)) {
                discrepancies.add(new IncomeDiscrepancy(
                        unitNumber,
                        resident.getName(),
                        verified,
                        declared,
                        verified.subtract(declared).abs(),
                        existing.getLease().getId(),
                        newLease.getId(),
                        existing.getId(),
                        resident.getId()
                ));
            }
        }
        return discrepancies;
    }
}
