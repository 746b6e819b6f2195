package com.lihtcmate.backend.modules.rentroll.application;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.lihtcmate.backend.modules.rentroll.presentation.dto.FinalizeComplianceRequest.LeaseRow;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.FinalizeComplianceRequest.ResidentRow;

import org.springframework.stereotype.Component;

/**
 * Checks a whole upload up front so that a bad row rejects the finalize before any write.
 * <p>
 * When the property has no registered units yet, any unit number is accepted and the units are
 * created from the upload.
 */
@Component
public class RentRollUploadValidator {

    public void validate(Map<String, List<LeaseRow>> unitGroups, Set<String> registeredUnitNumbers) {
        List<String> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Set<String> unknownUnits = new TreeSet<>();

        unitGroups.forEach((rawUnitNumber, rows) -> {
            String unitNumber = rawUnitNumber == null ? "" : rawUnitNumber.trim();
            if (unitNumber.isEmpty()) {
                errors.add("A unit group has no unit number");
                return;
            }
            if (!seen.add(unitNumber)) {
                errors.add("Unit %s: listed more than once".formatted(unitNumber));
            }
            if (!registeredUnitNumbers.isEmpty() && !registeredUnitNumbers.contains(unitNumber)) {
                unknownUnits.add(unitNumber);
            }
            if (rows == null) {
                return;
            }
            for (int i = 0; i < rows.size(); i++) {
                validateRow(unitNumber, i + 1, rows.get(i), errors);
            }
        });

        if (!unknownUnits.isEmpty()) {
            errors.add(0, "Unit numbers not found on property: %s".formatted(String.join(", ", unknownUnits)));
        }
        if (!errors.isEmpty()) {
            throw new RentRollValidationException(errors);
        }
    }

    private void validateRow(String unitNumber, int rowNumber, LeaseRow row, List<String> errors) {
        if (row.leaseEndDate() != null && row.leaseStartDate() == null) {
            errors.add("Unit %s row %d: lease end date without a start date".formatted(unitNumber, rowNumber));
        }
        if (row.leaseStartDate() != null && row.leaseEndDate() != null && row.leaseEndDate().isBefore(row.leaseStartDate())) {
            errors.add("Unit %s row %d: lease ends before it starts".formatted(unitNumber, rowNumber));
        }
        if (row.leaseRent() != null && row.leaseRent().signum() < 0) {
            errors.add("Unit %s row %d: negative lease rent".formatted(unitNumber, rowNumber));
        }
        for (ResidentRow resident : row.residents()) {
            if (resident.name() == null || resident.name().isBlank()) {
                errors.add("Unit %s row %d: resident without a name".formatted(unitNumber, rowNumber));
            }
            if (resident.annualizedIncome() != null && resident.annualizedIncome().signum() < 0) {
                errors.add("Unit %s row %d: negative income for %s".formatted(unitNumber, rowNumber, resident.name()));
            }
        }
    }
}
