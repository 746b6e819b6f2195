package com.lihtcmate.backend.modules.rentroll.application;

import java.util.List;

import com.lihtcmate.backend.modules.lease.domain.Lease;
import com.lihtcmate.backend.modules.lease.domain.Resident;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.FinalizeComplianceRequest.LeaseRow;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.FinalizeComplianceResponse.ExistingFutureLease;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.FinalizeComplianceResponse.FutureLeaseMatch;
import com.lihtcmate.backend.modules.rentroll.presentation.dto.FinalizeComplianceResponse.MatchedResident;

/**
 * Decides whether an uploaded row is the unit's current lease carried over or a different lease.
 * Rows are compared with the prior rent roll's current lease, never with the future lease's own
 * dates, which are usually empty. A row continues that lease only when both its term and its
 * household (names, trimmed and case-insensitive, with repeats) are unchanged.
 */
final class InheritanceMatcher {

    private InheritanceMatcher() {
    }

    static boolean continues(Lease priorCurrentLease, List<Resident> priorResidents, LeaseRow row) {
        if (priorCurrentLease == null || !priorCurrentLease.hasSameTerm(row.leaseStartDate(), row.leaseEndDate())) {
            return false;
        }
        List<String> household = priorResidents.stream().map(Resident::nameKey).sorted().toList();
        List<String> uploaded = row.residents().stream().map(resident -> Resident.nameKey(resident.name())).sorted().toList();
        return household.equals(uploaded);
    }

    static FutureLeaseMatch toMatch(String unitNumber, Lease newLease, LeaseGraphCopy futureLease) {
        return new FutureLeaseMatch(
                unitNumber,
                newLease.getId(),
                newLease.getLeaseStartDate(),
                newLease.getLeaseEndDate(),
                new ExistingFutureLease(
                        futureLease.copy().getId(),
                        futureLease.copy().getName(),
                        futureLease.residents().stream()
                                .map(InheritanceMatcher::toMatchedResident)
                                .toList()
                )
        );
    }

    private static MatchedResident toMatchedResident(Resident resident) {
        return new MatchedResident(
                resident.getId(),
                resident.getName(),
                resident.isIncomeFinalized() ? resident.getCalculatedAnnualizedIncome() : null
        );
    }
}
