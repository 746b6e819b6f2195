package com.lihtcmate.backend.modules.verification.domain;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;

import com.lihtcmate.backend.modules.lease.domain.Lease;
import com.lihtcmate.backend.modules.lease.domain.Resident;

/**
 * Derives a lease's verification status from its residents, their documents and the lease's verifications.
 * <p>
 * Rules are checked in order and the first match wins:
 * <ol>
 *     <li>no residents: {@code VACANT}</li>
 *     <li>any document awaiting review: {@code WAITING_FOR_ADMIN_REVIEW}</li>
 *     <li>some but not all residents finalized: {@code IN_PROGRESS}</li>
 *     <li>nobody finalized but documents exist: {@code IN_PROGRESS}</li>
 *     <li>nobody finalized and no documents: {@code OUT_OF_DATE_INCOME_DOCUMENTS}</li>
 *     <li>everyone finalized as having no income: {@code NEEDS_INCOME_DOCUMENTATION}</li>
 *     <li>declared income above zero and more than $1.00 away from verified: {@code NEEDS_INVESTIGATION}</li>
 *     <li>otherwise {@code VERIFIED}</li>
 * </ol>
 * Verifications do not change the outcome; resident finalization flags carry that state.
 */
public final class LeaseVerificationStatusEngine {

    private LeaseVerificationStatusEngine() {
    }

    public static LeaseVerificationStatus resolve(
            Lease lease,
            Collection<Resident> residents,
            Collection<IncomeDocument> documents,
            Collection<IncomeVerification> verifications
    ) {
        List<Resident> people = residents == null ? List.of() : List.copyOf(residents);
        Collection<IncomeDocument> docs = documents == null ? List.of() : documents;

        if (people.isEmpty()) {
            return LeaseVerificationStatus.VACANT;
        }
        if (docs.stream().anyMatch(IncomeDocument::needsReview)) {
            return LeaseVerificationStatus.WAITING_FOR_ADMIN_REVIEW;
        }

        long finalizedCount = people.stream().filter(Resident::isFinalized).count();
        if (finalizedCount > 0 && finalizedCount < people.size()) {
            return LeaseVerificationStatus.IN_PROGRESS;
        }
        if (finalizedCount == 0) {
            return docs.isEmpty()
                    ? LeaseVerificationStatus.OUT_OF_DATE_INCOME_DOCUMENTS
                    : LeaseVerificationStatus.IN_PROGRESS;
        }

        if (people.stream().allMatch(Resident::isHasNoIncome)) {
            return LeaseVerificationStatus.NEEDS_INCOME_DOCUMENTATION;
        }

        BigDecimal declared = totalDeclared(people);
        BigDecimal verified = totalVerified(people);
        if (declared.signum() > 0 && IncomeTolerance.exceeds(declared, verified)) {
            return LeaseVerificationStatus.NEEDS_INVESTIGATION;
        }
        return LeaseVerificationStatus.VERIFIED;
    }

    public static BigDecimal totalDeclared(Collection<Resident> residents) {
        return residents.stream()
                .map(Resident::declaredIncome)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public static BigDecimal totalVerified(Collection<Resident> residents) {
        return residents.stream()
                .map(Resident::verifiedIncome)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
