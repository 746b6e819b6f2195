package com.lihtcmate.backend.modules.verification.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

import com.lihtcmate.backend.modules.lease.domain.Lease;
import com.lihtcmate.backend.modules.lease.domain.Resident;
import com.lihtcmate.backend.modules.property.domain.Property;
import com.lihtcmate.backend.modules.property.domain.Unit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LeaseVerificationStatusEngineTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    private Lease lease;
    private IncomeVerification verification;

    @BeforeEach
    void setUp() {
        Property property = new Property();
        property.setName("Maple Court");
        lease = new Lease(new Unit(property, "101"), null, "Jane Doe");
        verification = new IncomeVerification(lease, VerificationReason.INITIAL_LEASE);
    }

    @Test
    @DisplayName("a lease without residents is vacant")
    void vacant() {
        assertThat(resolve(List.of(), List.of())).isEqualTo(LeaseVerificationStatus.VACANT);
    }

    @Test
    @DisplayName("a document awaiting review outranks everything else")
    void waitingForReviewTakesPrecedence() {
        Resident jane = finalized("Jane", "30000.00", "30000.00");
        Resident john = resident("John", "20000.00");
        IncomeDocument flagged = new IncomeDocument(john, verification, DocumentType.PAYSTUB);
        flagged.setStatus(DocumentStatus.NEEDS_REVIEW);

        assertThat(resolve(List.of(jane, john), List.of(flagged)))
                .isEqualTo(LeaseVerificationStatus.WAITING_FOR_ADMIN_REVIEW);
    }

    @Test
    @DisplayName("partially finalized households are in progress")
    void partiallyFinalized() {
        Resident jane = finalized("Jane", "30000.00", "30000.00");
        Resident john = resident("John", "20000.00");

        assertThat(resolve(List.of(jane, john), List.of())).isEqualTo(LeaseVerificationStatus.IN_PROGRESS);
    }

    @Test
    @DisplayName("nobody finalized: in progress with documents, out of date without")
    void noneFinalized() {
        Resident jane = resident("Jane", "30000.00");
        IncomeDocument paystub = new IncomeDocument(jane, verification, DocumentType.PAYSTUB);
        paystub.setStatus(DocumentStatus.COMPLETED);

        assertThat(resolve(List.of(jane), List.of(paystub))).isEqualTo(LeaseVerificationStatus.IN_PROGRESS);
        assertThat(resolve(List.of(jane), List.of())).isEqualTo(LeaseVerificationStatus.OUT_OF_DATE_INCOME_DOCUMENTS);
    }

    @Test
    @DisplayName("a household where everyone reported no income needs documentation")
    void allNoIncome() {
        Resident jane = resident("Jane", null);
        Resident john = resident("John", null);
        jane.markNoIncome(NOW);
        john.markNoIncome(NOW);

        assertThat(resolve(List.of(jane, john), List.of()))
                .isEqualTo(LeaseVerificationStatus.NEEDS_INCOME_DOCUMENTATION);
    }

    @Test
    @DisplayName("a difference of exactly one dollar still verifies")
    void oneDollarBoundary() {
        Resident jane = finalized("Jane", "30000.00", "30001.00");

        assertThat(resolve(List.of(jane), List.of())).isEqualTo(LeaseVerificationStatus.VERIFIED);
    }

    @Test
    @DisplayName("a difference above one dollar needs investigation")
    void aboveOneDollar() {
        Resident jane = finalized("Jane", "30000.00", "30001.01");
        Resident john = resident("John", "0");
        john.markNoIncome(NOW);

        assertThat(resolve(List.of(jane, john), List.of())).isEqualTo(LeaseVerificationStatus.NEEDS_INVESTIGATION);
    }

    @Test
    @DisplayName("zero declared income skips the discrepancy check")
    void futureLeaseWithoutDeclaredIncome() {
        Resident jane = finalized("Jane", null, "42000.00");

        assertThat(resolve(List.of(jane), List.of())).isEqualTo(LeaseVerificationStatus.VERIFIED);
    }

    @Test
    @DisplayName("declared and verified totals sum across the household")
    void householdTotals() {
        Resident jane = finalized("Jane", "30000.00", "29999.50");
        Resident john = finalized("John", "12000.00", "12000.25");

        assertThat(LeaseVerificationStatusEngine.totalDeclared(List.of(jane, john))).isEqualByComparingTo("42000.00");
        assertThat(LeaseVerificationStatusEngine.totalVerified(List.of(jane, john))).isEqualByComparingTo("41999.75");
        assertThat(resolve(List.of(jane, john), List.of())).isEqualTo(LeaseVerificationStatus.VERIFIED);
    }

    private LeaseVerificationStatus resolve(List<Resident> residents, List<IncomeDocument> documents) {
        return LeaseVerificationStatusEngine.resolve(lease, residents, documents, List.of(verification));
    }

    private Resident resident(String name, String declared) {
        return new Resident(lease, name, declared == null ? null : new BigDecimal(declared));
    }

    private Resident finalized(String name, String declared, String verified) {
        Resident resident = resident(name, declared);
        resident.finalizeIncome(new BigDecimal(verified), NOW);
        return resident;
    }
}
