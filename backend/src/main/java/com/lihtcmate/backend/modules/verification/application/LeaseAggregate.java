package com.lihtcmate.backend.modules.verification.application;

import java.math.BigDecimal;
import java.util.List;

import com.lihtcmate.backend.modules.lease.domain.Lease;
import com.lihtcmate.backend.modules.lease.domain.Resident;
import com.lihtcmate.backend.modules.verification.domain.IncomeDocument;
import com.lihtcmate.backend.modules.verification.domain.IncomeVerification;
import com.lihtcmate.backend.modules.verification.domain.LeaseVerificationStatus;
import com.lihtcmate.backend.modules.verification.domain.LeaseVerificationStatusEngine;

public record LeaseAggregate(
        Lease lease,
        List<Resident> residents,
        List<IncomeDocument> documents,
        List<IncomeVerification> verifications
) {

    public LeaseVerificationStatus status() {
        return LeaseVerificationStatusEngine.resolve(lease, residents, documents, verifications);
    }

    public BigDecimal declaredIncome() {
        return LeaseVerificationStatusEngine.totalDeclared(residents);
    }

    public BigDecimal verifiedIncome() {
        return LeaseVerificationStatusEngine.totalVerified(residents);
    }
}
