package com.lihtcmate.backend.modules.rentroll.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.lihtcmate.backend.modules.lease.domain.Lease;
import com.lihtcmate.backend.modules.lease.domain.Resident;
import com.lihtcmate.backend.modules.lease.infrastructure.persistence.LeaseRepository;
import com.lihtcmate.backend.modules.lease.infrastructure.persistence.ResidentRepository;
import com.lihtcmate.backend.modules.rentroll.domain.RentRollSnapshot;
import com.lihtcmate.backend.modules.verification.domain.IncomeDocument;
import com.lihtcmate.backend.modules.verification.domain.IncomeVerification;
import com.lihtcmate.backend.modules.verification.infrastructure.persistence.IncomeDocumentRepository;
import com.lihtcmate.backend.modules.verification.infrastructure.persistence.IncomeVerificationRepository;

import org.springframework.stereotype.Component;

/**
 * Copies a lease graph forward into a new snapshot. Rows get new ids and keep their original
 * {@code createdAt}; documents become references to the same stored file.
 * <p>
 * When any of the lease's verifications is FINALIZED the copy counts as verified, and every resident
 * copy is finalized even if the stored resident flag says otherwise.
 */
@Component
public class LeaseGraphCloner {

    private final LeaseRepository leaseRepository;
    private final ResidentRepository residentRepository;
    private final IncomeVerificationRepository incomeVerificationRepository;
    private final IncomeDocumentRepository incomeDocumentRepository;
    private final Clock clock;

    public LeaseGraphCloner(
            LeaseRepository leaseRepository,
            ResidentRepository residentRepository,
            IncomeVerificationRepository incomeVerificationRepository,
            IncomeDocumentRepository incomeDocumentRepository,
            Clock clock
    ) {
        this.leaseRepository = leaseRepository;
        this.residentRepository = residentRepository;
        this.incomeVerificationRepository = incomeVerificationRepository;
        this.incomeDocumentRepository = incomeDocumentRepository;
        this.clock = clock;
    }

    /**
     * @param residents     residents of {@code source}
     * @param verifications verifications of {@code source}, oldest first
     * @param documents     documents of those residents
     */
    public LeaseGraphCopy cloneLeaseGraph(
            Lease source,
            RentRollSnapshot target,
            List<Resident> residents,
            List<IncomeVerification> verifications,
            List<IncomeDocument> documents
    ) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        boolean anyFinalized = verifications.stream().anyMatch(IncomeVerification::isFinalized);

        Lease copy = leaseRepository.save(source.copyInto(target));

        Map<UUID, Resident> residentCopies = new LinkedHashMap<>();
        for (Resident resident : residents) {
            Resident residentCopy = resident.copyFor(copy);
            if (anyFinalized && !residentCopy.isIncomeFinalized()) {
                residentCopy.setIncomeFinalized(true);
            }
            if (residentCopy.isIncomeFinalized() && residentCopy.getFinalizedAt() == null) {
                residentCopy.setFinalizedAt(now);
            }
            residentCopies.put(resident.getId(), residentRepository.save(residentCopy));
        }

        Map<UUID, IncomeVerification> verificationCopies = new LinkedHashMap<>();
        for (IncomeVerification verification : verifications) {
            verificationCopies.put(verification.getId(), incomeVerificationRepository.save(verification.copyFor(copy)));
        }

        List<IncomeDocument> references = new ArrayList<>();
        for (IncomeDocument document : documents) {
            Resident owner = residentCopies.get(document.getResident().getId());
            if (owner == null) {
                continue;
            }
            IncomeVerification verification = document.getVerification() != null
                    ? verificationCopies.get(document.getVerification().getId())
                    : null;
            references.add(document.referenceFor(owner, verification));
        }
        incomeDocumentRepository.saveAll(references);

        Map<UUID, UUID> residentIds = new LinkedHashMap<>();
        residentCopies.forEach((originalId, residentCopy) -> residentIds.put(originalId, residentCopy.getId()));
        Map<UUID, UUID> verificationIds = new LinkedHashMap<>();
        verificationCopies.forEach((originalId, verificationCopy) -> verificationIds.put(originalId, verificationCopy.getId()));

        return new LeaseGraphCopy(
                source,
                copy,
                List.copyOf(residentCopies.values()),
                residentIds,
                verificationIds,
                references.size(),
                anyFinalized
        );
    }
}
