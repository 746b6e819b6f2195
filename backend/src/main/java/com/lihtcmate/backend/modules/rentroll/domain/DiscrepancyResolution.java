package com.lihtcmate.backend.modules.rentroll.domain;

public enum DiscrepancyResolution {
    /** Keep the document-verified income and apply it to the new lease's resident. */
    ACCEPT_VERIFIED,
    /** Trust the new rent roll; the earlier verification must be redone. */
    ACCEPT_RENT_ROLL
}
