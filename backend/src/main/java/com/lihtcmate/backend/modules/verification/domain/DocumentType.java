package com.lihtcmate.backend.modules.verification.domain;

public enum DocumentType {
    W2,
    PAYSTUB,
    BANK_STATEMENT,
    OFFER_LETTER,
    SOCIAL_SECURITY,
    OTHER
}
