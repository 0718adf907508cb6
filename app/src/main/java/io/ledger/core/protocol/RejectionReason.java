package io.ledger.core.protocol;

public enum RejectionReason {
    MALFORMED_RECORD,
    DUPLICATE_TRANSACTION_ID,
    UNKNOWN_REFERENCE,
    OWNER_MISMATCH,
    INVALID_STATE_TRANSITION,
    INSUFFICIENT_FUNDS,
    ACCOUNT_LOCKED
}
