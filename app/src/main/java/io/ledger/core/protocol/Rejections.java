package io.ledger.core.protocol;

import java.math.BigDecimal;

/**
 * Rejection factories shared by the router and the ledger, so a given failure reads the
 * same whichever layer catches it.
 */
public final class Rejections {
    private Rejections(){}

    public static ApplyResult missingAmount(long txId) {
        return ApplyResult.rejected(RejectionReason.MALFORMED_RECORD,
                "Transaction " + txId + " has no amount");
    }

    public static ApplyResult negativeAmount(long txId, BigDecimal amount) {
        return ApplyResult.rejected(RejectionReason.MALFORMED_RECORD,
                "Transaction " + txId + " has a negative amount " + amount.toPlainString());
    }

    public static ApplyResult accountLocked(int clientId, long txId) {
        return ApplyResult.rejected(RejectionReason.ACCOUNT_LOCKED,
                "Account " + clientId + " is locked (tx " + txId + ")");
    }

    public static ApplyResult duplicateTxId(long txId) {
        return ApplyResult.rejected(RejectionReason.DUPLICATE_TRANSACTION_ID,
                "Transaction id " + txId + " was already used");
    }

    public static ApplyResult insufficientFunds(int clientId, long txId, BigDecimal available, BigDecimal amount) {
        return ApplyResult.rejected(RejectionReason.INSUFFICIENT_FUNDS,
                "Client " + clientId + " has " + available.toPlainString()
                        + " available, cannot withdraw " + amount.toPlainString() + " (tx " + txId + ")");
    }

    public static ApplyResult unknownReference(long txId) {
        return ApplyResult.rejected(RejectionReason.UNKNOWN_REFERENCE,
                "No deposit with transaction id " + txId);
    }

    public static ApplyResult ownerMismatch(int clientId, long txId, int owner) {
        return ApplyResult.rejected(RejectionReason.OWNER_MISMATCH,
                "Transaction " + txId + " belongs to client " + owner + ", not " + clientId);
    }

    public static ApplyResult alreadyDisputed(long txId) {
        return ApplyResult.rejected(RejectionReason.INVALID_STATE_TRANSITION,
                "Transaction " + txId + " is already under dispute");
    }

    public static ApplyResult notDisputed(long txId) {
        return ApplyResult.rejected(RejectionReason.INVALID_STATE_TRANSITION,
                "Transaction " + txId + " is not under dispute");
    }
}
