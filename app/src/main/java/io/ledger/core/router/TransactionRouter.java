package io.ledger.core.router;

import io.ledger.core.protocol.ApplyResult;
import io.ledger.core.protocol.RejectionReason;
import io.ledger.core.protocol.Rejections;
import io.ledger.core.protocol.TransactionKind;
import io.ledger.core.protocol.TransactionRecord;
import io.ledger.core.state.DisputeState;
import io.ledger.core.state.Ledger;
import io.ledger.core.state.StoredDeposit;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks a record's structural preconditions against the ledger and hands it to the
 * matching ledger mutation. Stateless; checks run in a fixed order:
 * amount, account lock, deposit reference and owner, dispute state.
 */
public class TransactionRouter {
    private final Ledger ledger;

    public TransactionRouter(Ledger ledger) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
    }

    public ApplyResult route(TransactionRecord record) {
        if (record == null) {
            return ApplyResult.rejected(RejectionReason.MALFORMED_RECORD, "Record required");
        }
        ApplyResult check = validate(record);
        if (check.isRejected()) {
            return check;
        }
        return dispatch(record);
    }

    /** Runs the pre-dispatch checks only; the ledger is not changed. */
    public ApplyResult validate(TransactionRecord record) {
        TransactionKind kind = record.kind();
        if (kind.carriesAmount()) {
            BigDecimal amount = record.amount();
            if (amount == null) {
                return Rejections.missingAmount(record.txId());
            }
            if (amount.signum() < 0) {
                return Rejections.negativeAmount(record.txId(), amount);
            }
        }

        if (ledger.isLocked(record.clientId())) {
            return Rejections.accountLocked(record.clientId(), record.txId());
        }

        if (kind.carriesAmount()) {
            return ApplyResult.ok();
        }

        Optional<StoredDeposit> referenced = ledger.findDeposit(record.txId());
        if (referenced.isEmpty()) {
            return Rejections.unknownReference(record.txId());
        }
        StoredDeposit deposit = referenced.get();
        if (deposit.clientId() != record.clientId()) {
            return Rejections.ownerMismatch(record.clientId(), record.txId(), deposit.clientId());
        }

        if (kind == TransactionKind.DISPUTE) {
            return deposit.disputeState() == DisputeState.CLEAN ? ApplyResult.ok() : Rejections.alreadyDisputed(record.txId());
        }
        return deposit.disputeState() == DisputeState.DISPUTED ? ApplyResult.ok() : Rejections.notDisputed(record.txId());
    }

    private ApplyResult dispatch(TransactionRecord record) {
        switch (record.kind()) {
            case DEPOSIT:
                return ledger.deposit(record.clientId(), record.txId(), record.amount());
            case WITHDRAWAL:
                return ledger.withdraw(record.clientId(), record.txId(), record.amount());
            case DISPUTE:
                return ledger.dispute(record.clientId(), record.txId());
            case RESOLVE:
                return ledger.resolve(record.clientId(), record.txId());
            case CHARGEBACK:
                return ledger.chargeback(record.clientId(), record.txId());
            default:
                throw new IllegalStateException("Unhandled kind " + record.kind());
        }
    }
}
