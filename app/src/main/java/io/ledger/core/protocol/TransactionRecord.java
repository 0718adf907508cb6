package io.ledger.core.protocol;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One parsed input row. Immutable.
 * The amount is only kept for deposits and withdrawals.
 */
public final class TransactionRecord {

    private final TransactionKind kind;
    private final int clientId;
    private final long txId;
    private final BigDecimal amount;

    private TransactionRecord(TransactionKind kind, int clientId, long txId, BigDecimal amount) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.clientId = clientId;
        this.txId = txId;
        this.amount = kind.carriesAmount() ? amount : null;
    }

    public static TransactionRecord of(TransactionKind kind, int clientId, long txId, BigDecimal amount) {
        return new TransactionRecord(kind, clientId, txId, amount);
    }

    public static TransactionRecord deposit(int clientId, long txId, BigDecimal amount) {
        return new TransactionRecord(TransactionKind.DEPOSIT, clientId, txId, amount);
    }

    public static TransactionRecord withdrawal(int clientId, long txId, BigDecimal amount) {
        return new TransactionRecord(TransactionKind.WITHDRAWAL, clientId, txId, amount);
    }

    public static TransactionRecord dispute(int clientId, long txId) {
        return new TransactionRecord(TransactionKind.DISPUTE, clientId, txId, null);
    }

    public static TransactionRecord resolve(int clientId, long txId) {
        return new TransactionRecord(TransactionKind.RESOLVE, clientId, txId, null);
    }

    public static TransactionRecord chargeback(int clientId, long txId) {
        return new TransactionRecord(TransactionKind.CHARGEBACK, clientId, txId, null);
    }

    public TransactionKind kind() { return kind; }
    public int clientId() { return clientId; }
    public long txId() { return txId; }

    /** Null when absent. */
    public BigDecimal amount() { return amount; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransactionRecord)) return false;
        TransactionRecord that = (TransactionRecord) o;
        return clientId == that.clientId
                && txId == that.txId
                && kind == that.kind
                && Objects.equals(amount, that.amount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, clientId, txId, amount);
    }

    @Override
    public String toString() {
        return kind.wireName() + "(client=" + clientId + ", tx=" + txId
                + (amount != null ? ", amount=" + amount.toPlainString() : "") + ")";
    }
}
