package io.ledger.core.state;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A deposit kept in history so later disputes can find it.
 * Immutable; the ledger swaps in a copy when the dispute state moves.
 */
public final class StoredDeposit {
    private final long txId;
    private final int clientId;
    private final BigDecimal amount;
    private final DisputeState disputeState;

    public StoredDeposit(long txId, int clientId, BigDecimal amount, DisputeState disputeState) {
        this.txId = txId;
        this.clientId = clientId;
        this.amount = Objects.requireNonNull(amount, "amount");
        this.disputeState = Objects.requireNonNull(disputeState, "disputeState");
    }

    public long txId() { return txId; }
    public int clientId() { return clientId; }
    public BigDecimal amount() { return amount; }
    public DisputeState disputeState() { return disputeState; }

    public boolean isDisputed() {
        return disputeState == DisputeState.DISPUTED;
    }

    StoredDeposit withState(DisputeState state) {
        return new StoredDeposit(txId, clientId, amount, state);
    }

    @Override
    public String toString() {
        return "Deposit{tx=" + txId + ", client=" + clientId + ", amount=" + amount.toPlainString()
                + ", " + disputeState + "}";
    }
}
