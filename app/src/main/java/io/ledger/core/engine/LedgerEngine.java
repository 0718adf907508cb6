package io.ledger.core.engine;

import io.ledger.core.protocol.ApplyResult;
import io.ledger.core.protocol.TransactionRecord;
import io.ledger.core.router.TransactionRouter;
import io.ledger.core.state.AccountSnapshot;
import io.ledger.core.state.InMemoryLedger;
import io.ledger.core.state.Ledger;

import java.util.List;
import java.util.Objects;

/**
 * Wires one ledger and its router.
 * Feed records with apply() in arrival order, then read snapshot().
 */
public final class LedgerEngine {

    private final Ledger ledger;
    private final TransactionRouter router;

    public LedgerEngine(Ledger ledger) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.router = new TransactionRouter(ledger);
    }

    public static LedgerEngine inMemory() {
        return new LedgerEngine(new InMemoryLedger());
    }

    public ApplyResult apply(TransactionRecord record) {
        return router.route(record);
    }

    public List<AccountSnapshot> snapshot() {
        return ledger.snapshot();
    }

    public Ledger ledger() { return ledger; }
}
