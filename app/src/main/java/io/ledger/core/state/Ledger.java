package io.ledger.core.state;

import io.ledger.core.protocol.ApplyResult;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Client accounts plus deposit history.
 * Every mutation either applies in full or returns a rejection and changes nothing.
 */
public interface Ledger {

    Optional<AccountSnapshot> findAccount(int clientId);

    /** False for clients the ledger has never seen. */
    boolean isLocked(int clientId);

    Optional<StoredDeposit> findDeposit(long txId);

    /** Whether a deposit or withdrawal already used this id. */
    boolean isTxIdUsed(long txId);

    /** Credit available funds and remember the deposit. Creates the account if needed. */
    ApplyResult deposit(int clientId, long txId, BigDecimal amount);

    /** Debit available funds; refuses to take available below zero. */
    ApplyResult withdraw(int clientId, long txId, BigDecimal amount);

    /** Move a deposit's amount from available to held. */
    ApplyResult dispute(int clientId, long txId);

    /** Undo an open dispute. */
    ApplyResult resolve(int clientId, long txId);

    /** Remove the disputed amount for good and lock the account. */
    ApplyResult chargeback(int clientId, long txId);

    /** All accounts, ascending client id. */
    List<AccountSnapshot> snapshot();

    int accountCount();
}
