package io.ledger.core.state;

import java.math.BigDecimal;

/**
 * Mutable balances for one client. Only the ledger touches the mutators;
 * each one keeps {@code total == available + held}.
 */
final class Account {
    private final int clientId;
    private BigDecimal available = BigDecimal.ZERO;
    private BigDecimal held = BigDecimal.ZERO;
    private BigDecimal total = BigDecimal.ZERO;
    private boolean locked;

    Account(int clientId) {
        this.clientId = clientId;
    }

    int clientId() { return clientId; }
    BigDecimal available() { return available; }
    BigDecimal held() { return held; }
    BigDecimal total() { return total; }
    boolean locked() { return locked; }

    void credit(BigDecimal amount) {
        available = available.add(amount);
        total = total.add(amount);
    }

    void debit(BigDecimal amount) {
        available = available.subtract(amount);
        total = total.subtract(amount);
    }

    void hold(BigDecimal amount) {
        available = available.subtract(amount);
        held = held.add(amount);
    }

    void release(BigDecimal amount) {
        available = available.add(amount);
        held = held.subtract(amount);
    }

    // held funds leave the account for good, and the account freezes
    void chargeBack(BigDecimal amount) {
        held = held.subtract(amount);
        total = total.subtract(amount);
        locked = true;
    }

    AccountSnapshot snapshot() {
        return new AccountSnapshot(clientId, available, held, total, locked);
    }
}
