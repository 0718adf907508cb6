package io.ledger.core.protocol;

import java.util.Locale;

public enum TransactionKind {
    DEPOSIT,
    WITHDRAWAL,
    DISPUTE,
    RESOLVE,
    CHARGEBACK;

    /** Deposits and withdrawals carry an amount; the other kinds reference a prior deposit. */
    public boolean carriesAmount() {
        return this == DEPOSIT || this == WITHDRAWAL;
    }

    public static TransactionKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing transaction type");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown transaction type: " + value);
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
