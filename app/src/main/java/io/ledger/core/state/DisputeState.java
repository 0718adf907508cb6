package io.ledger.core.state;

public enum DisputeState {
    CLEAN,
    DISPUTED
}
