package io.ledger.core.state;

import java.math.BigDecimal;

/** Point-in-time copy of an account, handed to sinks and callers. */
public record AccountSnapshot(int clientId, BigDecimal available, BigDecimal held, BigDecimal total, boolean locked) {
}
