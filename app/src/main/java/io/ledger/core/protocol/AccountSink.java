package io.ledger.core.protocol;

import io.ledger.core.state.AccountSnapshot;

import java.io.IOException;
import java.util.List;

/** Consumer of the final account list. */
public interface AccountSink {
    void write(List<AccountSnapshot> accounts) throws IOException;
}
