package io.ledger.core.protocol;

import java.io.Closeable;
import java.io.IOException;

/**
 * Sequential supplier of parsed records, in the order they must be applied.
 */
public interface TransactionSource extends Closeable {

    /** True while more rows remain. */
    boolean hasNext() throws IOException;

    /**
     * Next record.
     *
     * @throws MalformedRecordException if the row cannot be parsed; the source stays usable
     * @throws IOException if the underlying stream fails (fatal)
     */
    TransactionRecord next() throws IOException;
}
