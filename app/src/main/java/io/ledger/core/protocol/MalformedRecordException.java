package io.ledger.core.protocol;

/** A row at the input boundary that could not be turned into a {@link TransactionRecord}. */
public class MalformedRecordException extends IllegalArgumentException {
    private final long row;

    public MalformedRecordException(long row, String message) {
        super("row " + row + ": " + message);
        this.row = row;
    }

    public MalformedRecordException(long row, String message, Throwable cause) {
        super("row " + row + ": " + message, cause);
        this.row = row;
    }

    /** One-based data row, header excluded. */
    public long row() {
        return row;
    }
}
