package io.ledger.core.engine;

/** Counts from one pass over a source. */
public record ReplaySummary(long applied, long rejected, long malformed) {

    public long total() {
        return applied + rejected + malformed;
    }

    @Override
    public String toString() {
        return total() + " records: " + applied + " applied, " + rejected + " rejected, " + malformed + " malformed";
    }
}
