package io.ledger.core.engine;

import io.ledger.core.metrics.LedgerMetrics;
import io.ledger.core.protocol.ApplyResult;
import io.ledger.core.protocol.MalformedRecordException;
import io.ledger.core.protocol.TransactionRecord;
import io.ledger.core.protocol.TransactionSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drains a source through an engine. Rejected and malformed records are logged,
 * counted and skipped; only I/O failures end the pass early.
 */
public final class LedgerReplayer {
    private static final Logger LOG = Logger.getLogger(LedgerReplayer.class.getName());

    private LedgerReplayer(){}

    public static ReplaySummary replay(TransactionSource source, LedgerEngine engine, LedgerMetrics metrics) throws IOException {
        try {
            return metrics.recordReplay(() -> {
                try {
                    return drain(source, engine, metrics);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private static ReplaySummary drain(TransactionSource source, LedgerEngine engine, LedgerMetrics metrics) throws IOException {
        long applied = 0;
        long rejected = 0;
        long malformed = 0;

        while (source.hasNext()) {
            TransactionRecord record;
            try {
                record = source.next();
            } catch (MalformedRecordException ex) {
                malformed++;
                metrics.recordMalformed();
                LOG.warning("Skipping malformed record, " + ex.getMessage());
                continue;
            }

            ApplyResult result = engine.apply(record);
            if (result.ok) {
                applied++;
                metrics.recordApplied(record.kind());
            } else {
                rejected++;
                metrics.recordRejected(result.reason);
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("Rejected " + record + ": " + result);
                }
            }
        }

        ReplaySummary summary = new ReplaySummary(applied, rejected, malformed);
        LOG.info("Replay finished, " + summary);
        return summary;
    }
}
