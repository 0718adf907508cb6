package io.ledger.core.metrics;

import io.ledger.core.protocol.RejectionReason;
import io.ledger.core.protocol.TransactionKind;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LedgerMetricsTest {

    @Test
    void countsByKindAndReason() {
        MeterRegistry registry = new SimpleMeterRegistry();
        LedgerMetrics metrics = new LedgerMetrics(registry);

        metrics.recordApplied(TransactionKind.DEPOSIT);
        metrics.recordApplied(TransactionKind.DEPOSIT);
        metrics.recordRejected(RejectionReason.OWNER_MISMATCH);
        metrics.recordMalformed();

        assertEquals(2.0, metrics.appliedCount(TransactionKind.DEPOSIT));
        assertEquals(0.0, metrics.appliedCount(TransactionKind.WITHDRAWAL));
        assertEquals(1.0, metrics.rejectedCount(RejectionReason.OWNER_MISMATCH));
        assertEquals(1.0, metrics.malformedCount());
        assertEquals(2.0, registry.get("ledger.records.applied").tag("kind", "deposit").counter().count());
        assertEquals(1.0, registry.get("ledger.records.rejected").tag("reason", "OWNER_MISMATCH").counter().count());
    }

    @Test
    void timesReplayAndScrapes() {
        LedgerMetrics metrics = new LedgerMetrics();

        String value = metrics.recordReplay(() -> "done");

        assertEquals("done", value);
        assertEquals(1L, metrics.registry().timer("ledger.replay.time").count());
        String scrape = metrics.scrape();
        assertTrue(scrape.contains("ledger.records.applied{stat=COUNT,kind=deposit}"), scrape);
        assertTrue(scrape.contains("ledger.records.malformed"), scrape);
    }
}
