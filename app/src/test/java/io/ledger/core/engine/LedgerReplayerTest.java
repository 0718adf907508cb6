package io.ledger.core.engine;

import io.ledger.core.csv.CsvTransactionSource;
import io.ledger.core.metrics.LedgerMetrics;
import io.ledger.core.protocol.MalformedRecordException;
import io.ledger.core.protocol.RejectionReason;
import io.ledger.core.protocol.TransactionKind;
import io.ledger.core.protocol.TransactionRecord;
import io.ledger.core.protocol.TransactionSource;
import io.ledger.core.state.AccountSnapshot;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;

import static org.junit.jupiter.api.Assertions.*;

class LedgerReplayerTest {

    @Test
    void depositsAndWithdrawals() throws IOException {
        LedgerEngine engine = replayFixture("deposits_and_withdrawals.csv", new LedgerMetrics());

        assertEquals(2, engine.snapshot().size());
        assertAvailable(engine, 1, "0");
        assertAvailable(engine, 2, "49.50");
    }

    @Test
    void failedWithdrawalLeavesBalance() throws IOException {
        LedgerMetrics metrics = new LedgerMetrics(new SimpleMeterRegistry());
        LedgerEngine engine = replayFixture("failed_withdrawal.csv", metrics);

        assertAvailable(engine, 1, "50.00");
        assertEquals(1.0, metrics.rejectedCount(RejectionReason.INSUFFICIENT_FUNDS));
    }

    @Test
    void disputes() throws IOException {
        LedgerEngine engine = replayFixture("disputes.csv", new LedgerMetrics());

        // client 1 resolved
        AccountSnapshot one = engine.ledger().findAccount(1).orElseThrow();
        assertEquals(0, new BigDecimal("100").compareTo(one.available()));
        assertEquals(0, one.held().signum());
        assertFalse(one.locked());
        assertFalse(engine.ledger().findDeposit(1).orElseThrow().isDisputed());

        // client 2 still open
        AccountSnapshot two = engine.ledger().findAccount(2).orElseThrow();
        assertEquals(0, two.available().signum());
        assertEquals(0, new BigDecimal("100").compareTo(two.held()));
        assertTrue(engine.ledger().findDeposit(2).orElseThrow().isDisputed());

        // client 3 resolve without dispute ignored
        AccountSnapshot three = engine.ledger().findAccount(3).orElseThrow();
        assertEquals(0, new BigDecimal("100").compareTo(three.available()));
        assertEquals(0, three.held().signum());
    }

    @Test
    void reversedDepositLocksAndIgnoresLaterDeposit() throws IOException {
        LedgerMetrics metrics = new LedgerMetrics();
        LedgerEngine engine = replayFixture("reversed_deposit.csv", metrics);

        AccountSnapshot account = engine.ledger().findAccount(1).orElseThrow();
        assertTrue(account.locked());
        assertEquals(0, account.available().signum());
        assertEquals(0, account.held().signum());
        assertEquals(0, account.total().signum());
        assertEquals(1.0, metrics.rejectedCount(RejectionReason.ACCOUNT_LOCKED));
        assertEquals(1.0, metrics.appliedCount(TransactionKind.CHARGEBACK));
    }

    @Test
    void whitespace() throws IOException {
        LedgerMetrics metrics = new LedgerMetrics();
        LedgerEngine engine = replayFixture("whitespace.csv", metrics);

        assertEquals(1, engine.snapshot().size());
        assertAvailable(engine, 1, "90.00");
        assertEquals(1.0, metrics.rejectedCount(RejectionReason.UNKNOWN_REFERENCE));
    }

    @Test
    void malformedRowsAreCountedAndSkipped() throws IOException {
        LedgerMetrics metrics = new LedgerMetrics();
        LedgerEngine engine = LedgerEngine.inMemory();

        ReplaySummary summary;
        try (TransactionSource source = fixture("malformed.csv")) {
            summary = LedgerReplayer.replay(source, engine, metrics);
        }

        assertEquals(new ReplaySummary(2, 1, 5), summary);
        assertEquals(8, summary.total());
        assertEquals(5.0, metrics.malformedCount());
        assertEquals(1.0, metrics.rejectedCount(RejectionReason.MALFORMED_RECORD));
        assertAvailable(engine, 1, "7.5");
    }

    @Test
    void reorderedColumns() throws IOException {
        LedgerEngine engine = replayFixture("reordered_columns.csv", new LedgerMetrics());

        AccountSnapshot account = engine.ledger().findAccount(1).orElseThrow();
        assertEquals(0, account.available().signum());
        assertEquals(0, new BigDecimal("1.1001").compareTo(account.held()));
    }

    @Test
    void ioFailureEndsReplay() {
        FakeSource source = new FakeSource();
        source.records.add(TransactionRecord.deposit(1, 1, BigDecimal.ONE));
        source.failAfterRecords = true;
        LedgerEngine engine = LedgerEngine.inMemory();

        IOException ex = assertThrows(IOException.class, () -> LedgerReplayer.replay(source, engine, new LedgerMetrics()));

        assertEquals("disk-gone", ex.getMessage());
        assertEquals(1, engine.snapshot().size());
    }

    @Test
    void malformedFromAnySourceIsSkipped() throws IOException {
        FakeSource source = new FakeSource();
        source.malformedFirst = true;
        source.records.add(TransactionRecord.deposit(1, 1, BigDecimal.TEN));
        LedgerMetrics metrics = new LedgerMetrics();

        ReplaySummary summary = LedgerReplayer.replay(source, LedgerEngine.inMemory(), metrics);

        assertEquals(new ReplaySummary(1, 0, 1), summary);
        assertEquals(1.0, metrics.appliedCount(TransactionKind.DEPOSIT));
    }

    private static LedgerEngine replayFixture(String name, LedgerMetrics metrics) throws IOException {
        LedgerEngine engine = LedgerEngine.inMemory();
        try (TransactionSource source = fixture(name)) {
            LedgerReplayer.replay(source, engine, metrics);
        }
        return engine;
    }

    private static TransactionSource fixture(String name) throws IOException {
        InputStream in = LedgerReplayerTest.class.getResourceAsStream("/fixtures/" + name);
        assertNotNull(in, "missing fixture " + name);
        return new CsvTransactionSource(new InputStreamReader(in, StandardCharsets.UTF_8), 4);
    }

    private static void assertAvailable(LedgerEngine engine, int client, String expected) {
        BigDecimal available = engine.ledger().findAccount(client).orElseThrow().available();
        assertEquals(0, new BigDecimal(expected).compareTo(available), () -> "client " + client + " available " + available);
    }

    private static final class FakeSource implements TransactionSource {
        final Deque<TransactionRecord> records = new ArrayDeque<>();
        boolean malformedFirst;
        boolean failAfterRecords;

        @Override
        public boolean hasNext() throws IOException {
            if (records.isEmpty() && !malformedFirst && failAfterRecords) {
                throw new IOException("disk-gone");
            }
            return malformedFirst || !records.isEmpty();
        }

        @Override
        public TransactionRecord next() {
            if (malformedFirst) {
                malformedFirst = false;
                throw new MalformedRecordException(1, "bad row");
            }
            return records.poll();
        }

        @Override
        public void close() {
        }
    }
}
