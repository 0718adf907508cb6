package io.ledger.core.metrics;

import io.ledger.core.protocol.RejectionReason;
import io.ledger.core.protocol.TransactionKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

public final class LedgerMetrics {
    private final MeterRegistry registry;
    private final Map<TransactionKind, Counter> applied = new EnumMap<>(TransactionKind.class);
    private final Map<RejectionReason, Counter> rejected = new EnumMap<>(RejectionReason.class);
    private final Counter malformed;
    private final Timer replayTime;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        for (TransactionKind kind : TransactionKind.values()) {
            applied.put(kind, Counter.builder("ledger.records.applied")
                    .description("Records applied to the ledger")
                    .tag("kind", kind.wireName())
                    .register(registry));
        }
        for (RejectionReason reason : RejectionReason.values()) {
            rejected.put(reason, Counter.builder("ledger.records.rejected")
                    .description("Records rejected by the router or ledger")
                    .tag("reason", reason.name())
                    .register(registry));
        }
        malformed = Counter.builder("ledger.records.malformed")
                .description("Input rows that could not be parsed")
                .register(registry);
        replayTime = registry.timer("ledger.replay.time");
    }

    public LedgerMetrics() {
        this(new SimpleMeterRegistry());
    }

    public void recordApplied(TransactionKind kind) {
        applied.get(kind).increment();
    }

    public void recordRejected(RejectionReason reason) {
        rejected.get(reason).increment();
    }

    public void recordMalformed() {
        malformed.increment();
    }

    public <T> T recordReplay(Supplier<T> replay) {
        return replayTime.record(replay);
    }

    public double appliedCount(TransactionKind kind) {
        return applied.get(kind).count();
    }

    public double rejectedCount(RejectionReason reason) {
        return rejected.get(reason).count();
    }

    public double malformedCount() {
        return malformed.count();
    }

    public String scrape() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                sb.append("{stat=").append(meas.getStatistic());
                m.getId().getTags().forEach(tag -> sb.append(',').append(tag.getKey()).append('=').append(tag.getValue()));
                sb.append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public MeterRegistry registry() {
        return registry;
    }
}
