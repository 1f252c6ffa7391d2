package io.txledger.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public final class LedgerMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter txReceived = registry.counter("transactions.received");
    private static final Counter txDuplicate = registry.counter("transactions.duplicate");
    private static final Counter txPurged = registry.counter("transactions.purged");
    private static final Counter blocksExecuted = registry.counter("blocks.executed");
    private static final Counter blocksRolledBack = registry.counter("blocks.rolledback");
    private static final Counter blocksFinalized = registry.counter("blocks.finalized");
    private static final Counter updatesApplied = registry.counter("updates.applied");
    private static final Timer executionTime = registry.timer("block.execution.time");

    private LedgerMetrics() {}

    public static <T> T recordExecution(Supplier<T> blockExecution) {
        return executionTime.record(blockExecution);
    }

    public static void incrementReceived() { txReceived.increment(); }

    public static void incrementDuplicate() { txDuplicate.increment(); }

    public static void incrementRejected(String reason) {
        registry.counter("transactions.rejected", "reason", reason).increment();
    }

    public static void addPurged(int n) { txPurged.increment(n); }

    public static void incrementExecuted() { blocksExecuted.increment(); }

    public static void incrementRolledBack() { blocksRolledBack.increment(); }

    public static void incrementFinalized() { blocksFinalized.increment(); }

    public static void addUpdatesApplied(int n) { updatesApplied.increment(n); }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                sb.append("{stat=").append(meas.getStatistic());
                for (var tag : m.getId().getTags()) {
                    sb.append(',').append(tag.getKey()).append('=').append(tag.getValue());
                }
                sb.append("} ").append(meas.getValue()).append('\n');
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
