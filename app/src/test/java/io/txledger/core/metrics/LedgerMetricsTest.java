package io.txledger.core.metrics;

import io.micrometer.core.instrument.Timer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LedgerMetricsTest {

    @Test
    void executionTimerCountsBlocks() {
        Timer timer = LedgerMetrics.registry().get("block.execution.time").timer();
        long before = timer.count();
        assertEquals("done", LedgerMetrics.recordExecution(() -> "done"));
        assertEquals(before + 1, timer.count());
    }

    @Test
    void rejectionsAreTaggedByReason() {
        LedgerMetrics.incrementRejected("bad_signature");
        double count = LedgerMetrics.registry().get("transactions.rejected").tag("reason", "bad_signature").counter().count();
        assertTrue(count >= 1);
        assertTrue(LedgerMetrics.scrapeMetrics().contains("transactions.rejected{stat=COUNT,reason=bad_signature}"));
    }
}
