package io.txledger.core.updates;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.txledger.core.protocol.ByteSink;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PendingUpdatesTest {

    private final PendingUpdates scheduled = PendingUpdates.empty()
            .enqueue(UpdateType.EURO_PER_ENERGY, 20, new ExchangeRate(1, 8))
            .enqueue(UpdateType.BAKER_STAKE_THRESHOLD, 10, new Amount(9))
            .enqueue(UpdateType.FOUNDATION_ACCOUNT, 50, new AccountIndex(3));

    @Test
    void enqueueLandsInTheTypedQueue() {
        UpdateQueue<Amount> threshold = scheduled.bakerStakeThreshold();
        assertEquals(new Amount(9), threshold.entries().get(0).update());
        assertEquals(2, threshold.nextSequenceNumber());
        assertSame(threshold, scheduled.queue(UpdateType.BAKER_STAKE_THRESHOLD));
        assertTrue(scheduled.microGtuPerEuro().isEmpty());
        assertEquals(1, scheduled.microGtuPerEuro().nextSequenceNumber());
    }

    @Test
    void enqueueRejectsValueOfAnotherKind() {
        assertThrows(IllegalArgumentException.class,
                () -> scheduled.enqueue(UpdateType.EURO_PER_ENERGY, 30, new Amount(1)));
    }

    @Test
    void dequeueReportsDueEntriesInQueueOrder() {
        PendingUpdates.Dequeued d = scheduled.dequeueUntil(20);
        assertEquals(List.of(
                new AppliedUpdate(20, UpdateType.EURO_PER_ENERGY, new ExchangeRate(1, 8)),
                new AppliedUpdate(10, UpdateType.BAKER_STAKE_THRESHOLD, new Amount(9))), d.due());
        assertTrue(d.remaining().euroPerEnergy().isEmpty());
        assertEquals(2, d.remaining().euroPerEnergy().nextSequenceNumber());
        assertEquals(1, d.remaining().foundationAccount().entries().size());
    }

    @Test
    void nothingDueKeepsTheSameQueues() {
        PendingUpdates.Dequeued d = scheduled.dequeueUntil(5);
        assertTrue(d.due().isEmpty());
        assertSame(scheduled, d.remaining());
    }

    @Test
    void bytesAndJsonRestoreTypedQueues() throws Exception {
        ByteSink sink = new ByteSink(256);
        scheduled.writeTo(sink);
        PendingUpdates fromBytes = PendingUpdates.read(ByteBuffer.wrap(sink.toByteArray()));
        assertEquals(scheduled, fromBytes);
        assertEquals(scheduled.hash(), fromBytes.hash());

        ObjectMapper mapper = new ObjectMapper();
        PendingUpdates fromJson = mapper.readValue(mapper.writeValueAsString(scheduled), PendingUpdates.class);
        assertEquals(new AccountIndex(3), fromJson.foundationAccount().entries().get(0).update());
        assertEquals(scheduled, fromJson);
    }
}
