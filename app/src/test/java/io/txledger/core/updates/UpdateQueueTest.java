package io.txledger.core.updates;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.DecodeException;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UpdateQueueTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static Amount amount(long micro) {
        return new Amount(micro);
    }

    @Test
    void emptyQueueStartsAtFirstSequenceNumber() {
        UpdateQueue<Amount> q = UpdateQueue.empty();
        assertEquals(1, q.nextSequenceNumber());
        assertTrue(q.isEmpty());
    }

    @Test
    void enqueueSupersedesLaterEntries() {
        UpdateQueue<Amount> q = UpdateQueue.<Amount>empty()
                .enqueue(100, amount(1))
                .enqueue(200, amount(2))
                .enqueue(150, amount(3));
        assertEquals(List.of(new UpdateQueue.Entry<>(100, amount(1)), new UpdateQueue.Entry<>(150, amount(3))), q.entries());
        assertEquals(4, q.nextSequenceNumber());
    }

    @Test
    void enqueueBeforeEverythingReplacesTheQueue() {
        UpdateQueue<Amount> q = UpdateQueue.<Amount>empty()
                .enqueue(100, amount(1))
                .enqueue(50, amount(2));
        assertEquals(List.of(new UpdateQueue.Entry<>(50, amount(2))), q.entries());
    }

    @Test
    void enqueueAtSameTimeReplacesEntry() {
        UpdateQueue<Amount> q = UpdateQueue.<Amount>empty()
                .enqueue(100, amount(1))
                .enqueue(100, amount(2));
        assertEquals(List.of(new UpdateQueue.Entry<>(100, amount(2))), q.entries());
    }

    @Test
    void dequeueTakesDueEntriesAndKeepsSequenceNumber() {
        UpdateQueue<Amount> q = UpdateQueue.<Amount>empty()
                .enqueue(100, amount(1))
                .enqueue(200, amount(2));
        UpdateQueue.Dequeued<Amount> d = q.dequeueUntil(100);
        assertEquals(List.of(new UpdateQueue.Entry<>(100, amount(1))), d.due());
        assertEquals(List.of(new UpdateQueue.Entry<>(200, amount(2))), d.remaining().entries());
        assertEquals(q.nextSequenceNumber(), d.remaining().nextSequenceNumber());

        UpdateQueue.Dequeued<Amount> none = q.dequeueUntil(99);
        assertTrue(none.due().isEmpty());
        assertSame(q, none.remaining());
    }

    @Test
    void bytesDecodeToSameQueue() {
        UpdateQueue<Amount> q = UpdateQueue.<Amount>empty()
                .enqueue(100, amount(1))
                .enqueue(200, amount(2));
        ByteSink sink = new ByteSink();
        q.writeTo(sink);
        ByteBuffer buf = ByteBuffer.wrap(sink.toByteArray());
        UpdateQueue<Amount> decoded = UpdateQueue.read(buf, Amount::read);
        assertEquals(q, decoded);
        assertEquals(q.hash(), decoded.hash());
        assertFalse(buf.hasRemaining());
    }

    @Test
    void hashDependsOnSequenceNumber() {
        UpdateQueue<Amount> a = new UpdateQueue<>(1, List.of(new UpdateQueue.Entry<>(5, amount(1))));
        UpdateQueue<Amount> b = new UpdateQueue<>(2, List.of(new UpdateQueue.Entry<>(5, amount(1))));
        assertNotEquals(a.hash(), b.hash());
    }

    @Test
    void invalidMarkerIsRejected() {
        ByteSink sink = new ByteSink();
        sink.putLong(1);
        sink.putByte(2);
        assertThrows(DecodeException.class, () -> UpdateQueue.read(ByteBuffer.wrap(sink.toByteArray()), Amount::read));
    }

    @Test
    void descendingTimesAreRejected() {
        ByteSink sink = new ByteSink();
        sink.putLong(1);
        sink.putByte(1);
        sink.putLong(200);
        amount(1).writeTo(sink);
        sink.putByte(1);
        sink.putLong(100);
        amount(2).writeTo(sink);
        sink.putByte(0);
        assertThrows(DecodeException.class, () -> UpdateQueue.read(ByteBuffer.wrap(sink.toByteArray()), Amount::read));
    }

    @Test
    void jsonRoundTrip() throws Exception {
        UpdateQueue<Amount> q = UpdateQueue.<Amount>empty().enqueue(100, amount(7));
        String json = JSON.writeValueAsString(q);
        assertEquals("{\"nextSequenceNumber\":2,\"queue\":[{\"effectiveTime\":100,\"update\":\"7\"}]}", json);
        UpdateQueue<Amount> back = JSON.readValue(json, new TypeReference<UpdateQueue<Amount>>() {});
        assertEquals(q, back);
    }

    @Test
    void jsonWithUnorderedQueueIsRejected() {
        String json = "{\"nextSequenceNumber\":3,\"queue\":[{\"effectiveTime\":5,\"update\":\"1\"},{\"effectiveTime\":5,\"update\":\"2\"}]}";
        assertThrows(Exception.class, () -> JSON.readValue(json, new TypeReference<UpdateQueue<Amount>>() {}));
    }
}
