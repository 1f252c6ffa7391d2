package io.txledger.core.updates;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.Bytes;
import io.txledger.core.protocol.DecodeException;
import io.txledger.core.protocol.Encodable;
import io.txledger.core.protocol.Hash;
import io.txledger.core.protocol.Hashes;
import io.txledger.core.protocol.ProtocolLimits;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Future updates of one kind, in strictly ascending order of effective time,
 * together with the next sequence number for update instructions of that kind.
 * <p>
 * Byte form: {@code nextSequenceNumber:u64 (1 effectiveTime:u64 event)* 0}.
 * Immutable.
 */
@JsonPropertyOrder({"nextSequenceNumber", "queue"})
public final class UpdateQueue<E extends Encodable> {

    /** One scheduled update. */
    @JsonPropertyOrder({"effectiveTime", "update"})
    public static final class Entry<E> {
        private final long effectiveTime;
        private final E update;

        @JsonCreator
        public Entry(@JsonProperty("effectiveTime") long effectiveTime,
                     @JsonProperty("update") E update) {
            this.effectiveTime = effectiveTime;
            this.update = Objects.requireNonNull(update, "update");
        }

        @JsonProperty("effectiveTime")
        public long effectiveTime() { return effectiveTime; }

        @JsonProperty("update")
        public E update() { return update; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Entry)) return false;
            Entry<?> other = (Entry<?>) o;
            return effectiveTime == other.effectiveTime && update.equals(other.update);
        }

        @Override public int hashCode() { return Objects.hash(effectiveTime, update); }
        @Override public String toString() { return "(" + effectiveTime + ", " + update + ")"; }
    }

    /** Result of taking the due entries off a queue. */
    public static final class Dequeued<E extends Encodable> {
        private final List<Entry<E>> due;
        private final UpdateQueue<E> remaining;

        Dequeued(List<Entry<E>> due, UpdateQueue<E> remaining) {
            this.due = due;
            this.remaining = remaining;
        }

        /** Due entries, ascending by effective time. */
        public List<Entry<E>> due() { return due; }
        public UpdateQueue<E> remaining() { return remaining; }
    }

    private final long nextSequenceNumber;
    private final List<Entry<E>> queue;

    @JsonCreator
    public UpdateQueue(@JsonProperty("nextSequenceNumber") long nextSequenceNumber,
                       @JsonProperty("queue") List<Entry<E>> queue) {
        List<Entry<E>> entries = queue == null ? List.of() : List.copyOf(queue);
        for (int i = 1; i < entries.size(); i++) {
            if (entries.get(i - 1).effectiveTime >= entries.get(i).effectiveTime) {
                throw new DecodeException("Update queue not in ascending order");
            }
        }
        this.nextSequenceNumber = nextSequenceNumber;
        this.queue = entries;
    }

    public static <E extends Encodable> UpdateQueue<E> empty() {
        return new UpdateQueue<>(ProtocolLimits.MIN_UPDATE_SEQUENCE_NUMBER, List.of());
    }

    @JsonProperty("nextSequenceNumber")
    public long nextSequenceNumber() { return nextSequenceNumber; }

    @JsonProperty("queue")
    public List<Entry<E>> entries() { return queue; }

    @JsonIgnore
    public boolean isEmpty() { return queue.isEmpty(); }

    /**
     * Schedules {@code event} at {@code effectiveTime}. Entries at or after
     * that time are superseded and dropped. Consumes one sequence number.
     */
    public UpdateQueue<E> enqueue(long effectiveTime, E event) {
        List<Entry<E>> next = new ArrayList<>(queue.size() + 1);
        for (Entry<E> e : queue) {
            if (e.effectiveTime >= effectiveTime) {
                break;
            }
            next.add(e);
        }
        next.add(new Entry<>(effectiveTime, event));
        return new UpdateQueue<>(nextSequenceNumber + 1, next);
    }

    /** Splits off the entries with effective time at or before {@code timestamp}. */
    public Dequeued<E> dequeueUntil(long timestamp) {
        int cut = 0;
        while (cut < queue.size() && queue.get(cut).effectiveTime <= timestamp) {
            cut++;
        }
        if (cut == 0) {
            return new Dequeued<>(List.of(), this);
        }
        return new Dequeued<>(queue.subList(0, cut),
                new UpdateQueue<>(nextSequenceNumber, queue.subList(cut, queue.size())));
    }

    public void writeTo(ByteSink sink) {
        sink.putLong(nextSequenceNumber);
        for (Entry<E> e : queue) {
            sink.putByte(1);
            sink.putLong(e.effectiveTime);
            e.update.writeTo(sink);
        }
        sink.putByte(0);
    }

    public static <E extends Encodable> UpdateQueue<E> read(ByteBuffer buf, Encodable.Reader<E> reader) {
        long seq = Bytes.readLong(buf);
        List<Entry<E>> entries = new ArrayList<>();
        Long last = null;
        while (true) {
            int marker = Bytes.readUnsignedByte(buf);
            if (marker == 0) {
                break;
            }
            if (marker != 1) {
                throw new DecodeException("Invalid update queue marker " + marker);
            }
            long time = Bytes.readLong(buf);
            if (last != null && last >= time) {
                throw new DecodeException("Update queue not in ascending order");
            }
            entries.add(new Entry<>(time, reader.read(buf)));
            last = time;
        }
        return new UpdateQueue<>(seq, entries);
    }

    /** SHA-256 of {@code nextSeq | count | (time | hash(event))*}. */
    public Hash hash() {
        ByteSink sink = new ByteSink(16 + queue.size() * 40);
        sink.putLong(nextSequenceNumber);
        sink.putLong(queue.size());
        for (Entry<E> e : queue) {
            sink.putLong(e.effectiveTime);
            e.update.hash().writeTo(sink);
        }
        return Hashes.hash(sink.toByteArray());
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof UpdateQueue)) return false;
        UpdateQueue<?> other = (UpdateQueue<?>) o;
        return nextSequenceNumber == other.nextSequenceNumber && queue.equals(other.queue);
    }

    @Override public int hashCode() { return Objects.hash(nextSequenceNumber, queue); }

    @Override
    public String toString() {
        return "UpdateQueue{next=" + nextSequenceNumber + ", queue=" + Collections.unmodifiableList(queue) + "}";
    }
}
