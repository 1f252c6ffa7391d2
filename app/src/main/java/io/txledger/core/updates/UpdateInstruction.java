package io.txledger.core.updates;

import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.Bytes;
import io.txledger.core.protocol.DecodeException;
import io.txledger.core.protocol.Ed25519;
import io.txledger.core.protocol.Encodable;
import io.txledger.core.protocol.Hash;
import io.txledger.core.protocol.Hashes;

import java.nio.ByteBuffer;
import java.security.PrivateKey;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A signed request to schedule one chain update.
 * <p>
 * Byte form: header {@code sequenceNumber:u64 effectiveTime:u64 timeout:u64 payloadSize:u32},
 * payload {@code type:u8 value}, then {@code count:u16 (keyIndex:u16 len:u16 signature)*}
 * with strictly ascending key indices. Signers sign SHA-256(header ‖ payload).
 */
public final class UpdateInstruction {
    public static final int HEADER_LENGTH = 28;

    private final long sequenceNumber;
    private final long effectiveTime;
    private final long timeout;
    private final UpdateType type;
    private final Encodable value;
    private final SortedMap<Integer, byte[]> signatures;
    private final Hash signedHash;

    public UpdateInstruction(long sequenceNumber, long effectiveTime, long timeout,
                             UpdateType type, Encodable value, Map<Integer, byte[]> signatures) {
        this.sequenceNumber = sequenceNumber;
        this.effectiveTime = effectiveTime;
        this.timeout = timeout;
        this.type = Objects.requireNonNull(type, "type");
        if (!type.valueType().isInstance(value)) {
            throw new IllegalArgumentException(type + " expects " + type.valueType().getSimpleName());
        }
        this.value = value;
        TreeMap<Integer, byte[]> sigs = new TreeMap<>();
        for (Map.Entry<Integer, byte[]> e : Objects.requireNonNull(signatures, "signatures").entrySet()) {
            if (e.getKey() < 0 || e.getKey() > 0xffff) {
                throw new IllegalArgumentException("key index out of range: " + e.getKey());
            }
            if (e.getValue().length > 0xffff) {
                throw new IllegalArgumentException("signature too long");
            }
            sigs.put(e.getKey(), e.getValue().clone());
        }
        this.signatures = Collections.unmodifiableSortedMap(sigs);
        this.signedHash = Hashes.hash(signedBytes(sequenceNumber, effectiveTime, timeout, payloadBytes(type, value)));
    }

    /** Builds and signs an instruction with the given governance keys, by key index. */
    public static UpdateInstruction sign(long sequenceNumber, long effectiveTime, long timeout,
                                         UpdateType type, Encodable value, Map<Integer, PrivateKey> keys) {
        byte[] message = Hashes.sha256(signedBytes(sequenceNumber, effectiveTime, timeout, payloadBytes(type, value)));
        TreeMap<Integer, byte[]> sigs = new TreeMap<>();
        keys.forEach((idx, key) -> sigs.put(idx, Ed25519.sign(message, key)));
        return new UpdateInstruction(sequenceNumber, effectiveTime, timeout, type, value, sigs);
    }

    private static byte[] payloadBytes(UpdateType type, Encodable value) {
        ByteSink sink = new ByteSink();
        sink.putByte(type.tag());
        value.writeTo(sink);
        return sink.toByteArray();
    }

    private static byte[] signedBytes(long seq, long effective, long timeout, byte[] payload) {
        ByteSink sink = new ByteSink(HEADER_LENGTH + payload.length);
        sink.putLong(seq);
        sink.putLong(effective);
        sink.putLong(timeout);
        sink.putInt(payload.length);
        sink.putBytes(payload);
        return sink.toByteArray();
    }

    public long sequenceNumber() { return sequenceNumber; }

    /** Requested effective time; 0 means at the timeout. */
    public long effectiveTime() { return effectiveTime; }

    public long timeout() { return timeout; }

    public UpdateType type() { return type; }

    public Encodable value() { return value; }

    public SortedMap<Integer, byte[]> signatures() { return signatures; }

    /** The hash every signature covers. */
    public Hash signedHash() { return signedHash; }

    /** Time the update is scheduled for once accepted. */
    public long scheduledTime() {
        return effectiveTime == 0 ? timeout : effectiveTime;
    }

    public byte[] serialize() {
        ByteSink sink = new ByteSink(256);
        sink.putBytes(signedBytes(sequenceNumber, effectiveTime, timeout, payloadBytes(type, value)));
        sink.putShort(signatures.size());
        signatures.forEach((idx, sig) -> {
            sink.putShort(idx);
            sink.putShort(sig.length);
            sink.putBytes(sig);
        });
        return sink.toByteArray();
    }

    public static UpdateInstruction fromBytes(byte[] bytes) {
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        try {
            long seq = Bytes.readLong(buf);
            long effective = Bytes.readLong(buf);
            long timeout = Bytes.readLong(buf);
            long payloadSize = Bytes.readUnsignedInt(buf);
            if (payloadSize > buf.remaining()) {
                throw new DecodeException("Declared payload size " + payloadSize + " exceeds input");
            }
            ByteBuffer payload = ByteBuffer.wrap(Bytes.readBytes(buf, (int) payloadSize));
            UpdateType type = UpdateType.fromTag(Bytes.readUnsignedByte(payload));
            Encodable value = type.reader().read(payload);
            Bytes.expectFullyConsumed(payload);

            int count = Bytes.readUnsignedShort(buf);
            TreeMap<Integer, byte[]> sigs = new TreeMap<>();
            int last = -1;
            for (int i = 0; i < count; i++) {
                int idx = Bytes.readUnsignedShort(buf);
                if (idx <= last) {
                    throw new DecodeException("Signature key indices must be strictly ascending");
                }
                sigs.put(idx, Bytes.readBytes(buf, Bytes.readUnsignedShort(buf)));
                last = idx;
            }
            Bytes.expectFullyConsumed(buf);
            return new UpdateInstruction(seq, effective, timeout, type, value, sigs);
        } catch (DecodeException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new DecodeException("Malformed update instruction: " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "UpdateInstruction{" + type + ", seq=" + sequenceNumber + ", effective=" + effectiveTime
                + ", timeout=" + timeout + ", signatures=" + signatures.keySet() + "}";
    }
}
