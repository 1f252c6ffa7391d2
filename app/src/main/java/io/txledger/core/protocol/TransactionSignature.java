package io.txledger.core.protocol;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Ordered (key index, signature) pairs. Between 1 and 255 entries; indices are
 * not required to be distinct here, full verification checks that.
 */
public final class TransactionSignature {

    public static final class Entry {
        private final int keyIndex;
        private final byte[] signature;

        public Entry(int keyIndex, byte[] signature) {
            if (keyIndex < 0 || keyIndex > 0xff) {
                throw new IllegalArgumentException("key index out of range: " + keyIndex);
            }
            if (signature == null || signature.length > ProtocolLimits.MAX_SIGNATURE_BYTES) {
                throw new IllegalArgumentException("signature missing or too long");
            }
            this.keyIndex = keyIndex;
            this.signature = signature.clone();
        }

        public int keyIndex() { return keyIndex; }
        public byte[] signature() { return signature.clone(); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Entry)) return false;
            Entry other = (Entry) o;
            return keyIndex == other.keyIndex && Arrays.equals(signature, other.signature);
        }

        @Override
        public int hashCode() {
            return 31 * keyIndex + Arrays.hashCode(signature);
        }
    }

    private final List<Entry> entries;

    public TransactionSignature(List<Entry> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("Need at least one signature");
        }
        if (entries.size() > ProtocolLimits.MAX_SIGNATURES) {
            throw new IllegalArgumentException("At most " + ProtocolLimits.MAX_SIGNATURES + " signatures");
        }
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<Entry> entries() { return entries; }
    public int count() { return entries.size(); }

    public void writeTo(ByteSink sink) {
        sink.putByte(entries.size());
        for (Entry e : entries) {
            sink.putByte(e.keyIndex);
            sink.putShort(e.signature.length);
            sink.putBytes(e.signature);
        }
    }

    public byte[] serialize() {
        ByteSink sink = new ByteSink();
        writeTo(sink);
        return sink.toByteArray();
    }

    public static TransactionSignature read(ByteBuffer buf) {
        int count = Bytes.readUnsignedByte(buf);
        if (count == 0) {
            throw new DecodeException("Need at least one signature");
        }
        List<Entry> entries = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int keyIndex = Bytes.readUnsignedByte(buf);
            int len = Bytes.readUnsignedShort(buf);
            entries.add(new Entry(keyIndex, Bytes.readBytes(buf, len)));
        }
        return new TransactionSignature(entries);
    }

    @Override public boolean equals(Object o){ return o instanceof TransactionSignature && entries.equals(((TransactionSignature)o).entries); }
    @Override public int hashCode(){ return entries.hashCode(); }
}
