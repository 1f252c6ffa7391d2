package io.txledger.core.protocol;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Growable big-endian writer for the deterministic byte formats.
 */
public final class ByteSink {
    private final ByteArrayOutputStream out;

    public ByteSink() {
        this(64);
    }

    public ByteSink(int initialCapacity) {
        this.out = new ByteArrayOutputStream(initialCapacity);
    }

    public ByteSink putByte(int v) {
        out.write(v & 0xff);
        return this;
    }

    public ByteSink putShort(int v) {
        out.write((v >>> 8) & 0xff);
        out.write(v & 0xff);
        return this;
    }

    public ByteSink putInt(long v) {
        for (int shift = 24; shift >= 0; shift -= 8) {
            out.write((int) (v >>> shift) & 0xff);
        }
        return this;
    }

    public ByteSink putLong(long v) {
        for (int shift = 56; shift >= 0; shift -= 8) {
            out.write((int) (v >>> shift) & 0xff);
        }
        return this;
    }

    public ByteSink putBytes(byte[] b) {
        out.write(b, 0, b.length);
        return this;
    }

    /** u64 length followed by the bytes. */
    public ByteSink putLengthPrefixed(byte[] b) {
        putLong(b.length);
        return putBytes(b);
    }

    public ByteSink putUtf8(String s) {
        return putLengthPrefixed(s.getBytes(StandardCharsets.UTF_8));
    }

    public int size() {
        return out.size();
    }

    public byte[] toByteArray() {
        return out.toByteArray();
    }
}
