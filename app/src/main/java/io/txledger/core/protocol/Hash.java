package io.txledger.core.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * A 32-byte SHA-256 digest. Used as transaction hash, block hash and
 * commitment hash of the governance structures.
 */
public final class Hash implements Comparable<Hash> {
    public static final int LENGTH = 32;
    private final byte[] bytes;

    public Hash(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Hash must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    @JsonCreator
    public static Hash fromHex(String hex) {
        return new Hash(Bytes.fromHex(hex));
    }

    public static Hash read(ByteBuffer buf) {
        return new Hash(Bytes.readBytes(buf, LENGTH));
    }

    public byte[] bytes() { return bytes.clone(); }

    @JsonValue
    public String hex() { return Bytes.toHex(bytes); }

    public void writeTo(ByteSink sink) { sink.putBytes(bytes); }

    @Override
    public int compareTo(Hash other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override public boolean equals(Object o){ return o instanceof Hash && Arrays.equals(bytes, ((Hash)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return "Hash("+hex().substring(0,8)+"…)"; }
}
