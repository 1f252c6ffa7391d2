package io.txledger.core.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.nio.ByteBuffer;
import java.util.Arrays;

/** 32-byte account address; text form is lowercase hex. */
public final class AccountAddress {
    public static final int LENGTH = 32;
    private final byte[] bytes;

    public AccountAddress(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Account address must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    @JsonCreator
    public static AccountAddress fromHex(String hex) {
        byte[] raw = Bytes.fromHex(hex);
        if (raw.length != LENGTH) {
            throw new DecodeException("Account address must be 32 bytes, got " + raw.length);
        }
        return new AccountAddress(raw);
    }

    public static AccountAddress read(ByteBuffer buf) {
        return new AccountAddress(Bytes.readBytes(buf, LENGTH));
    }

    public byte[] bytes() { return bytes.clone(); }

    @JsonValue
    public String hex() { return Bytes.toHex(bytes); }

    public void writeTo(ByteSink sink) { sink.putBytes(bytes); }

    @Override public boolean equals(Object o){ return o instanceof AccountAddress && Arrays.equals(bytes, ((AccountAddress)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return hex(); }
}
