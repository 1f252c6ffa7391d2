package io.txledger.core.updates;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.Bytes;
import io.txledger.core.protocol.Encodable;

import java.nio.ByteBuffer;

/**
 * Unsigned 64-bit amount in the smallest currency unit. JSON carries it as a
 * decimal string so that values above 2^53 survive.
 */
public final class Amount implements Encodable {
    private final long micro;

    public Amount(long micro) {
        this.micro = micro;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Amount parse(String text) {
        try {
            return new Amount(Long.parseUnsignedLong(text.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid amount: " + text, e);
        }
    }

    public long micro() { return micro; }

    @JsonValue
    @Override
    public String toString() { return Long.toUnsignedString(micro); }

    @Override
    public void writeTo(ByteSink sink) {
        sink.putLong(micro);
    }

    public static Amount read(ByteBuffer buf) {
        return new Amount(Bytes.readLong(buf));
    }

    @Override public boolean equals(Object o) { return o instanceof Amount && micro == ((Amount) o).micro; }
    @Override public int hashCode() { return Long.hashCode(micro); }
}
