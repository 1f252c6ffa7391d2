package io.txledger.core.updates;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.Bytes;
import io.txledger.core.protocol.Encodable;

import java.nio.ByteBuffer;

/** Position of an account in the account table. */
public final class AccountIndex implements Encodable {
    private final long index;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public AccountIndex(long index) {
        this.index = index;
    }

    @JsonValue
    public long index() { return index; }

    @Override
    public void writeTo(ByteSink sink) {
        sink.putLong(index);
    }

    public static AccountIndex read(ByteBuffer buf) {
        return new AccountIndex(Bytes.readLong(buf));
    }

    @Override public boolean equals(Object o) { return o instanceof AccountIndex && index == ((AccountIndex) o).index; }
    @Override public int hashCode() { return Long.hashCode(index); }
    @Override public String toString() { return "AccountIndex(" + Long.toUnsignedString(index) + ")"; }
}
