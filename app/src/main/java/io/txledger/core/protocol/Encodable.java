package io.txledger.core.protocol;

import java.nio.ByteBuffer;

/**
 * A value with a deterministic byte form. Its hash is SHA-256 of that form.
 */
public interface Encodable {

    void writeTo(ByteSink sink);

    default byte[] serialize() {
        ByteSink sink = new ByteSink();
        writeTo(sink);
        return sink.toByteArray();
    }

    default Hash hash() {
        return Hashes.hash(serialize());
    }

    /** Reads a value written by {@link #writeTo}. */
    @FunctionalInterface
    interface Reader<E> {
        E read(ByteBuffer buf);
    }
}
