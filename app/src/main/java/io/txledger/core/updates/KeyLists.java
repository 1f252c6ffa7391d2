package io.txledger.core.updates;

import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.Bytes;
import io.txledger.core.protocol.DecodeException;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/** u16-counted key lists shared by the key collections. */
final class KeyLists {
    private KeyLists() {}

    static void write(ByteSink sink, List<UpdatePublicKey> keys) {
        sink.putShort(keys.size());
        for (UpdatePublicKey k : keys) {
            k.writeTo(sink);
        }
    }

    static List<UpdatePublicKey> read(ByteBuffer buf) {
        int n = Bytes.readUnsignedShort(buf);
        List<UpdatePublicKey> keys = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            keys.add(UpdatePublicKey.read(buf));
        }
        return List.copyOf(keys);
    }

    static void checkThreshold(int threshold, int available) {
        if (threshold < 1 || threshold > available) {
            throw new DecodeException("threshold must be in [1," + available + "], got " + threshold);
        }
    }
}
