package io.txledger.core.updates;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.Bytes;
import io.txledger.core.protocol.DecodeException;
import io.txledger.core.protocol.Encodable;

import java.nio.ByteBuffer;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Which level-2 keys (by index) may authorize one kind of update, and how many must sign.
 */
@JsonPropertyOrder({"authorizedKeys", "threshold"})
public final class AccessStructure implements Encodable {
    private final SortedSet<Integer> authorizedKeys;
    private final int threshold;

    @JsonCreator
    public AccessStructure(@JsonProperty("authorizedKeys") Collection<Integer> authorizedKeys,
                           @JsonProperty("threshold") int threshold) {
        TreeSet<Integer> set = new TreeSet<>(Objects.requireNonNull(authorizedKeys, "authorizedKeys"));
        for (int idx : set) {
            if (idx < 0 || idx > 0xffff) {
                throw new IllegalArgumentException("key index out of range: " + idx);
            }
        }
        KeyLists.checkThreshold(threshold, set.size());
        this.authorizedKeys = Collections.unmodifiableSortedSet(set);
        this.threshold = threshold;
    }

    @JsonProperty("authorizedKeys")
    public SortedSet<Integer> authorizedKeys() { return authorizedKeys; }

    @JsonProperty("threshold")
    public int threshold() { return threshold; }

    public boolean authorizes(int keyIndex) {
        return authorizedKeys.contains(keyIndex);
    }

    @Override
    public void writeTo(ByteSink sink) {
        sink.putShort(authorizedKeys.size());
        for (int idx : authorizedKeys) {
            sink.putShort(idx);
        }
        sink.putShort(threshold);
    }

    public static AccessStructure read(ByteBuffer buf) {
        int n = Bytes.readUnsignedShort(buf);
        TreeSet<Integer> keys = new TreeSet<>();
        int last = -1;
        for (int i = 0; i < n; i++) {
            int idx = Bytes.readUnsignedShort(buf);
            if (idx <= last) {
                throw new DecodeException("Authorized key indices must be strictly ascending");
            }
            keys.add(idx);
            last = idx;
        }
        return new AccessStructure(keys, Bytes.readUnsignedShort(buf));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof AccessStructure)) return false;
        AccessStructure other = (AccessStructure) o;
        return threshold == other.threshold && authorizedKeys.equals(other.authorizedKeys);
    }

    @Override public int hashCode() { return Objects.hash(authorizedKeys, threshold); }
    @Override public String toString() { return "AccessStructure{" + authorizedKeys + ", threshold=" + threshold + "}"; }
}
