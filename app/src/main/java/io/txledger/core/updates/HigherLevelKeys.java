package io.txledger.core.updates;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.Bytes;
import io.txledger.core.protocol.Encodable;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;

/**
 * Root or level-1 governance keys with their signing threshold.
 */
@JsonPropertyOrder({"keys", "threshold"})
public final class HigherLevelKeys implements Encodable {
    private final List<UpdatePublicKey> keys;
    private final int threshold;

    @JsonCreator
    public HigherLevelKeys(@JsonProperty("keys") List<UpdatePublicKey> keys,
                           @JsonProperty("threshold") int threshold) {
        this.keys = List.copyOf(Objects.requireNonNull(keys, "keys"));
        KeyLists.checkThreshold(threshold, this.keys.size());
        this.threshold = threshold;
    }

    @JsonProperty("keys")
    public List<UpdatePublicKey> keys() { return keys; }

    @JsonProperty("threshold")
    public int threshold() { return threshold; }

    @Override
    public void writeTo(ByteSink sink) {
        KeyLists.write(sink, keys);
        sink.putShort(threshold);
    }

    public static HigherLevelKeys read(ByteBuffer buf) {
        List<UpdatePublicKey> keys = KeyLists.read(buf);
        return new HigherLevelKeys(keys, Bytes.readUnsignedShort(buf));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof HigherLevelKeys)) return false;
        HigherLevelKeys other = (HigherLevelKeys) o;
        return threshold == other.threshold && keys.equals(other.keys);
    }

    @Override public int hashCode() { return Objects.hash(keys, threshold); }
    @Override public String toString() { return "HigherLevelKeys{" + keys.size() + " keys, threshold=" + threshold + "}"; }
}
