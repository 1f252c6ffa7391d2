package io.txledger.core.updates;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.Bytes;
import io.txledger.core.protocol.Encodable;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;

/**
 * An anonymity revoker to be registered. The public key is opaque here.
 */
@JsonPropertyOrder({"arIdentity", "arDescription", "arPublicKey"})
public final class AnonymityRevokerInfo implements Encodable {
    private final long arIdentity;
    private final Description arDescription;
    private final byte[] arPublicKey;

    public AnonymityRevokerInfo(long arIdentity, Description arDescription, byte[] arPublicKey) {
        if (arIdentity < 0 || arIdentity > 0xffffffffL) {
            throw new IllegalArgumentException("arIdentity out of range: " + arIdentity);
        }
        this.arIdentity = arIdentity;
        this.arDescription = Objects.requireNonNull(arDescription, "arDescription");
        this.arPublicKey = Objects.requireNonNull(arPublicKey, "arPublicKey").clone();
    }

    @JsonCreator
    static AnonymityRevokerInfo fromJson(@JsonProperty("arIdentity") long arIdentity,
                                         @JsonProperty("arDescription") Description arDescription,
                                         @JsonProperty("arPublicKey") String arPublicKey) {
        return new AnonymityRevokerInfo(arIdentity, arDescription, Bytes.fromHex(arPublicKey));
    }

    @JsonProperty("arIdentity")
    public long arIdentity() { return arIdentity; }

    @JsonProperty("arDescription")
    public Description arDescription() { return arDescription; }

    public byte[] arPublicKey() { return arPublicKey.clone(); }

    @JsonProperty("arPublicKey")
    String arPublicKeyHex() { return Bytes.toHex(arPublicKey); }

    @Override
    public void writeTo(ByteSink sink) {
        sink.putInt(arIdentity);
        arDescription.writeTo(sink);
        sink.putLengthPrefixed(arPublicKey);
    }

    public static AnonymityRevokerInfo read(ByteBuffer buf) {
        long id = Bytes.readUnsignedInt(buf);
        Description d = Description.read(buf);
        return new AnonymityRevokerInfo(id, d, Bytes.readLengthPrefixed(buf));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof AnonymityRevokerInfo)) return false;
        AnonymityRevokerInfo other = (AnonymityRevokerInfo) o;
        return arIdentity == other.arIdentity && arDescription.equals(other.arDescription)
                && Arrays.equals(arPublicKey, other.arPublicKey);
    }

    @Override public int hashCode() { return Objects.hash(arIdentity, arDescription) * 31 + Arrays.hashCode(arPublicKey); }
    @Override public String toString() { return "AnonymityRevoker{" + arIdentity + ", " + arDescription.name() + "}"; }
}
