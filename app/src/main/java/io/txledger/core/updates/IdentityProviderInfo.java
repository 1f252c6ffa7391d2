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
 * An identity provider to be registered. Both verification keys are opaque here.
 */
@JsonPropertyOrder({"ipIdentity", "ipDescription", "ipVerifyKey", "ipCdiVerifyKey"})
public final class IdentityProviderInfo implements Encodable {
    private final long ipIdentity;
    private final Description ipDescription;
    private final byte[] ipVerifyKey;
    private final byte[] ipCdiVerifyKey;

    public IdentityProviderInfo(long ipIdentity, Description ipDescription, byte[] ipVerifyKey, byte[] ipCdiVerifyKey) {
        if (ipIdentity < 0 || ipIdentity > 0xffffffffL) {
            throw new IllegalArgumentException("ipIdentity out of range: " + ipIdentity);
        }
        this.ipIdentity = ipIdentity;
        this.ipDescription = Objects.requireNonNull(ipDescription, "ipDescription");
        this.ipVerifyKey = Objects.requireNonNull(ipVerifyKey, "ipVerifyKey").clone();
        this.ipCdiVerifyKey = Objects.requireNonNull(ipCdiVerifyKey, "ipCdiVerifyKey").clone();
    }

    @JsonCreator
    static IdentityProviderInfo fromJson(@JsonProperty("ipIdentity") long ipIdentity,
                                         @JsonProperty("ipDescription") Description ipDescription,
                                         @JsonProperty("ipVerifyKey") String ipVerifyKey,
                                         @JsonProperty("ipCdiVerifyKey") String ipCdiVerifyKey) {
        return new IdentityProviderInfo(ipIdentity, ipDescription,
                Bytes.fromHex(ipVerifyKey), Bytes.fromHex(ipCdiVerifyKey));
    }

    @JsonProperty("ipIdentity")
    public long ipIdentity() { return ipIdentity; }

    @JsonProperty("ipDescription")
    public Description ipDescription() { return ipDescription; }

    public byte[] ipVerifyKey() { return ipVerifyKey.clone(); }

    public byte[] ipCdiVerifyKey() { return ipCdiVerifyKey.clone(); }

    @JsonProperty("ipVerifyKey")
    String ipVerifyKeyHex() { return Bytes.toHex(ipVerifyKey); }

    @JsonProperty("ipCdiVerifyKey")
    String ipCdiVerifyKeyHex() { return Bytes.toHex(ipCdiVerifyKey); }

    @Override
    public void writeTo(ByteSink sink) {
        sink.putInt(ipIdentity);
        ipDescription.writeTo(sink);
        sink.putLengthPrefixed(ipVerifyKey);
        sink.putLengthPrefixed(ipCdiVerifyKey);
    }

    public static IdentityProviderInfo read(ByteBuffer buf) {
        long id = Bytes.readUnsignedInt(buf);
        Description d = Description.read(buf);
        byte[] vk = Bytes.readLengthPrefixed(buf);
        return new IdentityProviderInfo(id, d, vk, Bytes.readLengthPrefixed(buf));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof IdentityProviderInfo)) return false;
        IdentityProviderInfo other = (IdentityProviderInfo) o;
        return ipIdentity == other.ipIdentity && ipDescription.equals(other.ipDescription)
                && Arrays.equals(ipVerifyKey, other.ipVerifyKey)
                && Arrays.equals(ipCdiVerifyKey, other.ipCdiVerifyKey);
    }

    @Override
    public int hashCode() {
        return (Objects.hash(ipIdentity, ipDescription) * 31 + Arrays.hashCode(ipVerifyKey)) * 31
                + Arrays.hashCode(ipCdiVerifyKey);
    }

    @Override public String toString() { return "IdentityProvider{" + ipIdentity + ", " + ipDescription.name() + "}"; }
}
