package io.txledger.core.updates;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.Bytes;
import io.txledger.core.protocol.DecodeException;
import io.txledger.core.protocol.Encodable;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Verification key of a governance key holder. Only Ed25519 keys exist.
 */
@JsonPropertyOrder({"schemeId", "verifyKey"})
public final class UpdatePublicKey implements Encodable {
    public static final String ED25519 = "Ed25519";
    public static final int KEY_LENGTH = 32;

    private final byte[] verifyKey;

    public UpdatePublicKey(byte[] verifyKey) {
        if (verifyKey == null || verifyKey.length != KEY_LENGTH) {
            throw new IllegalArgumentException("Ed25519 verify key must be 32 bytes");
        }
        this.verifyKey = verifyKey.clone();
    }

    @JsonCreator
    static UpdatePublicKey fromJson(@JsonProperty("schemeId") String schemeId,
                                    @JsonProperty("verifyKey") String verifyKey) {
        if (schemeId != null && !ED25519.equals(schemeId)) {
            throw new IllegalArgumentException("Unsupported signature scheme " + schemeId);
        }
        return new UpdatePublicKey(Bytes.fromHex(verifyKey));
    }

    @JsonProperty("schemeId")
    public String schemeId() { return ED25519; }

    public byte[] verifyKey() { return verifyKey.clone(); }

    @JsonProperty("verifyKey")
    String verifyKeyHex() { return Bytes.toHex(verifyKey); }

    @Override
    public void writeTo(ByteSink sink) {
        sink.putByte(0);
        sink.putBytes(verifyKey);
    }

    public static UpdatePublicKey read(ByteBuffer buf) {
        int scheme = Bytes.readUnsignedByte(buf);
        if (scheme != 0) {
            throw new DecodeException("Unsupported signature scheme tag " + scheme);
        }
        return new UpdatePublicKey(Bytes.readBytes(buf, KEY_LENGTH));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UpdatePublicKey && Arrays.equals(verifyKey, ((UpdatePublicKey) o).verifyKey);
    }

    @Override public int hashCode() { return Arrays.hashCode(verifyKey); }
    @Override public String toString() { return "UpdatePublicKey{" + Bytes.toHex(verifyKey) + "}"; }
}
