package io.txledger.core.updates;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.Bytes;
import io.txledger.core.protocol.Encodable;
import io.txledger.core.protocol.Hash;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;

/**
 * Announcement of a new protocol version. Once one takes effect the chain stops
 * applying further updates of this kind.
 * <p>
 * Byte form: {@code bodyLength:u64} then message, URL (u64-prefixed UTF-8),
 * the 32-byte specification hash and the remaining bytes as auxiliary data.
 */
@JsonPropertyOrder({"message", "specificationURL", "specificationHash", "specificationAuxiliaryData"})
public final class ProtocolUpdate implements Encodable {
    private final String message;
    private final String specificationUrl;
    private final Hash specificationHash;
    private final byte[] auxiliaryData;

    public ProtocolUpdate(String message, String specificationUrl, Hash specificationHash, byte[] auxiliaryData) {
        this.message = Objects.requireNonNull(message, "message");
        this.specificationUrl = Objects.requireNonNull(specificationUrl, "specificationUrl");
        this.specificationHash = Objects.requireNonNull(specificationHash, "specificationHash");
        this.auxiliaryData = auxiliaryData == null ? new byte[0] : auxiliaryData.clone();
    }

    @JsonCreator
    static ProtocolUpdate fromJson(@JsonProperty("message") String message,
                                   @JsonProperty("specificationURL") String url,
                                   @JsonProperty("specificationHash") Hash hash,
                                   @JsonProperty("specificationAuxiliaryData") String aux) {
        return new ProtocolUpdate(message, url, hash, aux == null ? null : Bytes.fromHex(aux));
    }

    @JsonProperty("message")
    public String message() { return message; }

    @JsonProperty("specificationURL")
    public String specificationUrl() { return specificationUrl; }

    @JsonProperty("specificationHash")
    public Hash specificationHash() { return specificationHash; }

    public byte[] auxiliaryData() { return auxiliaryData.clone(); }

    @JsonProperty("specificationAuxiliaryData")
    String auxiliaryDataHex() { return Bytes.toHex(auxiliaryData); }

    @Override
    public void writeTo(ByteSink sink) {
        ByteSink body = new ByteSink();
        body.putUtf8(message);
        body.putUtf8(specificationUrl);
        specificationHash.writeTo(body);
        body.putBytes(auxiliaryData);
        sink.putLengthPrefixed(body.toByteArray());
    }

    public static ProtocolUpdate read(ByteBuffer buf) {
        byte[] body = Bytes.readLengthPrefixed(buf);
        ByteBuffer in = ByteBuffer.wrap(body);
        String message = Bytes.readUtf8(in);
        String url = Bytes.readUtf8(in);
        Hash hash = Hash.read(in);
        return new ProtocolUpdate(message, url, hash, Bytes.readBytes(in, in.remaining()));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ProtocolUpdate)) return false;
        ProtocolUpdate other = (ProtocolUpdate) o;
        return message.equals(other.message) && specificationUrl.equals(other.specificationUrl)
                && specificationHash.equals(other.specificationHash)
                && Arrays.equals(auxiliaryData, other.auxiliaryData);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(message, specificationUrl, specificationHash) + Arrays.hashCode(auxiliaryData);
    }

    @Override public String toString() { return "ProtocolUpdate{" + message + ", " + specificationUrl + "}"; }
}
