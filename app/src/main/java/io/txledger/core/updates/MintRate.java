package io.txledger.core.updates;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.Bytes;
import io.txledger.core.protocol.Encodable;

import java.nio.ByteBuffer;

/** Rate {@code mantissa * 10^-exponent}, mantissa u32 and exponent u8. */
@JsonPropertyOrder({"mantissa", "exponent"})
public final class MintRate implements Encodable {
    private final long mantissa;
    private final int exponent;

    @JsonCreator
    public MintRate(@JsonProperty("mantissa") long mantissa, @JsonProperty("exponent") int exponent) {
        if (mantissa < 0 || mantissa > 0xffffffffL) {
            throw new IllegalArgumentException("mantissa out of range: " + mantissa);
        }
        if (exponent < 0 || exponent > 0xff) {
            throw new IllegalArgumentException("exponent out of range: " + exponent);
        }
        this.mantissa = mantissa;
        this.exponent = exponent;
    }

    @JsonProperty("mantissa")
    public long mantissa() { return mantissa; }

    @JsonProperty("exponent")
    public int exponent() { return exponent; }

    @Override
    public void writeTo(ByteSink sink) {
        sink.putInt(mantissa);
        sink.putByte(exponent);
    }

    public static MintRate read(ByteBuffer buf) {
        long m = Bytes.readUnsignedInt(buf);
        return new MintRate(m, Bytes.readUnsignedByte(buf));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof MintRate)) return false;
        MintRate other = (MintRate) o;
        return mantissa == other.mantissa && exponent == other.exponent;
    }

    @Override public int hashCode() { return Long.hashCode(mantissa) * 31 + exponent; }
    @Override public String toString() { return mantissa + "e-" + exponent; }
}
