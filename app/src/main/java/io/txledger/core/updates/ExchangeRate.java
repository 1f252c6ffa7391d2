package io.txledger.core.updates;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.Bytes;
import io.txledger.core.protocol.Encodable;

import java.nio.ByteBuffer;

/**
 * Positive rational rate, both terms unsigned 64-bit and non-zero.
 */
@JsonPropertyOrder({"numerator", "denominator"})
public final class ExchangeRate implements Encodable {
    private final long numerator;
    private final long denominator;

    @JsonCreator
    public ExchangeRate(@JsonProperty("numerator") long numerator,
                        @JsonProperty("denominator") long denominator) {
        if (numerator == 0 || denominator == 0) {
            throw new IllegalArgumentException("exchange rate terms must be non-zero");
        }
        this.numerator = numerator;
        this.denominator = denominator;
    }

    @JsonProperty("numerator")
    public long numerator() { return numerator; }

    @JsonProperty("denominator")
    public long denominator() { return denominator; }

    @Override
    public void writeTo(ByteSink sink) {
        sink.putLong(numerator);
        sink.putLong(denominator);
    }

    public static ExchangeRate read(ByteBuffer buf) {
        long num = Bytes.readLong(buf);
        return new ExchangeRate(num, Bytes.readLong(buf));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ExchangeRate)) return false;
        ExchangeRate other = (ExchangeRate) o;
        return numerator == other.numerator && denominator == other.denominator;
    }

    @Override public int hashCode() { return Long.hashCode(numerator) * 31 + Long.hashCode(denominator); }

    @Override
    public String toString() {
        return Long.toUnsignedString(numerator) + "/" + Long.toUnsignedString(denominator);
    }
}
