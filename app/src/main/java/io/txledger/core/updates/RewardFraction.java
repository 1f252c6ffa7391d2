package io.txledger.core.updates;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.Bytes;
import io.txledger.core.protocol.DecodeException;
import io.txledger.core.protocol.Encodable;
import io.txledger.core.protocol.ProtocolLimits;

import java.math.BigDecimal;
import java.nio.ByteBuffer;

/**
 * A fraction in [0, 1] with a resolution of 1/100000. Written as a u32 count of
 * parts per hundred thousand and as a JSON decimal.
 */
public final class RewardFraction implements Encodable {
    private final int partsPerHundredThousand;

    public RewardFraction(int partsPerHundredThousand) {
        if (partsPerHundredThousand < 0 || partsPerHundredThousand > ProtocolLimits.PARTS_PER_HUNDRED_THOUSAND) {
            throw new IllegalArgumentException("reward fraction out of range: " + partsPerHundredThousand);
        }
        this.partsPerHundredThousand = partsPerHundredThousand;
    }

    public int partsPerHundredThousand() { return partsPerHundredThousand; }

    @JsonValue
    public BigDecimal toDecimal() {
        return toDecimal(partsPerHundredThousand);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static RewardFraction fromDecimal(BigDecimal value) {
        return new RewardFraction(partsOf(value));
    }

    static BigDecimal toDecimal(int ppht) {
        return BigDecimal.valueOf(ppht, 5).stripTrailingZeros();
    }

    static int partsOf(BigDecimal value) {
        try {
            return value.movePointRight(5).intValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Fraction " + value + " is not a multiple of 1/100000", e);
        }
    }

    @Override
    public void writeTo(ByteSink sink) {
        sink.putInt(partsPerHundredThousand);
    }

    public static RewardFraction read(ByteBuffer buf) {
        long v = Bytes.readUnsignedInt(buf);
        if (v > ProtocolLimits.PARTS_PER_HUNDRED_THOUSAND) {
            throw new DecodeException("reward fraction out of range: " + v);
        }
        return new RewardFraction((int) v);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RewardFraction && partsPerHundredThousand == ((RewardFraction) o).partsPerHundredThousand;
    }

    @Override public int hashCode() { return partsPerHundredThousand; }
    @Override public String toString() { return toDecimal().toPlainString(); }
}
