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
 * Leadership election difficulty in [0, 1).
 */
public final class ElectionDifficulty implements Encodable {
    private final int partsPerHundredThousand;

    public ElectionDifficulty(int partsPerHundredThousand) {
        if (partsPerHundredThousand < 0 || partsPerHundredThousand >= ProtocolLimits.PARTS_PER_HUNDRED_THOUSAND) {
            throw new IllegalArgumentException("election difficulty must be in [0, 1): " + partsPerHundredThousand);
        }
        this.partsPerHundredThousand = partsPerHundredThousand;
    }

    public int partsPerHundredThousand() { return partsPerHundredThousand; }

    @JsonValue
    public BigDecimal toDecimal() {
        return RewardFraction.toDecimal(partsPerHundredThousand);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ElectionDifficulty fromDecimal(BigDecimal value) {
        return new ElectionDifficulty(RewardFraction.partsOf(value));
    }

    @Override
    public void writeTo(ByteSink sink) {
        sink.putInt(partsPerHundredThousand);
    }

    public static ElectionDifficulty read(ByteBuffer buf) {
        long v = Bytes.readUnsignedInt(buf);
        if (v >= ProtocolLimits.PARTS_PER_HUNDRED_THOUSAND) {
            throw new DecodeException("election difficulty out of range: " + v);
        }
        return new ElectionDifficulty((int) v);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ElectionDifficulty
                && partsPerHundredThousand == ((ElectionDifficulty) o).partsPerHundredThousand;
    }

    @Override public int hashCode() { return partsPerHundredThousand; }
    @Override public String toString() { return "ElectionDifficulty(" + toDecimal().toPlainString() + ")"; }
}
