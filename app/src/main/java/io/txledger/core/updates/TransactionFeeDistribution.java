package io.txledger.core.updates;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.Encodable;
import io.txledger.core.protocol.ProtocolLimits;

import java.nio.ByteBuffer;
import java.util.Objects;

/** Shares of transaction fees paid to the baker and to the GAS account. */
@JsonPropertyOrder({"baker", "gasAccount"})
public final class TransactionFeeDistribution implements Encodable {
    private final RewardFraction baker;
    private final RewardFraction gasAccount;

    @JsonCreator
    public TransactionFeeDistribution(@JsonProperty("baker") RewardFraction baker,
                                      @JsonProperty("gasAccount") RewardFraction gasAccount) {
        this.baker = Objects.requireNonNull(baker, "baker");
        this.gasAccount = Objects.requireNonNull(gasAccount, "gasAccount");
        if (baker.partsPerHundredThousand() + gasAccount.partsPerHundredThousand()
                > ProtocolLimits.PARTS_PER_HUNDRED_THOUSAND) {
            throw new IllegalArgumentException("baker and gasAccount exceed one");
        }
    }

    @JsonProperty("baker")
    public RewardFraction baker() { return baker; }

    @JsonProperty("gasAccount")
    public RewardFraction gasAccount() { return gasAccount; }

    @Override
    public void writeTo(ByteSink sink) {
        baker.writeTo(sink);
        gasAccount.writeTo(sink);
    }

    public static TransactionFeeDistribution read(ByteBuffer buf) {
        RewardFraction b = RewardFraction.read(buf);
        return new TransactionFeeDistribution(b, RewardFraction.read(buf));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof TransactionFeeDistribution)) return false;
        TransactionFeeDistribution other = (TransactionFeeDistribution) o;
        return baker.equals(other.baker) && gasAccount.equals(other.gasAccount);
    }

    @Override public int hashCode() { return Objects.hash(baker, gasAccount); }
}
