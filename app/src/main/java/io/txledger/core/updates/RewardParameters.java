package io.txledger.core.updates;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.Encodable;

import java.nio.ByteBuffer;
import java.util.Objects;

@JsonPropertyOrder({"mintDistribution", "transactionFeeDistribution", "gASRewards"})
public final class RewardParameters implements Encodable {
    private final MintDistribution mintDistribution;
    private final TransactionFeeDistribution transactionFeeDistribution;
    private final GasRewards gasRewards;

    @JsonCreator
    public RewardParameters(@JsonProperty("mintDistribution") MintDistribution mintDistribution,
                            @JsonProperty("transactionFeeDistribution") TransactionFeeDistribution transactionFeeDistribution,
                            @JsonProperty("gASRewards") GasRewards gasRewards) {
        this.mintDistribution = Objects.requireNonNull(mintDistribution, "mintDistribution");
        this.transactionFeeDistribution = Objects.requireNonNull(transactionFeeDistribution, "transactionFeeDistribution");
        this.gasRewards = Objects.requireNonNull(gasRewards, "gASRewards");
    }

    @JsonProperty("mintDistribution")
    public MintDistribution mintDistribution() { return mintDistribution; }

    @JsonProperty("transactionFeeDistribution")
    public TransactionFeeDistribution transactionFeeDistribution() { return transactionFeeDistribution; }

    @JsonProperty("gASRewards")
    public GasRewards gasRewards() { return gasRewards; }

    RewardParameters withMintDistribution(MintDistribution v) {
        return new RewardParameters(v, transactionFeeDistribution, gasRewards);
    }

    RewardParameters withTransactionFeeDistribution(TransactionFeeDistribution v) {
        return new RewardParameters(mintDistribution, v, gasRewards);
    }

    RewardParameters withGasRewards(GasRewards v) {
        return new RewardParameters(mintDistribution, transactionFeeDistribution, v);
    }

    @Override
    public void writeTo(ByteSink sink) {
        mintDistribution.writeTo(sink);
        transactionFeeDistribution.writeTo(sink);
        gasRewards.writeTo(sink);
    }

    public static RewardParameters read(ByteBuffer buf) {
        MintDistribution md = MintDistribution.read(buf);
        TransactionFeeDistribution tfd = TransactionFeeDistribution.read(buf);
        return new RewardParameters(md, tfd, GasRewards.read(buf));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RewardParameters)) return false;
        RewardParameters other = (RewardParameters) o;
        return mintDistribution.equals(other.mintDistribution)
                && transactionFeeDistribution.equals(other.transactionFeeDistribution)
                && gasRewards.equals(other.gasRewards);
    }

    @Override public int hashCode() { return Objects.hash(mintDistribution, transactionFeeDistribution, gasRewards); }
}
