package io.txledger.core.updates;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.Encodable;
import io.txledger.core.protocol.ProtocolLimits;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Minting per slot and how it splits between bakers and finalizers. The two
 * shares may not exceed one; the rest goes to the foundation.
 */
@JsonPropertyOrder({"mintPerSlot", "bakingReward", "finalizationReward"})
public final class MintDistribution implements Encodable {
    private final MintRate mintPerSlot;
    private final RewardFraction bakingReward;
    private final RewardFraction finalizationReward;

    @JsonCreator
    public MintDistribution(@JsonProperty("mintPerSlot") MintRate mintPerSlot,
                            @JsonProperty("bakingReward") RewardFraction bakingReward,
                            @JsonProperty("finalizationReward") RewardFraction finalizationReward) {
        this.mintPerSlot = Objects.requireNonNull(mintPerSlot, "mintPerSlot");
        this.bakingReward = Objects.requireNonNull(bakingReward, "bakingReward");
        this.finalizationReward = Objects.requireNonNull(finalizationReward, "finalizationReward");
        if (bakingReward.partsPerHundredThousand() + finalizationReward.partsPerHundredThousand()
                > ProtocolLimits.PARTS_PER_HUNDRED_THOUSAND) {
            throw new IllegalArgumentException("bakingReward and finalizationReward exceed one");
        }
    }

    @JsonProperty("mintPerSlot")
    public MintRate mintPerSlot() { return mintPerSlot; }

    @JsonProperty("bakingReward")
    public RewardFraction bakingReward() { return bakingReward; }

    @JsonProperty("finalizationReward")
    public RewardFraction finalizationReward() { return finalizationReward; }

    @Override
    public void writeTo(ByteSink sink) {
        mintPerSlot.writeTo(sink);
        bakingReward.writeTo(sink);
        finalizationReward.writeTo(sink);
    }

    public static MintDistribution read(ByteBuffer buf) {
        MintRate rate = MintRate.read(buf);
        RewardFraction baking = RewardFraction.read(buf);
        return new MintDistribution(rate, baking, RewardFraction.read(buf));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof MintDistribution)) return false;
        MintDistribution other = (MintDistribution) o;
        return mintPerSlot.equals(other.mintPerSlot) && bakingReward.equals(other.bakingReward)
                && finalizationReward.equals(other.finalizationReward);
    }

    @Override public int hashCode() { return Objects.hash(mintPerSlot, bakingReward, finalizationReward); }
}
