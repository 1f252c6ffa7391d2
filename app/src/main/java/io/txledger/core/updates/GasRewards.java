package io.txledger.core.updates;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.Encodable;

import java.nio.ByteBuffer;
import java.util.Objects;

/** Fractions of the GAS account paid out to the baker per block and per included item. */
@JsonPropertyOrder({"baker", "finalizationProof", "accountCreation", "chainUpdate"})
public final class GasRewards implements Encodable {
    private final RewardFraction baker;
    private final RewardFraction finalizationProof;
    private final RewardFraction accountCreation;
    private final RewardFraction chainUpdate;

    @JsonCreator
    public GasRewards(@JsonProperty("baker") RewardFraction baker,
                      @JsonProperty("finalizationProof") RewardFraction finalizationProof,
                      @JsonProperty("accountCreation") RewardFraction accountCreation,
                      @JsonProperty("chainUpdate") RewardFraction chainUpdate) {
        this.baker = Objects.requireNonNull(baker, "baker");
        this.finalizationProof = Objects.requireNonNull(finalizationProof, "finalizationProof");
        this.accountCreation = Objects.requireNonNull(accountCreation, "accountCreation");
        this.chainUpdate = Objects.requireNonNull(chainUpdate, "chainUpdate");
    }

    @JsonProperty("baker")
    public RewardFraction baker() { return baker; }

    @JsonProperty("finalizationProof")
    public RewardFraction finalizationProof() { return finalizationProof; }

    @JsonProperty("accountCreation")
    public RewardFraction accountCreation() { return accountCreation; }

    @JsonProperty("chainUpdate")
    public RewardFraction chainUpdate() { return chainUpdate; }

    @Override
    public void writeTo(ByteSink sink) {
        baker.writeTo(sink);
        finalizationProof.writeTo(sink);
        accountCreation.writeTo(sink);
        chainUpdate.writeTo(sink);
    }

    public static GasRewards read(ByteBuffer buf) {
        RewardFraction b = RewardFraction.read(buf);
        RewardFraction fp = RewardFraction.read(buf);
        RewardFraction ac = RewardFraction.read(buf);
        return new GasRewards(b, fp, ac, RewardFraction.read(buf));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof GasRewards)) return false;
        GasRewards other = (GasRewards) o;
        return baker.equals(other.baker) && finalizationProof.equals(other.finalizationProof)
                && accountCreation.equals(other.accountCreation) && chainUpdate.equals(other.chainUpdate);
    }

    @Override public int hashCode() { return Objects.hash(baker, finalizationProof, accountCreation, chainUpdate); }
}
