package io.txledger.core.updates;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.Bytes;
import io.txledger.core.protocol.Encodable;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Chain parameters currently in force. Each queued parameter update replaces one
 * field through the matching {@code with*} method.
 */
@JsonPropertyOrder({"electionDifficulty", "euroPerEnergy", "microGTUPerEuro", "bakerCooldownEpochs",
        "accountCreationLimit", "rewardParameters", "foundationAccountIndex", "minimumThresholdForBaking"})
public final class ChainParameters implements Encodable {
    private final ElectionDifficulty electionDifficulty;
    private final ExchangeRate euroPerEnergy;
    private final ExchangeRate microGtuPerEuro;
    private final long bakerCooldownEpochs;
    private final int accountCreationLimit;
    private final RewardParameters rewardParameters;
    private final AccountIndex foundationAccountIndex;
    private final Amount minimumThresholdForBaking;

    private ChainParameters(Builder b) {
        this.electionDifficulty = Objects.requireNonNull(b.electionDifficulty, "electionDifficulty");
        this.euroPerEnergy = Objects.requireNonNull(b.euroPerEnergy, "euroPerEnergy");
        this.microGtuPerEuro = Objects.requireNonNull(b.microGtuPerEuro, "microGTUPerEuro");
        if (b.accountCreationLimit < 0 || b.accountCreationLimit > 0xffff) {
            throw new IllegalArgumentException("accountCreationLimit out of range: " + b.accountCreationLimit);
        }
        this.bakerCooldownEpochs = b.bakerCooldownEpochs;
        this.accountCreationLimit = b.accountCreationLimit;
        this.rewardParameters = Objects.requireNonNull(b.rewardParameters, "rewardParameters");
        this.foundationAccountIndex = Objects.requireNonNull(b.foundationAccountIndex, "foundationAccountIndex");
        this.minimumThresholdForBaking = Objects.requireNonNull(b.minimumThresholdForBaking, "minimumThresholdForBaking");
    }

    @JsonCreator
    static ChainParameters fromJson(@JsonProperty("electionDifficulty") ElectionDifficulty electionDifficulty,
                                    @JsonProperty("euroPerEnergy") ExchangeRate euroPerEnergy,
                                    @JsonProperty("microGTUPerEuro") ExchangeRate microGtuPerEuro,
                                    @JsonProperty("bakerCooldownEpochs") long bakerCooldownEpochs,
                                    @JsonProperty("accountCreationLimit") int accountCreationLimit,
                                    @JsonProperty("rewardParameters") RewardParameters rewardParameters,
                                    @JsonProperty("foundationAccountIndex") AccountIndex foundationAccountIndex,
                                    @JsonProperty("minimumThresholdForBaking") Amount minimumThresholdForBaking) {
        return new Builder()
                .electionDifficulty(electionDifficulty)
                .euroPerEnergy(euroPerEnergy)
                .microGtuPerEuro(microGtuPerEuro)
                .bakerCooldownEpochs(bakerCooldownEpochs)
                .accountCreationLimit(accountCreationLimit)
                .rewardParameters(rewardParameters)
                .foundationAccountIndex(foundationAccountIndex)
                .minimumThresholdForBaking(minimumThresholdForBaking)
                .build();
    }

    @JsonProperty("electionDifficulty")
    public ElectionDifficulty electionDifficulty() { return electionDifficulty; }

    @JsonProperty("euroPerEnergy")
    public ExchangeRate euroPerEnergy() { return euroPerEnergy; }

    @JsonProperty("microGTUPerEuro")
    public ExchangeRate microGtuPerEuro() { return microGtuPerEuro; }

    @JsonProperty("bakerCooldownEpochs")
    public long bakerCooldownEpochs() { return bakerCooldownEpochs; }

    @JsonProperty("accountCreationLimit")
    public int accountCreationLimit() { return accountCreationLimit; }

    @JsonProperty("rewardParameters")
    public RewardParameters rewardParameters() { return rewardParameters; }

    @JsonProperty("foundationAccountIndex")
    public AccountIndex foundationAccountIndex() { return foundationAccountIndex; }

    @JsonProperty("minimumThresholdForBaking")
    public Amount minimumThresholdForBaking() { return minimumThresholdForBaking; }

    public Builder toBuilder() {
        return new Builder()
                .electionDifficulty(electionDifficulty)
                .euroPerEnergy(euroPerEnergy)
                .microGtuPerEuro(microGtuPerEuro)
                .bakerCooldownEpochs(bakerCooldownEpochs)
                .accountCreationLimit(accountCreationLimit)
                .rewardParameters(rewardParameters)
                .foundationAccountIndex(foundationAccountIndex)
                .minimumThresholdForBaking(minimumThresholdForBaking);
    }

    public ChainParameters withElectionDifficulty(ElectionDifficulty v) {
        return toBuilder().electionDifficulty(v).build();
    }

    public ChainParameters withEuroPerEnergy(ExchangeRate v) {
        return toBuilder().euroPerEnergy(v).build();
    }

    public ChainParameters withMicroGtuPerEuro(ExchangeRate v) {
        return toBuilder().microGtuPerEuro(v).build();
    }

    public ChainParameters withFoundationAccount(AccountIndex v) {
        return toBuilder().foundationAccountIndex(v).build();
    }

    public ChainParameters withMintDistribution(MintDistribution v) {
        return toBuilder().rewardParameters(rewardParameters.withMintDistribution(v)).build();
    }

    public ChainParameters withTransactionFeeDistribution(TransactionFeeDistribution v) {
        return toBuilder().rewardParameters(rewardParameters.withTransactionFeeDistribution(v)).build();
    }

    public ChainParameters withGasRewards(GasRewards v) {
        return toBuilder().rewardParameters(rewardParameters.withGasRewards(v)).build();
    }

    public ChainParameters withMinimumThresholdForBaking(Amount v) {
        return toBuilder().minimumThresholdForBaking(v).build();
    }

    @Override
    public void writeTo(ByteSink sink) {
        electionDifficulty.writeTo(sink);
        euroPerEnergy.writeTo(sink);
        microGtuPerEuro.writeTo(sink);
        sink.putLong(bakerCooldownEpochs);
        sink.putShort(accountCreationLimit);
        rewardParameters.writeTo(sink);
        foundationAccountIndex.writeTo(sink);
        minimumThresholdForBaking.writeTo(sink);
    }

    public static ChainParameters read(ByteBuffer buf) {
        return new Builder()
                .electionDifficulty(ElectionDifficulty.read(buf))
                .euroPerEnergy(ExchangeRate.read(buf))
                .microGtuPerEuro(ExchangeRate.read(buf))
                .bakerCooldownEpochs(Bytes.readLong(buf))
                .accountCreationLimit(Bytes.readUnsignedShort(buf))
                .rewardParameters(RewardParameters.read(buf))
                .foundationAccountIndex(AccountIndex.read(buf))
                .minimumThresholdForBaking(Amount.read(buf))
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ChainParameters)) return false;
        ChainParameters other = (ChainParameters) o;
        return bakerCooldownEpochs == other.bakerCooldownEpochs
                && accountCreationLimit == other.accountCreationLimit
                && electionDifficulty.equals(other.electionDifficulty)
                && euroPerEnergy.equals(other.euroPerEnergy)
                && microGtuPerEuro.equals(other.microGtuPerEuro)
                && rewardParameters.equals(other.rewardParameters)
                && foundationAccountIndex.equals(other.foundationAccountIndex)
                && minimumThresholdForBaking.equals(other.minimumThresholdForBaking);
    }

    @Override
    public int hashCode() {
        return Objects.hash(electionDifficulty, euroPerEnergy, microGtuPerEuro, bakerCooldownEpochs,
                accountCreationLimit, rewardParameters, foundationAccountIndex, minimumThresholdForBaking);
    }

    public static final class Builder {
        private ElectionDifficulty electionDifficulty;
        private ExchangeRate euroPerEnergy;
        private ExchangeRate microGtuPerEuro;
        private long bakerCooldownEpochs;
        private int accountCreationLimit;
        private RewardParameters rewardParameters;
        private AccountIndex foundationAccountIndex;
        private Amount minimumThresholdForBaking;

        public Builder electionDifficulty(ElectionDifficulty v) { this.electionDifficulty = v; return this; }
        public Builder euroPerEnergy(ExchangeRate v) { this.euroPerEnergy = v; return this; }
        public Builder microGtuPerEuro(ExchangeRate v) { this.microGtuPerEuro = v; return this; }
        public Builder bakerCooldownEpochs(long v) { this.bakerCooldownEpochs = v; return this; }
        public Builder accountCreationLimit(int v) { this.accountCreationLimit = v; return this; }
        public Builder rewardParameters(RewardParameters v) { this.rewardParameters = v; return this; }
        public Builder foundationAccountIndex(AccountIndex v) { this.foundationAccountIndex = v; return this; }
        public Builder minimumThresholdForBaking(Amount v) { this.minimumThresholdForBaking = v; return this; }

        public ChainParameters build() { return new ChainParameters(this); }
    }
}
