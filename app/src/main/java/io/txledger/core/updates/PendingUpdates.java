package io.txledger.core.updates;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.Encodable;
import io.txledger.core.protocol.Hash;
import io.txledger.core.protocol.Hashes;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One {@link UpdateQueue} per {@link UpdateType}. Bytes, hash and JSON all list
 * the queues in {@code UpdateType} declaration order. Immutable.
 */
public final class PendingUpdates implements Encodable {
    private static final ObjectMapper JSON = new ObjectMapper();

    /** Queues taken off by {@link #dequeueUntil}: what is left and what came due. */
    public static final class Dequeued {
        private final PendingUpdates remaining;
        private final List<AppliedUpdate> due;

        Dequeued(PendingUpdates remaining, List<AppliedUpdate> due) {
            this.remaining = remaining;
            this.due = due;
        }

        public PendingUpdates remaining() { return remaining; }

        /** Due entries in queue order, ascending by effective time within a queue. */
        public List<AppliedUpdate> due() { return due; }
    }

    private final UpdateQueue<HigherLevelKeys> rootKeys;
    private final UpdateQueue<HigherLevelKeys> level1Keys;
    private final UpdateQueue<Authorizations> level2Keys;
    private final UpdateQueue<ProtocolUpdate> protocol;
    private final UpdateQueue<ElectionDifficulty> electionDifficulty;
    private final UpdateQueue<ExchangeRate> euroPerEnergy;
    private final UpdateQueue<ExchangeRate> microGtuPerEuro;
    private final UpdateQueue<AccountIndex> foundationAccount;
    private final UpdateQueue<MintDistribution> mintDistribution;
    private final UpdateQueue<TransactionFeeDistribution> transactionFeeDistribution;
    private final UpdateQueue<GasRewards> gasRewards;
    private final UpdateQueue<Amount> bakerStakeThreshold;
    private final UpdateQueue<AnonymityRevokerInfo> addAnonymityRevoker;
    private final UpdateQueue<IdentityProviderInfo> addIdentityProvider;

    private PendingUpdates(Builder b) {
        this.rootKeys = Objects.requireNonNull(b.rootKeys, "rootKeys");
        this.level1Keys = Objects.requireNonNull(b.level1Keys, "level1Keys");
        this.level2Keys = Objects.requireNonNull(b.level2Keys, "level2Keys");
        this.protocol = Objects.requireNonNull(b.protocol, "protocol");
        this.electionDifficulty = Objects.requireNonNull(b.electionDifficulty, "electionDifficulty");
        this.euroPerEnergy = Objects.requireNonNull(b.euroPerEnergy, "euroPerEnergy");
        this.microGtuPerEuro = Objects.requireNonNull(b.microGtuPerEuro, "microGtuPerEuro");
        this.foundationAccount = Objects.requireNonNull(b.foundationAccount, "foundationAccount");
        this.mintDistribution = Objects.requireNonNull(b.mintDistribution, "mintDistribution");
        this.transactionFeeDistribution = Objects.requireNonNull(b.transactionFeeDistribution, "transactionFeeDistribution");
        this.gasRewards = Objects.requireNonNull(b.gasRewards, "gasRewards");
        this.bakerStakeThreshold = Objects.requireNonNull(b.bakerStakeThreshold, "bakerStakeThreshold");
        this.addAnonymityRevoker = Objects.requireNonNull(b.addAnonymityRevoker, "addAnonymityRevoker");
        this.addIdentityProvider = Objects.requireNonNull(b.addIdentityProvider, "addIdentityProvider");
    }

    public static PendingUpdates empty() {
        return new Builder().build();
    }

    public UpdateQueue<HigherLevelKeys> rootKeys() { return rootKeys; }
    public UpdateQueue<HigherLevelKeys> level1Keys() { return level1Keys; }
    public UpdateQueue<Authorizations> level2Keys() { return level2Keys; }
    public UpdateQueue<ProtocolUpdate> protocol() { return protocol; }
    public UpdateQueue<ElectionDifficulty> electionDifficulty() { return electionDifficulty; }
    public UpdateQueue<ExchangeRate> euroPerEnergy() { return euroPerEnergy; }
    public UpdateQueue<ExchangeRate> microGtuPerEuro() { return microGtuPerEuro; }
    public UpdateQueue<AccountIndex> foundationAccount() { return foundationAccount; }
    public UpdateQueue<MintDistribution> mintDistribution() { return mintDistribution; }
    public UpdateQueue<TransactionFeeDistribution> transactionFeeDistribution() { return transactionFeeDistribution; }
    public UpdateQueue<GasRewards> gasRewards() { return gasRewards; }
    public UpdateQueue<Amount> bakerStakeThreshold() { return bakerStakeThreshold; }
    public UpdateQueue<AnonymityRevokerInfo> addAnonymityRevoker() { return addAnonymityRevoker; }
    public UpdateQueue<IdentityProviderInfo> addIdentityProvider() { return addIdentityProvider; }

    public UpdateQueue<?> queue(UpdateType type) {
        switch (type) {
            case ROOT_KEYS: return rootKeys;
            case LEVEL1_KEYS: return level1Keys;
            case LEVEL2_KEYS: return level2Keys;
            case PROTOCOL: return protocol;
            case ELECTION_DIFFICULTY: return electionDifficulty;
            case EURO_PER_ENERGY: return euroPerEnergy;
            case MICRO_GTU_PER_EURO: return microGtuPerEuro;
            case FOUNDATION_ACCOUNT: return foundationAccount;
            case MINT_DISTRIBUTION: return mintDistribution;
            case TRANSACTION_FEE_DISTRIBUTION: return transactionFeeDistribution;
            case GAS_REWARDS: return gasRewards;
            case BAKER_STAKE_THRESHOLD: return bakerStakeThreshold;
            case ADD_ANONYMITY_REVOKER: return addAnonymityRevoker;
            case ADD_IDENTITY_PROVIDER: return addIdentityProvider;
            default: throw new IllegalArgumentException("Unknown update type " + type);
        }
    }

    /** Schedules {@code value} in the queue of {@code type}. */
    public PendingUpdates enqueue(UpdateType type, long effectiveTime, Encodable value) {
        if (!type.valueType().isInstance(value)) {
            throw new IllegalArgumentException(type + " expects " + type.valueType().getSimpleName()
                    + ", got " + (value == null ? "null" : value.getClass().getSimpleName()));
        }
        Builder b = toBuilder();
        switch (type) {
            case ROOT_KEYS: b.rootKeys = rootKeys.enqueue(effectiveTime, (HigherLevelKeys) value); break;
            case LEVEL1_KEYS: b.level1Keys = level1Keys.enqueue(effectiveTime, (HigherLevelKeys) value); break;
            case LEVEL2_KEYS: b.level2Keys = level2Keys.enqueue(effectiveTime, (Authorizations) value); break;
            case PROTOCOL: b.protocol = protocol.enqueue(effectiveTime, (ProtocolUpdate) value); break;
            case ELECTION_DIFFICULTY:
                b.electionDifficulty = electionDifficulty.enqueue(effectiveTime, (ElectionDifficulty) value);
                break;
            case EURO_PER_ENERGY: b.euroPerEnergy = euroPerEnergy.enqueue(effectiveTime, (ExchangeRate) value); break;
            case MICRO_GTU_PER_EURO: b.microGtuPerEuro = microGtuPerEuro.enqueue(effectiveTime, (ExchangeRate) value); break;
            case FOUNDATION_ACCOUNT: b.foundationAccount = foundationAccount.enqueue(effectiveTime, (AccountIndex) value); break;
            case MINT_DISTRIBUTION:
                b.mintDistribution = mintDistribution.enqueue(effectiveTime, (MintDistribution) value);
                break;
            case TRANSACTION_FEE_DISTRIBUTION:
                b.transactionFeeDistribution = transactionFeeDistribution.enqueue(effectiveTime, (TransactionFeeDistribution) value);
                break;
            case GAS_REWARDS: b.gasRewards = gasRewards.enqueue(effectiveTime, (GasRewards) value); break;
            case BAKER_STAKE_THRESHOLD: b.bakerStakeThreshold = bakerStakeThreshold.enqueue(effectiveTime, (Amount) value); break;
            case ADD_ANONYMITY_REVOKER:
                b.addAnonymityRevoker = addAnonymityRevoker.enqueue(effectiveTime, (AnonymityRevokerInfo) value);
                break;
            case ADD_IDENTITY_PROVIDER:
                b.addIdentityProvider = addIdentityProvider.enqueue(effectiveTime, (IdentityProviderInfo) value);
                break;
            default:
                throw new IllegalArgumentException("Unknown update type " + type);
        }
        return b.build();
    }

    /** Takes every entry with effective time at or before {@code timestamp} off every queue. */
    public Dequeued dequeueUntil(long timestamp) {
        List<AppliedUpdate> due = new ArrayList<>();
        Builder b = new Builder();
        b.rootKeys = take(rootKeys, UpdateType.ROOT_KEYS, timestamp, due);
        b.level1Keys = take(level1Keys, UpdateType.LEVEL1_KEYS, timestamp, due);
        b.level2Keys = take(level2Keys, UpdateType.LEVEL2_KEYS, timestamp, due);
        b.protocol = take(protocol, UpdateType.PROTOCOL, timestamp, due);
        b.electionDifficulty = take(electionDifficulty, UpdateType.ELECTION_DIFFICULTY, timestamp, due);
        b.euroPerEnergy = take(euroPerEnergy, UpdateType.EURO_PER_ENERGY, timestamp, due);
        b.microGtuPerEuro = take(microGtuPerEuro, UpdateType.MICRO_GTU_PER_EURO, timestamp, due);
        b.foundationAccount = take(foundationAccount, UpdateType.FOUNDATION_ACCOUNT, timestamp, due);
        b.mintDistribution = take(mintDistribution, UpdateType.MINT_DISTRIBUTION, timestamp, due);
        b.transactionFeeDistribution = take(transactionFeeDistribution, UpdateType.TRANSACTION_FEE_DISTRIBUTION, timestamp, due);
        b.gasRewards = take(gasRewards, UpdateType.GAS_REWARDS, timestamp, due);
        b.bakerStakeThreshold = take(bakerStakeThreshold, UpdateType.BAKER_STAKE_THRESHOLD, timestamp, due);
        b.addAnonymityRevoker = take(addAnonymityRevoker, UpdateType.ADD_ANONYMITY_REVOKER, timestamp, due);
        b.addIdentityProvider = take(addIdentityProvider, UpdateType.ADD_IDENTITY_PROVIDER, timestamp, due);
        return new Dequeued(due.isEmpty() ? this : b.build(), due);
    }

    private static <E extends Encodable> UpdateQueue<E> take(UpdateQueue<E> queue, UpdateType type, long timestamp,
                                                             List<AppliedUpdate> due) {
        UpdateQueue.Dequeued<E> d = queue.dequeueUntil(timestamp);
        for (UpdateQueue.Entry<E> e : d.due()) {
            due.add(new AppliedUpdate(e.effectiveTime(), type, e.update()));
        }
        return d.remaining();
    }

    @Override
    public void writeTo(ByteSink sink) {
        for (UpdateType type : UpdateType.values()) {
            queue(type).writeTo(sink);
        }
    }

    public static PendingUpdates read(ByteBuffer buf) {
        Builder b = new Builder();
        b.rootKeys = UpdateQueue.read(buf, HigherLevelKeys::read);
        b.level1Keys = UpdateQueue.read(buf, HigherLevelKeys::read);
        b.level2Keys = UpdateQueue.read(buf, Authorizations::read);
        b.protocol = UpdateQueue.read(buf, ProtocolUpdate::read);
        b.electionDifficulty = UpdateQueue.read(buf, ElectionDifficulty::read);
        b.euroPerEnergy = UpdateQueue.read(buf, ExchangeRate::read);
        b.microGtuPerEuro = UpdateQueue.read(buf, ExchangeRate::read);
        b.foundationAccount = UpdateQueue.read(buf, AccountIndex::read);
        b.mintDistribution = UpdateQueue.read(buf, MintDistribution::read);
        b.transactionFeeDistribution = UpdateQueue.read(buf, TransactionFeeDistribution::read);
        b.gasRewards = UpdateQueue.read(buf, GasRewards::read);
        b.bakerStakeThreshold = UpdateQueue.read(buf, Amount::read);
        b.addAnonymityRevoker = UpdateQueue.read(buf, AnonymityRevokerInfo::read);
        b.addIdentityProvider = UpdateQueue.read(buf, IdentityProviderInfo::read);
        return b.build();
    }

    @Override
    public Hash hash() {
        ByteSink sink = new ByteSink(UpdateType.values().length * Hash.LENGTH);
        for (UpdateType type : UpdateType.values()) {
            queue(type).hash().writeTo(sink);
        }
        return Hashes.hash(sink.toByteArray());
    }

    @JsonValue
    ObjectNode toJson() {
        ObjectNode node = JSON.createObjectNode();
        for (UpdateType type : UpdateType.values()) {
            node.set(type.jsonName(), JSON.valueToTree(queue(type)));
        }
        return node;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static PendingUpdates fromJson(JsonNode node) {
        Builder b = new Builder();
        b.rootKeys = queueFromJson(node, UpdateType.ROOT_KEYS);
        b.level1Keys = queueFromJson(node, UpdateType.LEVEL1_KEYS);
        b.level2Keys = queueFromJson(node, UpdateType.LEVEL2_KEYS);
        b.protocol = queueFromJson(node, UpdateType.PROTOCOL);
        b.electionDifficulty = queueFromJson(node, UpdateType.ELECTION_DIFFICULTY);
        b.euroPerEnergy = queueFromJson(node, UpdateType.EURO_PER_ENERGY);
        b.microGtuPerEuro = queueFromJson(node, UpdateType.MICRO_GTU_PER_EURO);
        b.foundationAccount = queueFromJson(node, UpdateType.FOUNDATION_ACCOUNT);
        b.mintDistribution = queueFromJson(node, UpdateType.MINT_DISTRIBUTION);
        b.transactionFeeDistribution = queueFromJson(node, UpdateType.TRANSACTION_FEE_DISTRIBUTION);
        b.gasRewards = queueFromJson(node, UpdateType.GAS_REWARDS);
        b.bakerStakeThreshold = queueFromJson(node, UpdateType.BAKER_STAKE_THRESHOLD);
        b.addAnonymityRevoker = queueFromJson(node, UpdateType.ADD_ANONYMITY_REVOKER);
        b.addIdentityProvider = queueFromJson(node, UpdateType.ADD_IDENTITY_PROVIDER);
        return b.build();
    }

    // The element type comes from the UpdateType, so Jackson builds the right value class.
    private static <E extends Encodable> UpdateQueue<E> queueFromJson(JsonNode node, UpdateType type) {
        JsonNode q = node.get(type.jsonName());
        if (q == null || q.isNull()) {
            throw new IllegalArgumentException("Missing update queue " + type.jsonName());
        }
        JavaType queueType = JSON.getTypeFactory().constructParametricType(UpdateQueue.class, type.valueType());
        return JSON.convertValue(q, queueType);
    }

    private Builder toBuilder() {
        Builder b = new Builder();
        b.rootKeys = rootKeys;
        b.level1Keys = level1Keys;
        b.level2Keys = level2Keys;
        b.protocol = protocol;
        b.electionDifficulty = electionDifficulty;
        b.euroPerEnergy = euroPerEnergy;
        b.microGtuPerEuro = microGtuPerEuro;
        b.foundationAccount = foundationAccount;
        b.mintDistribution = mintDistribution;
        b.transactionFeeDistribution = transactionFeeDistribution;
        b.gasRewards = gasRewards;
        b.bakerStakeThreshold = bakerStakeThreshold;
        b.addAnonymityRevoker = addAnonymityRevoker;
        b.addIdentityProvider = addIdentityProvider;
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof PendingUpdates)) return false;
        PendingUpdates other = (PendingUpdates) o;
        for (UpdateType type : UpdateType.values()) {
            if (!queue(type).equals(other.queue(type))) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (UpdateType type : UpdateType.values()) {
            h = 31 * h + queue(type).hashCode();
        }
        return h;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("PendingUpdates{");
        for (UpdateType type : UpdateType.values()) {
            if (type.ordinal() > 0) sb.append(", ");
            sb.append(type.jsonName()).append('=').append(queue(type));
        }
        return sb.append('}').toString();
    }

    private static final class Builder {
        private UpdateQueue<HigherLevelKeys> rootKeys = UpdateQueue.empty();
        private UpdateQueue<HigherLevelKeys> level1Keys = UpdateQueue.empty();
        private UpdateQueue<Authorizations> level2Keys = UpdateQueue.empty();
        private UpdateQueue<ProtocolUpdate> protocol = UpdateQueue.empty();
        private UpdateQueue<ElectionDifficulty> electionDifficulty = UpdateQueue.empty();
        private UpdateQueue<ExchangeRate> euroPerEnergy = UpdateQueue.empty();
        private UpdateQueue<ExchangeRate> microGtuPerEuro = UpdateQueue.empty();
        private UpdateQueue<AccountIndex> foundationAccount = UpdateQueue.empty();
        private UpdateQueue<MintDistribution> mintDistribution = UpdateQueue.empty();
        private UpdateQueue<TransactionFeeDistribution> transactionFeeDistribution = UpdateQueue.empty();
        private UpdateQueue<GasRewards> gasRewards = UpdateQueue.empty();
        private UpdateQueue<Amount> bakerStakeThreshold = UpdateQueue.empty();
        private UpdateQueue<AnonymityRevokerInfo> addAnonymityRevoker = UpdateQueue.empty();
        private UpdateQueue<IdentityProviderInfo> addIdentityProvider = UpdateQueue.empty();

        PendingUpdates build() { return new PendingUpdates(this); }
    }
}
