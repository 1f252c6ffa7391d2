package io.txledger.core.updates;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.Bytes;
import io.txledger.core.protocol.DecodeException;
import io.txledger.core.protocol.Encodable;
import io.txledger.core.protocol.Hash;
import io.txledger.core.protocol.Hashes;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Live governance state: the active key collection, the protocol update that took
 * effect (if any), the active chain parameters, and everything still scheduled.
 * Immutable; every transition returns a new instance.
 */
@JsonPropertyOrder({"keys", "chainParameters", "updateQueues", "protocolUpdate"})
public final class Updates implements Encodable {
    private static final Logger LOG = Logger.getLogger(Updates.class.getName());

    private final UpdateKeysCollection keys;
    private final Hash keysHash;
    private final ProtocolUpdate protocolUpdate;
    private final ChainParameters chainParameters;
    private final PendingUpdates pending;

    public Updates(UpdateKeysCollection keys, ProtocolUpdate protocolUpdate,
                   ChainParameters chainParameters, PendingUpdates pending) {
        this.keys = Objects.requireNonNull(keys, "keys");
        this.keysHash = keys.hash();
        this.protocolUpdate = protocolUpdate;
        this.chainParameters = Objects.requireNonNull(chainParameters, "chainParameters");
        this.pending = Objects.requireNonNull(pending, "pending");
    }

    @JsonCreator
    static Updates fromJson(@JsonProperty("keys") UpdateKeysCollection keys,
                            @JsonProperty("chainParameters") ChainParameters chainParameters,
                            @JsonProperty("updateQueues") PendingUpdates pending,
                            @JsonProperty("protocolUpdate") ProtocolUpdate protocolUpdate) {
        return new Updates(keys, protocolUpdate, chainParameters, pending == null ? PendingUpdates.empty() : pending);
    }

    /** Genesis state: nothing scheduled, no protocol update. */
    public static Updates initial(UpdateKeysCollection keys, ChainParameters chainParameters) {
        return new Updates(keys, null, chainParameters, PendingUpdates.empty());
    }

    @JsonProperty("keys")
    public UpdateKeysCollection keys() { return keys; }

    @JsonProperty("chainParameters")
    public ChainParameters chainParameters() { return chainParameters; }

    @JsonProperty("updateQueues")
    public PendingUpdates pending() { return pending; }

    public Optional<ProtocolUpdate> protocolUpdate() { return Optional.ofNullable(protocolUpdate); }

    @JsonProperty("protocolUpdate")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    ProtocolUpdate protocolUpdateOrNull() { return protocolUpdate; }

    public long nextSequenceNumber(UpdateType type) {
        return pending.queue(type).nextSequenceNumber();
    }

    /** Schedules {@code value}; see {@link UpdateQueue#enqueue}. */
    public Updates enqueue(UpdateType type, long effectiveTime, Encodable value) {
        return new Updates(keys, protocolUpdate, chainParameters, pending.enqueue(type, effectiveTime, value));
    }

    public ProtocolUpdateStatus protocolUpdateStatus() {
        if (protocolUpdate != null) {
            return new ProtocolUpdateStatus.ProtocolUpdated(protocolUpdate);
        }
        return new ProtocolUpdateStatus.PendingProtocolUpdates(pending.protocol().entries());
    }

    /**
     * Takes every entry with effective time at or before {@code timestamp} off its
     * queue and applies it. Sequence numbers are unchanged.
     */
    public ProcessedUpdates processUpdateQueues(long timestamp) {
        UpdateKeysCollection k = keys;
        ProtocolUpdate pu = protocolUpdate;
        ChainParameters params = chainParameters;
        PendingUpdates.Dequeued dequeued = pending.dequeueUntil(timestamp);
        List<AppliedUpdate> applied = new ArrayList<>(dequeued.due());

        for (AppliedUpdate u : dequeued.due()) {
            Encodable v = u.value();
            switch (u.type()) {
                case ROOT_KEYS:
                    k = k.withRootKeys((HigherLevelKeys) v);
                    break;
                case LEVEL1_KEYS:
                    k = k.withLevel1Keys((HigherLevelKeys) v);
                    break;
                case LEVEL2_KEYS:
                    k = k.withLevel2Keys((Authorizations) v);
                    break;
                case PROTOCOL:
                    if (pu == null) {
                        pu = (ProtocolUpdate) v;
                        LOG.info("Protocol update took effect at " + u.effectiveTime() + ": " + pu.message());
                    } else {
                        LOG.fine("Ignoring protocol update at " + u.effectiveTime() + ", one already took effect");
                    }
                    break;
                case ELECTION_DIFFICULTY:
                    params = params.withElectionDifficulty((ElectionDifficulty) v);
                    break;
                case EURO_PER_ENERGY:
                    params = params.withEuroPerEnergy((ExchangeRate) v);
                    break;
                case MICRO_GTU_PER_EURO:
                    params = params.withMicroGtuPerEuro((ExchangeRate) v);
                    break;
                case FOUNDATION_ACCOUNT:
                    params = params.withFoundationAccount((AccountIndex) v);
                    break;
                case MINT_DISTRIBUTION:
                    params = params.withMintDistribution((MintDistribution) v);
                    break;
                case TRANSACTION_FEE_DISTRIBUTION:
                    params = params.withTransactionFeeDistribution((TransactionFeeDistribution) v);
                    break;
                case GAS_REWARDS:
                    params = params.withGasRewards((GasRewards) v);
                    break;
                case BAKER_STAKE_THRESHOLD:
                    params = params.withMinimumThresholdForBaking((Amount) v);
                    break;
                default:
                    // registrations are carried out by the caller
                    break;
            }
        }
        applied.sort(Comparator.comparingLong(AppliedUpdate::effectiveTime)
                .thenComparing(AppliedUpdate::type));
        if (applied.isEmpty()) {
            return new ProcessedUpdates(this, applied);
        }
        return new ProcessedUpdates(new Updates(k, pu, params, dequeued.remaining()), applied);
    }

    @Override
    public void writeTo(ByteSink sink) {
        keys.writeTo(sink);
        if (protocolUpdate == null) {
            sink.putByte(0);
        } else {
            sink.putByte(1);
            protocolUpdate.writeTo(sink);
        }
        chainParameters.writeTo(sink);
        pending.writeTo(sink);
    }

    public static Updates read(ByteBuffer buf) {
        try {
            UpdateKeysCollection keys = UpdateKeysCollection.read(buf);
            int tag = Bytes.readUnsignedByte(buf);
            ProtocolUpdate pu;
            if (tag == 0) {
                pu = null;
            } else if (tag == 1) {
                pu = ProtocolUpdate.read(buf);
            } else {
                throw new DecodeException("Invalid protocol update discriminant " + tag);
            }
            ChainParameters params = ChainParameters.read(buf);
            return new Updates(keys, pu, params, PendingUpdates.read(buf));
        } catch (DecodeException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new DecodeException("Malformed updates: " + e.getMessage(), e);
        }
    }

    /** Decodes a complete byte form; trailing bytes are rejected. */
    public static Updates fromBytes(byte[] bytes) {
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        Updates u = read(buf);
        Bytes.expectFullyConsumed(buf);
        return u;
    }

    @Override
    public Hash hash() {
        ByteSink sink = new ByteSink(4 * Hash.LENGTH + 1);
        keysHash.writeTo(sink);
        if (protocolUpdate == null) {
            sink.putByte(0);
        } else {
            sink.putByte(1);
            protocolUpdate.hash().writeTo(sink);
        }
        chainParameters.hash().writeTo(sink);
        pending.hash().writeTo(sink);
        return Hashes.hash(sink.toByteArray());
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Updates)) return false;
        Updates other = (Updates) o;
        return keys.equals(other.keys) && Objects.equals(protocolUpdate, other.protocolUpdate)
                && chainParameters.equals(other.chainParameters) && pending.equals(other.pending);
    }

    @Override public int hashCode() { return Objects.hash(keys, protocolUpdate, chainParameters, pending); }
}
