package io.txledger.core.updates;

import io.txledger.core.protocol.DecodeException;
import io.txledger.core.protocol.Encodable;

import java.util.Optional;

/**
 * Kinds of chain update. The declaration order is the order of the queues in
 * {@link PendingUpdates} and the tag is the payload tag of an {@link UpdateInstruction}.
 */
public enum UpdateType {
    ROOT_KEYS("rootKeys", HigherLevelKeys.class, HigherLevelKeys::read, null),
    LEVEL1_KEYS("level1Keys", HigherLevelKeys.class, HigherLevelKeys::read, null),
    LEVEL2_KEYS("level2Keys", Authorizations.class, Authorizations::read, null),
    PROTOCOL("protocol", ProtocolUpdate.class, ProtocolUpdate::read, AuthorizationKind.PROTOCOL),
    ELECTION_DIFFICULTY("electionDifficulty", ElectionDifficulty.class, ElectionDifficulty::read,
            AuthorizationKind.ELECTION_DIFFICULTY),
    EURO_PER_ENERGY("euroPerEnergy", ExchangeRate.class, ExchangeRate::read, AuthorizationKind.EURO_PER_ENERGY),
    MICRO_GTU_PER_EURO("microGTUPerEuro", ExchangeRate.class, ExchangeRate::read,
            AuthorizationKind.MICRO_GTU_PER_EURO),
    FOUNDATION_ACCOUNT("foundationAccount", AccountIndex.class, AccountIndex::read,
            AuthorizationKind.FOUNDATION_ACCOUNT),
    MINT_DISTRIBUTION("mintDistribution", MintDistribution.class, MintDistribution::read,
            AuthorizationKind.MINT_DISTRIBUTION),
    TRANSACTION_FEE_DISTRIBUTION("transactionFeeDistribution", TransactionFeeDistribution.class,
            TransactionFeeDistribution::read, AuthorizationKind.TRANSACTION_FEE_DISTRIBUTION),
    GAS_REWARDS("gasRewards", GasRewards.class, GasRewards::read, AuthorizationKind.PARAM_GAS_REWARDS),
    BAKER_STAKE_THRESHOLD("bakerStakeThreshold", Amount.class, Amount::read, AuthorizationKind.BAKER_STAKE_THRESHOLD),
    ADD_ANONYMITY_REVOKER("addAnonymityRevoker", AnonymityRevokerInfo.class, AnonymityRevokerInfo::read,
            AuthorizationKind.ADD_ANONYMITY_REVOKER),
    ADD_IDENTITY_PROVIDER("addIdentityProvider", IdentityProviderInfo.class, IdentityProviderInfo::read,
            AuthorizationKind.ADD_IDENTITY_PROVIDER);

    private final String jsonName;
    private final Class<? extends Encodable> valueType;
    private final Encodable.Reader<? extends Encodable> reader;
    private final AuthorizationKind level2Authorization;

    UpdateType(String jsonName, Class<? extends Encodable> valueType,
               Encodable.Reader<? extends Encodable> reader, AuthorizationKind level2Authorization) {
        this.jsonName = jsonName;
        this.valueType = valueType;
        this.reader = reader;
        this.level2Authorization = level2Authorization;
    }

    public String jsonName() { return jsonName; }

    public int tag() { return ordinal(); }

    public Class<? extends Encodable> valueType() { return valueType; }

    public Encodable.Reader<? extends Encodable> reader() { return reader; }

    /** Level-2 access structure that authorizes this kind, empty for key updates. */
    public Optional<AuthorizationKind> level2Authorization() {
        return Optional.ofNullable(level2Authorization);
    }

    public static UpdateType fromTag(int tag) {
        UpdateType[] all = values();
        if (tag < 0 || tag >= all.length) {
            throw new DecodeException("Unknown update type tag " + tag);
        }
        return all[tag];
    }
}
