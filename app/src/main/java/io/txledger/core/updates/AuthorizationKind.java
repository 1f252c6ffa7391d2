package io.txledger.core.updates;

/**
 * Kinds of chain update that level-2 keys authorize, each with its own access structure.
 * Declaration order is the byte order inside {@link Authorizations}.
 */
public enum AuthorizationKind {
    EMERGENCY("emergency"),
    PROTOCOL("protocol"),
    ELECTION_DIFFICULTY("electionDifficulty"),
    EURO_PER_ENERGY("euroPerEnergy"),
    MICRO_GTU_PER_EURO("microGTUPerEuro"),
    FOUNDATION_ACCOUNT("foundationAccount"),
    MINT_DISTRIBUTION("mintDistribution"),
    TRANSACTION_FEE_DISTRIBUTION("transactionFeeDistribution"),
    PARAM_GAS_REWARDS("paramGASRewards"),
    BAKER_STAKE_THRESHOLD("bakerStakeThreshold"),
    ADD_ANONYMITY_REVOKER("addAnonymityRevoker"),
    ADD_IDENTITY_PROVIDER("addIdentityProvider");

    private final String jsonName;

    AuthorizationKind(String jsonName) {
        this.jsonName = jsonName;
    }

    public String jsonName() {
        return jsonName;
    }
}
