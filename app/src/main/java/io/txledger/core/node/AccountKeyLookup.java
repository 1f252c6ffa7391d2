package io.txledger.core.node;

import io.txledger.core.protocol.AccountAddress;
import io.txledger.core.protocol.AccountKeys;

import java.util.Optional;

/** Source of the signing keys of existing accounts. */
@FunctionalInterface
public interface AccountKeyLookup {

    Optional<AccountKeys> keysOf(AccountAddress account);
}
