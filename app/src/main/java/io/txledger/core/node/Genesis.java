package io.txledger.core.node;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.txledger.core.protocol.AccountAddress;
import io.txledger.core.protocol.AccountKeys;
import io.txledger.core.protocol.Hash;
import io.txledger.core.protocol.Hashes;
import io.txledger.core.updates.ChainParameters;
import io.txledger.core.updates.UpdateKeysCollection;
import io.txledger.core.updates.Updates;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Genesis data: the initial accounts with their keys, the governance keys and
 * the chain parameters.
 *
 * <pre>
 * {
 *   "accounts": [ { "address": "..hex..", "keys": { "keys": { "0": "..hex.." }, "threshold": 1 } } ],
 *   "updateKeys": { "rootKeys": ..., "level1Keys": ..., "level2Keys": ... },
 *   "chainParameters": { ... }
 * }
 * </pre>
 */
public final class Genesis implements AccountKeyLookup {
    private static final ObjectMapper JSON = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final byte[] GENESIS_TAG = "genesis".getBytes(StandardCharsets.US_ASCII);

    public static final class Account {
        private final AccountAddress address;
        private final AccountKeys keys;

        @JsonCreator
        public Account(@JsonProperty("address") AccountAddress address, @JsonProperty("keys") AccountKeys keys) {
            this.address = Objects.requireNonNull(address, "address");
            this.keys = Objects.requireNonNull(keys, "keys");
        }

        @JsonProperty("address")
        public AccountAddress address() { return address; }

        @JsonProperty("keys")
        public AccountKeys keys() { return keys; }
    }

    private final Map<AccountAddress, AccountKeys> accounts;
    private final UpdateKeysCollection updateKeys;
    private final ChainParameters chainParameters;

    @JsonCreator
    public Genesis(@JsonProperty("accounts") List<Account> accounts,
                   @JsonProperty("updateKeys") UpdateKeysCollection updateKeys,
                   @JsonProperty("chainParameters") ChainParameters chainParameters) {
        LinkedHashMap<AccountAddress, AccountKeys> byAddress = new LinkedHashMap<>();
        if (accounts != null) {
            for (Account a : accounts) {
                if (byAddress.put(a.address(), a.keys()) != null) {
                    throw new IllegalArgumentException("Duplicate genesis account " + a.address());
                }
            }
        }
        this.accounts = Collections.unmodifiableMap(byAddress);
        this.updateKeys = Objects.requireNonNull(updateKeys, "updateKeys");
        this.chainParameters = Objects.requireNonNull(chainParameters, "chainParameters");
    }

    public static Genesis load(Path file) throws IOException {
        return JSON.readValue(Files.readAllBytes(file), Genesis.class);
    }

    public static Genesis parse(String json) throws IOException {
        return JSON.readValue(json, Genesis.class);
    }

    public Map<AccountAddress, AccountKeys> accounts() { return accounts; }

    public UpdateKeysCollection updateKeys() { return updateKeys; }

    public ChainParameters chainParameters() { return chainParameters; }

    @Override
    public Optional<AccountKeys> keysOf(AccountAddress account) {
        return Optional.ofNullable(accounts.get(account));
    }

    public Updates initialUpdates() {
        return Updates.initial(updateKeys, chainParameters);
    }

    /** Identifier of the genesis block: SHA-256("genesis" ‖ initial updates bytes). */
    public Hash blockHash() {
        return Hashes.hashAll(GENESIS_TAG, initialUpdates().serialize());
    }
}
