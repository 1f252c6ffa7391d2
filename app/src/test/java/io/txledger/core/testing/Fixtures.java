package io.txledger.core.testing;

import io.txledger.core.protocol.AccountAddress;
import io.txledger.core.protocol.AccountKeys;
import io.txledger.core.protocol.Ed25519;
import io.txledger.core.protocol.Hash;
import io.txledger.core.protocol.Hashes;
import io.txledger.core.protocol.Transaction;
import io.txledger.core.protocol.TransactionHeader;
import io.txledger.core.protocol.TransactionSigner;
import io.txledger.core.updates.AccessStructure;
import io.txledger.core.updates.AccountIndex;
import io.txledger.core.updates.Amount;
import io.txledger.core.updates.Authorizations;
import io.txledger.core.updates.ChainParameters;
import io.txledger.core.updates.ElectionDifficulty;
import io.txledger.core.updates.ExchangeRate;
import io.txledger.core.updates.GasRewards;
import io.txledger.core.updates.HigherLevelKeys;
import io.txledger.core.updates.MintDistribution;
import io.txledger.core.updates.MintRate;
import io.txledger.core.updates.RewardFraction;
import io.txledger.core.updates.RewardParameters;
import io.txledger.core.updates.TransactionFeeDistribution;
import io.txledger.core.updates.UpdateKeysCollection;
import io.txledger.core.updates.UpdatePublicKey;
import io.txledger.core.updates.Updates;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Accounts, transactions and governance keys shared by the tests. */
public final class Fixtures {
    private Fixtures() {}

    /** An account with one Ed25519 key at index 0. */
    public static final class TestAccount {
        private final KeyPair keyPair;
        private final AccountAddress address;

        private TestAccount(String name) {
            this.keyPair = Ed25519.generateKeyPair();
            this.address = new AccountAddress(Hashes.sha256(name.getBytes(StandardCharsets.UTF_8)));
        }

        public AccountAddress address() { return address; }

        public AccountKeys keys() { return AccountKeys.single(Ed25519.rawPublicKey(keyPair.getPublic())); }

        public PrivateKey privateKey() { return keyPair.getPrivate(); }

        public Transaction tx(long nonce) {
            return tx(nonce, Long.MAX_VALUE, 0, new byte[] {1, 2, 3});
        }

        public Transaction tx(long nonce, long expiry, long arrivalTime, byte[] payload) {
            TransactionHeader header = TransactionHeader.builder()
                    .sender(address)
                    .nonce(nonce)
                    .energyAmount(1_000)
                    .payloadSize(payload.length)
                    .expiry(expiry)
                    .build();
            return TransactionSigner.sign(header, payload, Map.of(0, keyPair.getPrivate()), arrivalTime);
        }
    }

    public static TestAccount account(String name) {
        return new TestAccount(name);
    }

    /**
     * Governance keys: two root keys (threshold 2), two level-1 keys (threshold 1),
     * three level-2 keys where every kind is authorized by keys 0 and 1, threshold 1.
     */
    public static final class Governance {
        private final List<KeyPair> root = generate(2);
        private final List<KeyPair> level1 = generate(2);
        private final List<KeyPair> level2 = generate(3);

        public UpdateKeysCollection keys() {
            return new UpdateKeysCollection(
                    new HigherLevelKeys(publicKeys(root), 2),
                    new HigherLevelKeys(publicKeys(level1), 1),
                    Authorizations.uniform(publicKeys(level2), new AccessStructure(List.of(0, 1), 1)));
        }

        public PrivateKey rootKey(int index) { return root.get(index).getPrivate(); }
        public PrivateKey level1Key(int index) { return level1.get(index).getPrivate(); }
        public PrivateKey level2Key(int index) { return level2.get(index).getPrivate(); }

        public Updates initialUpdates() {
            return Updates.initial(keys(), chainParameters());
        }
    }

    public static Governance governance() {
        return new Governance();
    }

    public static List<UpdatePublicKey> publicKeys(List<KeyPair> pairs) {
        List<UpdatePublicKey> keys = new ArrayList<>(pairs.size());
        for (KeyPair kp : pairs) {
            keys.add(new UpdatePublicKey(Ed25519.rawPublicKey(kp.getPublic())));
        }
        return keys;
    }

    private static List<KeyPair> generate(int n) {
        List<KeyPair> pairs = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            pairs.add(Ed25519.generateKeyPair());
        }
        return pairs;
    }

    public static ChainParameters chainParameters() {
        return new ChainParameters.Builder()
                .electionDifficulty(new ElectionDifficulty(25_000))
                .euroPerEnergy(new ExchangeRate(1, 50_000))
                .microGtuPerEuro(new ExchangeRate(100_000_000, 1))
                .bakerCooldownEpochs(166)
                .accountCreationLimit(10)
                .rewardParameters(new RewardParameters(
                        new MintDistribution(new MintRate(7_555_665, 16), new RewardFraction(60_000), new RewardFraction(30_000)),
                        new TransactionFeeDistribution(new RewardFraction(45_000), new RewardFraction(45_000)),
                        new GasRewards(new RewardFraction(25_000), new RewardFraction(50), new RewardFraction(200), new RewardFraction(50))))
                .foundationAccountIndex(new AccountIndex(5))
                .minimumThresholdForBaking(new Amount(15_000_000_000L))
                .build();
    }

    public static Hash blockHash(String name) {
        return Hashes.hash(name.getBytes(StandardCharsets.UTF_8));
    }
}
