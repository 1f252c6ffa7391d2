package io.txledger.core.protocol;

import java.util.HashSet;
import java.util.Set;

/**
 * Full signature check of a transaction against the sender's keys. A failed
 * check is an ordinary outcome: the caller drops the transaction.
 */
public final class TransactionVerifier {
    private final SignatureScheme scheme;

    public TransactionVerifier(SignatureScheme scheme) {
        this.scheme = scheme;
    }

    public TransactionVerifier() {
        this(Ed25519.INSTANCE);
    }

    public boolean verify(AccountKeys keys, Transaction tx) {
        if (keys == null || tx == null) {
            return false;
        }
        TransactionSignature signature = tx.signature();
        int count = signature.count();
        if (count > ProtocolLimits.MAX_SIGNATURES || count < keys.threshold()) {
            return false;
        }
        byte[] message = tx.hash().bytes();
        Set<Integer> seen = new HashSet<>();
        for (TransactionSignature.Entry entry : signature.entries()) {
            if (!seen.add(entry.keyIndex())) {
                return false;
            }
            byte[] key = keys.key(entry.keyIndex());
            if (key == null || !scheme.verify(key, message, entry.signature())) {
                return false;
            }
        }
        return true;
    }
}
