package io.txledger.core.protocol;

import java.security.PrivateKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Signs header and payload with Ed25519 keys, used by tools and tests. */
public final class TransactionSigner {
    private TransactionSigner() {}

    /**
     * Signs the hash of header || payload with every key, in the map's
     * iteration order. Index validity and distinctness are not checked.
     */
    public static Transaction sign(TransactionHeader header,
                                   byte[] payload,
                                   Map<Integer, PrivateKey> keys,
                                   long arrivalTime) {
        byte[] bodyHash = Hashes.sha256(Transaction.bodyBytes(header, payload));
        List<TransactionSignature.Entry> entries = new ArrayList<>(keys.size());
        for (Map.Entry<Integer, PrivateKey> e : keys.entrySet()) {
            entries.add(new TransactionSignature.Entry(e.getKey(), Ed25519.sign(bodyHash, e.getValue())));
        }
        return Transaction.create(new TransactionSignature(entries), header, payload, arrivalTime);
    }
}
