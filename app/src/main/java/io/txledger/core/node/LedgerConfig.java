package io.txledger.core.node;

import io.txledger.core.protocol.ProtocolLimits;

/** Simple config holder for a ledger node. */
public final class LedgerConfig {
    public final int maxPayloadBytes;
    public final long transactionKeepAliveSeconds;
    public final String dataDir;

    public LedgerConfig(int maxPayloadBytes, long transactionKeepAliveSeconds, String dataDir) {
        if (maxPayloadBytes <= 0) {
            throw new IllegalArgumentException("maxPayloadBytes must be positive");
        }
        if (transactionKeepAliveSeconds < 0) {
            throw new IllegalArgumentException("transactionKeepAliveSeconds must be >= 0");
        }
        this.maxPayloadBytes = maxPayloadBytes;
        this.transactionKeepAliveSeconds = transactionKeepAliveSeconds;
        this.dataDir = dataDir;
    }

    public static LedgerConfig defaultLocal() {
        return new LedgerConfig(
                ProtocolLimits.DEFAULT_MAX_PAYLOAD_BYTES,
                5 * 60L,      // received transactions are dropped after five minutes
                null          // in-memory updates store
        );
    }

    public LedgerConfig withKeepAlive(long seconds) {
        return new LedgerConfig(this.maxPayloadBytes, seconds, this.dataDir);
    }

    public LedgerConfig withMaxPayloadBytes(int maxPayloadBytes) {
        return new LedgerConfig(maxPayloadBytes, this.transactionKeepAliveSeconds, this.dataDir);
    }

    public LedgerConfig withDataDir(String dataDir) {
        return new LedgerConfig(this.maxPayloadBytes, this.transactionKeepAliveSeconds, dataDir);
    }
}
