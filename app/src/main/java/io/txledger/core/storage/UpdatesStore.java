package io.txledger.core.storage;

import io.txledger.core.protocol.Hash;
import io.txledger.core.updates.Updates;

import java.util.Optional;

/**
 * Snapshot of the governance state after each block, keyed by block hash, plus
 * the hash of the last finalized block.
 *
 * Notes:
 * - Snapshots are stored in the {@link Updates} byte form.
 * - Putting the same block twice overwrites the snapshot.
 */
public interface UpdatesStore {

    void put(Hash blockHash, Updates updates);

    Optional<Updates> get(Hash blockHash);

    /** Drops the snapshot of a dead block. No-op when absent. */
    void remove(Hash blockHash);

    long size();

    void setLastFinalized(Hash blockHash);

    Optional<Hash> getLastFinalized();
}
