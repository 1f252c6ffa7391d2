package io.txledger.core.storage;

import io.txledger.core.protocol.Hash;
import io.txledger.core.updates.Updates;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Map-backed store for tests and nodes that do not persist governance state.
 */
public final class InMemoryUpdatesStore implements UpdatesStore {

    private final Map<Hash, Updates> snapshots = new HashMap<>();

    private Hash lastFinalized; // null until set

    @Override
    public synchronized void put(Hash blockHash, Updates updates) {
        snapshots.put(Objects.requireNonNull(blockHash, "blockHash"), Objects.requireNonNull(updates, "updates"));
    }

    @Override
    public synchronized Optional<Updates> get(Hash blockHash) {
        if (blockHash == null) return Optional.empty();
        return Optional.ofNullable(snapshots.get(blockHash));
    }

    @Override
    public synchronized void remove(Hash blockHash) {
        if (blockHash == null) return;
        snapshots.remove(blockHash);
    }

    @Override
    public synchronized long size() {
        return snapshots.size();
    }

    @Override
    public synchronized void setLastFinalized(Hash blockHash) {
        if (!snapshots.containsKey(blockHash)) {
            throw new IllegalArgumentException("Unknown block " + blockHash + " (store its updates first)");
        }
        lastFinalized = blockHash;
    }

    @Override
    public synchronized Optional<Hash> getLastFinalized() {
        return Optional.ofNullable(lastFinalized);
    }
}
