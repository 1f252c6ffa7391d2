package io.txledger.core.storage;

import io.txledger.core.protocol.Hash;
import io.txledger.core.testing.Fixtures;
import io.txledger.core.updates.Amount;
import io.txledger.core.updates.UpdateType;
import io.txledger.core.updates.Updates;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryUpdatesStoreTest {

    @Test
    void storesAndRemovesSnapshots() {
        InMemoryUpdatesStore store = new InMemoryUpdatesStore();
        Updates genesis = Fixtures.governance().initialUpdates();
        Updates next = genesis.enqueue(UpdateType.BAKER_STAKE_THRESHOLD, 10, new Amount(1));
        Hash g = Fixtures.blockHash("genesis");
        Hash b = Fixtures.blockHash("b");

        store.put(g, genesis);
        store.put(b, next);
        assertEquals(2, store.size());
        assertEquals(next, store.get(b).orElseThrow());

        store.remove(b);
        store.remove(b);
        assertTrue(store.get(b).isEmpty());
        assertEquals(1, store.size());
    }

    @Test
    void lastFinalizedMustBeStored() {
        InMemoryUpdatesStore store = new InMemoryUpdatesStore();
        Hash g = Fixtures.blockHash("genesis");
        assertTrue(store.getLastFinalized().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> store.setLastFinalized(g));

        store.put(g, Fixtures.governance().initialUpdates());
        store.setLastFinalized(g);
        assertEquals(g, store.getLastFinalized().orElseThrow());
    }
}
