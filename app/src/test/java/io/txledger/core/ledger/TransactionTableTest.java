package io.txledger.core.ledger;

import io.txledger.core.protocol.Hash;
import io.txledger.core.protocol.Transaction;
import io.txledger.core.testing.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransactionTableTest {

    private final Fixtures.TestAccount alice = Fixtures.account("alice");
    private final Hash block = Fixtures.blockHash("block");

    @Test
    void addIsIdempotentPerHash() {
        TransactionTable table = new TransactionTable();
        Transaction tx = alice.tx(1);
        assertEquals(TransactionTable.Outcome.ADDED, table.add(tx, 1).outcome());
        TransactionTable.Insertion again = table.add(tx, 5);
        assertEquals(TransactionTable.Outcome.DUPLICATE, again.outcome());
        assertEquals(new TransactionStatus.Received(1), again.entry().orElseThrow().status());
        assertEquals(1, table.size());
        assertEquals(1, table.nonFinalizedTransactions(alice.address()).get(1L).size());
    }

    @Test
    void finalizingRetiresRivalsWithSameOrLowerNonce() {
        TransactionTable table = new TransactionTable();
        Transaction chosen = alice.tx(1);
        Transaction rival = alice.tx(1, Long.MAX_VALUE, 0, new byte[] {7});
        Transaction later = alice.tx(2);
        table.add(chosen, 1);
        table.add(rival, 1);
        table.add(later, 1);
        table.addResult(chosen.hash(), block, 4, 0);

        List<Transaction> removed = table.finalizeTransactions(block, 4, List.of(chosen));
        assertEquals(List.of(rival), removed);
        assertFalse(table.contains(rival.hash()));
        assertEquals(new TransactionStatus.Finalized(4, block, 0), table.lookup(chosen.hash()).orElseThrow().status());
        assertEquals(2, table.nextNonce(alice.address()));
        assertEquals(List.of(2L), List.copyOf(table.nonFinalizedTransactions(alice.address()).keySet()));

        assertEquals(TransactionTable.Outcome.OBSOLETE_NONCE, table.add(alice.tx(1, Long.MAX_VALUE, 0, new byte[] {8}), 5).outcome());
    }

    @Test
    void finalizingUncommittedTransactionIsAFault() {
        TransactionTable table = new TransactionTable();
        Transaction tx = alice.tx(1);
        table.add(tx, 1);
        assertThrows(LedgerInvariantException.class, () -> table.finalizeTransactions(block, 2, List.of(tx)));
        assertEquals(new TransactionStatus.Received(1), table.lookup(tx.hash()).orElseThrow().status());
    }

    @Test
    void rejectedFinalizationChangesNothing() {
        TransactionTable table = new TransactionTable();
        Transaction first = alice.tx(1);
        Transaction second = alice.tx(2);
        table.add(first, 1);
        table.add(second, 1);
        table.addResult(first.hash(), block, 2, 0);
        table.addResult(second.hash(), block, 2, 1);

        // nonce 2 listed before nonce 1
        assertThrows(LedgerInvariantException.class, () -> table.finalizeTransactions(block, 2, List.of(second, first)));
        assertEquals(TransactionStatus.Kind.COMMITTED, table.lookup(first.hash()).orElseThrow().status().kind());
        assertEquals(1, table.nextNonce(alice.address()));
    }

    @Test
    void unknownTransactionTransitionFails() {
        TransactionTable table = new TransactionTable();
        assertThrows(LedgerInvariantException.class, () -> table.addResult(alice.tx(1).hash(), block, 1, 0));
    }

    @Test
    void purgeDropsOnlyExpiredOrStaleReceived() {
        TransactionTable table = new TransactionTable();
        Transaction expired = alice.tx(1, 50, 90, new byte[] {1});
        Transaction stale = alice.tx(2, 10_000, 10, new byte[] {2});
        Transaction fresh = alice.tx(3, 10_000, 95, new byte[] {3});
        Transaction committed = alice.tx(4, 50, 10, new byte[] {4});
        table.add(expired, 1);
        table.add(stale, 1);
        table.add(fresh, 1);
        table.add(committed, 1);
        table.addResult(committed.hash(), block, 2, 0);

        List<Transaction> purged = table.purge(100, 60);
        assertEquals(2, purged.size());
        assertTrue(purged.containsAll(List.of(expired, stale)));
        assertTrue(table.contains(fresh.hash()));
        assertTrue(table.contains(committed.hash()));
        assertFalse(table.nonFinalizedTransactions(alice.address()).containsKey(1L));
    }
}
