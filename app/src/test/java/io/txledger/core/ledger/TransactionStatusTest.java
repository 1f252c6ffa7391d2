package io.txledger.core.ledger;

import io.txledger.core.protocol.Hash;
import io.txledger.core.testing.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TransactionStatusTest {

    private final Hash b1 = Fixtures.blockHash("b1");
    private final Hash b2 = Fixtures.blockHash("b2");

    @Test
    void committedInTwoBlocksThenOneDies() {
        TransactionStatus s = TransactionStatus.initial(3);
        s = TransactionStatus.addResult(b1, 5, 0, s);
        s = TransactionStatus.addResult(b2, 6, 2, s);
        assertEquals(new TransactionStatus.Committed(6, Map.of(b1, 0L, b2, 2L)), s);

        s = TransactionStatus.markDeadResult(b1, s);
        assertEquals(new TransactionStatus.Committed(6, Map.of(b2, 2L)), s);
        assertEquals(new TransactionStatus.Location(false, 2), TransactionStatus.getTransactionIndex(b2, s).orElseThrow());
        assertTrue(TransactionStatus.getTransactionIndex(b1, s).isEmpty());

        s = TransactionStatus.markDeadResult(b2, s);
        assertEquals(new TransactionStatus.Received(6), s);
    }

    @Test
    void slotNeverDecreases() {
        TransactionStatus s = TransactionStatus.initial(9);
        s = TransactionStatus.addResult(b1, 4, 0, s);
        assertEquals(9, s.slot());
    }

    @Test
    void finalizedIsTerminal() {
        TransactionStatus fin = new TransactionStatus.Finalized(7, b1, 1);
        assertSame(fin, TransactionStatus.addResult(b2, 8, 0, fin));
        assertSame(fin, TransactionStatus.markDeadResult(b1, fin));
        assertEquals(new TransactionStatus.Location(true, 1), TransactionStatus.getTransactionIndex(b1, fin).orElseThrow());
        assertTrue(TransactionStatus.getTransactionIndex(b2, fin).isEmpty());
    }

    @Test
    void markDeadOfUnrelatedBlockKeepsStatus() {
        TransactionStatus received = TransactionStatus.initial(1);
        assertSame(received, TransactionStatus.markDeadResult(b1, received));

        TransactionStatus committed = TransactionStatus.addResult(b1, 2, 0, received);
        assertSame(committed, TransactionStatus.markDeadResult(b2, committed));
        assertTrue(TransactionStatus.getTransactionIndex(b1, received).isEmpty());
    }

    @Test
    void committedNeedsAtLeastOneBlock() {
        assertThrows(IllegalArgumentException.class, () -> new TransactionStatus.Committed(1, Map.of()));
    }
}
