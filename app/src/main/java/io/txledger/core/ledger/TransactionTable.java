package io.txledger.core.ledger;

import io.txledger.core.protocol.AccountAddress;
import io.txledger.core.protocol.Hash;
import io.txledger.core.protocol.ProtocolLimits;
import io.txledger.core.protocol.Transaction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * All transactions the node knows about that are not yet superseded, indexed by
 * hash, plus the per-account nonce index.
 * <p>
 * Not thread-safe. The owner serializes writers and readers (see
 * {@code TransactionLedger}).
 */
public final class TransactionTable {
    private static final Logger LOG = Logger.getLogger(TransactionTable.class.getName());

    /** A transaction and its current status. */
    public static final class Entry {
        private final Transaction transaction;
        private final TransactionStatus status;

        Entry(Transaction transaction, TransactionStatus status) {
            this.transaction = transaction;
            this.status = status;
        }

        public Transaction transaction() { return transaction; }
        public TransactionStatus status() { return status; }

        @Override public String toString() { return "Entry{" + transaction.hash() + ", " + status + "}"; }
    }

    public enum Outcome { ADDED, DUPLICATE, OBSOLETE_NONCE }

    public static final class Insertion {
        private final Outcome outcome;
        private final Entry entry;

        Insertion(Outcome outcome, Entry entry) {
            this.outcome = outcome;
            this.entry = entry;
        }

        public Outcome outcome() { return outcome; }

        /** The stored entry; empty when the insertion was refused. */
        public Optional<Entry> entry() { return Optional.ofNullable(entry); }
    }

    private final Map<Hash, Entry> byHash = new HashMap<>();
    private final Map<AccountAddress, AccountNonFinalizedTransactions> nonFinalized = new HashMap<>();

    /**
     * Adds a verified transaction with status {@code Received{slot}}. Adding a
     * known hash changes nothing and returns the existing entry.
     */
    public Insertion add(Transaction tx, long slot) {
        Entry existing = byHash.get(tx.hash());
        if (existing != null) {
            return new Insertion(Outcome.DUPLICATE, existing);
        }
        AccountNonFinalizedTransactions anft = nonFinalized.computeIfAbsent(tx.sender(), a -> new AccountNonFinalizedTransactions());
        if (!anft.add(tx)) {
            LOG.fine(() -> "Refusing " + tx + ": nonce already finalized (next " + anft.nextNonce() + ")");
            return new Insertion(Outcome.OBSOLETE_NONCE, null);
        }
        Entry entry = new Entry(tx, TransactionStatus.initial(slot));
        byHash.put(tx.hash(), entry);
        return new Insertion(Outcome.ADDED, entry);
    }

    public Optional<Entry> lookup(Hash txHash) {
        return Optional.ofNullable(byHash.get(txHash));
    }

    public boolean contains(Hash txHash) {
        return byHash.containsKey(txHash);
    }

    /** Fails loudly unless the hash is in the table. */
    public void requireKnown(Hash txHash) {
        if (!byHash.containsKey(txHash)) {
            throw LedgerInvariantException.fail("status transition for unknown transaction " + txHash);
        }
    }

    /** Applies a status transition to a known transaction and returns the new status. */
    public TransactionStatus updateStatus(Hash txHash, UnaryOperator<TransactionStatus> transition) {
        requireKnown(txHash);
        Entry entry = byHash.get(txHash);
        TransactionStatus next = transition.apply(entry.status());
        if (next != entry.status()) {
            byHash.put(txHash, new Entry(entry.transaction(), next));
        }
        return next;
    }

    public TransactionStatus addResult(Hash txHash, Hash blockHash, long slot, long index) {
        return updateStatus(txHash, s -> TransactionStatus.addResult(blockHash, slot, index, s));
    }

    public TransactionStatus markDeadResult(Hash txHash, Hash blockHash) {
        return updateStatus(txHash, s -> TransactionStatus.markDeadResult(blockHash, s));
    }

    /**
     * Finalizes the transactions of block {@code blockHash}. Each must be
     * committed in that block. Other transactions from the same sender with the
     * same nonce can never execute any more and are removed.
     *
     * @return the removed transactions
     */
    public List<Transaction> finalizeTransactions(Hash blockHash, long slot, List<Transaction> txs) {
        Map<AccountAddress, Long> floors = new HashMap<>();
        for (Transaction tx : txs) {
            requireKnown(tx.hash());
            Optional<TransactionStatus.Location> loc = TransactionStatus.getTransactionIndex(blockHash, byHash.get(tx.hash()).status());
            LedgerInvariantException.check(loc.isPresent() && !loc.get().finalized(),
                    "finalizing " + tx + " which is not committed in block " + blockHash);
            long floor = floors.containsKey(tx.sender()) ? floors.get(tx.sender()) : nextNonce(tx.sender());
            LedgerInvariantException.check(tx.nonce() >= floor,
                    "finalizing nonce " + tx.nonce() + " of " + tx.sender() + " below next nonce " + floor);
            floors.put(tx.sender(), tx.nonce() + 1);
        }
        List<Transaction> removed = new ArrayList<>();
        for (Transaction tx : txs) {
            Entry entry = byHash.get(tx.hash());
            long index = TransactionStatus.getTransactionIndex(blockHash, entry.status()).get().index();
            byHash.put(tx.hash(), new Entry(tx, new TransactionStatus.Finalized(slot, blockHash, index)));

            AccountNonFinalizedTransactions anft = nonFinalized.computeIfAbsent(tx.sender(), a -> new AccountNonFinalizedTransactions());
            for (Transaction dead : anft.finalizeNonce(tx)) {
                byHash.remove(dead.hash());
                removed.add(dead);
            }
        }
        return removed;
    }

    /**
     * Drops received (uncommitted) transactions that expired, or that have
     * waited longer than {@code keepAliveSeconds}.
     */
    public List<Transaction> purge(long now, long keepAliveSeconds) {
        List<Transaction> purged = new ArrayList<>();
        Iterator<Map.Entry<Hash, Entry>> it = byHash.entrySet().iterator();
        while (it.hasNext()) {
            Entry entry = it.next().getValue();
            if (entry.status().kind() != TransactionStatus.Kind.RECEIVED) {
                continue;
            }
            Transaction tx = entry.transaction();
            boolean expired = tx.expiry() < now;
            boolean stale = tx.arrivalTime() + keepAliveSeconds < now;
            if (expired || stale) {
                it.remove();
                AccountNonFinalizedTransactions anft = nonFinalized.get(tx.sender());
                if (anft != null) {
                    anft.remove(tx);
                }
                purged.add(tx);
            }
        }
        return purged;
    }

    public long nextNonce(AccountAddress account) {
        AccountNonFinalizedTransactions anft = nonFinalized.get(account);
        return anft == null ? ProtocolLimits.MIN_NONCE : anft.nextNonce();
    }

    public NavigableMap<Long, Set<Transaction>> nonFinalizedTransactions(AccountAddress account) {
        AccountNonFinalizedTransactions anft = nonFinalized.get(account);
        return anft == null ? Collections.emptyNavigableMap() : anft.snapshot();
    }

    public int size() {
        return byHash.size();
    }
}
