package io.txledger.core.node;

import io.txledger.core.ledger.LedgerInvariantException;
import io.txledger.core.ledger.PendingTransactionTable;
import io.txledger.core.ledger.TransactionStatus;
import io.txledger.core.ledger.TransactionTable;
import io.txledger.core.metrics.LedgerMetrics;
import io.txledger.core.protocol.AccountAddress;
import io.txledger.core.protocol.AccountKeys;
import io.txledger.core.protocol.DecodeException;
import io.txledger.core.protocol.Hash;
import io.txledger.core.protocol.Transaction;
import io.txledger.core.protocol.TransactionCodec;
import io.txledger.core.protocol.TransactionVerifier;
import io.txledger.core.storage.InMemoryUpdatesStore;
import io.txledger.core.storage.RocksDBUpdatesStore;
import io.txledger.core.storage.UpdatesStore;
import io.txledger.core.updates.AppliedUpdate;
import io.txledger.core.updates.ProcessedUpdates;
import io.txledger.core.updates.UpdateAuthorizer;
import io.txledger.core.updates.UpdateInstruction;
import io.txledger.core.updates.Updates;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the {@link TransactionTable} and applies block events to it.
 * <p>
 * Writers (receive, execute, roll back, mark dead, finalize, purge) take the
 * write lock; queries take the read lock. Every block operation checks its
 * preconditions before the first mutation, so a rejected block leaves the
 * table as it was. Pending tables and {@link Updates} are values owned by the
 * caller's block states; the ledger only computes their successors.
 */
public final class TransactionLedger implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(TransactionLedger.class.getName());

    public enum ReceiveResult { ACCEPTED, DUPLICATE, OBSOLETE_NONCE, MALFORMED, UNKNOWN_SENDER, BAD_SIGNATURE }

    /** State of a block after executing it on top of its parent. */
    public record ExecutedBlock(PendingTransactionTable pendingTransactions, Updates updates,
                                List<AppliedUpdate> appliedUpdates) {
    }

    public record SubmitResult(UpdateAuthorizer.Result result, Updates updates) {
        public boolean accepted() { return result == UpdateAuthorizer.Result.OK; }
    }

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final TransactionTable table = new TransactionTable();
    private final LedgerConfig config;
    private final AccountKeyLookup accounts;
    private final UpdatesStore updatesStore;
    private final TransactionVerifier verifier;
    private final UpdateAuthorizer authorizer;

    public TransactionLedger(LedgerConfig config, AccountKeyLookup accounts, UpdatesStore updatesStore,
                             TransactionVerifier verifier, UpdateAuthorizer authorizer) {
        this.config = Objects.requireNonNull(config, "config");
        this.accounts = Objects.requireNonNull(accounts, "accounts");
        this.updatesStore = Objects.requireNonNull(updatesStore, "updatesStore");
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.authorizer = Objects.requireNonNull(authorizer, "authorizer");
    }

    public TransactionLedger(LedgerConfig config, AccountKeyLookup accounts, UpdatesStore updatesStore) {
        this(config, accounts, updatesStore, new TransactionVerifier(), new UpdateAuthorizer());
    }

    /** Convenience factory: in-memory updates store, or RocksDB when the config names a data dir. */
    public static TransactionLedger open(LedgerConfig config, AccountKeyLookup accounts) {
        UpdatesStore store = config.dataDir == null
                ? new InMemoryUpdatesStore()
                : RocksDBUpdatesStore.open(config.dataDir);
        return new TransactionLedger(config, accounts, store);
    }

    /**
     * Records the genesis governance state as the last finalized block, unless
     * the store already has one. Safe to call multiple times.
     */
    public Hash start(Genesis genesis) {
        lock.writeLock().lock();
        try {
            Optional<Hash> last = updatesStore.getLastFinalized();
            if (last.isPresent()) {
                LOG.info("Resuming from finalized block " + last.get().hex());
                return last.get();
            }
            Hash genesisHash = genesis.blockHash();
            updatesStore.put(genesisHash, genesis.initialUpdates());
            updatesStore.setLastFinalized(genesisHash);
            LOG.info("Initialized governance state from genesis " + genesisHash.hex());
            return genesisHash;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // -------------- transactions ----------------

    /** Decodes, verifies and records a transaction received as bytes. Malformed input is dropped. */
    public ReceiveResult receive(byte[] bytes, long slot, long now) {
        Transaction tx;
        try {
            tx = TransactionCodec.fromBytes(bytes, now, config.maxPayloadBytes);
        } catch (DecodeException e) {
            LOG.log(Level.FINE, "Dropping malformed transaction", e);
            LedgerMetrics.incrementRejected("malformed");
            return ReceiveResult.MALFORMED;
        }
        return receive(tx, slot);
    }

    /** Verifies {@code tx} against its sender's keys and records it as received at {@code slot}. */
    public ReceiveResult receive(Transaction tx, long slot) {
        Optional<AccountKeys> keys = accounts.keysOf(tx.sender());
        if (keys.isEmpty()) {
            LOG.fine(() -> "Dropping " + tx + ": unknown sender " + tx.sender());
            LedgerMetrics.incrementRejected("unknown_sender");
            return ReceiveResult.UNKNOWN_SENDER;
        }
        if (!verifier.verify(keys.get(), tx)) {
            LOG.fine(() -> "Dropping " + tx + ": signature check failed");
            LedgerMetrics.incrementRejected("bad_signature");
            return ReceiveResult.BAD_SIGNATURE;
        }
        TransactionTable.Insertion ins;
        lock.writeLock().lock();
        try {
            ins = table.add(tx, slot);
        } finally {
            lock.writeLock().unlock();
        }
        switch (ins.outcome()) {
            case ADDED:
                LedgerMetrics.incrementReceived();
                return ReceiveResult.ACCEPTED;
            case DUPLICATE:
                LedgerMetrics.incrementDuplicate();
                return ReceiveResult.DUPLICATE;
            default:
                LedgerMetrics.incrementRejected("obsolete_nonce");
                return ReceiveResult.OBSOLETE_NONCE;
        }
    }

    /**
     * Adds a received transaction to the pending table of the last finalized
     * block state, where the sender's next nonce is the finalized one.
     */
    public PendingTransactionTable addPending(PendingTransactionTable ptt, Transaction tx) {
        lock.readLock().lock();
        try {
            table.requireKnown(tx.hash());
            return ptt.checkedExtend(table.nextNonce(tx.sender()), tx);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Adds a received transaction to a block state's pending table.
     *
     * @param accountNextNonce the sender's next nonce in that block state, which
     *                         is above the finalized one once an unfinalized
     *                         ancestor executed some of its transactions
     */
    public PendingTransactionTable addPending(PendingTransactionTable ptt, long accountNextNonce, Transaction tx) {
        lock.readLock().lock();
        try {
            table.requireKnown(tx.hash());
            long finalizedNext = table.nextNonce(tx.sender());
            LedgerInvariantException.check(accountNextNonce >= finalizedNext,
                    "next nonce " + accountNextNonce + " of " + tx.sender() + " is below finalized next nonce " + finalizedNext);
            return ptt.checkedExtend(accountNextNonce, tx);
        } finally {
            lock.readLock().unlock();
        }
    }

    // -------------- blocks ----------------

    /**
     * Executes {@code block} on top of its parent's pending table and governance
     * state: records each transaction as committed at its index, advances the
     * pending table and applies the due updates. The new governance state is
     * stored under the block hash.
     */
    public ExecutedBlock executeBlock(CandidateBlock block, PendingTransactionTable parentPtt, Updates parentUpdates) {
        return LedgerMetrics.recordExecution(() -> {
            lock.writeLock().lock();
            try {
                List<Transaction> txs = block.transactions();
                Set<Hash> seen = new HashSet<>();
                for (Transaction tx : txs) {
                    table.requireKnown(tx.hash());
                    LedgerInvariantException.check(seen.add(tx.hash()),
                            "block " + block.hash() + " contains " + tx + " twice");
                }
                PendingTransactionTable ptt = parentPtt.forward(txs);
                ProcessedUpdates processed = parentUpdates.processUpdateQueues(block.timestamp());

                // The snapshot exists before any outcome refers to the block.
                updatesStore.put(block.hash(), processed.updates());
                for (int i = 0; i < txs.size(); i++) {
                    table.addResult(txs.get(i).hash(), block.hash(), block.slot(), i);
                }

                LedgerMetrics.incrementExecuted();
                LedgerMetrics.addUpdatesApplied(processed.applied().size());
                for (AppliedUpdate u : processed.applied()) {
                    LOG.info("Block " + block.hash().hex() + " applied " + u.type() + " effective at " + u.effectiveTime());
                }
                return new ExecutedBlock(ptt, processed.updates(), processed.applied());
            } finally {
                lock.writeLock().unlock();
            }
        });
    }

    /**
     * Undoes {@link #executeBlock} for a block that is being abandoned: its
     * transactions lose their commitment to it and the pending table goes back.
     *
     * @param ptt the pending table produced by executing the block
     * @return the parent's pending table
     */
    public PendingTransactionTable rollbackBlock(CandidateBlock block, PendingTransactionTable ptt) {
        lock.writeLock().lock();
        try {
            PendingTransactionTable parent = ptt.reverse(block.transactions());
            markDeadLocked(block);
            LedgerMetrics.incrementRolledBack();
            return parent;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** A block was pruned because it is not on the finalized chain. */
    public void markDead(CandidateBlock block) {
        lock.writeLock().lock();
        try {
            markDeadLocked(block);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // A transaction missing from the table is only acceptable when finalization
    // of a rival with its nonce retired it.
    private void markDeadLocked(CandidateBlock block) {
        List<Transaction> live = new ArrayList<>();
        for (Transaction tx : block.transactions()) {
            if (table.contains(tx.hash())) {
                live.add(tx);
            } else {
                LedgerInvariantException.check(tx.nonce() < table.nextNonce(tx.sender()),
                        "block " + block.hash() + " marked dead with unknown transaction " + tx);
                LOG.fine(() -> "Block " + block.hash().hex() + ": " + tx + " already retired");
            }
        }
        updatesStore.remove(block.hash());
        for (Transaction tx : live) {
            table.markDeadResult(tx.hash(), block.hash());
        }
    }

    /**
     * Finalizes an executed block. Returns the transactions that became obsolete
     * because another transaction with their nonce was finalized.
     */
    public List<Transaction> finalizeBlock(CandidateBlock block) {
        lock.writeLock().lock();
        try {
            LedgerInvariantException.check(updatesStore.get(block.hash()).isPresent(),
                    "finalizing block " + block.hash() + " which was never executed");
            List<Transaction> obsolete = table.finalizeTransactions(block.hash(), block.slot(), block.transactions());
            updatesStore.setLastFinalized(block.hash());
            LedgerMetrics.incrementFinalized();
            LOG.info("Finalized block " + block.hash().hex() + " (" + block.transactions().size()
                    + " transactions, " + obsolete.size() + " obsolete)");
            return obsolete;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Drops received transactions that expired or outstayed the keep-alive. */
    public List<Transaction> purge(long now) {
        lock.writeLock().lock();
        try {
            List<Transaction> purged = table.purge(now, config.transactionKeepAliveSeconds);
            if (!purged.isEmpty()) {
                LedgerMetrics.addPurged(purged.size());
                LOG.fine(() -> "Purged " + purged.size() + " transactions");
            }
            return purged;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // -------------- updates ----------------

    /**
     * Checks an update instruction against {@code updates} and, when authorized,
     * returns the state with the update scheduled.
     */
    public SubmitResult submitUpdate(Updates updates, UpdateInstruction instruction, long now) {
        UpdateAuthorizer.Result result = authorizer.check(updates, instruction, now);
        if (result != UpdateAuthorizer.Result.OK) {
            LOG.fine(() -> "Rejected " + instruction + ": " + result);
            return new SubmitResult(result, updates);
        }
        Updates next = updates.enqueue(instruction.type(), instruction.scheduledTime(), instruction.value());
        LOG.info("Scheduled " + instruction.type() + " at " + instruction.scheduledTime());
        return new SubmitResult(result, next);
    }

    public Optional<Updates> updatesAt(Hash blockHash) {
        return updatesStore.get(blockHash);
    }

    /** Governance state of the last finalized block. */
    public Optional<Updates> lastFinalizedUpdates() {
        return updatesStore.getLastFinalized().flatMap(updatesStore::get);
    }

    // -------------- queries ----------------

    public Optional<TransactionStatus> status(Hash txHash) {
        lock.readLock().lock();
        try {
            return table.lookup(txHash).map(TransactionTable.Entry::status);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<TransactionStatus.Location> transactionIndex(Hash blockHash, Hash txHash) {
        lock.readLock().lock();
        try {
            return table.lookup(txHash).flatMap(e -> TransactionStatus.getTransactionIndex(blockHash, e.status()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public long nextNonce(AccountAddress account) {
        lock.readLock().lock();
        try {
            return table.nextNonce(account);
        } finally {
            lock.readLock().unlock();
        }
    }

    public NavigableMap<Long, Set<Transaction>> nonFinalized(AccountAddress account) {
        lock.readLock().lock();
        try {
            return table.nonFinalizedTransactions(account);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return table.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public LedgerConfig config() { return config; }

    @Override
    public void close() throws Exception {
        if (updatesStore instanceof AutoCloseable) {
            ((AutoCloseable) updatesStore).close();
        }
    }
}
