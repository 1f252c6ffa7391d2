package io.txledger.core.ledger;

import io.txledger.core.protocol.ProtocolLimits;
import io.txledger.core.protocol.Transaction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

/**
 * Non-finalized transactions of one account, grouped by nonce. Several
 * transactions may share a nonce until one of them is finalized.
 * <p>
 * Every nonce key is at least {@link #nextNonce()}, and {@code nextNonce}
 * only moves forward.
 */
public final class AccountNonFinalizedTransactions {
    private final NavigableMap<Long, Set<Transaction>> byNonce = new TreeMap<>();
    private long nextNonce = ProtocolLimits.MIN_NONCE;

    /** Smallest nonce not yet finalized for the account. */
    public long nextNonce() {
        return nextNonce;
    }

    /** Adds the transaction; returns false when its nonce is already finalized. */
    boolean add(Transaction tx) {
        if (tx.nonce() < nextNonce) {
            return false;
        }
        byNonce.computeIfAbsent(tx.nonce(), n -> new HashSet<>()).add(tx);
        return true;
    }

    void remove(Transaction tx) {
        Set<Transaction> set = byNonce.get(tx.nonce());
        if (set == null) {
            return;
        }
        set.remove(tx);
        if (set.isEmpty()) {
            byNonce.remove(tx.nonce());
        }
    }

    /**
     * Consumes the nonce of {@code tx}: drops every entry up to and including
     * that nonce and moves {@code nextNonce} past it.
     *
     * @return the transactions other than {@code tx} that were dropped
     */
    List<Transaction> finalizeNonce(Transaction tx) {
        LedgerInvariantException.check(tx.nonce() >= nextNonce,
                "finalizing nonce " + tx.nonce() + " of " + tx.sender() + " below next nonce " + nextNonce);
        List<Transaction> dropped = new ArrayList<>();
        NavigableMap<Long, Set<Transaction>> consumed = byNonce.headMap(tx.nonce(), true);
        for (Set<Transaction> set : consumed.values()) {
            for (Transaction other : set) {
                if (!other.equals(tx)) {
                    dropped.add(other);
                }
            }
        }
        consumed.clear();
        nextNonce = tx.nonce() + 1;
        return dropped;
    }

    public Set<Transaction> atNonce(long nonce) {
        Set<Transaction> set = byNonce.get(nonce);
        return set == null ? Collections.emptySet() : Collections.unmodifiableSet(set);
    }

    /** Copy of the nonce-ordered view. */
    public NavigableMap<Long, Set<Transaction>> snapshot() {
        NavigableMap<Long, Set<Transaction>> copy = new TreeMap<>();
        for (Map.Entry<Long, Set<Transaction>> e : byNonce.entrySet()) {
            copy.put(e.getKey(), Collections.unmodifiableSet(new HashSet<>(e.getValue())));
        }
        return Collections.unmodifiableNavigableMap(copy);
    }

    public boolean isEmpty() {
        return byNonce.isEmpty();
    }
}
