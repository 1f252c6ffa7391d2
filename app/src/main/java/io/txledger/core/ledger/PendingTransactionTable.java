package io.txledger.core.ledger;

import io.txledger.core.protocol.AccountAddress;
import io.txledger.core.protocol.Transaction;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Pending nonces per account relative to one block state. An account maps to
 * {@code [nextNonce, highNonce]} with {@code highNonce >= nextNonce}; an
 * account without pending transactions is absent.
 * <p>
 * Immutable: every operation returns a new table, so a block state can keep
 * its own table and a failed block application leaves the parent untouched.
 */
public final class PendingTransactionTable {

    public static final class NonceRange {
        private final long nextNonce;
        private final long highNonce;

        public NonceRange(long nextNonce, long highNonce) {
            this.nextNonce = nextNonce;
            this.highNonce = highNonce;
        }

        public long nextNonce() { return nextNonce; }
        public long highNonce() { return highNonce; }

        @Override public boolean equals(Object o) { return o instanceof NonceRange && ((NonceRange) o).nextNonce == nextNonce && ((NonceRange) o).highNonce == highNonce; }
        @Override public int hashCode() { return Objects.hash(nextNonce, highNonce); }
        @Override public String toString() { return "(" + nextNonce + "," + highNonce + ")"; }
    }

    private static final PendingTransactionTable EMPTY = new PendingTransactionTable(Collections.emptyMap());

    private final Map<AccountAddress, NonceRange> ranges;

    private PendingTransactionTable(Map<AccountAddress, NonceRange> ranges) {
        this.ranges = ranges;
    }

    public static PendingTransactionTable empty() {
        return EMPTY;
    }

    public Optional<NonceRange> get(AccountAddress account) {
        return Optional.ofNullable(ranges.get(account));
    }

    public Map<AccountAddress, NonceRange> asMap() {
        return Collections.unmodifiableMap(ranges);
    }

    public int size() { return ranges.size(); }
    public boolean isEmpty() { return ranges.isEmpty(); }

    /**
     * Records {@code tx} as pending with the account's execution floor
     * {@code nextNonce}. The caller guarantees {@code nextNonce <= tx.nonce()};
     * anything else is a fault upstream.
     */
    public PendingTransactionTable extend(long nextNonce, Transaction tx) {
        LedgerInvariantException.check(nextNonce <= tx.nonce(),
                "extending pending table with nonce " + tx.nonce() + " below next nonce " + nextNonce);
        return widen(nextNonce, tx);
    }

    /** Like {@link #extend} but ignores a transaction whose nonce is already below {@code nextNonce}. */
    public PendingTransactionTable checkedExtend(long nextNonce, Transaction tx) {
        if (nextNonce > tx.nonce()) {
            return this;
        }
        return widen(nextNonce, tx);
    }

    private PendingTransactionTable widen(long nextNonce, Transaction tx) {
        Map<AccountAddress, NonceRange> next = new HashMap<>(ranges);
        NonceRange current = next.get(tx.sender());
        if (current == null) {
            next.put(tx.sender(), new NonceRange(nextNonce, tx.nonce()));
        } else {
            next.put(tx.sender(), new NonceRange(current.nextNonce, Math.max(current.highNonce, tx.nonce())));
        }
        return new PendingTransactionTable(next);
    }

    /**
     * Advances each sender past the executed transactions, given in execution
     * order. An account whose last pending nonce executes is removed.
     */
    public PendingTransactionTable forward(List<Transaction> executed) {
        Map<AccountAddress, NonceRange> next = new HashMap<>(ranges);
        for (Transaction tx : executed) {
            NonceRange range = next.get(tx.sender());
            if (range == null) {
                throw LedgerInvariantException.fail("forwarding " + tx + " which is not pending");
            }
            LedgerInvariantException.check(range.nextNonce == tx.nonce(),
                    "forwarding nonce " + tx.nonce() + " of " + tx.sender() + " but next pending nonce is " + range.nextNonce);
            LedgerInvariantException.check(range.nextNonce <= range.highNonce,
                    "pending range " + range + " of " + tx.sender() + " is empty");
            if (range.nextNonce == range.highNonce) {
                next.remove(tx.sender());
            } else {
                next.put(tx.sender(), new NonceRange(range.nextNonce + 1, range.highNonce));
            }
        }
        return new PendingTransactionTable(next);
    }

    /** Exact inverse of {@link #forward} for the same list; undoes it back to front. */
    public PendingTransactionTable reverse(List<Transaction> executed) {
        Map<AccountAddress, NonceRange> next = new HashMap<>(ranges);
        for (int i = executed.size() - 1; i >= 0; i--) {
            Transaction tx = executed.get(i);
            NonceRange range = next.get(tx.sender());
            if (range == null) {
                next.put(tx.sender(), new NonceRange(tx.nonce(), tx.nonce()));
            } else {
                LedgerInvariantException.check(range.nextNonce == tx.nonce() + 1,
                        "reversing nonce " + tx.nonce() + " of " + tx.sender() + " but next pending nonce is " + range.nextNonce);
                next.put(tx.sender(), new NonceRange(range.nextNonce - 1, range.highNonce));
            }
        }
        return new PendingTransactionTable(next);
    }

    @Override public boolean equals(Object o) { return o instanceof PendingTransactionTable && ranges.equals(((PendingTransactionTable) o).ranges); }
    @Override public int hashCode() { return ranges.hashCode(); }
    @Override public String toString() { return "PendingTransactionTable" + ranges; }
}
