package io.txledger.core.ledger;

import io.txledger.core.protocol.Hash;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Status of a transaction relative to the live blocks. Exactly three states,
 * {@link Received}, {@link Committed} and {@link Finalized}; the constructor is
 * private so no other subclass can exist.
 * <p>
 * Instances are immutable. The transition functions return new values.
 */
public abstract class TransactionStatus {

    public enum Kind { RECEIVED, COMMITTED, FINALIZED }

    private final long slot;

    private TransactionStatus(long slot) {
        this.slot = slot;
    }

    /** Highest slot of a block this transaction has been seen in. */
    public long slot() { return slot; }

    public abstract Kind kind();

    public static TransactionStatus initial(long slot) {
        return new Received(slot);
    }

    /** Seen, but not committed into any live block. */
    public static final class Received extends TransactionStatus {
        public Received(long slot) {
            super(slot);
        }

        @Override public Kind kind() { return Kind.RECEIVED; }

        @Override public boolean equals(Object o) { return o instanceof Received && ((Received) o).slot() == slot(); }
        @Override public int hashCode() { return Long.hashCode(slot()); }
        @Override public String toString() { return "Received{slot=" + slot() + "}"; }
    }

    /**
     * Committed into one or more live blocks. The outcome map goes from block
     * hash to the transaction's 0-based position in that block and is never empty.
     */
    public static final class Committed extends TransactionStatus {
        private final Map<Hash, Long> outcomes;

        public Committed(long slot, Map<Hash, Long> outcomes) {
            super(slot);
            if (outcomes == null || outcomes.isEmpty()) {
                throw new IllegalArgumentException("Committed status needs at least one block");
            }
            this.outcomes = Collections.unmodifiableMap(new HashMap<>(outcomes));
        }

        public Map<Hash, Long> outcomes() { return outcomes; }

        @Override public Kind kind() { return Kind.COMMITTED; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Committed)) return false;
            Committed other = (Committed) o;
            return other.slot() == slot() && other.outcomes.equals(outcomes);
        }

        @Override public int hashCode() { return Objects.hash(slot(), outcomes); }
        @Override public String toString() { return "Committed{slot=" + slot() + ", blocks=" + outcomes.size() + "}"; }
    }

    /** Committed into the finalized block. Terminal. */
    public static final class Finalized extends TransactionStatus {
        private final Hash blockHash;
        private final long index;

        public Finalized(long slot, Hash blockHash, long index) {
            super(slot);
            this.blockHash = Objects.requireNonNull(blockHash, "blockHash");
            this.index = index;
        }

        public Hash blockHash() { return blockHash; }
        public long index() { return index; }

        @Override public Kind kind() { return Kind.FINALIZED; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Finalized)) return false;
            Finalized other = (Finalized) o;
            return other.slot() == slot() && other.index == index && other.blockHash.equals(blockHash);
        }

        @Override public int hashCode() { return Objects.hash(slot(), blockHash, index); }
        @Override public String toString() { return "Finalized{slot=" + slot() + ", block=" + blockHash + ", index=" + index + "}"; }
    }

    /** Position of a transaction in a given block. */
    public static final class Location {
        private final boolean finalized;
        private final long index;

        public Location(boolean finalized, long index) {
            this.finalized = finalized;
            this.index = index;
        }

        public boolean finalized() { return finalized; }
        public long index() { return index; }

        @Override public boolean equals(Object o) { return o instanceof Location && ((Location) o).finalized == finalized && ((Location) o).index == index; }
        @Override public int hashCode() { return Objects.hash(finalized, index); }
        @Override public String toString() { return "Location{finalized=" + finalized + ", index=" + index + "}"; }
    }

    /**
     * Records that the transaction is at {@code index} in block {@code blockHash}.
     * A finalized status is returned unchanged.
     */
    public static TransactionStatus addResult(Hash blockHash, long slot, long index, TransactionStatus status) {
        if (status instanceof Finalized) {
            return status;
        }
        Map<Hash, Long> outcomes = new HashMap<>();
        if (status instanceof Committed) {
            outcomes.putAll(((Committed) status).outcomes);
        }
        outcomes.put(blockHash, index);
        return new Committed(Math.max(slot, status.slot()), outcomes);
    }

    /**
     * Forgets the outcome in a block that was pruned from the tree. Only a
     * committed status changes; it falls back to received, keeping its slot,
     * once no block remains.
     */
    public static TransactionStatus markDeadResult(Hash blockHash, TransactionStatus status) {
        if (!(status instanceof Committed)) {
            return status;
        }
        Committed committed = (Committed) status;
        if (!committed.outcomes.containsKey(blockHash)) {
            return status;
        }
        Map<Hash, Long> remaining = new HashMap<>(committed.outcomes);
        remaining.remove(blockHash);
        if (remaining.isEmpty()) {
            return new Received(committed.slot());
        }
        return new Committed(committed.slot(), remaining);
    }

    public static Optional<Location> getTransactionIndex(Hash blockHash, TransactionStatus status) {
        if (status instanceof Committed) {
            Long index = ((Committed) status).outcomes.get(blockHash);
            return index == null ? Optional.empty() : Optional.of(new Location(false, index));
        }
        if (status instanceof Finalized) {
            Finalized fin = (Finalized) status;
            return fin.blockHash.equals(blockHash) ? Optional.of(new Location(true, fin.index)) : Optional.empty();
        }
        return Optional.empty();
    }
}
