package io.txledger.core.node;

import io.txledger.core.protocol.Hash;
import io.txledger.core.protocol.Transaction;

import java.util.List;
import java.util.Objects;

/**
 * What the ledger needs to know about a block: its hash, slot, timestamp (seconds)
 * and transactions in execution order.
 */
public record CandidateBlock(Hash hash, long slot, long timestamp, List<Transaction> transactions) {

    public CandidateBlock {
        Objects.requireNonNull(hash, "hash");
        transactions = List.copyOf(transactions);
    }
}
