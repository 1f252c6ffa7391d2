package io.txledger.core.ledger;

import java.util.logging.Logger;

/**
 * An internal consistency fault: the ledger was driven into a state its
 * callers guarantee never happens. Not a recoverable input error; the
 * operation is aborted and the fault propagates.
 */
public class LedgerInvariantException extends IllegalStateException {
    private static final Logger LOG = Logger.getLogger(LedgerInvariantException.class.getName());

    public LedgerInvariantException(String message) {
        super(message);
    }

    /** Logs at SEVERE and throws when {@code condition} does not hold. */
    public static void check(boolean condition, String message) {
        if (!condition) {
            throw fail(message);
        }
    }

    public static LedgerInvariantException fail(String message) {
        LOG.severe("Ledger invariant violated: " + message);
        return new LedgerInvariantException(message);
    }
}
