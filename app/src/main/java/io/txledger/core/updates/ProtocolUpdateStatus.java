package io.txledger.core.updates;

import java.util.List;
import java.util.Objects;

/**
 * Either a protocol update has taken effect, or the list of those still scheduled.
 */
public abstract class ProtocolUpdateStatus {

    private ProtocolUpdateStatus() {}

    public abstract boolean isUpdated();

    public static final class ProtocolUpdated extends ProtocolUpdateStatus {
        private final ProtocolUpdate update;

        ProtocolUpdated(ProtocolUpdate update) {
            this.update = Objects.requireNonNull(update, "update");
        }

        public ProtocolUpdate update() { return update; }

        @Override public boolean isUpdated() { return true; }
        @Override public String toString() { return "ProtocolUpdated{" + update + "}"; }
    }

    public static final class PendingProtocolUpdates extends ProtocolUpdateStatus {
        private final List<UpdateQueue.Entry<ProtocolUpdate>> pending;

        PendingProtocolUpdates(List<UpdateQueue.Entry<ProtocolUpdate>> pending) {
            this.pending = List.copyOf(pending);
        }

        /** Scheduled protocol updates, ascending by effective time. */
        public List<UpdateQueue.Entry<ProtocolUpdate>> pending() { return pending; }

        @Override public boolean isUpdated() { return false; }
        @Override public String toString() { return "PendingProtocolUpdates" + pending; }
    }
}
