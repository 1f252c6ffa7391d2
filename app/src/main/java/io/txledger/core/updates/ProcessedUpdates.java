package io.txledger.core.updates;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of {@link Updates#processUpdateQueues(long)}: the new state and the
 * updates that took effect, ordered by effective time and then by update type.
 */
public record ProcessedUpdates(Updates updates, List<AppliedUpdate> applied) {

    public ProcessedUpdates {
        applied = List.copyOf(applied);
    }

    /** Applied updates the caller must act on, i.e. registrations of revokers and identity providers. */
    public List<AppliedUpdate> registrations() {
        return applied.stream()
                .filter(u -> u.type() == UpdateType.ADD_ANONYMITY_REVOKER || u.type() == UpdateType.ADD_IDENTITY_PROVIDER)
                .collect(Collectors.toList());
    }
}
