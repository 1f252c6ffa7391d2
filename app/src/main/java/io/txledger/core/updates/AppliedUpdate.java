package io.txledger.core.updates;

import io.txledger.core.protocol.Encodable;

/** A queued update that took effect while processing a block. */
public record AppliedUpdate(long effectiveTime, UpdateType type, Encodable value) {
}
