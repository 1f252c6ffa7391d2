package io.txledger.core.updates;

import io.txledger.core.protocol.Ed25519;
import io.txledger.core.protocol.SignatureScheme;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Decides whether an {@link UpdateInstruction} may be scheduled against the current {@link Updates}.
 * <p>
 * Root-key updates need the root keys, level-1 and level-2 key updates need the
 * level-1 keys, every other kind needs its level-2 access structure.
 */
public final class UpdateAuthorizer {
    private static final Logger LOG = Logger.getLogger(UpdateAuthorizer.class.getName());

    public enum Result {
        OK,
        EXPIRED,
        INVALID_EFFECTIVE_TIME,
        SEQUENCE_NUMBER_MISMATCH,
        UNAUTHORIZED
    }

    private final SignatureScheme scheme;

    public UpdateAuthorizer(SignatureScheme scheme) {
        this.scheme = Objects.requireNonNull(scheme, "scheme");
    }

    public UpdateAuthorizer() {
        this(Ed25519.INSTANCE);
    }

    public Result check(Updates updates, UpdateInstruction ui, long now) {
        if (ui.timeout() < now) {
            return Result.EXPIRED;
        }
        if (ui.effectiveTime() != 0 && ui.effectiveTime() <= ui.timeout()) {
            return Result.INVALID_EFFECTIVE_TIME;
        }
        long expected = updates.nextSequenceNumber(ui.type());
        if (ui.sequenceNumber() != expected) {
            LOG.fine(() -> ui.type() + ": sequence number " + ui.sequenceNumber() + ", expected " + expected);
            return Result.SEQUENCE_NUMBER_MISMATCH;
        }
        return authorized(updates.keys(), ui) ? Result.OK : Result.UNAUTHORIZED;
    }

    private boolean authorized(UpdateKeysCollection keys, UpdateInstruction ui) {
        Optional<AuthorizationKind> level2 = ui.type().level2Authorization();
        if (level2.isPresent()) {
            Authorizations auth = keys.level2Keys();
            AccessStructure as = auth.accessStructure(level2.get());
            for (int idx : ui.signatures().keySet()) {
                if (!as.authorizes(idx)) {
                    return false;
                }
            }
            return verifyAll(auth.keys(), as.threshold(), ui);
        }
        HigherLevelKeys signers = ui.type() == UpdateType.ROOT_KEYS ? keys.rootKeys() : keys.level1Keys();
        return verifyAll(signers.keys(), signers.threshold(), ui);
    }

    private boolean verifyAll(List<UpdatePublicKey> keys, int threshold, UpdateInstruction ui) {
        if (ui.signatures().size() < threshold) {
            return false;
        }
        byte[] message = ui.signedHash().bytes();
        for (Map.Entry<Integer, byte[]> e : ui.signatures().entrySet()) {
            int idx = e.getKey();
            if (idx >= keys.size()) {
                return false;
            }
            if (!scheme.verify(keys.get(idx).verifyKey(), message, e.getValue())) {
                return false;
            }
        }
        return true;
    }
}
