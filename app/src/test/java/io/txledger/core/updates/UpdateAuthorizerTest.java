package io.txledger.core.updates;

import io.txledger.core.testing.Fixtures;
import org.junit.jupiter.api.Test;

import java.security.PrivateKey;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class UpdateAuthorizerTest {

    private final Fixtures.Governance governance = Fixtures.governance();
    private final Updates updates = governance.initialUpdates();
    private final UpdateAuthorizer authorizer = new UpdateAuthorizer();

    private UpdateInstruction difficulty(long seq, long effective, long timeout, Map<Integer, PrivateKey> keys) {
        return UpdateInstruction.sign(seq, effective, timeout, UpdateType.ELECTION_DIFFICULTY, new ElectionDifficulty(40_000), keys);
    }

    @Test
    void levelTwoKeyInAccessStructureAuthorizes() {
        UpdateInstruction ui = difficulty(1, 200, 100, Map.of(0, governance.level2Key(0)));
        assertEquals(UpdateAuthorizer.Result.OK, authorizer.check(updates, ui, 50));
    }

    @Test
    void timeoutInThePastIsExpired() {
        UpdateInstruction ui = difficulty(1, 200, 40, Map.of(0, governance.level2Key(0)));
        assertEquals(UpdateAuthorizer.Result.EXPIRED, authorizer.check(updates, ui, 50));
    }

    @Test
    void effectiveTimeMustFollowTimeout() {
        UpdateInstruction ui = difficulty(1, 100, 100, Map.of(0, governance.level2Key(0)));
        assertEquals(UpdateAuthorizer.Result.INVALID_EFFECTIVE_TIME, authorizer.check(updates, ui, 50));
    }

    @Test
    void zeroEffectiveTimeMeansAtTimeout() {
        UpdateInstruction ui = difficulty(1, 0, 100, Map.of(1, governance.level2Key(1)));
        assertEquals(UpdateAuthorizer.Result.OK, authorizer.check(updates, ui, 50));
        assertEquals(100, ui.scheduledTime());
    }

    @Test
    void sequenceNumberMustMatchQueue() {
        UpdateInstruction ui = difficulty(2, 200, 100, Map.of(0, governance.level2Key(0)));
        assertEquals(UpdateAuthorizer.Result.SEQUENCE_NUMBER_MISMATCH, authorizer.check(updates, ui, 50));

        Updates advanced = updates.enqueue(UpdateType.ELECTION_DIFFICULTY, 300, new ElectionDifficulty(1));
        assertEquals(UpdateAuthorizer.Result.OK, authorizer.check(advanced, ui, 50));
    }

    @Test
    void keyOutsideAccessStructureIsUnauthorized() {
        UpdateInstruction ui = difficulty(1, 200, 100, Map.of(2, governance.level2Key(2)));
        assertEquals(UpdateAuthorizer.Result.UNAUTHORIZED, authorizer.check(updates, ui, 50));
    }

    @Test
    void signatureByWrongKeyIsUnauthorized() {
        UpdateInstruction ui = difficulty(1, 200, 100, Map.of(0, governance.rootKey(0)));
        assertEquals(UpdateAuthorizer.Result.UNAUTHORIZED, authorizer.check(updates, ui, 50));
    }

    @Test
    void rootKeyUpdateNeedsRootThreshold() {
        HigherLevelKeys newRoot = Fixtures.governance().keys().rootKeys();
        UpdateInstruction one = UpdateInstruction.sign(1, 0, 100, UpdateType.ROOT_KEYS, newRoot, Map.of(0, governance.rootKey(0)));
        assertEquals(UpdateAuthorizer.Result.UNAUTHORIZED, authorizer.check(updates, one, 50));

        Map<Integer, PrivateKey> both = new TreeMap<>();
        both.put(0, governance.rootKey(0));
        both.put(1, governance.rootKey(1));
        UpdateInstruction two = UpdateInstruction.sign(1, 0, 100, UpdateType.ROOT_KEYS, newRoot, both);
        assertEquals(UpdateAuthorizer.Result.OK, authorizer.check(updates, two, 50));
    }

    @Test
    void levelTwoKeysAreManagedByLevelOne() {
        Authorizations newLevel2 = Fixtures.governance().keys().level2Keys();
        UpdateInstruction byLevel1 = UpdateInstruction.sign(1, 0, 100, UpdateType.LEVEL2_KEYS, newLevel2,
                Map.of(1, governance.level1Key(1)));
        assertEquals(UpdateAuthorizer.Result.OK, authorizer.check(updates, byLevel1, 50));

        UpdateInstruction byLevel2 = UpdateInstruction.sign(1, 0, 100, UpdateType.LEVEL2_KEYS, newLevel2,
                Map.of(0, governance.level2Key(0)));
        assertEquals(UpdateAuthorizer.Result.UNAUTHORIZED, authorizer.check(updates, byLevel2, 50));
    }
}
