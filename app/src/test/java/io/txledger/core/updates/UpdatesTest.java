package io.txledger.core.updates;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.txledger.core.protocol.DecodeException;
import io.txledger.core.protocol.Hashes;
import io.txledger.core.testing.Fixtures;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UpdatesTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final Fixtures.Governance governance = Fixtures.governance();
    private final Updates initial = governance.initialUpdates();

    private static ProtocolUpdate protocolUpdate(String message) {
        return new ProtocolUpdate(message, "https://example.org/" + message,
                Hashes.hash(message.getBytes(StandardCharsets.UTF_8)), new byte[] {1, 2});
    }

    @Test
    void initialStateHasNothingScheduled() {
        for (UpdateType type : UpdateType.values()) {
            assertEquals(1, initial.nextSequenceNumber(type), type.name());
            assertTrue(initial.pending().queue(type).isEmpty(), type.name());
        }
        assertTrue(initial.protocolUpdate().isEmpty());
        assertFalse(initial.protocolUpdateStatus().isUpdated());
    }

    @Test
    void nothingDueLeavesStateUntouched() {
        Updates u = initial.enqueue(UpdateType.ELECTION_DIFFICULTY, 100, new ElectionDifficulty(50_000));
        ProcessedUpdates p = u.processUpdateQueues(99);
        assertSame(u, p.updates());
        assertTrue(p.applied().isEmpty());
    }

    @Test
    void dueParameterUpdateTakesEffect() {
        Updates u = initial.enqueue(UpdateType.ELECTION_DIFFICULTY, 100, new ElectionDifficulty(50_000));
        assertEquals(2, u.nextSequenceNumber(UpdateType.ELECTION_DIFFICULTY));

        ProcessedUpdates p = u.processUpdateQueues(100);
        Updates after = p.updates();
        assertEquals(new ElectionDifficulty(50_000), after.chainParameters().electionDifficulty());
        assertTrue(after.pending().electionDifficulty().isEmpty());
        assertEquals(2, after.nextSequenceNumber(UpdateType.ELECTION_DIFFICULTY));
        assertEquals(List.of(new AppliedUpdate(100, UpdateType.ELECTION_DIFFICULTY, new ElectionDifficulty(50_000))), p.applied());
        assertEquals(initial.chainParameters().euroPerEnergy(), after.chainParameters().euroPerEnergy());
    }

    @Test
    void appliedUpdatesAreOrderedByTime() {
        Updates u = initial
                .enqueue(UpdateType.BAKER_STAKE_THRESHOLD, 30, new Amount(9))
                .enqueue(UpdateType.EURO_PER_ENERGY, 10, new ExchangeRate(1, 7))
                .enqueue(UpdateType.EURO_PER_ENERGY, 20, new ExchangeRate(1, 8));
        ProcessedUpdates p = u.processUpdateQueues(1_000);
        assertEquals(List.of(10L, 20L, 30L), p.applied().stream().map(AppliedUpdate::effectiveTime).toList());
        assertEquals(new ExchangeRate(1, 8), p.updates().chainParameters().euroPerEnergy());
        assertEquals(new Amount(9), p.updates().chainParameters().minimumThresholdForBaking());
    }

    @Test
    void firstProtocolUpdateWins() {
        ProtocolUpdate first = protocolUpdate("first");
        ProtocolUpdate second = protocolUpdate("second");
        Updates u = initial
                .enqueue(UpdateType.PROTOCOL, 10, first)
                .enqueue(UpdateType.PROTOCOL, 20, second);

        ProtocolUpdateStatus pending = u.protocolUpdateStatus();
        assertFalse(pending.isUpdated());
        assertEquals(2, ((ProtocolUpdateStatus.PendingProtocolUpdates) pending).pending().size());

        Updates after = u.processUpdateQueues(25).updates();
        assertEquals(first, after.protocolUpdate().orElseThrow());
        ProtocolUpdateStatus status = after.protocolUpdateStatus();
        assertTrue(status.isUpdated());
        assertEquals(first, ((ProtocolUpdateStatus.ProtocolUpdated) status).update());

        Updates later = after.enqueue(UpdateType.PROTOCOL, 30, protocolUpdate("third")).processUpdateQueues(40).updates();
        assertEquals(first, later.protocolUpdate().orElseThrow());
    }

    @Test
    void keyUpdatesReplaceTheKeyCollection() {
        Fixtures.Governance other = Fixtures.governance();
        HigherLevelKeys newLevel1 = other.keys().level1Keys();
        Updates u = initial.enqueue(UpdateType.LEVEL1_KEYS, 5, newLevel1);
        Updates after = u.processUpdateQueues(5).updates();
        assertEquals(newLevel1, after.keys().level1Keys());
        assertEquals(initial.keys().rootKeys(), after.keys().rootKeys());
        assertNotEquals(u.hash(), after.hash());
    }

    @Test
    void registrationsAreReportedWithoutChangingState() {
        AnonymityRevokerInfo ar = new AnonymityRevokerInfo(3, new Description("ar", "https://ar", "revoker"), new byte[] {5, 5});
        ProcessedUpdates p = initial.enqueue(UpdateType.ADD_ANONYMITY_REVOKER, 1, ar).processUpdateQueues(1);
        assertEquals(List.of(new AppliedUpdate(1, UpdateType.ADD_ANONYMITY_REVOKER, ar)), p.applied());
        assertEquals(initial.keys(), p.updates().keys());
        assertEquals(initial.chainParameters(), p.updates().chainParameters());
        assertEquals(p.applied(), p.registrations());
    }

    @Test
    void enqueueRejectsWrongValueType() {
        assertThrows(IllegalArgumentException.class, () -> initial.enqueue(UpdateType.GAS_REWARDS, 1, new Amount(1)));
    }

    @Test
    void bytesDecodeToSameState() {
        Updates u = initial
                .enqueue(UpdateType.PROTOCOL, 10, protocolUpdate("p"))
                .enqueue(UpdateType.FOUNDATION_ACCOUNT, 20, new AccountIndex(9))
                .processUpdateQueues(15).updates();
        Updates decoded = Updates.fromBytes(u.serialize());
        assertEquals(u, decoded);
        assertEquals(u.hash(), decoded.hash());
    }

    @Test
    void malformedBytesAreRejected() {
        byte[] bytes = initial.serialize();
        byte[] padded = Arrays.copyOf(bytes, bytes.length + 1);
        assertThrows(DecodeException.class, () -> Updates.fromBytes(padded));

        byte[] badTag = bytes.clone();
        badTag[initial.keys().serialize().length] = 2;
        assertThrows(DecodeException.class, () -> Updates.fromBytes(badTag));

        assertThrows(DecodeException.class, () -> Updates.fromBytes(Arrays.copyOf(bytes, bytes.length - 1)));
    }

    @Test
    void hashTracksScheduledUpdates() {
        Updates u = initial.enqueue(UpdateType.MICRO_GTU_PER_EURO, 10, new ExchangeRate(3, 1));
        assertNotEquals(initial.hash(), u.hash());
        assertEquals(u.hash(), initial.enqueue(UpdateType.MICRO_GTU_PER_EURO, 10, new ExchangeRate(3, 1)).hash());
    }

    @Test
    void jsonUsesWireFieldNames() throws Exception {
        Updates u = initial.enqueue(UpdateType.GAS_REWARDS, 10,
                new GasRewards(new RewardFraction(1), new RewardFraction(2), new RewardFraction(3), new RewardFraction(4)));
        JsonNode tree = JSON.readTree(JSON.writeValueAsString(u));
        assertTrue(tree.has("keys"));
        assertTrue(tree.has("chainParameters"));
        assertTrue(tree.has("updateQueues"));
        assertFalse(tree.has("protocolUpdate"));
        assertTrue(tree.get("keys").get("level2Keys").has("paramGASRewards"));
        assertTrue(tree.get("chainParameters").has("microGTUPerEuro"));
        assertTrue(tree.get("chainParameters").get("rewardParameters").has("gASRewards"));
        assertEquals(2, tree.get("updateQueues").get("gasRewards").get("nextSequenceNumber").asLong());
        assertEquals(1, tree.get("updateQueues").get("gasRewards").get("queue").size());

        Updates back = JSON.readValue(JSON.writeValueAsString(u), Updates.class);
        assertEquals(u, back);
    }

    @Test
    void jsonCarriesProtocolUpdateOnceInEffect() throws Exception {
        Updates u = initial.enqueue(UpdateType.PROTOCOL, 1, protocolUpdate("p")).processUpdateQueues(1).updates();
        JsonNode tree = JSON.readTree(JSON.writeValueAsString(u));
        assertEquals("p", tree.get("protocolUpdate").get("message").asText());
        assertEquals(u, JSON.readValue(JSON.writeValueAsString(u), Updates.class));
    }
}
