package io.txledger.core.updates;

import io.txledger.core.protocol.ByteSink;
import io.txledger.core.protocol.DecodeException;
import io.txledger.core.testing.Fixtures;
import org.junit.jupiter.api.Test;

import java.security.PrivateKey;
import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class UpdateInstructionTest {

    private final Fixtures.Governance governance = Fixtures.governance();

    @Test
    void decodesSignedInstruction() {
        Map<Integer, PrivateKey> keys = new TreeMap<>();
        keys.put(0, governance.level2Key(0));
        keys.put(1, governance.level2Key(1));
        UpdateInstruction ui = UpdateInstruction.sign(4, 500, 400, UpdateType.MINT_DISTRIBUTION,
                Fixtures.chainParameters().rewardParameters().mintDistribution(), keys);

        UpdateInstruction decoded = UpdateInstruction.fromBytes(ui.serialize());
        assertEquals(4, decoded.sequenceNumber());
        assertEquals(500, decoded.effectiveTime());
        assertEquals(400, decoded.timeout());
        assertEquals(UpdateType.MINT_DISTRIBUTION, decoded.type());
        assertEquals(ui.value(), decoded.value());
        assertEquals(ui.signedHash(), decoded.signedHash());
        assertEquals(ui.signatures().keySet(), decoded.signatures().keySet());
        assertArrayEquals(ui.signatures().get(1), decoded.signatures().get(1));
    }

    @Test
    void trailingBytesAreRejected() {
        byte[] bytes = unsigned().serialize();
        assertThrows(DecodeException.class, () -> UpdateInstruction.fromBytes(Arrays.copyOf(bytes, bytes.length + 1)));
    }

    @Test
    void unknownUpdateTagIsRejected() {
        byte[] bytes = unsigned().serialize();
        bytes[UpdateInstruction.HEADER_LENGTH] = (byte) UpdateType.values().length;
        assertThrows(DecodeException.class, () -> UpdateInstruction.fromBytes(bytes));
    }

    @Test
    void signatureIndicesMustAscend() {
        byte[] bytes = unsigned().serialize();
        ByteSink sink = new ByteSink();
        sink.putBytes(Arrays.copyOf(bytes, bytes.length - 2));
        sink.putShort(2);
        sink.putShort(1).putShort(0);
        sink.putShort(0).putShort(0);
        assertThrows(DecodeException.class, () -> UpdateInstruction.fromBytes(sink.toByteArray()));
    }

    @Test
    void valueMustMatchType() {
        assertThrows(IllegalArgumentException.class,
                () -> new UpdateInstruction(1, 0, 10, UpdateType.PROTOCOL, new Amount(1), Map.of()));
    }

    private static UpdateInstruction unsigned() {
        return new UpdateInstruction(1, 0, 10, UpdateType.BAKER_STAKE_THRESHOLD, new Amount(77), Map.of());
    }
}
