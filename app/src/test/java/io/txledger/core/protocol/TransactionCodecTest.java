package io.txledger.core.protocol;

import io.txledger.core.testing.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class TransactionCodecTest {

    private final Fixtures.TestAccount alice = Fixtures.account("alice");

    @Test
    void decodesWhatWasEncoded() {
        Transaction tx = alice.tx(3, 1_000, 42, new byte[] {9, 8, 7, 6});
        byte[] bytes = tx.serialize();

        Transaction decoded = TransactionCodec.fromBytes(bytes, 42);
        assertEquals(tx.hash(), decoded.hash());
        assertEquals(tx.size(), decoded.size());
        assertEquals(bytes.length, decoded.size());
        assertEquals(alice.address(), decoded.sender());
        assertEquals(3, decoded.nonce());
        assertEquals(1_000, decoded.expiry());
        assertArrayEquals(new byte[] {9, 8, 7, 6}, decoded.payload());
        assertEquals(tx.signature(), decoded.signature());
    }

    @Test
    void hashCoversHeaderAndPayloadOnly() {
        Transaction tx = alice.tx(1);
        Hash expected = Hashes.hash(Transaction.bodyBytes(tx.header(), tx.payload()));
        assertEquals(expected, tx.hash());

        Transaction resigned = Transaction.create(
                new TransactionSignature(java.util.List.of(new TransactionSignature.Entry(7, new byte[64]))),
                tx.header(), tx.payload(), 0);
        assertEquals(tx.hash(), resigned.hash());
    }

    @Test
    void zeroSignatureCountIsRejected() {
        byte[] bytes = alice.tx(1).serialize();
        bytes[0] = 0;
        assertThrows(DecodeException.class, () -> TransactionCodec.fromBytes(bytes, 0));
    }

    @Test
    void truncatedInputIsRejected() {
        byte[] bytes = alice.tx(1).serialize();
        for (int cut : new int[] {0, 1, 5, bytes.length - 1}) {
            byte[] truncated = Arrays.copyOf(bytes, cut);
            assertThrows(DecodeException.class, () -> TransactionCodec.fromBytes(truncated, 0), "cut at " + cut);
        }
    }

    @Test
    void trailingBytesAreRejected() {
        byte[] bytes = alice.tx(1).serialize();
        byte[] padded = Arrays.copyOf(bytes, bytes.length + 1);
        assertThrows(DecodeException.class, () -> TransactionCodec.fromBytes(padded, 0));
    }

    @Test
    void oversizedPayloadIsRejected() {
        Transaction tx = alice.tx(1, Long.MAX_VALUE, 0, new byte[2048]);
        assertThrows(DecodeException.class, () -> TransactionCodec.fromBytes(tx.serialize(), 0, 1024));
        assertEquals(tx.hash(), TransactionCodec.fromBytes(tx.serialize(), 0, 4096).hash());
    }

    @Test
    void payloadSizeMismatchIsRefusedOnCreate() {
        TransactionHeader header = TransactionHeader.builder()
                .sender(alice.address())
                .nonce(1)
                .payloadSize(4)
                .build();
        TransactionSignature sig = new TransactionSignature(java.util.List.of(new TransactionSignature.Entry(0, new byte[64])));
        assertThrows(IllegalArgumentException.class, () -> Transaction.create(sig, header, new byte[3], 0));
    }

    @Test
    void nonceZeroIsNotAValidHeader() {
        assertThrows(IllegalArgumentException.class, () -> TransactionHeader.builder()
                .sender(alice.address())
                .nonce(0)
                .build());
    }
}
