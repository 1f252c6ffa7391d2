package io.txledger.core.protocol;

import java.nio.ByteBuffer;

/**
 * Wire format: signature | header | payload(header.payloadSize).
 * <p>
 * Decoding here only checks structure; signatures are checked separately by
 * {@link TransactionVerifier}.
 */
public final class TransactionCodec {
    private TransactionCodec(){}

    public static byte[] encode(Transaction tx) {
        ByteSink sink = new ByteSink(tx.size());
        tx.signature().writeTo(sink);
        tx.header().writeTo(sink);
        tx.writePayload(sink);
        return sink.toByteArray();
    }

    /** Decodes exactly one transaction; trailing bytes are an error. */
    public static Transaction fromBytes(byte[] bytes, long arrivalTime) {
        return fromBytes(bytes, arrivalTime, ProtocolLimits.DEFAULT_MAX_PAYLOAD_BYTES);
    }

    public static Transaction fromBytes(byte[] bytes, long arrivalTime, int maxPayloadBytes) {
        if (bytes == null) {
            throw new DecodeException("Missing transaction bytes");
        }
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        Transaction tx = readUnverified(buf, arrivalTime, maxPayloadBytes);
        Bytes.expectFullyConsumed(buf);
        return tx;
    }

    /**
     * Reads one transaction from the buffer's position without verifying its
     * signatures. The header and payload are parsed once; the hash is computed
     * over the same byte range afterwards, so hash and size match what
     * {@link Transaction#create} would produce.
     */
    public static Transaction readUnverified(ByteBuffer buf, long arrivalTime, int maxPayloadBytes) {
        try {
            int sigStart = buf.position();
            TransactionSignature signature = TransactionSignature.read(buf);
            int sigEnd = buf.position();

            int bodyStart = buf.position();
            TransactionHeader header = TransactionHeader.read(buf);
            if (header.payloadSize() > maxPayloadBytes) {
                throw new DecodeException("Payload size " + header.payloadSize() + " exceeds limit " + maxPayloadBytes);
            }
            byte[] payload = Bytes.readBytes(buf, (int) header.payloadSize());
            int bodyEnd = buf.position();

            ByteBuffer body = buf.duplicate();
            body.position(bodyStart);
            body.limit(bodyEnd);
            Hash hash = Hashes.hash(body);

            int size = (bodyEnd - bodyStart) + (sigEnd - sigStart);
            return new Transaction(signature, header, payload, hash, size, arrivalTime);
        } catch (DecodeException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new DecodeException("Malformed transaction bytes", e);
        }
    }
}
