package io.txledger.core.protocol;

/**
 * A signed transaction together with its derived fields: content hash (over
 * header and payload, signature excluded), byte size and arrival time.
 * <p>
 * Equality and ordering only look at the hash.
 */
public final class Transaction implements Comparable<Transaction> {

    private final TransactionSignature signature;
    private final TransactionHeader header;
    private final byte[] payload;

    private final Hash hash;
    private final int size;
    private final long arrivalTime;

    Transaction(TransactionSignature signature,
                TransactionHeader header,
                byte[] payload,
                Hash hash,
                int size,
                long arrivalTime) {
        this.signature = signature;
        this.header = header;
        this.payload = payload;
        this.hash = hash;
        this.size = size;
        this.arrivalTime = arrivalTime;
    }

    /**
     * Builds a transaction from its parts, computing hash and size.
     *
     * @param arrivalTime seconds since the unix epoch when first seen
     */
    public static Transaction create(TransactionSignature signature,
                                     TransactionHeader header,
                                     byte[] payload,
                                     long arrivalTime) {
        if (signature == null || header == null || payload == null) {
            throw new IllegalArgumentException("signature, header and payload are required");
        }
        if (payload.length != header.payloadSize()) {
            throw new IllegalArgumentException("payload length " + payload.length
                    + " does not match declared size " + header.payloadSize());
        }
        byte[] body = bodyBytes(header, payload);
        int size = body.length + signature.serialize().length;
        return new Transaction(signature, header, payload.clone(), Hashes.hash(body), size, arrivalTime);
    }

    /** header || payload: the bytes that are hashed and signed. */
    public static byte[] bodyBytes(TransactionHeader header, byte[] payload) {
        ByteSink sink = new ByteSink(TransactionHeader.SERIALIZED_LENGTH + payload.length);
        header.writeTo(sink);
        sink.putBytes(payload);
        return sink.toByteArray();
    }

    // -------------------- getters --------------------
    public TransactionSignature signature() { return signature; }
    public TransactionHeader header() { return header; }
    public byte[] payload() { return payload.clone(); }
    public Hash hash() { return hash; }
    public int size() { return size; }
    public long arrivalTime() { return arrivalTime; }

    public AccountAddress sender() { return header.sender(); }
    public long nonce() { return header.nonce(); }
    public long energyAmount() { return header.energyAmount(); }
    public long expiry() { return header.expiry(); }

    public byte[] serialize() {
        return TransactionCodec.encode(this);
    }

    void writePayload(ByteSink sink) {
        sink.putBytes(payload);
    }

    @Override
    public int compareTo(Transaction other) {
        return hash.compareTo(other.hash);
    }

    @Override public boolean equals(Object o){ return o instanceof Transaction && hash.equals(((Transaction)o).hash); }
    @Override public int hashCode(){ return hash.hashCode(); }

    @Override
    public String toString() {
        return "Transaction{" + hash + ", sender=" + header.sender() + ", nonce=" + header.nonce() + "}";
    }
}
