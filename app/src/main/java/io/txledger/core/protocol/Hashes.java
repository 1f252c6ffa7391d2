package io.txledger.core.protocol;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Hashes {
    private Hashes(){}

    public static byte[] sha256(byte[] in){
        try {
            return MessageDigest.getInstance("SHA-256").digest(in);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }

    /** Hashes the remaining bytes of {@code region} without copying them. */
    public static Hash hash(ByteBuffer region) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            md.update(region);
            return new Hash(md.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }

    public static Hash hash(byte[] in) {
        return new Hash(sha256(in));
    }

    /** Hash of the concatenation of the given byte strings. */
    public static Hash hashAll(byte[]... parts) {
        ByteSink sink = new ByteSink();
        for (byte[] part : parts) {
            sink.putBytes(part);
        }
        return hash(sink.toByteArray());
    }
}
