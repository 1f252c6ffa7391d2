package io.txledger.core.protocol;

/** Signature verification primitive used for transactions and update instructions. */
public interface SignatureScheme {

    /** True iff {@code signature} is a valid signature of {@code message} under {@code publicKey}. */
    boolean verify(byte[] publicKey, byte[] message, byte[] signature);
}
