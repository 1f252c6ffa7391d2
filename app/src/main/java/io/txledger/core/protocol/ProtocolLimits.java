package io.txledger.core.protocol;

public final class ProtocolLimits {
    private ProtocolLimits(){}

    public static final int MAX_SIGNATURES = 255;
    public static final int DEFAULT_MAX_PAYLOAD_BYTES = 100 * 1024;
    public static final int MAX_SIGNATURE_BYTES = 0xffff;
    public static final long MIN_NONCE = 1L;
    public static final long MIN_UPDATE_SEQUENCE_NUMBER = 1L;
    /** Denominator of the "parts per hundred thousand" fractions. */
    public static final int PARTS_PER_HUNDRED_THOUSAND = 100_000;
}
