package io.txledger.core.protocol;

/**
 * Malformed bytes or JSON: the input is rejected as a whole and no partial
 * value is returned.
 */
public class DecodeException extends IllegalArgumentException {
    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
