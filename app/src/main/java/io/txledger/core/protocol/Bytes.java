package io.txledger.core.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Reading helpers over {@link ByteBuffer} plus hex conversion. Every short read
 * surfaces as a {@link DecodeException}.
 */
public final class Bytes {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private Bytes() {}

    public static int readUnsignedByte(ByteBuffer buf) {
        require(buf, 1);
        return buf.get() & 0xff;
    }

    public static int readUnsignedShort(ByteBuffer buf) {
        require(buf, 2);
        return buf.getShort() & 0xffff;
    }

    public static long readUnsignedInt(ByteBuffer buf) {
        require(buf, 4);
        return buf.getInt() & 0xffffffffL;
    }

    public static long readLong(ByteBuffer buf) {
        require(buf, 8);
        return buf.getLong();
    }

    public static byte[] readBytes(ByteBuffer buf, int len) {
        if (len < 0) {
            throw new DecodeException("Bad length: " + len);
        }
        require(buf, len);
        byte[] out = new byte[len];
        buf.get(out);
        return out;
    }

    /** Reads a u64 length followed by that many bytes. */
    public static byte[] readLengthPrefixed(ByteBuffer buf) {
        long len = readLong(buf);
        if (len < 0 || len > buf.remaining()) {
            throw new DecodeException("Bad length: " + len + " (remaining=" + buf.remaining() + ")");
        }
        return readBytes(buf, (int) len);
    }

    public static String readUtf8(ByteBuffer buf) {
        byte[] raw = readLengthPrefixed(buf);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new DecodeException("Invalid UTF-8 text", e);
        }
    }

    public static void expectFullyConsumed(ByteBuffer buf) {
        if (buf.hasRemaining()) {
            throw new DecodeException(buf.remaining() + " trailing bytes");
        }
    }

    private static void require(ByteBuffer buf, int n) {
        if (buf.remaining() < n) {
            throw new DecodeException("Truncated input: need " + n + " bytes, have " + buf.remaining());
        }
    }

    public static String toHex(byte[] b) {
        char[] out = new char[b.length * 2];
        for (int i = 0, j = 0; i < b.length; i++) {
            int v = b[i] & 0xff;
            out[j++] = HEX[v >>> 4];
            out[j++] = HEX[v & 0x0f];
        }
        return new String(out);
    }

    public static byte[] fromHex(String hex) {
        if (hex == null) {
            throw new DecodeException("Missing hex string");
        }
        String normalized = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (normalized.length() % 2 != 0) {
            throw new DecodeException("Hex string must have an even number of digits");
        }
        int len = normalized.length();
        byte[] out = new byte[len / 2];
        for (int i = 0; i < len; i += 2) {
            int hi = Character.digit(normalized.charAt(i), 16);
            int lo = Character.digit(normalized.charAt(i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new DecodeException("Not a hexadecimal string");
            }
            out[i / 2] = (byte) ((hi << 4) + lo);
        }
        return out;
    }
}
