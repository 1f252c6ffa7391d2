package io.txledger.core.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Keys of an account indexed by key index, and how many of them must sign.
 */
public final class AccountKeys {
    private final Map<Integer, byte[]> keys;
    private final int threshold;

    public AccountKeys(Map<Integer, byte[]> keys, int threshold) {
        if (keys == null || keys.isEmpty()) {
            throw new IllegalArgumentException("Account needs at least one key");
        }
        if (threshold < 1 || threshold > keys.size()) {
            throw new IllegalArgumentException("threshold must be in [1," + keys.size() + "], got " + threshold);
        }
        TreeMap<Integer, byte[]> copy = new TreeMap<>();
        for (Map.Entry<Integer, byte[]> e : keys.entrySet()) {
            if (e.getKey() < 0 || e.getKey() > 0xff) {
                throw new IllegalArgumentException("key index out of range: " + e.getKey());
            }
            copy.put(e.getKey(), e.getValue().clone());
        }
        this.keys = Collections.unmodifiableMap(copy);
        this.threshold = threshold;
    }

    @JsonCreator
    static AccountKeys fromJson(@JsonProperty("keys") Map<Integer, String> hexKeys,
                                @JsonProperty("threshold") int threshold) {
        TreeMap<Integer, byte[]> raw = new TreeMap<>();
        if (hexKeys != null) {
            hexKeys.forEach((idx, hex) -> raw.put(idx, Bytes.fromHex(hex)));
        }
        return new AccountKeys(raw, threshold);
    }

    public static AccountKeys single(byte[] publicKey) {
        return new AccountKeys(Map.of(0, publicKey), 1);
    }

    /** Key at {@code index}, or null when the account has none there. */
    public byte[] key(int index) {
        byte[] k = keys.get(index);
        return k == null ? null : k.clone();
    }

    @JsonProperty("threshold")
    public int threshold() { return threshold; }

    @JsonProperty("keys")
    Map<Integer, String> hexKeys() {
        TreeMap<Integer, String> out = new TreeMap<>();
        keys.forEach((idx, k) -> out.put(idx, Bytes.toHex(k)));
        return out;
    }

    public int size() { return keys.size(); }
}
