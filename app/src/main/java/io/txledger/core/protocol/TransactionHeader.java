package io.txledger.core.protocol;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Header common to all transactions. Layout:
 * sender(32) | nonce(8) | energyAmount(8) | payloadSize(4) | expiry(8).
 */
public final class TransactionHeader {
    public static final int SERIALIZED_LENGTH = AccountAddress.LENGTH + 8 + 8 + 4 + 8;
    private static final long MAX_PAYLOAD_SIZE = 0xffffffffL;

    private final AccountAddress sender;
    private final long nonce;
    private final long energyAmount;
    private final long payloadSize;
    private final long expiry;

    private TransactionHeader(AccountAddress sender, long nonce, long energyAmount, long payloadSize, long expiry) {
        this.sender = sender;
        this.nonce = nonce;
        this.energyAmount = energyAmount;
        this.payloadSize = payloadSize;
        this.expiry = expiry;
        basicValidate();
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private AccountAddress sender;
        private long nonce = ProtocolLimits.MIN_NONCE;
        private long energyAmount;
        private long payloadSize;
        private long expiry;

        public Builder sender(AccountAddress s) { this.sender = s; return this; }
        public Builder nonce(long n) { this.nonce = n; return this; }
        public Builder energyAmount(long e) { this.energyAmount = e; return this; }
        public Builder payloadSize(long p) { this.payloadSize = p; return this; }
        public Builder expiry(long e) { this.expiry = e; return this; }

        public TransactionHeader build() {
            return new TransactionHeader(sender, nonce, energyAmount, payloadSize, expiry);
        }
    }

    public AccountAddress sender() { return sender; }
    public long nonce() { return nonce; }
    public long energyAmount() { return energyAmount; }
    public long payloadSize() { return payloadSize; }
    public long expiry() { return expiry; }

    public void writeTo(ByteSink sink) {
        sender.writeTo(sink);
        sink.putLong(nonce);
        sink.putLong(energyAmount);
        sink.putInt(payloadSize);
        sink.putLong(expiry);
    }

    public static TransactionHeader read(ByteBuffer buf) {
        AccountAddress sender = AccountAddress.read(buf);
        long nonce = Bytes.readLong(buf);
        long energy = Bytes.readLong(buf);
        long payloadSize = Bytes.readUnsignedInt(buf);
        long expiry = Bytes.readLong(buf);
        return new TransactionHeader(sender, nonce, energy, payloadSize, expiry);
    }

    private void basicValidate() {
        if (sender == null) throw new IllegalArgumentException("Missing sender");
        if (Long.compareUnsigned(nonce, ProtocolLimits.MIN_NONCE) < 0) throw new IllegalArgumentException("nonce must be >= " + ProtocolLimits.MIN_NONCE);
        if (payloadSize < 0 || payloadSize > MAX_PAYLOAD_SIZE) throw new IllegalArgumentException("payloadSize out of range: " + payloadSize);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransactionHeader)) return false;
        TransactionHeader other = (TransactionHeader) o;
        return nonce == other.nonce
                && energyAmount == other.energyAmount
                && payloadSize == other.payloadSize
                && expiry == other.expiry
                && sender.equals(other.sender);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sender, nonce, energyAmount, payloadSize, expiry);
    }

    @Override
    public String toString() {
        return "TransactionHeader{sender=" + sender + ", nonce=" + nonce + ", energy=" + energyAmount
                + ", payloadSize=" + payloadSize + ", expiry=" + expiry + "}";
    }
}
