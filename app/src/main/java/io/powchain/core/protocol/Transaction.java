package io.powchain.core.protocol;

import java.util.Objects;

/**
 * Value transfer embedded in a block.
 * {@code amount} is an unsigned 64-bit quantity carried in a {@code long}; zero is allowed.
 */
public final class Transaction {

    private final String sender;
    private final String receiver;
    private final long amount;

    public Transaction(String sender, String receiver, long amount) {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.receiver = Objects.requireNonNull(receiver, "receiver");
        this.amount = amount;
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String sender;
        private String receiver;
        private long amount;

        public Builder sender(String s) { this.sender = s; return this; }
        public Builder receiver(String r) { this.receiver = r; return this; }
        public Builder amount(long a) { this.amount = a; return this; }

        public Transaction build() {
            return new Transaction(sender, receiver, amount);
        }
    }

    public String sender() { return sender; }
    public String receiver() { return receiver; }
    public long amount() { return amount; }

    /** Hash contribution: sender bytes, receiver bytes, u64(amount). */
    public byte[] toHashBytes() {
        byte[] s = ByteCodec.utf8(sender);
        byte[] r = ByteCodec.utf8(receiver);
        byte[] a = ByteCodec.u64(amount);
        byte[] out = new byte[s.length + r.length + a.length];
        System.arraycopy(s, 0, out, 0, s.length);
        System.arraycopy(r, 0, out, s.length, r.length);
        System.arraycopy(a, 0, out, s.length + r.length, a.length);
        return out;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transaction)) return false;
        Transaction other = (Transaction) o;
        return amount == other.amount && sender.equals(other.sender) && receiver.equals(other.receiver);
    }

    @Override public int hashCode() {
        return Objects.hash(sender, receiver, amount);
    }

    @Override public String toString() {
        return sender + " -> " + receiver + " : " + Long.toUnsignedString(amount);
    }
}
