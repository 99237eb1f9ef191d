package io.powchain.core.protocol;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Block = chain position + predecessor link + transactions + free-form data + proof.
 * - index: unsigned 32-bit height (genesis = 0)
 * - timestamp: seconds since epoch, informational only
 * - prevHash: hash of the predecessor (32 zero bytes for genesis)
 * - nonce/hash: proof-of-work, zero until mined
 *
 * Instances are immutable; mining produces a new instance via {@link #withProof(long, byte[])}.
 */
public final class Block {
    public static final long MAX_INDEX = 0xFFFF_FFFFL;

    private final long index;
    private final long timestamp;
    private final byte[] prevHash;
    private final List<Transaction> transactions;
    private final long nonce;
    private final String data;
    private final byte[] hash;

    private Block(Builder b) {
        this.index = b.index;
        this.timestamp = b.timestamp;
        this.prevHash = b.prevHash != null ? b.prevHash.clone() : Hashes.zero();
        this.transactions = b.transactions != null ? List.copyOf(b.transactions) : List.of();
        this.nonce = b.nonce;
        this.data = b.data != null ? b.data : "";
        this.hash = b.hash != null ? b.hash.clone() : Hashes.zero();
        basicValidate();
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private long index;
        private long timestamp;
        private byte[] prevHash;
        private List<Transaction> transactions;
        private long nonce;
        private String data;
        private byte[] hash;

        public Builder index(long i) { this.index = i; return this; }
        public Builder timestamp(long ts) { this.timestamp = ts; return this; }
        public Builder prevHash(byte[] h) { this.prevHash = h; return this; }
        public Builder transactions(List<Transaction> txs) { this.transactions = txs; return this; }
        public Builder nonce(long n) { this.nonce = n; return this; }
        public Builder data(String d) { this.data = d; return this; }
        public Builder hash(byte[] h) { this.hash = h; return this; }

        public Block build() { return new Block(this); }
    }

    public long index() { return index; }
    public long timestamp() { return timestamp; }
    public byte[] prevHash() { return prevHash.clone(); }
    public List<Transaction> transactions() { return transactions; }
    public long nonce() { return nonce; }
    public String data() { return data; }
    public byte[] hash() { return hash.clone(); }

    public boolean isGenesis() {
        return index == 0 && Hashes.isZero(prevHash);
    }

    /** Copy with the mined nonce and its digest. */
    public Block withProof(long minedNonce, byte[] minedHash) {
        return toBuilder().nonce(minedNonce).hash(minedHash).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .index(index)
                .timestamp(timestamp)
                .prevHash(prevHash)
                .transactions(transactions)
                .nonce(nonce)
                .data(data)
                .hash(hash);
    }

    public void basicValidate() {
        if (index < 0 || index > MAX_INDEX) throw new IllegalArgumentException("index out of u32 range: " + index);
        if (prevHash.length != Hashes.LENGTH) throw new IllegalArgumentException("prevHash must be 32 bytes");
        if (hash.length != Hashes.LENGTH) throw new IllegalArgumentException("hash must be 32 bytes");
        for (Transaction tx : transactions) {
            if (tx == null) throw new IllegalArgumentException("null transaction");
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Block)) return false;
        Block other = (Block) o;
        return index == other.index
                && timestamp == other.timestamp
                && nonce == other.nonce
                && Arrays.equals(prevHash, other.prevHash)
                && Arrays.equals(hash, other.hash)
                && transactions.equals(other.transactions)
                && data.equals(other.data);
    }

    @Override public int hashCode() {
        int h = Objects.hash(index, timestamp, nonce, transactions, data);
        h = 31 * h + Arrays.hashCode(prevHash);
        return 31 * h + Arrays.hashCode(hash);
    }

    @Override public String toString() {
        return "Block{index=" + index + ", nonce=" + Long.toUnsignedString(nonce)
                + ", txs=" + transactions.size() + ", hash=" + Hashes.shortHex(hash) + "}";
    }
}
