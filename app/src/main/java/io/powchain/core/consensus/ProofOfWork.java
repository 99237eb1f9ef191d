package io.powchain.core.consensus;

import io.powchain.core.protocol.Block;
import io.powchain.core.protocol.ByteCodec;
import io.powchain.core.protocol.Hashes;
import io.powchain.core.protocol.Transaction;

import java.io.ByteArrayOutputStream;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Leading-zero-bytes Proof-of-Work:
 * - Hash = SHA-256(u32(index) || u64(timestamp) || u64(nonce) || prevHash || txs || data),
 *   where each tx contributes sender || receiver || u64(amount). The hash field is never an input.
 * - Difficulty = number of leading zero BYTES, clamped to [0, 32].
 *
 * Example:
 *   difficulty = 2  -> hash must start with 0x00 0x00.
 */
public final class ProofOfWork {
    public static final int MAX_DIFFICULTY = Hashes.LENGTH;

    /** Interrupt check period for the unbounded loop. */
    private static final long INTERRUPT_CHECK_MASK = 0xFFFFL;

    private final int difficulty;

    /** @param difficulty the node's admission difficulty used by {@link #verify(Block)} */
    public ProofOfWork(int difficulty) {
        this.difficulty = clamp(difficulty);
    }

    public int difficulty() { return difficulty; }

    public static byte[] computeHash(Block block) {
        return new HashInput(block).digest(block.nonce());
    }

    /** True iff the first min(difficulty, 32) bytes are zero. Difficulty 0 always succeeds. */
    public static boolean meetsDifficulty(byte[] hash, int difficulty) {
        int limit = clamp(difficulty);
        if (hash == null || hash.length < limit) return false;
        for (int i = 0; i < limit; i++) {
            if (hash[i] != 0) return false;
        }
        return true;
    }

    /**
     * Search nonces upward from the template's nonce until the difficulty is met.
     * Unbounded and CPU-bound: run it off any thread that must stay responsive.
     * The returned Block is a NEW instance carrying the winning nonce and hash.
     *
     * @throws CancellationException if the calling thread is interrupted while searching
     */
    public Block mine(Block template, int targetDifficulty) {
        HashInput input = new HashInput(template);
        long nonce = template.nonce();
        for (long tries = 0; ; tries++, nonce++) {
            byte[] hash = input.digest(nonce);
            if (meetsDifficulty(hash, targetDifficulty)) {
                return template.withProof(nonce, hash);
            }
            if ((tries & INTERRUPT_CHECK_MASK) == INTERRUPT_CHECK_MASK && Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Mining interrupted at index " + template.index());
            }
        }
    }

    /** Mine at this engine's own difficulty. */
    public Block mine(Block template) {
        return mine(template, difficulty);
    }

    /**
     * Bounded variant: try at most maxTries nonces.
     * Returns Optional.of(minedBlock) if found; Optional.empty() otherwise.
     */
    public Optional<Block> mine(Block template, int targetDifficulty, long maxTries) {
        if (template == null) return Optional.empty();
        HashInput input = new HashInput(template);
        long nonce = template.nonce();
        for (long i = 0; i < maxTries; i++, nonce++) {
            byte[] hash = input.digest(nonce);
            if (meetsDifficulty(hash, targetDifficulty)) {
                return Optional.of(template.withProof(nonce, hash));
            }
        }
        return Optional.empty();
    }

    /** Stored hash must equal the recomputed hash AND meet this node's difficulty. */
    public boolean verify(Block block) {
        if (block == null) return false;
        byte[] recomputed = computeHash(block);
        if (!Arrays.equals(recomputed, block.hash())) return false;
        return meetsDifficulty(recomputed, difficulty);
    }

    // ---------- helpers ----------

    /** Clamp difficulty to [0, 32]. */
    private static int clamp(int difficulty) {
        if (difficulty < 0) return 0;
        return Math.min(difficulty, MAX_DIFFICULTY);
    }

    /**
     * Pre-serialized hash input around the nonce, so a mining step only
     * feeds the 8 nonce bytes plus two fixed arrays.
     */
    private static final class HashInput {
        private final byte[] head;
        private final byte[] tail;
        private final MessageDigest digest = Hashes.sha256();

        HashInput(Block block) {
            byte[] idx = ByteCodec.u32(block.index());
            byte[] ts = ByteCodec.u64(block.timestamp());
            this.head = new byte[idx.length + ts.length];
            System.arraycopy(idx, 0, head, 0, idx.length);
            System.arraycopy(ts, 0, head, idx.length, ts.length);

            ByteArrayOutputStream buf = new ByteArrayOutputStream();
            buf.writeBytes(block.prevHash());
            for (Transaction tx : block.transactions()) {
                buf.writeBytes(tx.toHashBytes());
            }
            buf.writeBytes(ByteCodec.utf8(block.data()));
            this.tail = buf.toByteArray();
        }

        byte[] digest(long nonce) {
            digest.update(head);
            digest.update(ByteCodec.u64(nonce));
            digest.update(tail);
            return digest.digest();
        }
    }
}
