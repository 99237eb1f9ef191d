package io.powchain.core.consensus;

import io.powchain.core.protocol.Block;
import io.powchain.core.protocol.Hashes;

import java.util.Arrays;
import java.util.List;

public final class ConsensusRules {
    private ConsensusRules() {}

    /**
     * Does {@code candidate} extend a chain whose last block is {@code tip}?
     * A null tip means an empty chain, which only accepts a genesis block.
     */
    public static ValidationResult checkContinuity(Block candidate, Block tip) {
        if (tip == null) {
            if (candidate.index() != 0) {
                return ValidationResult.error("Bad block index: expected 0, got " + candidate.index());
            }
            if (!Hashes.isZero(candidate.prevHash())) {
                return ValidationResult.error("Genesis must have a zero prev_hash");
            }
            return ValidationResult.ok();
        }

        long expectedIndex = tip.index() + 1;
        if (candidate.index() != expectedIndex) {
            return ValidationResult.error("Bad block index: expected " + expectedIndex + ", got " + candidate.index());
        }
        if (!Arrays.equals(candidate.prevHash(), tip.hash())) {
            return ValidationResult.error("prev_hash does not match tip " + Hashes.shortHex(tip.hash()));
        }
        return ValidationResult.ok();
    }

    /** Every block passes PoW and links to its predecessor, starting from genesis. */
    public static ValidationResult validateChain(List<Block> blocks, ProofOfWork pow) {
        Block previous = null;
        for (Block block : blocks) {
            if (!pow.verify(block)) {
                return ValidationResult.error("Proof-of-Work check failed at index " + block.index());
            }
            ValidationResult link = checkContinuity(block, previous);
            if (!link.ok) {
                return link;
            }
            previous = block;
        }
        return ValidationResult.ok();
    }
}
