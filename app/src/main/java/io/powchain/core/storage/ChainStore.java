package io.powchain.core.storage;

import io.powchain.core.protocol.Block;

import java.util.List;
import java.util.Optional;

/**
 * Linear chain of accepted blocks, index 0 = genesis.
 * Mutated only by {@link #append} and {@link #replaceIfLonger}; implementations must be thread-safe.
 */
public interface ChainStore {

    /** Admit a block after proof-of-work re-verification. Rejections leave the chain untouched. */
    AppendResult append(Block block);

    /**
     * Longest-chain rule: atomically adopt {@code candidate} if it has more blocks than the current chain.
     *
     * @return true if the candidate replaced the current chain
     */
    boolean replaceIfLonger(List<Block> candidate);

    /** Number of blocks stored. */
    int height();

    Optional<Block> get(long index);

    /** Last block, if any. */
    Optional<Block> tip();

    /** Snapshot of the whole chain in order. */
    List<Block> blocks();
}
