package io.powchain.core.storage;

import io.powchain.core.consensus.ConsensusRules;
import io.powchain.core.consensus.ProofOfWork;
import io.powchain.core.consensus.ValidationResult;
import io.powchain.core.protocol.Block;
import io.powchain.core.protocol.Hashes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * In-memory chain for the lifetime of the process.
 * Every method synchronizes on the store, so connection threads and the miner
 * never observe a half-applied append or replace.
 */
public final class InMemoryChainStore implements ChainStore {
    private static final Logger LOG = Logger.getLogger(InMemoryChainStore.class.getName());

    private final List<Block> chain = new ArrayList<>();
    private final ProofOfWork pow;
    private final boolean strictContinuity;
    private final boolean verifyOnReplace;

    public InMemoryChainStore(ProofOfWork pow) {
        this(pow, true, true);
    }

    /**
     * @param strictContinuity require index == height and prev_hash == tip.hash on append
     * @param verifyOnReplace  re-check PoW and links of every block before adopting a longer chain
     */
    public InMemoryChainStore(ProofOfWork pow, boolean strictContinuity, boolean verifyOnReplace) {
        this.pow = pow;
        this.strictContinuity = strictContinuity;
        this.verifyOnReplace = verifyOnReplace;
    }

    @Override
    public synchronized AppendResult append(Block block) {
        if (block == null) return AppendResult.REJECTED_POW;
        if (!pow.verify(block)) {
            LOG.warning(() -> "Block fails PoW check, rejecting: " + block);
            return AppendResult.REJECTED_POW;
        }
        if (isStored(block)) {
            LOG.fine(() -> "Already have block " + block);
            return AppendResult.DUPLICATE;
        }
        if (strictContinuity) {
            ValidationResult link = ConsensusRules.checkContinuity(block, lastOrNull());
            if (!link.ok) {
                LOG.warning(() -> "Block " + block + " does not extend the chain: " + link.message);
                return AppendResult.REJECTED_CONTINUITY;
            }
        }
        chain.add(block);
        LOG.info(() -> "Added block index=" + block.index() + " nonce=" + Long.toUnsignedString(block.nonce())
                + " hash=" + Hashes.shortHex(block.hash()) + " (height " + chain.size() + ")");
        return AppendResult.ACCEPTED;
    }

    @Override
    public synchronized boolean replaceIfLonger(List<Block> candidate) {
        if (candidate == null || candidate.size() <= chain.size()) {
            int size = candidate == null ? 0 : candidate.size();
            LOG.info(() -> "Received chain (" + size + " blocks) is not longer than current chain ("
                    + chain.size() + " blocks)");
            return false;
        }
        if (verifyOnReplace) {
            ValidationResult result = ConsensusRules.validateChain(candidate, pow);
            if (!result.ok) {
                LOG.warning(() -> "Rejecting longer chain: " + result.message);
                return false;
            }
        }
        int previous = chain.size();
        chain.clear();
        chain.addAll(candidate);
        LOG.info(() -> "Chain replaced: " + previous + " -> " + chain.size() + " blocks");
        return true;
    }

    @Override
    public synchronized int height() {
        return chain.size();
    }

    @Override
    public synchronized Optional<Block> get(long index) {
        if (index < 0 || index >= chain.size()) return Optional.empty();
        return Optional.of(chain.get((int) index));
    }

    @Override
    public synchronized Optional<Block> tip() {
        return Optional.ofNullable(lastOrNull());
    }

    @Override
    public synchronized List<Block> blocks() {
        return List.copyOf(chain);
    }

    private Block lastOrNull() {
        return chain.isEmpty() ? null : chain.get(chain.size() - 1);
    }

    // Newest first: re-announced blocks are almost always recent ones.
    private boolean isStored(Block block) {
        byte[] hash = block.hash();
        for (int i = chain.size() - 1; i >= 0; i--) {
            if (Arrays.equals(chain.get(i).hash(), hash)) return true;
        }
        return false;
    }
}
