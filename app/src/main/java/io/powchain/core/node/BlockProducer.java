package io.powchain.core.node;

import io.powchain.core.consensus.ProofOfWork;
import io.powchain.core.metrics.BlockMetrics;
import io.powchain.core.p2p.P2pMessage;
import io.powchain.core.p2p.P2pServer;
import io.powchain.core.p2p.PeerNetwork;
import io.powchain.core.protocol.Block;
import io.powchain.core.storage.AppendResult;
import io.powchain.core.storage.ChainStore;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/**
 * Turns new data into a mined block on the current tip, appends it, and broadcasts it.
 * Mining runs on a dedicated single thread so it never stalls network I/O.
 */
public final class BlockProducer {
    private static final Logger LOG = Logger.getLogger(BlockProducer.class.getName());

    /** Re-mining rounds when a remote block moves the tip while we search. */
    private static final int MAX_ATTEMPTS = 3;

    private final ChainStore chain;
    private final ProofOfWork pow;
    private final PeerNetwork network;
    private final Clock clock;
    private final int maxFrameBytes;
    private final ExecutorService miner;

    public BlockProducer(ChainStore chain, ProofOfWork pow, PeerNetwork network, Clock clock) {
        this(chain, pow, network, clock, P2pServer.DEFAULT_MAX_FRAME_BYTES);
    }

    /** @param maxFrameBytes largest wire line, newline included, that peers accept */
    public BlockProducer(ChainStore chain, ProofOfWork pow, PeerNetwork network, Clock clock, int maxFrameBytes) {
        this.chain = Objects.requireNonNull(chain, "chain");
        this.pow = Objects.requireNonNull(pow, "pow");
        this.network = Objects.requireNonNull(network, "network");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.maxFrameBytes = maxFrameBytes;
        this.miner = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "powchain-miner");
            t.setDaemon(true);
            return t;
        });
    }

    /** Unmined successor of {@code predecessor}: nonce 0, zero hash, no transactions. */
    public Block createNext(String payload, Block predecessor) {
        Objects.requireNonNull(predecessor, "predecessor");
        return Block.builder()
                .index(predecessor.index() + 1)
                .timestamp(clock.instant().getEpochSecond())
                .prevHash(predecessor.hash())
                .transactions(List.of())
                .nonce(0)
                .data(payload)
                .build();
    }

    /** Mine and publish {@code payload} on the miner thread. */
    public CompletableFuture<Block> submit(String payload) {
        return CompletableFuture.supplyAsync(() -> produce(payload), miner);
    }

    /**
     * Mine and append a prepared template (e.g. a shared genesis) on the miner thread.
     * Completes with the block the chain holds at the template's index, which is the
     * peer's copy when an identical or competing block arrived first.
     */
    public CompletableFuture<Block> submit(Block template) {
        return CompletableFuture.supplyAsync(() -> publish(template), miner);
    }

    /**
     * Synchronous production on the calling thread. On an empty chain the payload becomes the genesis block.
     *
     * @throws IllegalArgumentException if the encoded block would not fit in one wire frame
     * @throws IllegalStateException if the mined block is not accepted by the chain
     */
    public Block produce(String payload) {
        for (int attempt = 1; ; attempt++) {
            Block template = chain.tip()
                    .map(tip -> createNext(payload, tip))
                    .orElseGet(() -> GenesisBuilder.buildGenesis(payload, List.of(), clock.instant().getEpochSecond()));
            checkFrameSize(template);
            Block mined = mine(template);
            AppendResult result = chain.append(mined);
            if (result.accepted()) {
                network.broadcast(mined, null);
                return mined;
            }
            if (result != AppendResult.REJECTED_CONTINUITY || attempt >= MAX_ATTEMPTS) {
                throw new IllegalStateException("Mined block " + mined + " was rejected: " + result);
            }
            LOG.info(() -> "Tip moved while mining index " + mined.index() + ", mining again on the new tip");
        }
    }

    public void shutdown() {
        miner.shutdownNow();
    }

    private Block mine(Block template) {
        Block mined = BlockMetrics.recordMining(() -> pow.mine(template));
        BlockMetrics.incrementMined();
        LOG.info(() -> "Mined block index=" + mined.index() + " nonce=" + Long.toUnsignedString(mined.nonce()));
        return mined;
    }

    private Block publish(Block template) {
        checkFrameSize(template);
        Optional<Block> existing = chain.get(template.index());
        if (existing.isPresent()) {
            LOG.info(() -> "Chain already has index " + template.index() + ", keeping " + existing.get());
            return existing.get();
        }
        Block mined = mine(template);
        AppendResult result = chain.append(mined);
        switch (result) {
            case ACCEPTED:
                network.broadcast(mined, null);
                return mined;
            case DUPLICATE:
                LOG.info(() -> "Block " + mined + " arrived from a peer while mining");
                return mined;
            case REJECTED_CONTINUITY:
                Optional<Block> arrived = chain.get(mined.index());
                if (arrived.isPresent()) {
                    LOG.info(() -> "Index " + mined.index() + " was filled by a peer while mining, keeping " + arrived.get());
                    return arrived.get();
                }
                throw new IllegalStateException("Mined block " + mined + " does not extend the chain");
            default:
                throw new IllegalStateException("Mined block " + mined + " was rejected: " + result);
        }
    }

    /** Worst case is the 20-digit nonce, so check with the largest one. */
    private void checkFrameSize(Block template) {
        String line = P2pMessage.block(template.withProof(-1L, template.hash())).toLine();
        int bytes = line.getBytes(StandardCharsets.UTF_8).length + 1;
        if (bytes > maxFrameBytes) {
            throw new IllegalArgumentException("Block index " + template.index() + " would be " + bytes
                    + " bytes on the wire, peers accept at most " + maxFrameBytes);
        }
    }
}
