package io.powchain.core.p2p;

import io.powchain.core.metrics.BlockMetrics;
import io.powchain.core.protocol.Block;
import io.powchain.core.protocol.BlockCodec;
import io.powchain.core.protocol.ProtocolException;
import io.powchain.core.storage.AppendResult;
import io.powchain.core.storage.ChainStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Block protocol rules on top of a {@link PeerNetwork}:
 * - BLOCK: decode, append, and on acceptance relay to every peer except the sender.
 * - GET_CHAIN: stream the whole chain as BLOCK messages, then CHAIN_SYNC_COMPLETE.
 * - CHAIN_SYNC_COMPLETE: offer the blocks received since our GET_CHAIN to the longest-chain rule.
 * Outbound peers are asked for their chain as soon as they connect.
 */
public final class BlockSync implements P2pServer.PeerListener {
    private static final Logger LOG = Logger.getLogger(BlockSync.class.getName());

    private final ChainStore chain;
    private final Map<String, SyncSession> sessions = new ConcurrentHashMap<>();
    private volatile PeerNetwork network;

    public BlockSync(ChainStore chain) {
        this.chain = Objects.requireNonNull(chain, "chain");
    }

    /** Must be called before the network starts delivering events. */
    public void attach(PeerNetwork network) {
        this.network = Objects.requireNonNull(network, "network");
    }

    @Override
    public void onPeerConnected(P2pServer.Peer peer) {
        if (peer.outbound()) {
            requestChain(peer);
        }
    }

    @Override
    public void onPeerDisconnected(P2pServer.Peer peer) {
        sessions.remove(peer.remoteAddress());
    }

    @Override
    public void onMessage(P2pServer.Peer peer, P2pMessage message) {
        switch (message.type()) {
            case BLOCK:
                handleBlock(peer, message.payload());
                break;
            case GET_CHAIN:
                LOG.info(() -> "Received GET_CHAIN from " + peer.remoteAddress());
                sendChain(peer);
                break;
            case CHAIN_SYNC_COMPLETE:
                completeSync(peer);
                break;
            default:
                LOG.info(() -> "Unknown message from " + peer.remoteAddress() + ": " + message.payload());
        }
    }

    /** Ask {@code peer} for its full chain and start collecting it as a replacement candidate. */
    public void requestChain(P2pServer.Peer peer) {
        session(peer).begin();
        if (network().send(peer, P2pMessage.getChain())) {
            LOG.info(() -> "Requested chain from " + peer.remoteAddress());
        }
    }

    private void handleBlock(P2pServer.Peer peer, String json) {
        Block block;
        try {
            block = BlockCodec.decode(json);
        } catch (ProtocolException e) {
            BlockMetrics.incrementRejected();
            LOG.warning(() -> "Block parse error from " + peer.remoteAddress() + ": " + e);
            return;
        }

        SyncSession session = session(peer);
        session.collect(block);

        AppendResult result = chain.append(block);
        switch (result) {
            case ACCEPTED:
                BlockMetrics.incrementAccepted();
                network().broadcast(block, peer);
                break;
            case DUPLICATE:
                break;
            case REJECTED_CONTINUITY:
                BlockMetrics.incrementRejected();
                // A block ahead of us means we are missing its ancestors.
                if (block.index() >= chain.height() && !session.isSyncing()) {
                    requestChain(peer);
                }
                break;
            default:
                BlockMetrics.incrementRejected();
        }
    }

    private void sendChain(P2pServer.Peer peer) {
        List<Block> blocks = chain.blocks();
        LOG.info(() -> "Sending full chain (height=" + blocks.size() + ") to " + peer.remoteAddress());
        PeerNetwork net = network();
        for (Block block : blocks) {
            if (!net.send(peer, P2pMessage.block(block))) {
                return;
            }
        }
        net.send(peer, P2pMessage.chainSyncComplete());
    }

    private void completeSync(P2pServer.Peer peer) {
        List<Block> candidate = session(peer).finish();
        if (candidate == null) {
            LOG.fine(() -> "Unsolicited CHAIN_SYNC_COMPLETE from " + peer.remoteAddress());
            return;
        }
        LOG.info(() -> "Chain synchronization completed with peer " + peer.remoteAddress()
                + " (" + candidate.size() + " blocks received)");
        if (candidate.size() > chain.height() && chain.replaceIfLonger(candidate)) {
            chain.tip().ifPresent(tip -> network().broadcast(tip, peer));
        }
    }

    private SyncSession session(P2pServer.Peer peer) {
        return sessions.computeIfAbsent(peer.remoteAddress(), k -> new SyncSession());
    }

    private PeerNetwork network() {
        PeerNetwork net = network;
        if (net == null) {
            throw new IllegalStateException("BlockSync is not attached to a network");
        }
        return net;
    }

    /** Blocks received from one peer between our GET_CHAIN and its CHAIN_SYNC_COMPLETE. */
    private static final class SyncSession {
        private boolean syncing;
        private final List<Block> received = new ArrayList<>();

        synchronized void begin() {
            syncing = true;
            received.clear();
        }

        synchronized boolean isSyncing() {
            return syncing;
        }

        synchronized void collect(Block block) {
            if (syncing) {
                received.add(block);
            }
        }

        /** @return the collected blocks, or null if no request was outstanding */
        synchronized List<Block> finish() {
            if (!syncing) {
                return null;
            }
            syncing = false;
            List<Block> out = List.copyOf(received);
            received.clear();
            return out;
        }
    }
}
