package io.powchain.core.p2p;

import io.powchain.core.protocol.Block;

import java.util.Collection;

/** Outbound side of the peer protocol, as seen by message handlers and the block producer. */
public interface PeerNetwork {

    /** @return false if the peer is no longer connected */
    boolean send(P2pServer.Peer peer, P2pMessage message);

    /**
     * Send {@code BLOCK:} to every connected peer except {@code exclude}.
     * A null {@code exclude} marks a locally originated block, which is kept for later peers if nobody receives it.
     */
    void broadcast(Block block, P2pServer.Peer exclude);

    Collection<P2pServer.Peer> peers();
}
