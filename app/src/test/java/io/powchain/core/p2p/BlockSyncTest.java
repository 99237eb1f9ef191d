package io.powchain.core.p2p;

import io.powchain.core.consensus.ProofOfWork;
import io.powchain.core.node.GenesisBuilder;
import io.powchain.core.protocol.Block;
import io.powchain.core.protocol.BlockCodec;
import io.powchain.core.protocol.Hashes;
import io.powchain.core.storage.ChainStore;
import io.powchain.core.storage.InMemoryChainStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockSyncTest {

    private static final P2pServer.Peer INBOUND = new P2pServer.Peer("10.0.0.1:50000", false);
    private static final P2pServer.Peer OUTBOUND = new P2pServer.Peer("10.0.0.2:8080", true);

    private final ProofOfWork pow = new ProofOfWork(1);
    private ChainStore chain;
    private RecordingNetwork network;
    private BlockSync sync;

    @BeforeEach
    void setUp() {
        chain = new InMemoryChainStore(pow);
        network = new RecordingNetwork();
        sync = new BlockSync(chain);
        sync.attach(network);
    }

    private List<Block> mineChain(String label, int length) {
        List<Block> blocks = new ArrayList<>();
        Block tip = pow.mine(GenesisBuilder.buildGenesis(label + "-0", List.of(), 1_000L));
        blocks.add(tip);
        for (int i = 1; i < length; i++) {
            tip = pow.mine(Block.builder()
                    .index(tip.index() + 1)
                    .timestamp(1_000L + i)
                    .prevHash(tip.hash())
                    .data(label + "-" + i)
                    .build());
            blocks.add(tip);
        }
        return blocks;
    }

    @Test
    void acceptedBlockIsRelayedToEveryoneButSender() {
        Block genesis = pow.mine(GenesisBuilder.referenceGenesis());
        sync.onMessage(INBOUND, P2pMessage.block(genesis));

        assertEquals(1, chain.height());
        assertEquals(1, network.broadcasts.size());
        assertEquals(genesis, network.broadcasts.get(0).block);
        assertSame(INBOUND, network.broadcasts.get(0).exclude);
    }

    @Test
    void duplicateBlockIsNotRelayedAgain() {
        Block genesis = pow.mine(GenesisBuilder.referenceGenesis());
        sync.onMessage(INBOUND, P2pMessage.block(genesis));
        sync.onMessage(OUTBOUND, P2pMessage.block(genesis));

        assertEquals(1, chain.height());
        assertEquals(1, network.broadcasts.size());
    }

    @Test
    void unparseableBlockIsDroppedAndConnectionKeepsWorking() {
        sync.onMessage(INBOUND, new P2pMessage(P2pMessage.Type.BLOCK, "{not json"));
        sync.onMessage(INBOUND, new P2pMessage(P2pMessage.Type.BLOCK, "{\"hash\":\"xyz\"}"));
        assertEquals(0, chain.height());
        assertTrue(network.broadcasts.isEmpty());

        Block genesis = pow.mine(GenesisBuilder.referenceGenesis());
        sync.onMessage(INBOUND, P2pMessage.block(genesis));
        assertEquals(1, chain.height());
    }

    @Test
    void tamperedHashIsRejected() {
        Block genesis = pow.mine(GenesisBuilder.referenceGenesis());
        byte[] forged = genesis.hash();
        forged[31] ^= 0x01;
        sync.onMessage(INBOUND, new P2pMessage(P2pMessage.Type.BLOCK,
                BlockCodec.encode(genesis.toBuilder().hash(forged).build())));

        assertEquals(0, chain.height());
        assertTrue(network.broadcasts.isEmpty());
    }

    @Test
    void getChainStreamsEveryBlockThenMarker() {
        List<Block> blocks = mineChain("local", 3);
        blocks.forEach(chain::append);

        sync.onMessage(INBOUND, P2pMessage.getChain());

        assertEquals(4, network.sent.size());
        for (int i = 0; i < 3; i++) {
            assertSame(INBOUND, network.sent.get(i).peer);
            assertEquals(P2pMessage.block(blocks.get(i)), network.sent.get(i).message);
        }
        assertEquals(P2pMessage.chainSyncComplete(), network.sent.get(3).message);
    }

    @Test
    void getChainOnEmptyStoreSendsOnlyMarker() {
        sync.onMessage(INBOUND, P2pMessage.getChain());
        assertEquals(1, network.sent.size());
        assertEquals(P2pMessage.Type.CHAIN_SYNC_COMPLETE, network.sent.get(0).message.type());
    }

    @Test
    void outboundPeerIsAskedForItsChain() {
        sync.onPeerConnected(OUTBOUND);
        sync.onPeerConnected(INBOUND);

        assertEquals(1, network.sent.size());
        assertSame(OUTBOUND, network.sent.get(0).peer);
        assertEquals(P2pMessage.getChain(), network.sent.get(0).message);
    }

    @Test
    void longerChainFromSyncReplacesLocalChain() {
        mineChain("local", 2).forEach(chain::append);
        List<Block> remote = mineChain("remote", 4);

        sync.onPeerConnected(OUTBOUND);
        for (Block b : remote) {
            sync.onMessage(OUTBOUND, P2pMessage.block(b));
        }
        assertEquals(2, chain.height());

        sync.onMessage(OUTBOUND, P2pMessage.chainSyncComplete());

        assertEquals(remote, chain.blocks());
        RecordingNetwork.Broadcast last = network.broadcasts.get(network.broadcasts.size() - 1);
        assertEquals(remote.get(3), last.block);
        assertSame(OUTBOUND, last.exclude);
    }

    @Test
    void shorterChainFromSyncIsIgnored() {
        List<Block> local = mineChain("local", 3);
        local.forEach(chain::append);

        sync.onPeerConnected(OUTBOUND);
        for (Block b : mineChain("remote", 2)) {
            sync.onMessage(OUTBOUND, P2pMessage.block(b));
        }
        sync.onMessage(OUTBOUND, P2pMessage.chainSyncComplete());

        assertEquals(local, chain.blocks());
    }

    @Test
    void unsolicitedSyncMarkerIsIgnored() {
        mineChain("local", 1).forEach(chain::append);
        sync.onMessage(INBOUND, P2pMessage.chainSyncComplete());
        assertEquals(1, chain.height());
        assertTrue(network.broadcasts.isEmpty());
    }

    @Test
    void blockAheadOfTipTriggersChainRequest() {
        Block orphan = pow.mine(Block.builder()
                .index(5)
                .timestamp(9L)
                .prevHash(Hashes.sha256().digest("unknown parent".getBytes()))
                .data("orphan")
                .build());

        sync.onMessage(INBOUND, P2pMessage.block(orphan));
        sync.onMessage(INBOUND, P2pMessage.block(orphan));

        assertEquals(0, chain.height());
        assertEquals(1, network.sent.size());
        assertEquals(P2pMessage.getChain(), network.sent.get(0).message);
        assertSame(INBOUND, network.sent.get(0).peer);
    }

    @Test
    void unknownMessagesAreIgnored() {
        assertDoesNotThrow(() -> sync.onMessage(INBOUND, P2pMessage.parse("HELLO")));
        assertTrue(network.sent.isEmpty());
        assertTrue(network.broadcasts.isEmpty());
    }

    @Test
    void unattachedSyncFailsFast() {
        BlockSync detached = new BlockSync(chain);
        assertThrows(IllegalStateException.class, () -> detached.onMessage(INBOUND, P2pMessage.getChain()));
    }

    private static final class RecordingNetwork implements PeerNetwork {
        final List<Sent> sent = new ArrayList<>();
        final List<Broadcast> broadcasts = new ArrayList<>();

        @Override
        public boolean send(P2pServer.Peer peer, P2pMessage message) {
            sent.add(new Sent(peer, message));
            return true;
        }

        @Override
        public void broadcast(Block block, P2pServer.Peer exclude) {
            broadcasts.add(new Broadcast(block, exclude));
        }

        @Override
        public Collection<P2pServer.Peer> peers() {
            return List.of(INBOUND, OUTBOUND);
        }

        record Sent(P2pServer.Peer peer, P2pMessage message) {}

        record Broadcast(Block block, P2pServer.Peer exclude) {}
    }
}
