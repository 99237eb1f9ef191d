package io.powchain.core.node;

import io.powchain.core.consensus.ProofOfWork;
import io.powchain.core.p2p.BlockSync;
import io.powchain.core.p2p.P2pServer;
import io.powchain.core.protocol.Block;
import io.powchain.core.storage.ChainStore;
import io.powchain.core.storage.InMemoryChainStore;

import java.time.Clock;
import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Wires consensus, storage, the block protocol, the peer transport, and the block producer.
 * Start once, then submit data to mine it into the shared chain.
 */
public final class Node {
    private static final Logger LOG = Logger.getLogger(Node.class.getName());

    private final NodeConfig config;
    private final ProofOfWork pow;
    private final ChainStore chain;
    private final BlockSync sync;
    private final P2pServer server;
    private final BlockProducer producer;

    public Node(NodeConfig config) {
        this(config, Clock.systemUTC());
    }

    public Node(NodeConfig config, Clock clock) {
        this.config = config;
        this.pow = new ProofOfWork(config.difficulty);
        this.chain = new InMemoryChainStore(pow, config.strictContinuity, config.verifyOnReplace);
        this.sync = new BlockSync(chain);
        this.server = new P2pServer(config.listenPort, sync, config.reconnectDelayMillis, config.maxFrameBytes);
        this.sync.attach(server);
        this.producer = new BlockProducer(chain, pow, server, clock, server.maxFrameBytes());
    }

    /** Bind the listener and start dialing the configured peers. */
    public void start() {
        server.start();
        server.connect(config.peers);
        LOG.info(() -> "Node started on port " + config.listenPort + " with difficulty " + pow.difficulty()
                + " and " + config.peers.size() + " bootstrap peers");
    }

    /** Mine {@code data} on the current tip (or as genesis on an empty chain) and broadcast it. */
    public CompletableFuture<Block> submit(String data) {
        return producer.submit(data);
    }

    /** Mine a prepared template, typically {@link GenesisBuilder#referenceGenesis()}, and broadcast it. */
    public CompletableFuture<Block> submit(Block template) {
        return producer.submit(template);
    }

    public void stop() {
        producer.shutdown();
        server.stop();
    }

    public NodeConfig config() { return config; }
    public ProofOfWork pow() { return pow; }
    public ChainStore chain() { return chain; }
    public BlockSync sync() { return sync; }
    public P2pServer server() { return server; }
    public BlockProducer producer() { return producer; }

    public Collection<P2pServer.Peer> peers() {
        return server.peers();
    }
}
