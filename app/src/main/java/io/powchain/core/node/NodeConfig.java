package io.powchain.core.node;

import io.powchain.core.p2p.P2pServer;

import java.util.List;

/** Simple config holder for a node. */
public final class NodeConfig {
    public final int listenPort;
    public final List<String> peers;
    public final int difficulty;
    public final long reconnectDelayMillis;
    public final int maxFrameBytes;
    public final boolean strictContinuity;
    public final boolean verifyOnReplace;

    public NodeConfig(int listenPort, List<String> peers, int difficulty, long reconnectDelayMillis,
                      int maxFrameBytes, boolean strictContinuity, boolean verifyOnReplace) {
        this.listenPort = listenPort;
        this.peers = peers == null ? List.of() : List.copyOf(peers);
        this.difficulty = difficulty;
        this.reconnectDelayMillis = reconnectDelayMillis;
        this.maxFrameBytes = maxFrameBytes;
        this.strictContinuity = strictContinuity;
        this.verifyOnReplace = verifyOnReplace;
    }

    public static NodeConfig defaultLocal() {
        return new NodeConfig(
                8080,                                      // listen port
                List.of(),                                 // no bootstrap peers
                2,                                         // leading zero bytes
                P2pServer.DEFAULT_RECONNECT_DELAY_MS,
                P2pServer.DEFAULT_MAX_FRAME_BYTES,
                true,
                true
        );
    }

    public NodeConfig withListenPort(int port) {
        return new NodeConfig(port, peers, difficulty, reconnectDelayMillis, maxFrameBytes, strictContinuity, verifyOnReplace);
    }

    public NodeConfig withPeers(List<String> endpoints) {
        return new NodeConfig(listenPort, endpoints, difficulty, reconnectDelayMillis, maxFrameBytes, strictContinuity, verifyOnReplace);
    }

    public NodeConfig withDifficulty(int bytes) {
        return new NodeConfig(listenPort, peers, bytes, reconnectDelayMillis, maxFrameBytes, strictContinuity, verifyOnReplace);
    }

    public NodeConfig withReconnectDelayMillis(long millis) {
        return new NodeConfig(listenPort, peers, difficulty, millis, maxFrameBytes, strictContinuity, verifyOnReplace);
    }

    public NodeConfig withMaxFrameBytes(int bytes) {
        return new NodeConfig(listenPort, peers, difficulty, reconnectDelayMillis, bytes, strictContinuity, verifyOnReplace);
    }

    public NodeConfig withStrictContinuity(boolean strict) {
        return new NodeConfig(listenPort, peers, difficulty, reconnectDelayMillis, maxFrameBytes, strict, verifyOnReplace);
    }

    public NodeConfig withVerifyOnReplace(boolean verify) {
        return new NodeConfig(listenPort, peers, difficulty, reconnectDelayMillis, maxFrameBytes, strictContinuity, verify);
    }
}
