package io.powchain.core.p2p;

import io.powchain.core.protocol.Block;
import io.powchain.core.protocol.BlockCodec;

import java.util.Objects;

/**
 * One newline-framed wire message, decoded once into a tagged value.
 * Wire forms: {@code BLOCK:<json>}, {@code GET_CHAIN}, {@code CHAIN_SYNC_COMPLETE}; anything else is UNKNOWN.
 */
public record P2pMessage(Type type, String payload) {
    public enum Type { BLOCK, GET_CHAIN, CHAIN_SYNC_COMPLETE, UNKNOWN }

    static final String BLOCK_PREFIX = "BLOCK:";
    static final String GET_CHAIN = "GET_CHAIN";
    static final String CHAIN_SYNC_COMPLETE = "CHAIN_SYNC_COMPLETE";

    public P2pMessage {
        Objects.requireNonNull(type, "type");
        payload = payload == null ? "" : payload;
    }

    public static P2pMessage block(Block block) {
        return new P2pMessage(Type.BLOCK, BlockCodec.encode(block));
    }

    public static P2pMessage getChain() {
        return new P2pMessage(Type.GET_CHAIN, "");
    }

    public static P2pMessage chainSyncComplete() {
        return new P2pMessage(Type.CHAIN_SYNC_COMPLETE, "");
    }

    /** Classify one frame (without its newline) by prefix. */
    public static P2pMessage parse(String line) {
        if (line == null) {
            return new P2pMessage(Type.UNKNOWN, "");
        }
        if (line.startsWith(BLOCK_PREFIX)) {
            return new P2pMessage(Type.BLOCK, line.substring(BLOCK_PREFIX.length()));
        }
        if (line.startsWith(CHAIN_SYNC_COMPLETE)) {
            return chainSyncComplete();
        }
        if (line.startsWith(GET_CHAIN)) {
            return getChain();
        }
        return new P2pMessage(Type.UNKNOWN, line);
    }

    /** Wire text without the trailing newline. */
    public String toLine() {
        switch (type) {
            case BLOCK:
                return BLOCK_PREFIX + payload;
            case GET_CHAIN:
                return GET_CHAIN;
            case CHAIN_SYNC_COMPLETE:
                return CHAIN_SYNC_COMPLETE;
            default:
                return payload;
        }
    }
}
