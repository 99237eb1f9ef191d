package io.powchain.core.p2p;

import io.powchain.core.node.GenesisBuilder;
import io.powchain.core.protocol.Block;
import io.powchain.core.protocol.BlockCodec;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class P2pMessageTest {

    @Test
    void parsesBlockPayload() {
        P2pMessage msg = P2pMessage.parse("BLOCK:{\"index\":1}");
        assertEquals(P2pMessage.Type.BLOCK, msg.type());
        assertEquals("{\"index\":1}", msg.payload());
    }

    @Test
    void parsesControlMessages() {
        assertEquals(P2pMessage.Type.GET_CHAIN, P2pMessage.parse("GET_CHAIN").type());
        assertEquals(P2pMessage.Type.CHAIN_SYNC_COMPLETE, P2pMessage.parse("CHAIN_SYNC_COMPLETE").type());
    }

    @Test
    void anythingElseIsUnknown() {
        P2pMessage msg = P2pMessage.parse("HELLO there");
        assertEquals(P2pMessage.Type.UNKNOWN, msg.type());
        assertEquals("HELLO there", msg.payload());
        assertEquals(P2pMessage.Type.UNKNOWN, P2pMessage.parse("").type());
        assertEquals(P2pMessage.Type.UNKNOWN, P2pMessage.parse("block:{}").type());
        assertEquals(P2pMessage.Type.UNKNOWN, P2pMessage.parse(null).type());
    }

    @Test
    void blockMessageCarriesEncodedBlock() {
        Block genesis = GenesisBuilder.referenceGenesis();
        P2pMessage msg = P2pMessage.block(genesis);
        assertEquals("BLOCK:" + BlockCodec.encode(genesis), msg.toLine());
        assertEquals(genesis, BlockCodec.decode(P2pMessage.parse(msg.toLine()).payload()));
    }

    @Test
    void controlMessagesRenderBareKeywords() {
        assertEquals("GET_CHAIN", P2pMessage.getChain().toLine());
        assertEquals("CHAIN_SYNC_COMPLETE", P2pMessage.chainSyncComplete().toLine());
    }
}
