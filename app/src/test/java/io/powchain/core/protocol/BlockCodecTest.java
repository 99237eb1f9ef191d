package io.powchain.core.protocol;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class BlockCodecTest {

    private static byte[] filled(int value) {
        byte[] out = new byte[32];
        for (int i = 0; i < out.length; i++) {
            out[i] = (byte) (value + i);
        }
        return out;
    }

    private static Block sample(List<Transaction> txs) {
        return Block.builder()
                .index(7)
                .timestamp(1_672_531_200L)
                .prevHash(filled(1))
                .transactions(txs)
                .nonce(123_456L)
                .data("Hello, Chain!")
                .hash(filled(100))
                .build();
    }

    @Test
    void roundTripsWithoutTransactions() {
        Block block = sample(List.of());
        assertEquals(block, BlockCodec.decode(BlockCodec.encode(block)));
    }

    @Test
    void roundTripsWithOneTransaction() {
        Block block = sample(List.of(new Transaction("Alice", "Bob", 100)));
        Block decoded = BlockCodec.decode(BlockCodec.encode(block));
        assertEquals(block, decoded);
        assertEquals("Alice", decoded.transactions().get(0).sender());
        assertEquals(100L, decoded.transactions().get(0).amount());
    }

    @Test
    void roundTripsManyTransactionsInOrder() {
        List<Transaction> txs = List.of(
                new Transaction("Alice", "Bob", 1),
                new Transaction("Bob", "Carol", 2),
                new Transaction("Carol", "Dave", 3),
                new Transaction("Dave", "Alice", 4));
        Block decoded = BlockCodec.decode(BlockCodec.encode(sample(txs)));
        assertEquals(txs, decoded.transactions());
    }

    @Test
    void fullUnsignedRangeSurvives() {
        Block block = sample(List.of(new Transaction("A", "B", -1L))).toBuilder()
                .nonce(-1L)
                .timestamp(Long.MIN_VALUE)
                .index(Block.MAX_INDEX)
                .build();
        String json = BlockCodec.encode(block);
        assertTrue(json.contains("\"nonce\":18446744073709551615"), json);
        assertTrue(json.contains("\"index\":4294967295"), json);
        assertEquals(block, BlockCodec.decode(json));
    }

    @Test
    void encodesKeysInWireOrderWithLowercaseHex() {
        String json = BlockCodec.encode(sample(List.of(new Transaction("Alice", "Bob", 100))));
        int index = json.indexOf("\"index\"");
        int timestamp = json.indexOf("\"timestamp\"");
        int nonce = json.indexOf("\"nonce\"");
        int data = json.indexOf("\"data\"");
        int prevHash = json.indexOf("\"prev_hash\"");
        int hash = json.indexOf("\"hash\"");
        int txs = json.indexOf("\"transactions\"");
        assertEquals(1, index);
        assertTrue(index < timestamp && timestamp < nonce && nonce < data && data < prevHash
                && prevHash < hash && hash < txs, json);
        assertTrue(json.contains(Hex.encode(filled(100))));
        assertFalse(json.contains(Hex.encode(filled(100)).toUpperCase(Locale.ROOT)));
        assertFalse(json.contains("\n"));
    }

    @Test
    void missingFieldsTakeDefaults() {
        Block decoded = BlockCodec.decode("{}");
        assertEquals(0L, decoded.index());
        assertEquals(0L, decoded.timestamp());
        assertEquals(0L, decoded.nonce());
        assertEquals(BlockCodec.DEFAULT_DATA, decoded.data());
        assertTrue(Hashes.isZero(decoded.prevHash()));
        assertTrue(Hashes.isZero(decoded.hash()));
        assertTrue(decoded.transactions().isEmpty());
    }

    @Test
    void presentDataOverridesDefault() {
        assertEquals("", BlockCodec.decode("{\"data\":\"\"}").data());
        assertEquals("x", BlockCodec.decode("{\"index\":3,\"data\":\"x\"}").data());
    }

    @Test
    void malformedJsonIsInvalidFormat() {
        assertInvalidFormat("not json");
        assertInvalidFormat("");
        assertInvalidFormat("[1,2]");
        assertInvalidFormat("\"text\"");
    }

    @Test
    void wrongTypesAreInvalidFormat() {
        assertInvalidFormat("{\"index\":\"1\"}");
        assertInvalidFormat("{\"index\":1.5}");
        assertInvalidFormat("{\"index\":-1}");
        assertInvalidFormat("{\"index\":4294967296}");
        assertInvalidFormat("{\"timestamp\":true}");
        assertInvalidFormat("{\"nonce\":18446744073709551616}");
        assertInvalidFormat("{\"data\":42}");
        assertInvalidFormat("{\"data\":null}");
        assertInvalidFormat("{\"prev_hash\":7}");
    }

    @Test
    void hashOfWrongLengthIsInvalidFormat() {
        assertInvalidFormat("{\"hash\":\"00ff\"}");
        assertInvalidFormat("{\"prev_hash\":\"" + "00".repeat(33) + "\"}");
    }

    @Test
    void malformedHashTextSurfacesHexErrors() {
        ProtocolException odd = assertThrows(ProtocolException.class,
                () -> BlockCodec.decode("{\"hash\":\"" + "0".repeat(63) + "\"}"));
        assertEquals(ProtocolError.INVALID_HEX_LENGTH, odd.error());

        ProtocolException bad = assertThrows(ProtocolException.class,
                () -> BlockCodec.decode("{\"prev_hash\":\"" + "zz".repeat(32) + "\"}"));
        assertEquals(ProtocolError.INVALID_HEX_CHAR, bad.error());
    }

    @Test
    void transactionsMustBeWellFormed() {
        assertInvalidFormat("{\"transactions\":{}}");
        assertInvalidFormat("{\"transactions\":[1]}");
        assertInvalidFormat("{\"transactions\":[{\"sender\":\"A\",\"receiver\":\"B\"}]}");
        assertInvalidFormat("{\"transactions\":[{\"sender\":\"A\",\"amount\":1}]}");
        assertInvalidFormat("{\"transactions\":[{\"sender\":1,\"receiver\":\"B\",\"amount\":1}]}");
        assertInvalidFormat("{\"transactions\":[{\"sender\":\"A\",\"receiver\":\"B\",\"amount\":\"1\"}]}");
    }

    private static void assertInvalidFormat(String json) {
        ProtocolException ex = assertThrows(ProtocolException.class, () -> BlockCodec.decode(json), json);
        assertEquals(ProtocolError.INVALID_FORMAT, ex.error(), json);
    }
}
