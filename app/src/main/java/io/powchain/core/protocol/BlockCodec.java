package io.powchain.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Block &lt;-&gt; JSON text, the payload of a {@code BLOCK:} wire message.
 *
 * Layout: {"index","timestamp","nonce","data","prev_hash","hash","transactions":[{"sender","receiver","amount"}]}.
 * Every field is optional on decode; a present field must have the right type.
 */
public final class BlockCodec {
    /** Data used when a decoded document carries no {@code data} field. */
    public static final String DEFAULT_DATA = "P2P Received Block";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final BigInteger U64_LIMIT = BigInteger.ONE.shiftLeft(64);

    private BlockCodec(){}

    public static String encode(Block block) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("index", block.index());
        putU64(root, "timestamp", block.timestamp());
        putU64(root, "nonce", block.nonce());
        root.put("data", block.data());
        root.put("prev_hash", Hex.encode(block.prevHash()));
        root.put("hash", Hex.encode(block.hash()));
        ArrayNode txs = root.putArray("transactions");
        for (Transaction tx : block.transactions()) {
            ObjectNode t = txs.addObject();
            t.put("sender", tx.sender());
            t.put("receiver", tx.receiver());
            putU64(t, "amount", tx.amount());
        }
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Block JSON encoding failed", e);
        }
    }

    /**
     * @throws ProtocolException INVALID_FORMAT on structural problems; INVALID_HEX_* from malformed hash text
     */
    public static Block decode(String text) {
        JsonNode root;
        try {
            root = MAPPER.readTree(text == null ? "" : text);
        } catch (JsonProcessingException e) {
            throw new ProtocolException(ProtocolError.INVALID_FORMAT, "Malformed block JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw invalid("block document must be a JSON object");
        }

        Block.Builder b = Block.builder().data(DEFAULT_DATA);

        JsonNode index = root.get("index");
        if (index != null) {
            long v = readU64(index, "index");
            if (v < 0 || v > Block.MAX_INDEX) throw invalid("index out of range");
            b.index(v);
        }
        JsonNode timestamp = root.get("timestamp");
        if (timestamp != null) b.timestamp(readU64(timestamp, "timestamp"));
        JsonNode nonce = root.get("nonce");
        if (nonce != null) b.nonce(readU64(nonce, "nonce"));

        JsonNode data = root.get("data");
        if (data != null) b.data(readText(data, "data"));

        JsonNode prevHash = root.get("prev_hash");
        if (prevHash != null) b.prevHash(readHash(prevHash, "prev_hash"));
        JsonNode hash = root.get("hash");
        if (hash != null) b.hash(readHash(hash, "hash"));

        JsonNode txs = root.get("transactions");
        if (txs != null) b.transactions(readTransactions(txs));

        return b.build();
    }

    private static List<Transaction> readTransactions(JsonNode node) {
        if (!node.isArray()) throw invalid("transactions must be an array");
        List<Transaction> out = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            JsonNode t = node.get(i);
            if (!t.isObject()) throw invalid("transaction " + i + " is not an object");
            JsonNode sender = t.get("sender");
            JsonNode receiver = t.get("receiver");
            JsonNode amount = t.get("amount");
            if (sender == null || receiver == null || amount == null) {
                throw invalid("transaction " + i + " missing sender/receiver/amount");
            }
            out.add(new Transaction(
                    readText(sender, "sender"),
                    readText(receiver, "receiver"),
                    readU64(amount, "amount")));
        }
        return out;
    }

    private static long readU64(JsonNode node, String field) {
        if (!node.isIntegralNumber()) throw invalid(field + " must be an integer");
        BigInteger v = node.bigIntegerValue();
        if (v.signum() < 0 || v.compareTo(U64_LIMIT) >= 0) throw invalid(field + " out of u64 range");
        return v.longValue();
    }

    private static String readText(JsonNode node, String field) {
        if (!node.isTextual()) throw invalid(field + " must be a string");
        return node.textValue();
    }

    private static byte[] readHash(JsonNode node, String field) {
        byte[] bytes = Hex.decode(readText(node, field));
        if (bytes.length != Hashes.LENGTH) {
            throw invalid(field + " must decode to 32 bytes, got " + bytes.length);
        }
        return bytes;
    }

    private static void putU64(ObjectNode node, String field, long value) {
        if (value >= 0) {
            node.put(field, value);
        } else {
            node.put(field, new BigInteger(Long.toUnsignedString(value)));
        }
    }

    private static ProtocolException invalid(String message) {
        return new ProtocolException(ProtocolError.INVALID_FORMAT, message);
    }
}
